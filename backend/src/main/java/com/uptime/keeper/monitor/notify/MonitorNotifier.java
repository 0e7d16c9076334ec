package com.uptime.keeper.monitor.notify;

/**
 * Fire-and-forget sink for monitoring events. Implementations must not block the caller
 * and must not propagate delivery failures.
 */
public interface MonitorNotifier {

    void publish(MonitorEvent event);
}

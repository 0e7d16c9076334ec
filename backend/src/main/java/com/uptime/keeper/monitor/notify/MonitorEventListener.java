package com.uptime.keeper.monitor.notify;

public interface MonitorEventListener {

    void onEvent(MonitorEvent event);
}

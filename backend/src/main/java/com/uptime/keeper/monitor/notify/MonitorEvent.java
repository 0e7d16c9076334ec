package com.uptime.keeper.monitor.notify;

import java.time.Instant;

public interface MonitorEvent {

    String type();

    String targetId();

    Instant occurredAt();
}

package com.uptime.keeper.monitor.model;

public enum HealthStatus {
    UNKNOWN,
    HEALTHY,
    DEGRADED,
    DOWN,
    REDEPLOYING;

    public boolean isRecovering() {
        return this == DEGRADED || this == DOWN || this == REDEPLOYING;
    }
}

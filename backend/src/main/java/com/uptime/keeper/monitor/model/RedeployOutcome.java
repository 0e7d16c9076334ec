package com.uptime.keeper.monitor.model;

public enum RedeployOutcome {
    SUCCEEDED,
    FAILED,
    THROTTLED
}

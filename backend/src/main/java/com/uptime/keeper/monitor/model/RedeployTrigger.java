package com.uptime.keeper.monitor.model;

public enum RedeployTrigger {
    AUTOMATIC,
    MANUAL
}

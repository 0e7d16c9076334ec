package com.uptime.keeper.monitor.model;

public enum ProbeOutcome {
    SUCCESS,
    TIMEOUT,
    CONNECTION_ERROR,
    HTTP_ERROR
}

package com.uptime.keeper.monitor.model;

public enum ProviderType {
    RENDER,
    KOYEB,
    GENERIC_HOOK
}

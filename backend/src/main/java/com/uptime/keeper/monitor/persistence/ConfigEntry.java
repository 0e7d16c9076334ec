package com.uptime.keeper.monitor.persistence;

public record ConfigEntry(
    String key,
    String value
) {
}

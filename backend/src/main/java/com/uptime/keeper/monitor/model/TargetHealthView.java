package com.uptime.keeper.monitor.model;

public record TargetHealthView(
    Target target,
    HealthSnapshot health
) {
}

package com.uptime.keeper.monitor.model;

import java.time.Duration;

public record Target(
    String id,
    String url,
    ProviderType provider,
    String deployHookUrl,
    String serviceId,
    long probeIntervalSeconds,
    int failureThreshold,
    long redeployCooldownSeconds,
    boolean enabled,
    boolean autoRedeploy
) {
    public Duration probeInterval() {
        return Duration.ofSeconds(probeIntervalSeconds);
    }

    public Duration redeployCooldown() {
        return Duration.ofSeconds(redeployCooldownSeconds);
    }
}

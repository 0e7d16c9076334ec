package com.uptime.keeper.monitor.model;

/**
 * Configuration submitted when registering a target. Missing numeric and boolean fields
 * fall back to the {@code keeper.defaults} settings.
 */
public record TargetRequest(
    String id,
    String url,
    ProviderType provider,
    String deployHookUrl,
    String serviceId,
    Long probeIntervalSeconds,
    Integer failureThreshold,
    Long redeployCooldownSeconds,
    Boolean enabled,
    Boolean autoRedeploy
) {
}

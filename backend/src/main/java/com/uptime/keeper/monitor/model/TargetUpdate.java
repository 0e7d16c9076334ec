package com.uptime.keeper.monitor.model;

/**
 * Partial update of a registered target. Null fields keep their current value.
 */
public record TargetUpdate(
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
    public Target applyTo(Target current) {
        return new Target(
            current.id(),
            url == null ? current.url() : url,
            provider == null ? current.provider() : provider,
            deployHookUrl == null ? current.deployHookUrl() : deployHookUrl,
            serviceId == null ? current.serviceId() : serviceId,
            probeIntervalSeconds == null ? current.probeIntervalSeconds() : probeIntervalSeconds,
            failureThreshold == null ? current.failureThreshold() : failureThreshold,
            redeployCooldownSeconds == null ? current.redeployCooldownSeconds() : redeployCooldownSeconds,
            enabled == null ? current.enabled() : enabled,
            autoRedeploy == null ? current.autoRedeploy() : autoRedeploy
        );
    }
}

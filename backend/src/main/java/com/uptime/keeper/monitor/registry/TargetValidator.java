package com.uptime.keeper.monitor.registry;

import com.uptime.keeper.monitor.model.ProviderType;
import com.uptime.keeper.monitor.model.Target;
import com.uptime.keeper.monitor.util.EndpointUrls;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class TargetValidator {
    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    static final long MAX_PROBE_INTERVAL_SECONDS = 7L * 24 * 60 * 60;
    static final long MAX_REDEPLOY_COOLDOWN_SECONDS = 30L * 24 * 60 * 60;

    private TargetValidator() {
    }

    /**
     * Returns the target with its URLs normalized, or throws listing every problem found.
     */
    public static Target validate(Target target) {
        if (target == null) {
            throw new InvalidTargetConfigException(List.of("target is required"));
        }
        List<String> problems = new ArrayList<>();
        if (target.id() == null || !ID_PATTERN.matcher(target.id()).matches()) {
            problems.add("id must be 1-64 characters of letters, digits, '.', '_' or '-'");
        }
        String url = EndpointUrls.normalize(target.url());
        if (url == null || !EndpointUrls.isValidHttpUrl(url)) {
            problems.add("url must be an http(s) URL with a host");
        }
        if (target.probeIntervalSeconds() <= 0 || target.probeIntervalSeconds() > MAX_PROBE_INTERVAL_SECONDS) {
            problems.add("probeIntervalSeconds must be between 1 and " + MAX_PROBE_INTERVAL_SECONDS);
        }
        if (target.failureThreshold() < 1) {
            problems.add("failureThreshold must be >= 1");
        }
        if (target.redeployCooldownSeconds() < 0 || target.redeployCooldownSeconds() > MAX_REDEPLOY_COOLDOWN_SECONDS) {
            problems.add("redeployCooldownSeconds must be between 0 and " + MAX_REDEPLOY_COOLDOWN_SECONDS);
        }
        String deployHookUrl = EndpointUrls.normalize(target.deployHookUrl());
        String serviceId = target.serviceId() == null || target.serviceId().isBlank() ? null : target.serviceId().trim();
        ProviderType provider = target.provider();
        if (provider == null) {
            problems.add("provider is required");
        } else if (provider == ProviderType.KOYEB) {
            if (serviceId == null) {
                problems.add("serviceId is required for KOYEB targets");
            }
        } else if (deployHookUrl == null || !EndpointUrls.isValidHttpUrl(deployHookUrl)) {
            problems.add("deployHookUrl must be an http(s) URL for " + provider + " targets");
        }
        if (!problems.isEmpty()) {
            throw new InvalidTargetConfigException(problems);
        }
        return new Target(
            target.id(),
            url,
            provider,
            deployHookUrl,
            serviceId,
            target.probeIntervalSeconds(),
            target.failureThreshold(),
            target.redeployCooldownSeconds(),
            target.enabled(),
            target.autoRedeploy()
        );
    }
}

package com.uptime.keeper.monitor.provider;

import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.monitor.model.Target;
import com.uptime.keeper.monitor.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Base for providers whose redeploy is a single HTTP call.
 */
public abstract class HttpHostingProvider implements HostingProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpHostingProvider.class);

    private final HttpClient client;
    protected final KeeperProperties properties;

    protected HttpHostingProvider(HttpClient client, KeeperProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    /**
     * Builds the provider request, or returns null when the target lacks the addressing it needs.
     */
    protected abstract HttpRequest.Builder buildRequest(Target target, URI endpoint);

    protected abstract URI endpointFor(Target target);

    @Override
    public ProviderResponse redeploy(Target target) {
        URI endpoint = endpointFor(target);
        if (endpoint == null || endpoint.getHost() == null) {
            return ProviderResponse.error(null, "provider_not_configured");
        }
        HttpRequest.Builder builder = buildRequest(target, endpoint);
        if (builder == null) {
            return ProviderResponse.error(null, "provider_not_configured");
        }
        HttpRequest request = builder
            .timeout(Duration.ofSeconds(properties.getRedeploy().getProviderTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            ProviderResponse result = ProviderResponse.fromStatus(response.statusCode());
            if (result.kind() != ProviderResponse.Kind.ACCEPTED) {
                log.warn("{} redeploy for {} returned status {}", type(), target.id(), response.statusCode());
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProviderResponse.error(null, FailureClassifier.INTERRUPTED);
        } catch (IOException e) {
            String reason = FailureClassifier.classify(e);
            log.warn("{} redeploy for {} failed: {}", type(), target.id(), reason);
            return ProviderResponse.error(null, reason);
        }
    }
}

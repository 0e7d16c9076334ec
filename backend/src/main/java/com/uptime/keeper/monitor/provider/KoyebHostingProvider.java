package com.uptime.keeper.monitor.provider;

import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.monitor.model.ProviderType;
import com.uptime.keeper.monitor.model.Target;
import com.uptime.keeper.monitor.util.EndpointUrls;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;

/**
 * Koyeb redeploys go through the services API with an account token.
 */
@Component
public class KoyebHostingProvider extends HttpHostingProvider {

    public KoyebHostingProvider(HttpClient client, KeeperProperties properties) {
        super(client, properties);
    }

    @Override
    public ProviderType type() {
        return ProviderType.KOYEB;
    }

    @Override
    protected URI endpointFor(Target target) {
        if (target.serviceId() == null || target.serviceId().isBlank()) {
            return null;
        }
        String serviceId = URLEncoder.encode(target.serviceId().trim(), StandardCharsets.UTF_8);
        return EndpointUrls.safeUri(
            properties.getProviders().getKoyeb().getApiBaseUrl() + "/v1/services/" + serviceId + "/redeploy"
        );
    }

    @Override
    protected HttpRequest.Builder buildRequest(Target target, URI endpoint) {
        String token = properties.getProviders().getKoyeb().getApiToken();
        if (token == null || token.isBlank()) {
            return null;
        }
        return HttpRequest.newBuilder(endpoint)
            .header("Authorization", "Bearer " + token.trim())
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString("{}", StandardCharsets.UTF_8));
    }
}

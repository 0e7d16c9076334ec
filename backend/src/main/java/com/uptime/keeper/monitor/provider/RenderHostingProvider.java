package com.uptime.keeper.monitor.provider;

import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.monitor.model.ProviderType;
import com.uptime.keeper.monitor.model.Target;
import com.uptime.keeper.monitor.util.EndpointUrls;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;

/**
 * Render deploy hooks: the hook URL carries the service key, a POST starts a deploy.
 */
@Component
public class RenderHostingProvider extends HttpHostingProvider {

    public RenderHostingProvider(HttpClient client, KeeperProperties properties) {
        super(client, properties);
    }

    @Override
    public ProviderType type() {
        return ProviderType.RENDER;
    }

    @Override
    protected URI endpointFor(Target target) {
        return EndpointUrls.safeUri(target.deployHookUrl());
    }

    @Override
    protected HttpRequest.Builder buildRequest(Target target, URI endpoint) {
        return HttpRequest.newBuilder(endpoint)
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.noBody());
    }
}

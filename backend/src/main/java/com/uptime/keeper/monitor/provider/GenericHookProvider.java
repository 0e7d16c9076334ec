package com.uptime.keeper.monitor.provider;

import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.monitor.model.ProviderType;
import com.uptime.keeper.monitor.model.Target;
import com.uptime.keeper.monitor.util.EndpointUrls;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;

@Component
public class GenericHookProvider extends HttpHostingProvider {

    public GenericHookProvider(HttpClient client, KeeperProperties properties) {
        super(client, properties);
    }

    @Override
    public ProviderType type() {
        return ProviderType.GENERIC_HOOK;
    }

    @Override
    protected URI endpointFor(Target target) {
        return EndpointUrls.safeUri(target.deployHookUrl());
    }

    @Override
    protected HttpRequest.Builder buildRequest(Target target, URI endpoint) {
        return HttpRequest.newBuilder(endpoint)
            .header("Accept", "*/*")
            .GET();
    }
}

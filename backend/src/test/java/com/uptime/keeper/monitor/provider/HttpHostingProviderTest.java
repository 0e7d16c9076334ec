package com.uptime.keeper.monitor.provider;

import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.monitor.model.ProviderType;
import com.uptime.keeper.monitor.model.Target;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpHostingProviderTest {
    private MockWebServer server;
    private KeeperProperties properties;
    private HttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new KeeperProperties();
        properties.getRedeploy().setProviderTimeoutSeconds(1);
        client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
    }

    @Test
    void renderPostsToDeployHook() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"deploy\":{\"id\":\"dep-1\"}}"));
        RenderHostingProvider provider = new RenderHostingProvider(client, properties);

        ProviderResponse response = provider.redeploy(target(ProviderType.RENDER, server.url("/deploy/srv-1?key=k").toString(), null));

        assertThat(response.kind()).isEqualTo(ProviderResponse.Kind.ACCEPTED);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/deploy/srv-1?key=k");
    }

    @Test
    void rateLimitIsPassedThrough() {
        server.enqueue(new MockResponse().setResponseCode(429));
        RenderHostingProvider provider = new RenderHostingProvider(client, properties);

        ProviderResponse response = provider.redeploy(target(ProviderType.RENDER, server.url("/deploy").toString(), null));

        assertThat(response.kind()).isEqualTo(ProviderResponse.Kind.RATE_LIMITED);
        assertThat(response.statusCode()).isEqualTo(429);
    }

    @Test
    void serverErrorIsReportedWithCode() {
        server.enqueue(new MockResponse().setResponseCode(500));
        GenericHookProvider provider = new GenericHookProvider(client, properties);

        ProviderResponse response = provider.redeploy(target(ProviderType.GENERIC_HOOK, server.url("/redeploy").toString(), null));

        assertThat(response.kind()).isEqualTo(ProviderResponse.Kind.ERROR);
        assertThat(response.message()).isEqualTo("http_500");
    }

    @Test
    void genericHookUsesGet() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        GenericHookProvider provider = new GenericHookProvider(client, properties);

        provider.redeploy(target(ProviderType.GENERIC_HOOK, server.url("/hook").toString(), null));

        assertThat(server.takeRequest().getMethod()).isEqualTo("GET");
    }

    @Test
    void slowProviderIsReportedAsTimeout() {
        server.enqueue(new MockResponse().setResponseCode(200).setHeadersDelay(3, TimeUnit.SECONDS));
        GenericHookProvider provider = new GenericHookProvider(client, properties);

        ProviderResponse response = provider.redeploy(target(ProviderType.GENERIC_HOOK, server.url("/slow").toString(), null));

        assertThat(response.kind()).isEqualTo(ProviderResponse.Kind.ERROR);
        assertThat(response.message()).isEqualTo("timeout");
    }

    @Test
    void koyebCallsServicesApiWithBearerToken() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));
        properties.getProviders().getKoyeb().setApiBaseUrl(server.url("/").toString());
        properties.getProviders().getKoyeb().setApiToken("secret-token");
        KoyebHostingProvider provider = new KoyebHostingProvider(client, properties);

        ProviderResponse response = provider.redeploy(target(ProviderType.KOYEB, null, "svc-42"));

        assertThat(response.kind()).isEqualTo(ProviderResponse.Kind.ACCEPTED);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/v1/services/svc-42/redeploy");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret-token");
    }

    @Test
    void koyebWithoutTokenIsNotConfigured() {
        properties.getProviders().getKoyeb().setApiBaseUrl(server.url("/").toString());
        KoyebHostingProvider provider = new KoyebHostingProvider(client, properties);

        ProviderResponse response = provider.redeploy(target(ProviderType.KOYEB, null, "svc-42"));

        assertThat(response.kind()).isEqualTo(ProviderResponse.Kind.ERROR);
        assertThat(response.message()).isEqualTo("provider_not_configured");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void registryRejectsTwoProvidersForOneType() {
        RenderHostingProvider first = new RenderHostingProvider(client, properties);
        RenderHostingProvider second = new RenderHostingProvider(client, properties);

        assertThatThrownBy(() -> new HostingProviderRegistry(List.of(first, second)))
            .isInstanceOf(IllegalStateException.class);
        assertThat(new HostingProviderRegistry(List.of(first)).forType(ProviderType.KOYEB)).isEmpty();
    }

    private Target target(ProviderType provider, String hookUrl, String serviceId) {
        return new Target("bot", "https://bot.example.com", provider, hookUrl, serviceId, 60, 3, 60, true, true);
    }
}

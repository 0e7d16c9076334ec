package com.uptime.keeper.monitor.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.config.MonitorConfig;
import com.uptime.keeper.monitor.model.HealthStatus;
import com.uptime.keeper.monitor.model.RedeployAttempt;
import com.uptime.keeper.monitor.model.RedeployOutcome;
import com.uptime.keeper.monitor.model.RedeployTrigger;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class WebhookEventListenerTest {
    private MockWebServer server;
    private KeeperProperties properties;
    private ObjectMapper objectMapper;
    private WebhookEventListener listener;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new KeeperProperties();
        objectMapper = new MonitorConfig().objectMapper();
        listener = new WebhookEventListener(HttpClient.newHttpClient(), objectMapper, properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
    }

    @Test
    void postsStatusChangeAsJson() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        properties.getNotifier().setWebhookUrl(server.url("/hooks/keeper").toString());

        listener.onEvent(new StatusChangedEvent(
            "bot", HealthStatus.DEGRADED, HealthStatus.DOWN, "timeout", Instant.parse("2026-05-01T12:00:00Z")
        ));

        RecordedRequest request = server.takeRequest(2, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.get("type").asText()).isEqualTo("status_changed");
        assertThat(body.get("targetId").asText()).isEqualTo("bot");
        assertThat(body.get("newStatus").asText()).isEqualTo("DOWN");
        assertThat(body.get("occurredAt").asText()).isEqualTo("2026-05-01T12:00:00Z");
    }

    @Test
    void redeployEventCarriesAttempt() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        properties.getNotifier().setWebhookUrl(server.url("/").toString());
        Instant at = Instant.parse("2026-05-01T12:00:00Z");
        RedeployAttempt attempt = new RedeployAttempt("bot", RedeployTrigger.AUTOMATIC, at, RedeployOutcome.FAILED, "http_500", at);

        listener.onEvent(new RedeployAttemptedEvent("bot", attempt, at));

        JsonNode body = objectMapper.readTree(server.takeRequest(2, TimeUnit.SECONDS).getBody().readUtf8());
        assertThat(body.get("type").asText()).isEqualTo("redeploy_attempted");
        assertThat(body.get("attempt").get("outcome").asText()).isEqualTo("FAILED");
        assertThat(body.get("attempt").get("reason").asText()).isEqualTo("http_500");
    }

    @Test
    void rejectedDeliveryIsNotThrown() {
        server.enqueue(new MockResponse().setResponseCode(500));
        properties.getNotifier().setWebhookUrl(server.url("/").toString());

        assertThatCode(() -> listener.onEvent(new StatusChangedEvent(
            "bot", HealthStatus.DOWN, HealthStatus.HEALTHY, "probe_succeeded", Instant.now()
        ))).doesNotThrowAnyException();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void noUrlMeansNoDelivery() {
        listener.onEvent(new StatusChangedEvent("bot", HealthStatus.DOWN, HealthStatus.HEALTHY, "probe_succeeded", Instant.now()));

        assertThat(server.getRequestCount()).isZero();
    }
}

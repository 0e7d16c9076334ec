package com.uptime.keeper.monitor.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.monitor.util.EndpointUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Posts every event as JSON to {@code keeper.notifier.webhook-url}, the bridge a chat
 * front-end subscribes through. Does nothing when no URL is configured.
 */
@Component
public class WebhookEventListener implements MonitorEventListener {
    private static final Logger log = LoggerFactory.getLogger(WebhookEventListener.class);
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final KeeperProperties properties;

    public WebhookEventListener(HttpClient client, ObjectMapper objectMapper, KeeperProperties properties) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void onEvent(MonitorEvent event) {
        URI uri = EndpointUrls.safeUri(properties.getNotifier().getWebhookUrl());
        if (uri == null || uri.getHost() == null) {
            return;
        }
        try {
            String body = objectMapper.writeValueAsString(event);
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(TIMEOUT)
                .header("User-Agent", properties.getUserAgent())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            if (response.statusCode() >= 300) {
                log.warn("Webhook rejected {} for {} with status {}", event.type(), event.targetId(), response.statusCode());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while delivering {} for {}", event.type(), event.targetId());
        } catch (IOException e) {
            log.warn("Webhook delivery of {} for {} failed: {}", event.type(), event.targetId(), e.getMessage());
        }
    }
}

package com.uptime.keeper.monitor.http;

import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.monitor.model.ProbeResult;
import com.uptime.keeper.monitor.model.Target;
import com.uptime.keeper.monitor.util.EndpointUrls;
import com.uptime.keeper.monitor.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Performs a single reachability check. Every failure mode is encoded in the returned
 * {@link ProbeResult}; nothing is thrown and nothing is retried here.
 */
@Service
public class TargetProber {
    private static final Logger log = LoggerFactory.getLogger(TargetProber.class);

    private final HttpClient client;
    private final KeeperProperties properties;
    private final Clock clock;

    public TargetProber(HttpClient client, KeeperProperties properties, Clock clock) {
        this.client = client;
        this.properties = properties;
        this.clock = clock;
    }

    public ProbeResult probe(Target target) {
        Instant probedAt = clock.instant();
        long startedNanos = System.nanoTime();
        URI uri = EndpointUrls.safeUri(EndpointUrls.normalize(target.url()));
        if (uri == null || uri.getHost() == null) {
            return ProbeResult.connectionError(target.id(), probedAt, Duration.ZERO, FailureClassifier.INVALID_URL);
        }
        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeoutFor(target))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", "*/*")
                .GET()
                .build();
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            Duration latency = elapsedSince(startedNanos);
            int status = response.statusCode();
            if (status >= 200 && status < 400) {
                log.debug("Probe {} ok status={} latency={}ms", target.id(), status, latency.toMillis());
                return ProbeResult.success(target.id(), probedAt, status, latency);
            }
            log.debug("Probe {} failed status={} latency={}ms", target.id(), status, latency.toMillis());
            return ProbeResult.httpError(target.id(), probedAt, status, latency);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.connectionError(target.id(), probedAt, elapsedSince(startedNanos), FailureClassifier.INTERRUPTED);
        } catch (IOException e) {
            Duration latency = elapsedSince(startedNanos);
            if (FailureClassifier.isTimeout(e)) {
                log.debug("Probe {} timed out after {}ms", target.id(), latency.toMillis());
                return ProbeResult.timeout(target.id(), probedAt, latency);
            }
            String detail = FailureClassifier.classify(e);
            log.debug("Probe {} connection error {}: {}", target.id(), detail, e.getMessage());
            return ProbeResult.connectionError(target.id(), probedAt, latency, detail);
        } catch (RuntimeException e) {
            log.debug("Probe {} rejected: {}", target.id(), e.getMessage());
            return ProbeResult.connectionError(
                target.id(),
                probedAt,
                elapsedSince(startedNanos),
                FailureClassifier.classify(e)
            );
        }
    }

    /**
     * Half the probe interval, capped at {@code keeper.probe.max-timeout-seconds}, never below one second.
     */
    public Duration timeoutFor(Target target) {
        Duration cap = Duration.ofSeconds(properties.getProbe().getMaxTimeoutSeconds());
        Duration half = Duration.ofMillis(Math.max(1, target.probeIntervalSeconds()) * 500L);
        Duration timeout = half.compareTo(cap) < 0 ? half : cap;
        return timeout.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1) : timeout;
    }

    private Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}

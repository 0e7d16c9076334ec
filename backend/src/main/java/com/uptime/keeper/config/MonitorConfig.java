package com.uptime.keeper.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class MonitorConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(KeeperProperties properties) {
        int size = Math.max(4, properties.getScheduler().getPoolSize() * 2);
        return Executors.newFixedThreadPool(size, namedThreads("keeper-http"));
    }

    @Bean(name = "redeployExecutor", destroyMethod = "shutdown")
    public ExecutorService redeployExecutor(KeeperProperties properties) {
        return Executors.newFixedThreadPool(properties.getRedeploy().getPoolSize(), namedThreads("keeper-redeploy"));
    }

    @Bean(name = "notifierExecutor", destroyMethod = "shutdown")
    public ExecutorService notifierExecutor() {
        return Executors.newSingleThreadExecutor(namedThreads("keeper-notifier"));
    }

    @Bean
    public HttpClient keeperHttpClient(
        KeeperProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        return HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getProbe().getMaxTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

package com.uptime.keeper.monitor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.monitor.model.TargetRequest;
import com.uptime.keeper.monitor.registry.InvalidTargetConfigException;
import com.uptime.keeper.monitor.registry.TargetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Imports targets from {@code keeper.seed.file} at startup. Ids that are already
 * registered are left untouched, so the file can stay in place across restarts.
 */
@Component
public class TargetSeedRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(TargetSeedRunner.class);

    private final KeeperProperties properties;
    private final TargetRegistry registry;
    private final MonitorService monitorService;
    private final ObjectMapper objectMapper;

    public TargetSeedRunner(
        KeeperProperties properties,
        TargetRegistry registry,
        MonitorService monitorService,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.registry = registry;
        this.monitorService = monitorService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        String file = properties.getSeed().getFile();
        if (file == null || file.isBlank()) {
            return;
        }
        Path path = Path.of(file.trim());
        if (!Files.isRegularFile(path)) {
            log.warn("Seed file {} not found; skipping", path);
            return;
        }
        SeedFile seed = objectMapper.readValue(path.toFile(), SeedFile.class);
        int added = 0;
        int skipped = 0;
        for (TargetRequest request : seed.targets() == null ? List.<TargetRequest>of() : seed.targets()) {
            if (request == null) {
                continue;
            }
            if (request.id() != null && registry.contains(request.id())) {
                skipped++;
                continue;
            }
            try {
                monitorService.addTarget(request);
                added++;
            } catch (InvalidTargetConfigException e) {
                log.warn("Seed entry {} rejected: {}", request.id(), e.getProblems());
            }
        }
        log.info("Seeded {} targets from {} ({} already registered)", added, path, skipped);
    }

    public record SeedFile(List<TargetRequest> targets) {
    }
}

package com.uptime.keeper.monitor.api;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class MonitorControllerTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;
    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void addGetUpdateAndRemoveTarget() throws Exception {
        String id = uniqueId();
        mockMvc.perform(post("/api/targets")
                .contentType(MediaType.APPLICATION_JSON)
                .content(targetJson(id, "https://" + id + ".example.com", 60)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(id))
            .andExpect(jsonPath("$.failureThreshold").value(3))
            .andExpect(jsonPath("$.autoRedeploy").value(true));

        mockMvc.perform(get("/api/targets/" + id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.probeIntervalSeconds").value(60));

        mockMvc.perform(patch("/api/targets/" + id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"probeIntervalSeconds\": 15, \"enabled\": false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.probeIntervalSeconds").value(15))
            .andExpect(jsonPath("$.enabled").value(false));

        mockMvc.perform(get("/api/targets"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.id == '" + id + "')].probeIntervalSeconds").value(15));

        mockMvc.perform(delete("/api/targets/" + id))
            .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/targets"))
            .andExpect(jsonPath("$[*].id").value(not(hasItem(id))));
    }

    @Test
    void duplicateTargetIsConflict() throws Exception {
        String id = uniqueId();
        String body = targetJson(id, "https://" + id + ".example.com", 60);
        mockMvc.perform(post("/api/targets").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/targets").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("duplicate_target"));

        mockMvc.perform(delete("/api/targets/" + id)).andExpect(status().isNoContent());
    }

    @Test
    void invalidConfigIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/targets")
                .contentType(MediaType.APPLICATION_JSON)
                .content(targetJson(uniqueId(), "https://x.example.com", 0)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_config"));

        mockMvc.perform(post("/api/targets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\": \"x\", \"provider\": \"HEROKU\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_config"));
    }

    @Test
    void unknownTargetIsNotFound() throws Exception {
        mockMvc.perform(get("/api/targets/ghost-" + uniqueId()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("target_not_found"));
        mockMvc.perform(delete("/api/targets/ghost-" + uniqueId()))
            .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/targets/ghost-" + uniqueId() + "/redeploy"))
            .andExpect(status().isNotFound());
    }

    @Test
    void forcedProbeUpdatesHealth() throws Exception {
        String id = uniqueId();
        server.enqueue(new MockResponse().setResponseCode(200));
        mockMvc.perform(post("/api/targets")
                .contentType(MediaType.APPLICATION_JSON)
                .content(targetJson(id, server.url("/health").toString(), 60)))
            .andExpect(status().isCreated());

        mockMvc.perform(get("/api/targets/" + id + "/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.health.status").value("UNKNOWN"));

        mockMvc.perform(post("/api/targets/" + id + "/probe"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("SUCCESS"))
            .andExpect(jsonPath("$.statusCode").value(200));

        mockMvc.perform(get("/api/targets/" + id + "/health"))
            .andExpect(jsonPath("$.health.status").value("HEALTHY"))
            .andExpect(jsonPath("$.health.lastProbe.outcome").value("SUCCESS"));

        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.target.id == '" + id + "')].health.status").value("HEALTHY"));

        mockMvc.perform(get("/api/events").param("limit", "20"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());

        mockMvc.perform(delete("/api/targets/" + id)).andExpect(status().isNoContent());
    }

    @Test
    void secondManualRedeployIsThrottled() throws Exception {
        String id = uniqueId();
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200));
        mockMvc.perform(post("/api/targets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"id": "%s", "url": "%s", "provider": "GENERIC_HOOK",
                     "deployHookUrl": "%s", "failureThreshold": 1,
                     "redeployCooldownSeconds": 600, "autoRedeploy": false}
                    """.formatted(id, server.url("/health"), server.url("/redeploy"))))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/targets/" + id + "/probe"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("HTTP_ERROR"));
        mockMvc.perform(get("/api/targets/" + id + "/health"))
            .andExpect(jsonPath("$.health.status").value("DOWN"));

        mockMvc.perform(post("/api/targets/" + id + "/redeploy"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.started").value(true));

        mockMvc.perform(post("/api/targets/" + id + "/redeploy"))
            .andExpect(status().isTooManyRequests())
            .andExpect(jsonPath("$.started").value(false))
            .andExpect(jsonPath("$.throttled.outcome").value("THROTTLED"));
    }

    @Test
    void redeployOfTargetThatIsNotDownIsRefused() throws Exception {
        String id = uniqueId();
        mockMvc.perform(post("/api/targets")
                .contentType(MediaType.APPLICATION_JSON)
                .content(targetJson(id, "https://" + id + ".example.com", 60)))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/targets/" + id + "/redeploy"))
            .andExpect(status().isTooManyRequests())
            .andExpect(jsonPath("$.started").value(false))
            .andExpect(jsonPath("$.throttled.reason").value("target_not_down"));
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void oversizedIntervalAndCooldownAreRejected() throws Exception {
        String id = uniqueId();
        mockMvc.perform(post("/api/targets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"id": "%s", "url": "https://%s.example.com", "provider": "RENDER",
                     "deployHookUrl": "https://api.render.com/deploy/srv-%s?key=k",
                     "probeIntervalSeconds": 10000000000, "redeployCooldownSeconds": 100000000000000000}
                    """.formatted(id, id, id)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_config"));
    }

    @Test
    void schedulerCanBeStartedAndStopped() throws Exception {
        mockMvc.perform(get("/api/scheduler/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false));

        mockMvc.perform(post("/api/scheduler/start"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(true));

        mockMvc.perform(post("/api/scheduler/stop"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false));
    }

    private String uniqueId() {
        return "t-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private String targetJson(String id, String url, long intervalSeconds) {
        return """
            {"id": "%s", "url": "%s", "provider": "RENDER",
             "deployHookUrl": "https://api.render.com/deploy/srv-%s?key=k",
             "probeIntervalSeconds": %d}
            """.formatted(id, url, id, intervalSeconds);
    }
}

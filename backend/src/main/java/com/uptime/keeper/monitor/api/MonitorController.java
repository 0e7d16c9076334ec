package com.uptime.keeper.monitor.api;

import com.uptime.keeper.monitor.model.ProbeResult;
import com.uptime.keeper.monitor.model.RedeployRequestResponse;
import com.uptime.keeper.monitor.model.Target;
import com.uptime.keeper.monitor.model.TargetHealthView;
import com.uptime.keeper.monitor.model.TargetRequest;
import com.uptime.keeper.monitor.model.TargetUpdate;
import com.uptime.keeper.monitor.notify.MonitorEvent;
import com.uptime.keeper.monitor.notify.RecentEventsBuffer;
import com.uptime.keeper.monitor.service.MonitorService;
import com.uptime.keeper.monitor.service.RedeployDispatch;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class MonitorController {
    private final MonitorService monitorService;
    private final RecentEventsBuffer recentEvents;

    public MonitorController(MonitorService monitorService, RecentEventsBuffer recentEvents) {
        this.monitorService = monitorService;
        this.recentEvents = recentEvents;
    }

    @GetMapping("/targets")
    public List<Target> listTargets() {
        return monitorService.listTargets();
    }

    @PostMapping("/targets")
    @ResponseStatus(HttpStatus.CREATED)
    public Target addTarget(@RequestBody TargetRequest request) {
        return monitorService.addTarget(request);
    }

    @GetMapping("/targets/{id}")
    public Target getTarget(@PathVariable("id") String id) {
        return monitorService.getTarget(id);
    }

    @PatchMapping("/targets/{id}")
    public Target updateTarget(@PathVariable("id") String id, @RequestBody TargetUpdate update) {
        return monitorService.updateTarget(id, update);
    }

    @DeleteMapping("/targets/{id}")
    public ResponseEntity<Void> removeTarget(@PathVariable("id") String id) {
        monitorService.removeTarget(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/targets/{id}/health")
    public TargetHealthView getHealth(@PathVariable("id") String id) {
        return monitorService.getHealth(id);
    }

    @GetMapping("/health")
    public List<TargetHealthView> listHealth() {
        return monitorService.listHealth();
    }

    @PostMapping("/targets/{id}/probe")
    public ProbeResult forceProbe(@PathVariable("id") String id) {
        return monitorService.forceProbe(id);
    }

    @PostMapping("/targets/{id}/redeploy")
    public ResponseEntity<RedeployRequestResponse> forceRedeploy(@PathVariable("id") String id) {
        RedeployDispatch dispatch = monitorService.forceRedeploy(id);
        RedeployRequestResponse body = new RedeployRequestResponse(id, dispatch.started(), dispatch.throttledAttempt());
        HttpStatus status = dispatch.started() ? HttpStatus.ACCEPTED : HttpStatus.TOO_MANY_REQUESTS;
        return ResponseEntity.status(status).body(body);
    }

    @GetMapping("/events")
    public List<MonitorEvent> recentEvents(
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        return recentEvents.recent(limit);
    }
}

package com.uptime.keeper.monitor.api;

import com.uptime.keeper.monitor.model.SchedulerStatusResponse;
import com.uptime.keeper.monitor.service.ProbeScheduler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {
    private final ProbeScheduler scheduler;

    public SchedulerController(ProbeScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @PostMapping("/start")
    public SchedulerStatusResponse start() {
        scheduler.start();
        return scheduler.getStatus();
    }

    @PostMapping("/stop")
    public SchedulerStatusResponse stop() {
        scheduler.stop();
        return scheduler.getStatus();
    }

    @GetMapping("/status")
    public SchedulerStatusResponse status() {
        return scheduler.getStatus();
    }
}

package com.example.jobscheduler.web;

import com.example.jobscheduler.service.SchedulerEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {
    private final SchedulerEngine engine;
    private final Clock clock;

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", "scheduler-service");
        body.put("timestamp", Instant.now(clock));
        body.put("version", "1.0.0");
        body.put("initialized", engine.isInitialized());
        body.put("jobs", engine.jobCount());
        return body;
    }
}

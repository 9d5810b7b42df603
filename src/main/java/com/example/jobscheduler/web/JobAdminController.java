package com.example.jobscheduler.web;

import com.example.jobscheduler.domain.*;
import com.example.jobscheduler.service.SchedulerEngine;
import com.example.jobscheduler.web.dto.JobRegistrationRequest;
import com.example.jobscheduler.web.dto.TriggerJobRequest;
import com.example.jobscheduler.web.dto.UpdateCronRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 调度器管理接口。
 */
@Validated
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobAdminController {

    private final SchedulerEngine engine;

    @PostMapping("/register")
    public Map<String, Object> register(@RequestBody @Valid JobRegistrationRequest request) {
        JobDefinition saved = engine.register(request.toDefinition());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Job " + saved.getName() + " registered successfully");
        body.put("job", engine.get(saved.getName()));
        return body;
    }

    @GetMapping
    public Map<String, List<JobView>> list() {
        return Map.of("jobs", engine.list());
    }

    @GetMapping("/{jobName}")
    public JobView get(@PathVariable String jobName) {
        return engine.get(jobName);
    }

    @GetMapping("/{jobName}/history")
    public Map<String, Object> history(@PathVariable String jobName,
                                       @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
                                       @RequestParam(defaultValue = "0") @Min(0) int offset) {
        ExecutionPage page = engine.history(jobName, limit, offset);
        Map<String, Object> pagination = new LinkedHashMap<>();
        pagination.put("limit", page.getLimit());
        pagination.put("offset", page.getOffset());
        pagination.put("total", page.getTotal());
        pagination.put("hasMore", page.isHasMore());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("executions", page.getExecutions());
        body.put("pagination", pagination);
        return body;
    }

    @GetMapping("/{jobName}/stats")
    public Map<String, Object> stats(@PathVariable String jobName,
                                     @RequestParam(defaultValue = "30") @Min(1) @Max(365) int days) {
        JobStats stats = engine.stats(jobName, days);
        Map<String, Object> period = new LinkedHashMap<>();
        period.put("days", stats.getWindowDays());
        period.put("from", stats.getFrom());
        period.put("to", stats.getTo());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stats", stats);
        body.put("period", period);
        return body;
    }

    @PostMapping("/{jobName}/enable")
    public Map<String, Object> enable(@PathVariable String jobName) {
        engine.enable(jobName);
        return message("Job " + jobName + " enabled successfully");
    }

    @PostMapping("/{jobName}/disable")
    public Map<String, Object> disable(@PathVariable String jobName) {
        engine.disable(jobName);
        return message("Job " + jobName + " disabled successfully");
    }

    @DeleteMapping("/{jobName}")
    public Map<String, Object> delete(@PathVariable String jobName) {
        engine.delete(jobName);
        return message("Job " + jobName + " deleted successfully");
    }

    @PutMapping("/{jobName}/cron")
    public Map<String, Object> updateCron(@PathVariable String jobName,
                                          @RequestBody @Valid UpdateCronRequest request) {
        JobDefinition job = engine.reschedule(jobName, request.getCronExpression());
        Map<String, Object> body = message("Cron expression updated for job " + jobName);
        body.put("cronExpression", job.getCronExpression());
        return body;
    }

    /**
     * 默认异步触发（202）；wait=true 时等待终态，作业失败也返回 200。
     */
    @PostMapping("/{jobName}/trigger")
    public ResponseEntity<Map<String, Object>> trigger(@PathVariable String jobName,
                                                       @RequestParam(defaultValue = "false") boolean wait,
                                                       @RequestBody(required = false) TriggerJobRequest request) {
        TriggerSource source = request == null || request.getTriggeredBy() == null
                ? TriggerSource.MANUAL : request.getTriggeredBy();
        String userId = request == null ? null : request.getUserId();

        if (!wait) {
            engine.triggerAsync(jobName, source, userId);
            Map<String, Object> body = message("Job " + jobName + " triggered");
            body.put("jobName", jobName);
            body.put("triggeredBy", source);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        }

        ExecutionOutcome outcome = engine.trigger(jobName, source, userId);
        Map<String, Object> body = message("Job " + jobName + " triggered successfully");
        body.put("executionId", outcome.getExecutionId());
        body.put("status", outcome.getStatus());
        body.put("durationMs", outcome.getDurationMs());
        body.put("result", outcome.getResult());
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> message(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        return body;
    }
}

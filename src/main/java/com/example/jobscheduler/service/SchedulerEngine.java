package com.example.jobscheduler.service;

import com.example.jobscheduler.config.ServiceDirectory;
import com.example.jobscheduler.domain.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 调度引擎：注册表 + cron 驱动 + 派发器 + 台账的统一入口。
 * 所有修改（注册/启停/改 cron/删除/初始化/关闭）在同一把锁内串行，
 * 派发只读不可变快照，不会读到改了一半的定义。
 */
@Slf4j
@Service
public class SchedulerEngine {

    private final JobRegistry registry;
    private final CronDriver cronDriver;
    private final JobDispatcher dispatcher;
    private final ExecutionLedger ledger;
    private final ServiceDirectory services;
    private final TaskExecutor dispatchExec;

    private final Object lock = new Object();
    private volatile boolean initialized = false;

    public SchedulerEngine(JobRegistry registry,
                           CronDriver cronDriver,
                           JobDispatcher dispatcher,
                           ExecutionLedger ledger,
                           ServiceDirectory services,
                           @Qualifier("dispatchExec") TaskExecutor dispatchExec) {
        this.registry = registry;
        this.cronDriver = cronDriver;
        this.dispatcher = dispatcher;
        this.ledger = ledger;
        this.services = services;
        this.dispatchExec = dispatchExec;
    }

    /**
     * 从存储恢复注册表，并为每个启用的作业启动定时器。重复调用无副作用。
     */
    public void initialize() {
        synchronized (lock) {
            if (initialized) {
                log.warn("Scheduler already initialized");
                return;
            }
            log.info("Initializing scheduler engine...");
            int loaded = registry.hydrate();
            cronDriver.open();
            for (JobDefinition job : registry.list()) {
                if (!services.contains(job.getService())) {
                    log.error("Job {} references unconfigured service '{}'; executions will fail until it is configured",
                            job.getName(), job.getService());
                }
                if (job.isEnabled()) {
                    startTimer(job);
                } else {
                    log.info("Job {} is disabled, skipping", job.getName());
                }
            }
            initialized = true;
            log.info("Scheduler initialized with {} jobs ({} timers)", loaded, cronDriver.activeJobs().size());
        }
    }

    /**
     * 停止全部定时器；已在途的派发继续跑完并正常记账。
     */
    public void shutdown() {
        synchronized (lock) {
            log.info("Shutting down scheduler...");
            cronDriver.stopAll();
            initialized = false;
            log.info("Scheduler shut down");
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    public JobDefinition register(JobDefinition job) {
        CronSchedules.normalize(job.getCronExpression());
        services.baseUrl(job.getService());
        synchronized (lock) {
            JobDefinition saved = registry.upsert(job);
            if (initialized) {
                if (saved.isEnabled()) {
                    startTimer(saved);
                } else {
                    stopTimer(saved.getName());
                }
            }
            return saved;
        }
    }

    public JobDefinition enable(String jobName) {
        synchronized (lock) {
            JobDefinition job = registry.setEnabled(jobName, true);
            if (initialized) startTimer(job);
            log.info("Enabled job: {}", jobName);
            return job;
        }
    }

    public JobDefinition disable(String jobName) {
        synchronized (lock) {
            JobDefinition job = registry.setEnabled(jobName, false);
            stopTimer(jobName);
            log.info("Disabled job: {}", jobName);
            return job;
        }
    }

    /**
     * 新表达式先校验；启用中的作业在 CronDriver 锁内原子替换定时器。
     */
    public JobDefinition reschedule(String jobName, String cronExpression) {
        CronSchedules.normalize(cronExpression);
        synchronized (lock) {
            JobDefinition job = registry.reschedule(jobName, cronExpression);
            if (initialized && job.isEnabled()) {
                startTimer(job);
            }
            log.info("Updated cron expression for {}: {}", jobName, cronExpression);
            return job;
        }
    }

    public void delete(String jobName) {
        synchronized (lock) {
            registry.require(jobName);
            cronDriver.stop(jobName);
            registry.delete(jobName);
            log.info("Deleted job: {}", jobName);
        }
    }

    public JobView get(String jobName) {
        JobDefinition job = registry.require(jobName);
        JobSchedule row = registry.findRow(jobName).orElse(null);
        return toView(job, row);
    }

    public List<JobView> list() {
        Map<String, JobSchedule> rows = registry.findAllRows();
        List<JobView> out = new ArrayList<>();
        for (JobDefinition job : registry.list()) {
            out.add(toView(job, rows.get(job.getName())));
        }
        return out;
    }

    public int jobCount() {
        return registry.size();
    }

    /**
     * 同步触发并等待终态结果。作业失败也正常返回（status = FAILED）。
     */
    public ExecutionOutcome trigger(String jobName, TriggerSource source, String triggeredByUser) {
        return dispatcher.execute(jobName, requireManualSource(source), triggeredByUser);
    }

    /**
     * 异步触发：校验作业存在后立即返回，结果通过历史/统计查询。
     * 派发池满时抛 TaskRejectedException，由调用方感知。
     */
    public void triggerAsync(String jobName, TriggerSource source, String triggeredByUser) {
        TriggerSource src = requireManualSource(source);
        registry.require(jobName);
        dispatchExec.execute(() -> runSafely(jobName, src, triggeredByUser));
    }

    public ExecutionPage history(String jobName, int limit, int offset) {
        return ledger.history(jobName, limit, offset);
    }

    /**
     * 作业删除后仍可查询（历史不随定义删除）。
     */
    public JobStats stats(String jobName, int windowDays) {
        return ledger.stats(jobName, windowDays);
    }

    /**
     * 到点交接给派发池。派发前再确认一次定时器仍有效：
     * disable/delete 返回之后不会再有新的派发开始，
     * 只有已经越过这次确认、正在执行的派发会跑完。
     */
    private void onCronFire(String jobName) {
        try {
            dispatchExec.execute(() -> {
                if (!cronDriver.isActive(jobName)) {
                    log.info("Job {} was stopped before its tick was dispatched, skipping", jobName);
                    return;
                }
                registry.recordNextRun(jobName, cronDriver.nextFireTime(jobName));
                runSafely(jobName, TriggerSource.SCHEDULER, null);
            });
        } catch (TaskRejectedException e) {
            log.error("Dispatch pool saturated, job {} tick rejected", jobName);
            try {
                dispatcher.recordRejected(jobName, TriggerSource.SCHEDULER, "Dispatch rejected: executor saturated");
            } catch (RuntimeException ex) {
                log.error("Failed to record rejected tick for job {}", jobName, ex);
            }
        }
    }

    private void runSafely(String jobName, TriggerSource source, String user) {
        try {
            ExecutionOutcome outcome = dispatcher.execute(jobName, source, user);
            log.debug("Execution {} of job {} finished with {}", outcome.getExecutionId(), jobName, outcome.getStatus());
        } catch (JobNotFoundException e) {
            log.warn("Job {} was removed before it could run", jobName);
        } catch (Exception e) {
            log.error("Error executing job {} (triggeredBy={})", jobName, source.wireName(), e);
        }
    }

    private void startTimer(JobDefinition job) {
        try {
            cronDriver.start(job.getName(), job.getCronExpression(), this::onCronFire);
            registry.recordNextRun(job.getName(), cronDriver.nextFireTime(job.getName()));
        } catch (InvalidScheduleException e) {
            log.error("Failed to start job {}: {}", job.getName(), e.getMessage());
        }
    }

    private void stopTimer(String jobName) {
        if (cronDriver.stop(jobName)) {
            registry.recordNextRun(jobName, null);
        }
    }

    private static TriggerSource requireManualSource(TriggerSource source) {
        TriggerSource src = source == null ? TriggerSource.MANUAL : source;
        if (src == TriggerSource.SCHEDULER) {
            throw new IllegalArgumentException("triggeredBy must be 'manual' or 'admin'");
        }
        return src;
    }

    private JobView toView(JobDefinition job, JobSchedule row) {
        JobView.JobViewBuilder b = JobView.builder()
                .name(job.getName())
                .displayName(job.getDisplayName())
                .description(job.getDescription())
                .cronExpression(job.getCronExpression())
                .enabled(job.isEnabled())
                .running(cronDriver.isActive(job.getName()))
                .jobType(job.getJobType())
                .service(job.getService())
                .endpoint(job.getEndpoint())
                .config(job.getConfig())
                .nextRunAt(cronDriver.nextFireTime(job.getName()));
        if (row != null) {
            b.lastRunAt(row.getLastRunAt())
                    .lastRunStatus(row.getLastRunStatus())
                    .lastRunDurationMs(row.getLastRunDurationMs())
                    .totalRuns(row.getTotalRuns() == null ? 0L : row.getTotalRuns())
                    .successfulRuns(row.getSuccessfulRuns() == null ? 0L : row.getSuccessfulRuns())
                    .failedRuns(row.getFailedRuns() == null ? 0L : row.getFailedRuns());
        }
        return b.build();
    }
}

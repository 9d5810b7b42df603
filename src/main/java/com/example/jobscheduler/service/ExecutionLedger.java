package com.example.jobscheduler.service;

import com.example.jobscheduler.domain.*;
import com.example.jobscheduler.repo.JobExecutionRepo;
import com.example.jobscheduler.repo.JobScheduleRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityManager;
import javax.persistence.LockModeType;
import javax.persistence.PersistenceContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 执行台账：开单（RUNNING）与收尾（COMPLETED / FAILED）各自一个短事务，
 * 统计与历史全部从 job_executions 实时聚合。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionLedger {

    public static final int MAX_HISTORY_LIMIT = 100;
    public static final int MAX_STATS_DAYS = 365;

    private final JobExecutionRepo executionRepo;
    private final JobScheduleRepo scheduleRepo;
    private final Clock clock;

    @PersistenceContext
    private EntityManager em;

    /**
     * 新建 RUNNING 记录（新事务，先于网络调用提交）。
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public JobExecution open(JobDefinition job, TriggerSource triggeredBy, String triggeredByUser) {
        JobExecution e = new JobExecution();
        e.setId(UUID.randomUUID().toString());
        e.setJobName(job.getName());
        e.setJobType(job.getJobType());
        e.setStatus(ExecutionStatus.RUNNING);
        e.setStartedAt(clock.instant());
        e.setTriggeredBy(triggeredBy);
        e.setTriggeredByUser(triggeredBy == TriggerSource.SCHEDULER ? null : triggeredByUser);
        em.persist(e);
        return e;
    }

    /**
     * 收尾为 COMPLETED。记录已是终态（例如被过期清理）时不再修改，返回 empty。
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<JobExecution> complete(String executionId, JobResult result) {
        return finish(executionId, ExecutionStatus.COMPLETED, null, result);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<JobExecution> fail(String executionId, String errorMessage) {
        return finish(executionId, ExecutionStatus.FAILED, errorMessage, null);
    }

    private Optional<JobExecution> finish(String executionId, ExecutionStatus status, String errorMessage, JobResult result) {
        JobExecution e = em.find(JobExecution.class, executionId, LockModeType.PESSIMISTIC_WRITE);
        if (e == null) {
            log.warn("Execution record not found when finishing, id={}", executionId);
            return Optional.empty();
        }
        if (e.getStatus().isTerminal()) {
            log.warn("Execution {} already {}, ignoring transition to {}", executionId, e.getStatus(), status);
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (now.isBefore(e.getStartedAt())) now = e.getStartedAt();

        e.setStatus(status);
        e.setCompletedAt(now);
        e.setDurationMs(Duration.between(e.getStartedAt(), now).toMillis());
        if (result != null) {
            e.setItemsProcessed(result.processedOrZero());
            e.setItemsSucceeded(result.succeededOrZero());
            e.setItemsFailed(result.failedOrZero());
            e.setMetadata(result.getMetadata() == null || result.getMetadata().isEmpty() ? null : new LinkedHashMap<>(result.getMetadata()));
        }
        e.setErrorMessage(status == ExecutionStatus.FAILED ? errorMessage : null);

        scheduleRepo.recordRun(e.getJobName(),
                status == ExecutionStatus.COMPLETED ? 1 : 0,
                status == ExecutionStatus.FAILED ? 1 : 0,
                now, status, e.getDurationMs());
        return Optional.of(e);
    }

    /**
     * 分页历史，最新在前。
     */
    @Transactional(readOnly = true)
    public ExecutionPage history(String jobName, int limit, int offset) {
        if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        List<JobExecution> rows = em.createQuery(
                        "SELECT e FROM JobExecution e WHERE e.jobName = :jobName ORDER BY e.startedAt DESC, e.id DESC",
                        JobExecution.class)
                .setParameter("jobName", jobName)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
        return ExecutionPage.builder()
                .executions(rows)
                .limit(limit)
                .offset(offset)
                .total(executionRepo.countByJobName(jobName))
                .build();
    }

    /**
     * 时间窗口内的聚合；平均耗时只统计 COMPLETED，RUNNING/卡住的记录不参与。
     * 无记录时返回全 0。
     */
    @Transactional(readOnly = true)
    public JobStats stats(String jobName, int windowDays) {
        if (windowDays < 1 || windowDays > MAX_STATS_DAYS) {
            throw new IllegalArgumentException("days must be between 1 and " + MAX_STATS_DAYS);
        }
        Instant to = clock.instant();
        Instant from = to.minus(Duration.ofDays(windowDays));

        long total = executionRepo.countByJobNameAndStartedAtGreaterThanEqual(jobName, from);
        long ok = executionRepo.countByJobNameAndStatusAndStartedAtGreaterThanEqual(jobName, ExecutionStatus.COMPLETED, from);
        long failed = executionRepo.countByJobNameAndStatusAndStartedAtGreaterThanEqual(jobName, ExecutionStatus.FAILED, from);
        Number avg = executionRepo.averageDuration(jobName, ExecutionStatus.COMPLETED, from);
        Number items = executionRepo.sumItemsProcessed(jobName, from);

        long terminal = ok + failed;
        return JobStats.builder()
                .jobName(jobName)
                .windowDays(windowDays)
                .from(from)
                .to(to)
                .totalExecutions(total)
                .successfulExecutions(ok)
                .failedExecutions(failed)
                .runningExecutions(total - terminal)
                .successRate(terminal == 0 ? 0d : (double) ok / terminal)
                .avgDurationMs(avg == null ? 0L : Math.round(avg.doubleValue()))
                .totalItemsProcessed(items == null ? 0L : items.longValue())
                .build();
    }

    /**
     * 把超过阈值仍为 RUNNING 的记录标记为 FAILED（进程崩溃遗留）。
     */
    @Transactional
    public int failStaleExecutions(Duration threshold) {
        Instant cutoff = clock.instant().minus(threshold);
        List<JobExecution> stale = executionRepo.findByStatusAndStartedAtBefore(ExecutionStatus.RUNNING, cutoff);
        int n = 0;
        for (JobExecution s : stale) {
            String msg = "Execution did not complete within " + threshold + "; marked failed by stale sweep";
            if (finish(s.getId(), ExecutionStatus.FAILED, msg, null).isPresent()) {
                log.warn("Marked stale execution failed: id={}, job={}, startedAt={}", s.getId(), s.getJobName(), s.getStartedAt());
                n++;
            }
        }
        return n;
    }
}

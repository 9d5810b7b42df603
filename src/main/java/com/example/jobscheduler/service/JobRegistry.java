package com.example.jobscheduler.service;

import com.example.jobscheduler.domain.JobDefinition;
import com.example.jobscheduler.domain.JobSchedule;
import com.example.jobscheduler.repo.JobScheduleRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 作业注册表：内存快照 + job_schedules 表。
 * 写操作先落库再替换内存快照，落库失败时内存保持原样。
 * 并发写由 SchedulerEngine 串行化；读可以随时进行。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRegistry {

    private final JobScheduleRepo scheduleRepo;

    private final Map<String, JobDefinition> jobs = new ConcurrentHashMap<>();

    /**
     * 从存储重新加载全部定义（进程启动时的恢复点）。
     */
    public int hydrate() {
        List<JobSchedule> rows = scheduleRepo.findAll();
        Map<String, JobDefinition> loaded = new LinkedHashMap<>();
        for (JobSchedule s : rows) {
            loaded.put(s.getName(), JobDefinition.fromEntity(s));
            log.info("Loaded job: {} ({} -> {})", s.getName(), s.getService(), s.getEndpoint());
        }
        jobs.keySet().retainAll(loaded.keySet());
        jobs.putAll(loaded);
        return loaded.size();
    }

    /**
     * 按 name 幂等 upsert，重复注册以最新值为准。
     */
    public JobDefinition upsert(JobDefinition def) {
        if (def == null || !StringUtils.hasText(def.getName())) {
            throw new IllegalArgumentException("Job name must not be empty");
        }
        CronSchedules.normalize(def.getCronExpression());

        JobDefinition snapshot = def.toBuilder().config(JobDefinition.copyOf(def.getConfig())).build();
        persist(snapshot);
        JobDefinition prev = jobs.put(snapshot.getName(), snapshot);
        log.info("{} job: {} ({} -> {})", prev == null ? "Registered" : "Updated",
                snapshot.getName(), snapshot.getService(), snapshot.getEndpoint());
        return snapshot;
    }

    public Optional<JobDefinition> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(jobs.get(name));
    }

    public JobDefinition require(String name) {
        return get(name).orElseThrow(() -> new JobNotFoundException(name));
    }

    public boolean contains(String name) {
        return name != null && jobs.containsKey(name);
    }

    public List<JobDefinition> list() {
        List<JobDefinition> out = new ArrayList<>(jobs.values());
        out.sort(Comparator.comparing(JobDefinition::getName));
        return out;
    }

    public int size() {
        return jobs.size();
    }

    public JobDefinition setEnabled(String name, boolean enabled) {
        JobDefinition updated = require(name).toBuilder().enabled(enabled).build();
        persist(updated);
        jobs.put(name, updated);
        return updated;
    }

    /**
     * 先校验新表达式，非法时什么都不改。
     */
    public JobDefinition reschedule(String name, String cronExpression) {
        CronSchedules.normalize(cronExpression);
        JobDefinition updated = require(name).toBuilder().cronExpression(cronExpression).build();
        persist(updated);
        jobs.put(name, updated);
        return updated;
    }

    /**
     * 删除定义；job_executions 中的历史保留。
     */
    public JobDefinition delete(String name) {
        JobDefinition existing = require(name);
        scheduleRepo.findById(name).ifPresent(scheduleRepo::delete);
        jobs.remove(name);
        return existing;
    }

    public Optional<JobSchedule> findRow(String name) {
        return scheduleRepo.findById(name);
    }

    public Map<String, JobSchedule> findAllRows() {
        Map<String, JobSchedule> m = new HashMap<>();
        for (JobSchedule s : scheduleRepo.findAll()) {
            m.put(s.getName(), s);
        }
        return m;
    }

    /**
     * next_run_at 只是展示用缓存，写失败记 ERROR 不向上抛。
     */
    public void recordNextRun(String name, Instant nextRunAt) {
        try {
            scheduleRepo.updateNextRunAt(name, nextRunAt);
        } catch (DataAccessException e) {
            log.error("Failed to update next_run_at for job={}", name, e);
        }
    }

    private void persist(JobDefinition def) {
        JobSchedule row = scheduleRepo.findById(def.getName()).orElseGet(JobSchedule::new);
        def.applyTo(row);
        try {
            scheduleRepo.save(row);
        } catch (DataAccessException e) {
            log.error("Failed to persist job definition {}", def.getName(), e);
            throw e;
        }
    }
}

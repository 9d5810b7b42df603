package com.example.jobscheduler.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * 每个启用的作业持有且仅持有一个 cron 定时器（UTC）。
 * 定时器到点只调用 onFire 交接，不等待派发完成；同一作业的执行可以重叠。
 */
@Slf4j
@Component
public class CronDriver {

    private final TaskScheduler scheduler;
    private final Clock clock;

    // jobName -> 当前定时器，所有读写都在 this 上同步
    private final Map<String, Timer> timers = new HashMap<>();
    private boolean closed = false;

    public CronDriver(TaskScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    private static final class Timer {
        final String jobName;
        final String cronExpression;
        ScheduledFuture<?> future;

        Timer(String jobName, String cronExpression) {
            this.jobName = jobName;
            this.cronExpression = cronExpression;
        }
    }

    /**
     * 允许 start；initialize 时调用。
     */
    public synchronized void open() {
        closed = false;
    }

    /**
     * 启动（或替换）作业的定时器。旧定时器在同一把锁内先取消，
     * 不存在新旧两个同时有效的窗口。
     */
    public synchronized void start(String jobName, String cronExpression, Consumer<String> onFire) {
        if (closed) {
            throw new IllegalStateException("Cron driver is shut down, cannot start job " + jobName);
        }
        String six = CronSchedules.normalize(cronExpression);

        cancel(timers.remove(jobName));

        Timer timer = new Timer(jobName, cronExpression);
        ScheduledFuture<?> future = scheduler.schedule(() -> fire(timer, onFire), new CronTrigger(six, CronSchedules.ZONE));
        if (future == null) {
            throw new InvalidScheduleException(cronExpression, "expression never fires");
        }
        timer.future = future;
        timers.put(jobName, timer);
        log.info("Started timer: job={}, cron={}", jobName, cronExpression);
    }

    /**
     * @return 之前是否持有定时器
     */
    public synchronized boolean stop(String jobName) {
        Timer t = timers.remove(jobName);
        if (t == null) return false;
        cancel(t);
        log.info("Stopped timer: job={}", jobName);
        return true;
    }

    public synchronized boolean isActive(String jobName) {
        return timers.containsKey(jobName);
    }

    public synchronized Set<String> activeJobs() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(timers.keySet()));
    }

    /**
     * 下一次触发时刻；没有定时器时为 null。
     */
    public synchronized Instant nextFireTime(String jobName) {
        Timer t = timers.get(jobName);
        return t == null ? null : CronSchedules.nextFire(t.cronExpression, clock.instant());
    }

    /**
     * 关闭后不再有任何作业触发，直到再次 open。
     */
    public synchronized void stopAll() {
        closed = true;
        int n = timers.size();
        for (Timer t : timers.values()) {
            cancel(t);
        }
        timers.clear();
        log.info("Cron driver stopped {} timer(s)", n);
    }

    private void fire(Timer timer, Consumer<String> onFire) {
        synchronized (this) {
            // 已被替换/停止的旧定时器不再派发
            if (closed || timers.get(timer.jobName) != timer) {
                log.debug("Ignoring fire of stale timer for job={}", timer.jobName);
                return;
            }
        }
        try {
            onFire.accept(timer.jobName);
        } catch (Exception e) {
            log.error("Cron fire handler failed for job={}", timer.jobName, e);
        }
    }

    private static void cancel(Timer t) {
        if (t != null && t.future != null) {
            t.future.cancel(false);
        }
    }
}

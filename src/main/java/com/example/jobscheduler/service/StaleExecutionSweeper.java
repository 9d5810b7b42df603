package com.example.jobscheduler.service;

import com.example.jobscheduler.config.SchedulerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定期把卡在 RUNNING 的执行（进程崩溃遗留）标记为 FAILED。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "scheduler.stale-sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StaleExecutionSweeper {
    private final ExecutionLedger ledger;
    private final SchedulerProperties props;

    @Scheduled(fixedDelayString = "${scheduler.stale-sweep.interval-ms:300000}", initialDelay = 60000L)
    public void sweep() {
        try {
            int n = ledger.failStaleExecutions(props.getStaleSweep().getThreshold());
            if (n > 0) {
                log.warn("Stale sweep marked {} execution(s) failed (threshold={})", n, props.getStaleSweep().getThreshold());
            }
        } catch (RuntimeException e) {
            log.error("Stale execution sweep failed", e);
        }
    }
}

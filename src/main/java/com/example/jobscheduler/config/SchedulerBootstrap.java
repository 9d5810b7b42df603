package com.example.jobscheduler.config;

import com.example.jobscheduler.service.SchedulerEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;

/**
 * 引擎生命周期：应用就绪后 initialize，容器关闭时 shutdown。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulerBootstrap {

    private final SchedulerEngine engine;
    private final SchedulerProperties props;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!props.isAutoStart()) {
            log.info("scheduler.auto-start=false, engine not initialized");
            return;
        }
        engine.initialize();
    }

    @PreDestroy
    public void stop() {
        if (engine.isInitialized()) {
            engine.shutdown();
        }
    }
}

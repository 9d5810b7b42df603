package com.example.jobscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 两个池：
 * - jobTaskScheduler：cron 定时器，只负责到点把派发丢给 dispatchExec，本身不做 IO
 * - dispatchExec：HTTP 派发（IO 型），有限队列；满了直接拒绝（TaskRejectedException），
 *   不在定时器线程或请求线程上执行派发
 */
@Slf4j
@Configuration
public class ExecPoolConfig {

    @Bean("jobTaskScheduler")
    public ThreadPoolTaskScheduler jobTaskScheduler(SchedulerProperties props) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(props.getCron().getPoolSize());
        s.setThreadNamePrefix("cron-");
        s.setRemoveOnCancelPolicy(true);         // 取消的定时器立即出队
        s.setWaitForTasksToCompleteOnShutdown(false);
        s.setAwaitTerminationSeconds(5);
        s.initialize();
        log.info("Cron task scheduler initialized with pool size {}", props.getCron().getPoolSize());
        return s;
    }

    @Bean("dispatchExec")
    public ThreadPoolTaskExecutor dispatchExec(SchedulerProperties props) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();

        int poolSize = Math.max(1, props.getDispatch().getPoolSize());
        e.setCorePoolSize(poolSize);
        e.setMaxPoolSize(poolSize * 2);
        e.setQueueCapacity(props.getDispatch().getQueueCapacity());
        e.setKeepAliveSeconds(30);
        e.setAllowCoreThreadTimeOut(true);
        e.setThreadNamePrefix("dispatch-");
        e.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        // 已在途的派发跑完再退出，保证台账落到终态
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(20);

        e.initialize();
        return e;
    }
}

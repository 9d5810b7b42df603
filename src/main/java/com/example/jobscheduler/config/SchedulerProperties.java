package com.example.jobscheduler.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * scheduler.* 配置项。
 */
@Getter @Setter
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    /** 应用就绪后自动 initialize，容器关闭时 shutdown */
    private boolean autoStart = true;

    /** 服务名 -> base URL，未配置的服务直接拒绝 */
    private Map<String, String> services = new LinkedHashMap<>();

    private final Dispatch dispatch = new Dispatch();
    private final Cron cron = new Cron();
    private final StaleSweep staleSweep = new StaleSweep();

    @Getter @Setter
    public static class Dispatch {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(120);
        private int poolSize = 16;
        private int queueCapacity = 100;
    }

    @Getter @Setter
    public static class Cron {
        private int poolSize = 4;
    }

    @Getter @Setter
    public static class StaleSweep {
        private boolean enabled = true;
        private Duration threshold = Duration.ofHours(6);
        private long intervalMs = 300_000L;
    }
}

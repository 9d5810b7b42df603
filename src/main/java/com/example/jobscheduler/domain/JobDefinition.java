package com.example.jobscheduler.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 注册表内存中的作业定义快照。不可变：每次变更都替换整个实例，
 * 派发线程读到的永远是完整的一版。
 */
@Value
@Builder(toBuilder = true)
public class JobDefinition {
    String name;
    String displayName;
    String description;
    String cronExpression;
    boolean enabled;
    String jobType;
    String service;
    String endpoint;
    @Builder.Default
    Map<String, Object> config = Collections.emptyMap();

    public static JobDefinition fromEntity(JobSchedule s) {
        return JobDefinition.builder()
                .name(s.getName())
                .displayName(s.getDisplayName())
                .description(s.getDescription())
                .cronExpression(s.getCronExpression())
                .enabled(Boolean.TRUE.equals(s.getEnabled()))
                .jobType(s.getJobType())
                .service(s.getService())
                .endpoint(s.getEndpoint())
                .config(copyOf(s.getConfig()))
                .build();
    }

    /**
     * 写回实体，不触碰运维计数器。
     */
    public void applyTo(JobSchedule s) {
        s.setName(name);
        s.setDisplayName(displayName);
        s.setDescription(description);
        s.setCronExpression(cronExpression);
        s.setEnabled(enabled);
        s.setJobType(jobType);
        s.setService(service);
        s.setEndpoint(endpoint);
        s.setConfig(new LinkedHashMap<>(config == null ? Collections.emptyMap() : config));
    }

    public static Map<String, Object> copyOf(Map<String, Object> m) {
        if (m == null || m.isEmpty()) return Collections.emptyMap();
        return Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }
}

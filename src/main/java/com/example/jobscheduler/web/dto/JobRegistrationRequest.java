package com.example.jobscheduler.web.dto;

import com.example.jobscheduler.domain.JobDefinition;
import lombok.Data;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.Size;
import java.util.Map;

/**
 * 协作服务启动时调用的注册请求体；同名重复注册即更新。
 */
@Data
public class JobRegistrationRequest {
    @NotBlank
    @Size(max = 128)
    private String name;

    @Size(max = 255)
    private String displayName;

    @Size(max = 2000)
    private String description;

    @NotBlank
    private String cronExpression;

    private Boolean enabled = Boolean.TRUE;

    @Size(max = 64)
    private String jobType;

    @NotBlank
    private String service;

    @NotBlank
    @Pattern(regexp = "/.*", message = "must start with /")
    private String endpoint;

    private Map<String, Object> config;

    public JobDefinition toDefinition() {
        return JobDefinition.builder()
                .name(name.trim())
                .displayName(displayName == null ? name.trim() : displayName)
                .description(description)
                .cronExpression(cronExpression)
                .enabled(enabled == null || enabled)
                .jobType(jobType == null ? "other" : jobType)
                .service(service.trim())
                .endpoint(endpoint.trim())
                .config(JobDefinition.copyOf(config))
                .build();
    }
}

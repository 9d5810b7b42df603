package com.example.jobscheduler.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * POST 给协作服务的请求体。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobContext {
    private String jobName;
    private Map<String, Object> config;
    private String executionId;
    private TriggerSource triggeredBy;
    private String triggeredByUser;
}

package com.example.jobscheduler.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 协作服务返回的结果体；缺省计数按 0 处理。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobResult {
    private boolean success;
    private Integer itemsProcessed;
    private Integer itemsSucceeded;
    private Integer itemsFailed;
    private String error;
    private Map<String, Object> metadata;

    public static JobResult failure(String error) {
        return JobResult.builder()
                .success(false)
                .itemsProcessed(0)
                .itemsSucceeded(0)
                .itemsFailed(0)
                .error(error)
                .build();
    }

    public int processedOrZero() {
        return itemsProcessed == null ? 0 : itemsProcessed;
    }

    public int succeededOrZero() {
        return itemsSucceeded == null ? 0 : itemsSucceeded;
    }

    public int failedOrZero() {
        return itemsFailed == null ? 0 : itemsFailed;
    }
}

package com.example.jobscheduler.web.dto;

import com.example.jobscheduler.domain.TriggerSource;
import lombok.Data;

@Data
public class TriggerJobRequest {
    /** 外部认证系统的用户 id，执行时解析为内部 id */
    private String userId;

    /** manual（默认）或 admin */
    private TriggerSource triggeredBy;
}

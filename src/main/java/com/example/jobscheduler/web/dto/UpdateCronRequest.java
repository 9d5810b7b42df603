package com.example.jobscheduler.web.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;

@Data
public class UpdateCronRequest {
    @NotBlank
    private String cronExpression;
}

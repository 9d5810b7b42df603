package com.example.jobscheduler.service;

import org.springframework.scheduling.support.CronExpression;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * cron 表达式工具。对外接受 5 段（分 时 日 月 周）或 6 段（带秒）写法，
 * 内部统一成 Spring 的 6 段格式；所有计算固定在 UTC。
 */
public final class CronSchedules {

    public static final ZoneId ZONE = ZoneOffset.UTC;

    private CronSchedules() {
    }

    /**
     * 校验并返回 6 段格式，非法时抛 InvalidScheduleException。
     */
    public static String normalize(String expression) {
        if (!StringUtils.hasText(expression)) {
            throw new InvalidScheduleException(expression, "expression is empty");
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        String six;
        if (fields.length == 5) {
            six = "0 " + String.join(" ", fields);
        } else if (fields.length == 6) {
            six = String.join(" ", fields);
        } else {
            throw new InvalidScheduleException(expression, "expected 5 or 6 fields but found " + fields.length);
        }
        try {
            CronExpression.parse(six);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(expression, e.getMessage());
        }
        return six;
    }

    public static boolean isValid(String expression) {
        try {
            normalize(expression);
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }

    /**
     * now 之后（不含）的下一次触发时刻，没有则为 null。
     */
    public static Instant nextFire(String expression, Instant now) {
        CronExpression cron = CronExpression.parse(normalize(expression));
        ZonedDateTime next = cron.next(now.atZone(ZONE));
        return next == null ? null : next.toInstant();
    }
}

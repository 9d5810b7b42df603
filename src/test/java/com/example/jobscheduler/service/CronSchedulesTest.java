package com.example.jobscheduler.service;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronSchedulesTest {

    @Test
    void fiveFieldExpressionGetsZeroSeconds() {
        assertThat(CronSchedules.normalize("0 2 * * *")).isEqualTo("0 0 2 * * *");
        assertThat(CronSchedules.normalize("  */5   * * * * ")).isEqualTo("0 */5 * * * *");
    }

    @Test
    void sixFieldExpressionKeptAsIs() {
        assertThat(CronSchedules.normalize("30 0 2 * * *")).isEqualTo("30 0 2 * * *");
    }

    @Test
    void rejectsWrongFieldCountAndGarbage() {
        assertThatThrownBy(() -> CronSchedules.normalize("* * *"))
                .isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(() -> CronSchedules.normalize("61 * * * *"))
                .isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(() -> CronSchedules.normalize(" "))
                .isInstanceOf(InvalidScheduleException.class);
        assertThat(CronSchedules.isValid("not a cron")).isFalse();
        assertThat(CronSchedules.isValid("0 2 * * 1-5")).isTrue();
    }

    @Test
    void nextFireIsComputedInUtc() {
        Instant now = Instant.parse("2024-03-01T01:59:00Z");
        assertThat(CronSchedules.nextFire("0 2 * * *", now)).isEqualTo(Instant.parse("2024-03-01T02:00:00Z"));
        // 正好在触发点上时取下一次
        assertThat(CronSchedules.nextFire("0 2 * * *", Instant.parse("2024-03-01T02:00:00Z")))
                .isEqualTo(Instant.parse("2024-03-02T02:00:00Z"));
    }
}

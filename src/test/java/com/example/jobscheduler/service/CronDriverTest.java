package com.example.jobscheduler.service;

import com.example.jobscheduler.support.ManualTaskScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronDriverTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private ManualTaskScheduler scheduler;
    private CronDriver driver;
    private final List<String> fired = new ArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler(START);
        driver = new CronDriver(scheduler, Clock.fixed(START, ZoneOffset.UTC));
        driver.open();
    }

    @Test
    void firesAtEachCronTick() {
        driver.start("every-5", "*/5 * * * *", fired::add);

        scheduler.advanceTo(START.plus(Duration.ofMinutes(16)));

        assertThat(fired).containsExactly("every-5", "every-5", "every-5");
        assertThat(driver.nextFireTime("every-5")).isEqualTo(START.plus(Duration.ofMinutes(5)));
    }

    @Test
    void restartReplacesTimerInsteadOfAddingOne() {
        driver.start("job", "*/5 * * * *", fired::add);
        driver.start("job", "0 * * * *", fired::add);

        assertThat(driver.activeJobs()).containsExactly("job");
        assertThat(scheduler.pendingCount()).isEqualTo(1);

        scheduler.advanceTo(START.plus(Duration.ofMinutes(30)));
        assertThat(fired).isEmpty();

        scheduler.advanceTo(START.plus(Duration.ofMinutes(60)));
        assertThat(fired).containsExactly("job");
    }

    @Test
    void stoppedJobNeverFires() {
        driver.start("job", "*/5 * * * *", fired::add);

        assertThat(driver.stop("job")).isTrue();
        assertThat(driver.stop("job")).isFalse();
        assertThat(driver.isActive("job")).isFalse();
        assertThat(driver.nextFireTime("job")).isNull();

        scheduler.advanceTo(START.plus(Duration.ofHours(1)));
        assertThat(fired).isEmpty();
    }

    @Test
    void stopAllClosesDriverUntilReopened() {
        driver.start("a", "*/5 * * * *", fired::add);
        driver.start("b", "*/5 * * * *", fired::add);

        driver.stopAll();
        scheduler.advanceTo(START.plus(Duration.ofMinutes(10)));

        assertThat(fired).isEmpty();
        assertThat(driver.activeJobs()).isEmpty();
        assertThatThrownBy(() -> driver.start("a", "*/5 * * * *", fired::add))
                .isInstanceOf(IllegalStateException.class);

        driver.open();
        driver.start("a", "*/5 * * * *", fired::add);
        assertThat(driver.isActive("a")).isTrue();
    }

    @Test
    void invalidExpressionLeavesExistingTimerRunning() {
        driver.start("job", "*/5 * * * *", fired::add);

        assertThatThrownBy(() -> driver.start("job", "bogus", fired::add))
                .isInstanceOf(InvalidScheduleException.class);

        scheduler.advanceTo(START.plus(Duration.ofMinutes(5)));
        assertThat(fired).containsExactly("job");
    }

    @Test
    void handlerFailureDoesNotKillTimer() {
        driver.start("job", "*/5 * * * *", name -> {
            fired.add(name);
            throw new IllegalStateException("boom");
        });

        scheduler.advanceTo(START.plus(Duration.ofMinutes(10)));

        assertThat(fired).hasSize(2);
        assertThat(driver.isActive("job")).isTrue();
    }
}

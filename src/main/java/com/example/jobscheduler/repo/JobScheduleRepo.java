package com.example.jobscheduler.repo;

import com.example.jobscheduler.domain.ExecutionStatus;
import com.example.jobscheduler.domain.JobSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface JobScheduleRepo extends JpaRepository<JobSchedule, String> {

    @Transactional
    @Modifying
    @Query("UPDATE JobSchedule s SET s.nextRunAt = :nextRunAt WHERE s.name = :name")
    int updateNextRunAt(@Param("name") String name, @Param("nextRunAt") Instant nextRunAt);

    /**
     * 计数器原子自增，重叠执行同时收尾也不会丢计数。
     */
    @Transactional
    @Modifying
    @Query("UPDATE JobSchedule s SET s.totalRuns = s.totalRuns + 1, " +
            "s.successfulRuns = s.successfulRuns + :succeeded, " +
            "s.failedRuns = s.failedRuns + :failed, " +
            "s.lastRunAt = :lastRunAt, s.lastRunStatus = :status, s.lastRunDurationMs = :durationMs " +
            "WHERE s.name = :name")
    int recordRun(@Param("name") String name,
                  @Param("succeeded") long succeeded,
                  @Param("failed") long failed,
                  @Param("lastRunAt") Instant lastRunAt,
                  @Param("status") ExecutionStatus status,
                  @Param("durationMs") Long durationMs);
}

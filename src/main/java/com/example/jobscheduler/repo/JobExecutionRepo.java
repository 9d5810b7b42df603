package com.example.jobscheduler.repo;

import com.example.jobscheduler.domain.ExecutionStatus;
import com.example.jobscheduler.domain.JobExecution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface JobExecutionRepo extends JpaRepository<JobExecution, String> {

    long countByJobName(String jobName);

    long countByJobNameAndStartedAtGreaterThanEqual(String jobName, Instant since);

    long countByJobNameAndStatusAndStartedAtGreaterThanEqual(String jobName, ExecutionStatus status, Instant since);

    List<JobExecution> findByJobNameOrderByStartedAtDesc(String jobName);

    List<JobExecution> findByStatusAndStartedAtBefore(ExecutionStatus status, Instant before);

    @Query("SELECT AVG(e.durationMs) FROM JobExecution e " +
            "WHERE e.jobName = :jobName AND e.status = :status AND e.startedAt >= :since AND e.durationMs IS NOT NULL")
    Number averageDuration(@Param("jobName") String jobName,
                           @Param("status") ExecutionStatus status,
                           @Param("since") Instant since);

    @Query("SELECT COALESCE(SUM(e.itemsProcessed), 0) FROM JobExecution e " +
            "WHERE e.jobName = :jobName AND e.startedAt >= :since")
    Number sumItemsProcessed(@Param("jobName") String jobName, @Param("since") Instant since);
}

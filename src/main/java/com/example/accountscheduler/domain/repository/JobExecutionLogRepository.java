package com.example.accountscheduler.domain.repository;

import com.example.accountscheduler.domain.entity.JobExecutionLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for JobExecutionLog entity
 */
@Repository
public interface JobExecutionLogRepository extends JpaRepository<JobExecutionLog, UUID> {

    /**
     * Attempt history of a job, latest first
     */
    List<JobExecutionLog> findByJobIdOrderByAttemptNumberDesc(UUID jobId);

    long countByJobId(UUID jobId);

    @Modifying
    @Query("DELETE FROM JobExecutionLog el WHERE el.jobId IN :jobIds")
    int deleteByJobIds(@Param("jobIds") List<UUID> jobIds);
}

package com.example.accountscheduler.mapper;

import com.example.accountscheduler.domain.entity.Job;
import com.example.accountscheduler.domain.entity.JobExecutionLog;
import com.example.accountscheduler.dto.JobExecutionLogResponse;
import com.example.accountscheduler.dto.JobResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    @Mapping(target = "lastErrorKind", source = "lastError.kind")
    @Mapping(target = "lastErrorMessage", source = "lastError.message")
    @Mapping(target = "lastErrorAt", source = "lastError.occurredAt")
    @Mapping(target = "executionHistory", ignore = true)
    JobResponse toResponse(Job job);

    List<JobResponse> toResponseList(List<Job> jobs);

    JobExecutionLogResponse toLogResponse(JobExecutionLog log);

    List<JobExecutionLogResponse> toLogResponses(List<JobExecutionLog> logs);
}

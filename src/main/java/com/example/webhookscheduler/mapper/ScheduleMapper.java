package com.example.webhookscheduler.mapper;

import com.example.webhookscheduler.domain.entity.Run;
import com.example.webhookscheduler.domain.entity.Schedule;
import com.example.webhookscheduler.dto.CreateScheduleRequest;
import com.example.webhookscheduler.dto.RunResponse;
import com.example.webhookscheduler.dto.ScheduleResponse;
import com.example.webhookscheduler.dto.UpdateScheduleRequest;
import org.mapstruct.BeanMapping;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper between schedule/run entities and API DTOs.
 * Runtime, lock and audit columns are never taken from a request.
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ScheduleMapper {

    ScheduleResponse toResponse(Schedule schedule);

    List<ScheduleResponse> toResponseList(List<Schedule> schedules);

    RunResponse toRunResponse(Run run);

    List<RunResponse> toRunResponses(List<Run> runs);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "status", ignore = true)
    @Mapping(target = "nextRunAt", ignore = true)
    @Mapping(target = "lastRunAt", ignore = true)
    @Mapping(target = "lockedBy", ignore = true)
    @Mapping(target = "lockedUntil", ignore = true)
    @Mapping(target = "version", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    Schedule toEntity(CreateScheduleRequest request);

    /**
     * Copy the non-null fields of an edit onto the schedule
     */
    @BeanMapping(nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "tenantId", ignore = true)
    @Mapping(target = "userId", ignore = true)
    @Mapping(target = "status", ignore = true)
    @Mapping(target = "nextRunAt", ignore = true)
    @Mapping(target = "lastRunAt", ignore = true)
    @Mapping(target = "lockedBy", ignore = true)
    @Mapping(target = "lockedUntil", ignore = true)
    @Mapping(target = "version", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    void applyUpdate(UpdateScheduleRequest request, @MappingTarget Schedule schedule);
}

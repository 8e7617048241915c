package com.example.billingautomation.mapper;

import com.example.billingautomation.domain.model.ScheduledTask;
import com.example.billingautomation.dto.TaskResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper from scheduler task snapshots to API DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface TaskMapper {

    TaskResponse toResponse(ScheduledTask task);

    List<TaskResponse> toResponseList(List<ScheduledTask> tasks);
}

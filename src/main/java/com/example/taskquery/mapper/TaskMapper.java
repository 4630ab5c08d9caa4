package com.example.taskquery.mapper;

import com.example.taskquery.domain.entity.Task;
import com.example.taskquery.dto.TaskPageResponse;
import com.example.taskquery.dto.TaskResponse;
import com.example.taskquery.service.pagination.TaskPage;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between domain objects and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface TaskMapper {

    /**
     * Convert Task to TaskResponse DTO
     */
    TaskResponse toResponse(Task task);

    /**
     * Convert list of Tasks to TaskResponse DTOs
     */
    List<TaskResponse> toResponseList(List<Task> tasks);

    /**
     * Convert a page of tasks to the list response
     */
    @Mapping(target = "page.nextCursor", source = "nextCursor")
    @Mapping(target = "page.limit", source = "limit")
    TaskPageResponse toPageResponse(TaskPage page);
}

package com.example.taskquery.controller;

import com.example.taskquery.dto.ApiResponse;
import com.example.taskquery.dto.TaskPageResponse;
import com.example.taskquery.dto.TaskQueryParams;
import com.example.taskquery.service.TaskListService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API controller for listing a project's tasks.
 * <p>
 * Supports:
 * - Filtering by status, priority, assignee, due date window and title text
 * - Whitelisted sorting
 * - Keyset pagination through opaque cursors
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/projects/{projectId}/tasks")
@Tag(name = "Task List", description = "APIs for filtering and paging through project tasks")
public class TaskListController {

    private final TaskListService taskListService;

    @GetMapping
    @Operation(summary = "List tasks", description = "List one page of a project's tasks. Pass nextCursor back as cursor to get the next page.")
    public ResponseEntity<ApiResponse<TaskPageResponse>> listTasks(
            @Parameter(description = "Project ID") @PathVariable String projectId,
            @Parameter(description = "Comma-separated statuses: todo, in_progress (or doing), done")
            @RequestParam(required = false) String status,
            @Parameter(description = "Comma-separated priorities: low, medium, high")
            @RequestParam(required = false) String priority,
            @Parameter(description = "Assignee ID (exact match)")
            @RequestParam(required = false) String assigneeId,
            @Parameter(description = "First included due date (YYYY-MM-DD)")
            @RequestParam(required = false) String dueDateFrom,
            @Parameter(description = "Last included due date (YYYY-MM-DD)")
            @RequestParam(required = false) String dueDateTo,
            @Parameter(description = "Case-insensitive title search")
            @RequestParam(required = false) String q,
            @Parameter(description = "Sort keys: sortOrder, createdAt, updatedAt, dueDate, priority; prefix with - for descending. Not allowed with cursor.")
            @RequestParam(required = false) String sort,
            @Parameter(description = "Page size, 1-200 (default 200)")
            @RequestParam(required = false) String limit,
            @Parameter(description = "Cursor from the previous page")
            @RequestParam(required = false) String cursor) {

        log.debug("API: List tasks for project {}", projectId);

        var params = TaskQueryParams.builder()
                .status(status)
                .priority(priority)
                .assigneeId(assigneeId)
                .dueDateFrom(dueDateFrom)
                .dueDateTo(dueDateTo)
                .q(q)
                .sort(sort)
                .limit(limit)
                .cursor(cursor)
                .build();

        return ResponseEntity.ok(ApiResponse.success(taskListService.listTasks(projectId, params)));
    }
}

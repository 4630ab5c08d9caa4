package com.example.taskquery.service;

import com.example.taskquery.config.MetricsConfig;
import com.example.taskquery.domain.query.TaskQuery;
import com.example.taskquery.domain.repository.TaskReadRepository;
import com.example.taskquery.dto.TaskPageResponse;
import com.example.taskquery.dto.TaskQueryParams;
import com.example.taskquery.exception.TaskQueryException;
import com.example.taskquery.mapper.TaskMapper;
import com.example.taskquery.service.pagination.TaskPaginator;
import com.example.taskquery.service.query.TaskQueryNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for listing the tasks of a project one page at a time.
 * <p>
 * Flow:
 * 1. Normalize and validate the raw parameters, including the cursor
 * 2. Fetch up to {@code limit + 1} rows from the configured store
 * 3. Cut the page and mint the next cursor
 * 4. Map to response DTOs
 * <p>
 * Rejected requests never reach the store. Transactions belong to the store itself, so the
 * in-memory store serves requests without a database.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskListService {

    private final TaskQueryNormalizer queryNormalizer;
    private final TaskReadRepository taskRepository;
    private final TaskPaginator paginator;
    private final TaskMapper taskMapper;
    private final MetricsConfig metrics;

    /**
     * List one page of a project's tasks
     *
     * @throws TaskQueryException when a parameter or the cursor is rejected
     */
    public TaskPageResponse listTasks(String projectId, TaskQueryParams params) {
        var sample = metrics.startQueryTimer();

        var query = normalize(projectId, params);
        log.debug("Listing tasks for project {} (limit {}, cursor {})", projectId, query.getLimit(), query.hasCursor());

        var rows = taskRepository.findByProject(projectId, query);
        var page = paginator.paginate(projectId, query, rows);

        metrics.recordRequest(sample, taskRepository.backendName());
        metrics.recordPage(page.hasNext());
        log.debug("Returning {} tasks for project {}, hasNext={}", page.getTasks().size(), projectId, page.hasNext());

        return taskMapper.toPageResponse(page);
    }

    private TaskQuery normalize(String projectId, TaskQueryParams params) {
        try {
            return queryNormalizer.normalize(projectId, params);
        } catch (TaskQueryException e) {
            metrics.recordRejection(e.getField(), e.getCode());
            log.warn("Rejected task list request for project {}: {}", projectId, e.getMessage());
            throw e;
        }
    }
}

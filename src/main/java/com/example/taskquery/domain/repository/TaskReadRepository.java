package com.example.taskquery.domain.repository;

import com.example.taskquery.domain.entity.Task;
import com.example.taskquery.domain.query.TaskQuery;

import java.util.List;

/**
 * Read access to the tasks of a project.
 * <p>
 * Implementations apply the filters, ordering, seek position and fetch size of a
 * {@link TaskQuery} exactly as described by its
 * {@link com.example.taskquery.domain.query.TaskQuerySpecification}, so every backend
 * returns the same rows in the same order.
 */
public interface TaskReadRepository {

    /**
     * Find at most {@code query.getFetchSize()} tasks of a project, ordered as the query requires.
     *
     * @param projectId project scope, never null
     * @param query     normalized and validated query
     * @return up to {@code limit + 1} tasks; the extra row only signals that another page exists
     */
    List<Task> findByProject(String projectId, TaskQuery query);

    /**
     * Name of the backend, used as a metric tag
     */
    String backendName();
}

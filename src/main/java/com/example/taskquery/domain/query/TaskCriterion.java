package com.example.taskquery.domain.query;

import com.example.taskquery.domain.entity.Task;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * One filter condition of a task query, defined once for every backend.
 * <p>
 * {@link #toSql(MapSqlParameterSource)} and {@link #matches(Task)} must accept exactly the same rows.
 */
public interface TaskCriterion {

    /**
     * Render the condition as a SQL predicate, registering its values as named parameters.
     * Values are never concatenated into the returned text.
     */
    String toSql(MapSqlParameterSource parameters);

    /**
     * Evaluate the condition against an in-memory row
     */
    boolean matches(Task task);
}

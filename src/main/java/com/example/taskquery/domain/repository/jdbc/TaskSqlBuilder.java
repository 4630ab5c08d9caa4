package com.example.taskquery.domain.repository.jdbc;

import com.example.taskquery.domain.query.OrderTerm;
import com.example.taskquery.domain.query.TaskQuery;
import com.example.taskquery.domain.query.TaskQuerySpecification;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Renders a task query as one parameterized PostgreSQL statement.
 * <p>
 * Shape:
 * <pre>
 * SELECT ... FROM tasks
 * WHERE project_id = :projectId [AND filters] [AND seek predicate]
 * ORDER BY [requested terms | created_at ASC], id ASC
 * LIMIT :limit
 * </pre>
 * {@code :limit} is bound to {@code limit + 1}. Every user supplied value is a bind parameter.
 */
@Component
public class TaskSqlBuilder {

    static final String SELECT_COLUMNS = """
            SELECT id, project_id, title, description, status, priority, assignee_id, due_date, created_at, updated_at
            FROM tasks""";

    public SqlStatement build(String projectId, TaskQuery query) {
        var specification = TaskQuerySpecification.of(projectId, query);
        var parameters = new MapSqlParameterSource();

        var where = specification.getCriteria().stream()
                .map(criterion -> criterion.toSql(parameters))
                .collect(Collectors.joining(" AND "));
        var orderBy = specification.getOrderTerms().stream()
                .map(OrderTerm::toSql)
                .collect(Collectors.joining(", "));
        parameters.addValue("limit", specification.getFetchSize());

        var sql = SELECT_COLUMNS + "\nWHERE " + where + "\nORDER BY " + orderBy + "\nLIMIT :limit";
        return new SqlStatement(sql, parameters);
    }
}

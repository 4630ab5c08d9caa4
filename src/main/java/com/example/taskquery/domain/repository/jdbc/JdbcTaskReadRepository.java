package com.example.taskquery.domain.repository.jdbc;

import com.example.taskquery.domain.entity.Task;
import com.example.taskquery.domain.query.TaskQuery;
import com.example.taskquery.domain.repository.TaskReadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * PostgreSQL task store.
 * <p>
 * Runs one keyset query per page. The {@code (project_id, created_at, id)} index serves the
 * project scope, the seek predicate and the default ordering. Storage errors surface as
 * {@link org.springframework.dao.DataAccessException} and are not retried.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "task-query", name = "store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcTaskReadRepository implements TaskReadRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final TaskSqlBuilder sqlBuilder;

    @Override
    @Transactional(readOnly = true)
    public List<Task> findByProject(String projectId, TaskQuery query) {
        var statement = sqlBuilder.build(projectId, query);
        log.debug("Executing task query: {}", statement.getSql());
        return jdbcTemplate.query(statement.getSql(), statement.getParameters(), TaskRowMapper.INSTANCE);
    }

    @Override
    public String backendName() {
        return "jdbc";
    }
}

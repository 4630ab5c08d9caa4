package com.example.taskquery.domain.repository.jdbc;

import com.example.taskquery.domain.entity.Task;
import com.example.taskquery.domain.enums.TaskPriority;
import com.example.taskquery.domain.enums.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Maps a row of the {@code tasks} table to a {@link Task}.
 * Unknown priority codes map to null (lowest rank); unknown status codes are kept as null.
 */
@Slf4j
class TaskRowMapper implements RowMapper<Task> {

    static final TaskRowMapper INSTANCE = new TaskRowMapper();

    @Override
    public Task mapRow(ResultSet rs, int rowNum) throws SQLException {
        var id = rs.getString("id");
        var statusCode = rs.getString("status");
        var status = statusCode == null ? null : TaskStatus.findByCode(statusCode).orElse(null);
        if (statusCode != null && status == null) {
            log.debug("Task {} has unknown status code '{}'", id, statusCode);
        }
        var priorityCode = rs.getString("priority");

        return Task.builder()
                .id(id)
                .projectId(rs.getString("project_id"))
                .title(rs.getString("title"))
                .description(rs.getString("description"))
                .status(status)
                .priority(priorityCode == null ? null : TaskPriority.findByCode(priorityCode).orElse(null))
                .assigneeId(rs.getString("assignee_id"))
                .dueDate(rs.getObject("due_date", LocalDate.class))
                .createdAt(toInstant(rs.getObject("created_at", OffsetDateTime.class)))
                .updatedAt(toInstant(rs.getObject("updated_at", OffsetDateTime.class)))
                .build();
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}

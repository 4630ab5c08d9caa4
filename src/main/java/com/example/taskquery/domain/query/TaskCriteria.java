package com.example.taskquery.domain.query;

import com.example.taskquery.domain.entity.Task;
import com.example.taskquery.domain.enums.TaskPriority;
import com.example.taskquery.domain.enums.TaskStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;

/**
 * Factory for the filter conditions of a task query.
 */
public final class TaskCriteria {

    static final char LIKE_ESCAPE = '\\';

    private TaskCriteria() {
    }

    public static TaskCriterion projectScope(String projectId) {
        return new ProjectScope(projectId);
    }

    public static TaskCriterion statusIn(List<TaskStatus> statuses) {
        return new StatusIn(List.copyOf(statuses));
    }

    public static TaskCriterion priorityIn(List<TaskPriority> priorities) {
        return new PriorityIn(List.copyOf(priorities));
    }

    public static TaskCriterion assigneeEquals(String assigneeId) {
        return new AssigneeEquals(assigneeId);
    }

    public static TaskCriterion dueOnOrAfter(LocalDateTime from) {
        return new DueOnOrAfter(from);
    }

    public static TaskCriterion dueOnOrBefore(LocalDateTime to) {
        return new DueOnOrBefore(to);
    }

    public static TaskCriterion titleContains(String text) {
        return new TitleContains(text.toLowerCase(Locale.ROOT));
    }

    public static TaskCriterion seekAfter(SeekKey seekKey) {
        return new SeekAfter(seekKey);
    }

    /**
     * Escape LIKE wildcards so the text only ever matches itself
     */
    static String escapeLike(String text) {
        var escaped = new StringBuilder(text.length() + 8);
        for (var c : text.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    @RequiredArgsConstructor
    private static final class ProjectScope implements TaskCriterion {

        private final String projectId;

        @Override
        public String toSql(MapSqlParameterSource parameters) {
            parameters.addValue("projectId", projectId);
            return "project_id = :projectId";
        }

        @Override
        public boolean matches(Task task) {
            return projectId.equals(task.getProjectId());
        }
    }

    @RequiredArgsConstructor
    private static final class StatusIn implements TaskCriterion {

        private final List<TaskStatus> statuses;

        @Override
        public String toSql(MapSqlParameterSource parameters) {
            parameters.addValue("statuses", statuses.stream().map(TaskStatus::getCode).toList());
            return "status IN (:statuses)";
        }

        @Override
        public boolean matches(Task task) {
            return statuses.contains(task.getStatus());
        }
    }

    @RequiredArgsConstructor
    private static final class PriorityIn implements TaskCriterion {

        private final List<TaskPriority> priorities;

        @Override
        public String toSql(MapSqlParameterSource parameters) {
            parameters.addValue("priorities", priorities.stream().map(TaskPriority::getCode).toList());
            return "priority IN (:priorities)";
        }

        @Override
        public boolean matches(Task task) {
            return priorities.contains(task.getPriority());
        }
    }

    @RequiredArgsConstructor
    private static final class AssigneeEquals implements TaskCriterion {

        private final String assigneeId;

        @Override
        public String toSql(MapSqlParameterSource parameters) {
            parameters.addValue("assigneeId", assigneeId);
            return "assignee_id = :assigneeId";
        }

        @Override
        public boolean matches(Task task) {
            return assigneeId.equals(task.getAssigneeId());
        }
    }

    /**
     * due_date is a DATE column, so the window start compares on its date part
     */
    @RequiredArgsConstructor
    private static final class DueOnOrAfter implements TaskCriterion {

        private final LocalDateTime from;

        @Override
        public String toSql(MapSqlParameterSource parameters) {
            parameters.addValue("dueDateFrom", from.toLocalDate());
            return "due_date >= :dueDateFrom";
        }

        @Override
        public boolean matches(Task task) {
            return task.getDueDate() != null && !task.getDueDate().atStartOfDay().isBefore(from);
        }
    }

    @RequiredArgsConstructor
    private static final class DueOnOrBefore implements TaskCriterion {

        private final LocalDateTime to;

        @Override
        public String toSql(MapSqlParameterSource parameters) {
            parameters.addValue("dueDateTo", to.toLocalDate());
            return "due_date <= :dueDateTo";
        }

        @Override
        public boolean matches(Task task) {
            return task.getDueDate() != null && !task.getDueDate().atStartOfDay().isAfter(to);
        }
    }

    @RequiredArgsConstructor
    private static final class TitleContains implements TaskCriterion {

        private final String lowerCaseText;

        @Override
        public String toSql(MapSqlParameterSource parameters) {
            parameters.addValue("titlePattern", "%" + escapeLike(lowerCaseText) + "%");
            return "LOWER(title) LIKE :titlePattern ESCAPE '" + LIKE_ESCAPE + "'";
        }

        @Override
        public boolean matches(Task task) {
            return task.getTitle() != null && task.getTitle().toLowerCase(Locale.ROOT).contains(lowerCaseText);
        }
    }

    @RequiredArgsConstructor
    private static final class SeekAfter implements TaskCriterion {

        private final SeekKey seekKey;

        @Override
        public String toSql(MapSqlParameterSource parameters) {
            parameters.addValue("cursorCreatedAt", seekKey.getCreatedAt().atOffset(ZoneOffset.UTC));
            parameters.addValue("cursorId", seekKey.getId());
            return "(created_at > :cursorCreatedAt OR (created_at = :cursorCreatedAt AND id > :cursorId))";
        }

        @Override
        public boolean matches(Task task) {
            var createdAt = TaskQuerySpecification.toColumnPrecision(task.getCreatedAt());
            var cmp = createdAt.compareTo(seekKey.getCreatedAt());
            return cmp > 0 || (cmp == 0 && task.getId().compareTo(seekKey.getId()) > 0);
        }
    }
}

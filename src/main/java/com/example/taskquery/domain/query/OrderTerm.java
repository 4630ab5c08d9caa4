package com.example.taskquery.domain.query;

import com.example.taskquery.domain.entity.Task;
import com.example.taskquery.domain.enums.SortDirection;
import com.example.taskquery.domain.enums.SortKey;
import com.example.taskquery.domain.enums.TaskPriority;
import lombok.Value;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.Collectors;

/**
 * One resolved ORDER BY term, rendered identically for SQL and in-memory evaluation.
 */
@Value
public class OrderTerm {

    static final String PRIORITY_RANK_SQL = Arrays.stream(TaskPriority.values())
            .sorted(Comparator.comparingInt(TaskPriority::getRank).reversed())
            .map(p -> "WHEN '" + p.getCode() + "' THEN " + p.getRank())
            .collect(Collectors.joining(" ", "CASE priority ", " ELSE " + TaskPriority.UNKNOWN_RANK + " END"));

    SortKey key;
    SortDirection direction;

    public static OrderTerm of(SortOrder sortOrder) {
        return new OrderTerm(sortOrder.getKey(), sortOrder.getDirection());
    }

    public static OrderTerm asc(SortKey key) {
        return new OrderTerm(key, SortDirection.ASC);
    }

    public String toSql() {
        return switch (key) {
            case CREATED_AT -> "created_at " + direction;
            case UPDATED_AT -> "updated_at " + direction;
            case DUE_DATE -> direction == SortDirection.ASC ? "due_date ASC NULLS LAST" : "due_date DESC NULLS FIRST";
            case PRIORITY -> PRIORITY_RANK_SQL + " " + direction;
            case ID -> "id " + direction;
            case SORT_ORDER -> throw new IllegalStateException("sortOrder has no stored column");
        };
    }

    public Comparator<Task> comparator() {
        Comparator<Task> ascending = switch (key) {
            case CREATED_AT -> Comparator.comparing((Task t) -> TaskQuerySpecification.toColumnPrecision(t.getCreatedAt()));
            case UPDATED_AT -> Comparator.comparing((Task t) -> TaskQuerySpecification.toColumnPrecision(t.getUpdatedAt()));
            // nulls last ascending; reversing puts them first descending
            case DUE_DATE -> Comparator.comparing(Task::getDueDate, Comparator.nullsLast(Comparator.naturalOrder()));
            case PRIORITY -> Comparator.comparingInt((Task t) -> TaskPriority.rankOf(t.getPriority()));
            case ID -> Comparator.comparing(Task::getId);
            case SORT_ORDER -> throw new IllegalStateException("sortOrder has no stored column");
        };
        return direction == SortDirection.ASC ? ascending : ascending.reversed();
    }
}

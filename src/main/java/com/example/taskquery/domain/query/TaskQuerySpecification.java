package com.example.taskquery.domain.query;

import com.example.taskquery.domain.entity.Task;
import com.example.taskquery.domain.enums.SortKey;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Filter conditions and ordering of a task query, resolved once and shared by the SQL builder
 * and the in-memory evaluator so both backends return the same rows in the same order.
 * <p>
 * Ordering rules:
 * - with a cursor, {@code createdAt ASC} (the seek order)
 * - otherwise the requested keys, or {@code createdAt ASC} when none orders anything
 * - always followed by {@code id ASC} as the tie-break
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class TaskQuerySpecification {

    private final List<TaskCriterion> criteria;
    private final List<OrderTerm> orderTerms;
    private final int fetchSize;

    public static TaskQuerySpecification of(String projectId, TaskQuery query) {
        return new TaskQuerySpecification(criteriaOf(projectId, query), orderTermsOf(query), query.getFetchSize());
    }

    /**
     * Timestamps are stored with microsecond precision; in-memory comparisons use the same precision
     */
    public static Instant toColumnPrecision(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MICROS);
    }

    public Predicate<Task> predicate() {
        return task -> criteria.stream().allMatch(criterion -> criterion.matches(task));
    }

    public Comparator<Task> comparator() {
        return orderTerms.stream()
                .map(OrderTerm::comparator)
                .reduce(Comparator::thenComparing)
                .orElseThrow();
    }

    private static List<TaskCriterion> criteriaOf(String projectId, TaskQuery query) {
        var criteria = new ArrayList<TaskCriterion>();
        criteria.add(TaskCriteria.projectScope(projectId));
        if (!query.getStatuses().isEmpty()) {
            criteria.add(TaskCriteria.statusIn(query.getStatuses()));
        }
        if (!query.getPriorities().isEmpty()) {
            criteria.add(TaskCriteria.priorityIn(query.getPriorities()));
        }
        if (query.getAssigneeId() != null) {
            criteria.add(TaskCriteria.assigneeEquals(query.getAssigneeId()));
        }
        if (query.getDueDateFrom() != null) {
            criteria.add(TaskCriteria.dueOnOrAfter(query.getDueDateFrom()));
        }
        if (query.getDueDateTo() != null) {
            criteria.add(TaskCriteria.dueOnOrBefore(query.getDueDateTo()));
        }
        if (query.getFreeText() != null) {
            criteria.add(TaskCriteria.titleContains(query.getFreeText()));
        }
        if (query.hasCursor()) {
            criteria.add(TaskCriteria.seekAfter(query.getCursor()));
        }
        return List.copyOf(criteria);
    }

    private static List<OrderTerm> orderTermsOf(TaskQuery query) {
        var terms = new ArrayList<OrderTerm>();
        if (!query.hasCursor()) {
            query.getSortOrders().stream()
                    .filter(order -> order.getKey() != SortKey.SORT_ORDER)
                    .map(OrderTerm::of)
                    .forEach(terms::add);
        }
        if (terms.isEmpty()) {
            terms.add(OrderTerm.asc(SortKey.CREATED_AT));
        }
        terms.add(OrderTerm.asc(SortKey.ID));
        return List.copyOf(terms);
    }
}

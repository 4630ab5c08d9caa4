package com.example.taskquery.domain.repository.memory;

import com.example.taskquery.domain.entity.Task;
import com.example.taskquery.domain.query.TaskQuery;
import com.example.taskquery.domain.query.TaskQuerySpecification;

import java.util.Collection;
import java.util.List;

/**
 * Evaluates a task query against a collection of tasks: filter, sort, then keep at most
 * {@code limit + 1} rows. Same semantics as the SQL statement built for the same query.
 */
public final class InMemoryTaskEvaluator {

    private InMemoryTaskEvaluator() {
    }

    public static List<Task> evaluate(Collection<Task> tasks, String projectId, TaskQuery query) {
        var specification = TaskQuerySpecification.of(projectId, query);
        return tasks.stream()
                .filter(specification.predicate())
                .sorted(specification.comparator())
                .limit(specification.getFetchSize())
                .toList();
    }
}

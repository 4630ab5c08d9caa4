package com.example.taskquery.domain.repository.memory;

import com.example.taskquery.domain.entity.Task;
import com.example.taskquery.domain.query.TaskQuery;
import com.example.taskquery.domain.repository.TaskReadRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Task store held in memory, for local runs and tests.
 * Supports the same filters, ordering and cursors as the JDBC store.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "task-query", name = "store", havingValue = "memory")
public class InMemoryTaskReadRepository implements TaskReadRepository {

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public List<Task> findByProject(String projectId, TaskQuery query) {
        return InMemoryTaskEvaluator.evaluate(tasks.values(), projectId, query);
    }

    @Override
    public String backendName() {
        return "memory";
    }

    /**
     * Insert or replace a task by id
     */
    public Task save(Task task) {
        tasks.put(task.getId(), task);
        return task;
    }

    public void saveAll(Collection<Task> newTasks) {
        newTasks.forEach(this::save);
        log.debug("Stored {} tasks, {} in total", newTasks.size(), tasks.size());
    }

    public void clear() {
        tasks.clear();
    }
}

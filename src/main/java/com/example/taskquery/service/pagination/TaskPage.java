package com.example.taskquery.service.pagination;

import com.example.taskquery.domain.entity.Task;
import lombok.Value;

import java.util.List;

/**
 * One page of tasks and the cursor of the page after it, if any
 */
@Value
public class TaskPage {

    List<Task> tasks;

    /**
     * Null on the last page
     */
    String nextCursor;

    int limit;

    public boolean hasNext() {
        return nextCursor != null;
    }
}

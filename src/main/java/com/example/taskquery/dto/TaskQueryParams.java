package com.example.taskquery.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw task list parameters as received from the caller.
 * <p>
 * Every field is optional. Values are validated and normalized in one step by the query
 * normalizer, so the result does not depend on the order in which fields were set.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TaskQueryParams {

    /**
     * Comma-separated status codes, e.g. {@code todo,doing}
     */
    private String status;

    /**
     * Comma-separated priority codes, e.g. {@code high,medium}
     */
    private String priority;

    private String assigneeId;

    /**
     * First included due date, {@code YYYY-MM-DD}
     */
    private String dueDateFrom;

    /**
     * Last included due date, {@code YYYY-MM-DD}
     */
    private String dueDateTo;

    /**
     * Title search text
     */
    private String q;

    /**
     * Comma-separated sort keys, {@code -} prefix for descending, e.g. {@code -priority,createdAt}
     */
    private String sort;

    private String limit;

    /**
     * Opaque cursor returned as {@code nextCursor} by the previous page
     */
    private String cursor;
}

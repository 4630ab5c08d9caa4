package com.example.taskquery.domain.query;

import com.example.taskquery.exception.IssueCode;
import com.example.taskquery.exception.QueryValidationException;
import com.example.taskquery.domain.enums.TaskPriority;
import com.example.taskquery.domain.enums.TaskStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Normalized, validated task list query.
 * <p>
 * Holds the filter dimensions, the requested ordering, the page size and the optional seek
 * position of a cursor. Instances are produced by the query normalizer and never mutated;
 * {@link #withCursor(SeekKey)} returns a copy.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class TaskQuery {

    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 200;
    public static final int DEFAULT_LIMIT = 200;

    /**
     * Deduplicated, in first-seen order
     */
    @Builder.Default
    private final List<TaskStatus> statuses = List.of();

    /**
     * Deduplicated, in first-seen order
     */
    @Builder.Default
    private final List<TaskPriority> priorities = List.of();

    private final String assigneeId;

    /**
     * Start of the first included day (00:00:00)
     */
    private final LocalDateTime dueDateFrom;

    /**
     * End of the last included day (23:59:59.999999999)
     */
    private final LocalDateTime dueDateTo;

    /**
     * Case-insensitive substring of the title, already trimmed
     */
    private final String freeText;

    /**
     * Explicit ordering; always empty when a cursor is present
     */
    @Builder.Default
    private final List<SortOrder> sortOrders = List.of();

    @Builder.Default
    private final int limit = DEFAULT_LIMIT;

    private final SeekKey cursor;

    /**
     * Clamp a requested page size into [1, 200]; anything outside becomes the default
     */
    public static int normalizeLimit(int requested) {
        if (requested < MIN_LIMIT || requested > MAX_LIMIT) {
            return DEFAULT_LIMIT;
        }
        return requested;
    }

    public boolean hasCursor() {
        return cursor != null;
    }

    /**
     * Number of rows a backend must return: one more than the page so the next page can be detected
     */
    public int getFetchSize() {
        return limit + 1;
    }

    public TaskQuery withCursor(SeekKey seekKey) {
        return toBuilder().cursor(seekKey).build();
    }

    /**
     * Fingerprint of the filter dimensions of this query within a project
     */
    public String computeFingerprint(String projectId) {
        return QueryFingerprint.compute(projectId, this);
    }

    /**
     * Check the cross-field invariants of the query
     */
    public void validate() {
        if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
            throw new QueryValidationException("limit", IssueCode.INVALID_RANGE, String.valueOf(limit));
        }
        if (dueDateFrom != null && dueDateTo != null && dueDateFrom.isAfter(dueDateTo)) {
            throw new QueryValidationException("dueDateFrom", IssueCode.CONSTRAINT_VIOLATION, null);
        }
        if (cursor != null && !sortOrders.isEmpty()) {
            throw new QueryValidationException("sort", IssueCode.INCOMPATIBLE_WITH_CURSOR, null);
        }
    }
}

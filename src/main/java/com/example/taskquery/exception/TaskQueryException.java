package com.example.taskquery.exception;

import lombok.Getter;

/**
 * Base class for every rejection of a task list request.
 * <p>
 * Carries the offending parameter, a typed reason and the rejected value so callers
 * can react without parsing the message.
 */
@Getter
public abstract class TaskQueryException extends RuntimeException {

    private final String field;
    private final IssueCode code;

    /**
     * Offending input, null when it is not meaningful to echo it back
     */
    private final String rejectedValue;

    protected TaskQueryException(String field, IssueCode code, String rejectedValue, String message) {
        super(message);
        this.field = field;
        this.code = code;
        this.rejectedValue = rejectedValue;
    }

    protected TaskQueryException(String field, IssueCode code, String rejectedValue, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
        this.code = code;
        this.rejectedValue = rejectedValue;
    }
}

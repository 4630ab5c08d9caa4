package com.example.taskquery.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Task workflow status as stored in the {@code tasks.status} column.
 */
@Getter
@RequiredArgsConstructor
public enum TaskStatus {

    /**
     * Not started yet
     */
    TODO("todo", "To Do"),

    /**
     * Work in progress. Also accepted under the legacy code {@code doing}.
     */
    IN_PROGRESS("in_progress", "In Progress"),

    /**
     * Finished
     */
    DONE("done", "Done");

    /**
     * Legacy alias accepted on input and normalized to {@link #IN_PROGRESS}
     */
    public static final String DOING_ALIAS = "doing";

    @JsonValue
    private final String code;
    private final String displayName;

    /**
     * Find TaskStatus by its code value, accepting the {@code doing} alias
     */
    public static Optional<TaskStatus> findByCode(String code) {
        if (DOING_ALIAS.equals(code)) {
            return Optional.of(IN_PROGRESS);
        }
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    /**
     * Find TaskStatus by its code value
     */
    public static TaskStatus fromCode(String code) {
        return findByCode(code).orElseThrow(() -> new IllegalArgumentException("Unknown task status code: " + code));
    }
}

package com.example.taskquery.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Task priority levels.
 * Ordering uses {@link #getRank()}, never the code, so that high sorts above medium above low.
 */
@Getter
@RequiredArgsConstructor
public enum TaskPriority {

    LOW("low", 1),

    MEDIUM("medium", 2),

    HIGH("high", 3);

    /**
     * Rank given to rows whose priority is missing or not recognized
     */
    public static final int UNKNOWN_RANK = 0;

    @JsonValue
    private final String code;
    private final int rank;

    /**
     * Find TaskPriority by its code value
     */
    public static Optional<TaskPriority> findByCode(String code) {
        for (var priority : values()) {
            if (priority.getCode().equals(code)) {
                return Optional.of(priority);
            }
        }
        return Optional.empty();
    }

    /**
     * Find TaskPriority by its code value
     */
    public static TaskPriority fromCode(String code) {
        return findByCode(code).orElseThrow(() -> new IllegalArgumentException("Unknown task priority code: " + code));
    }

    /**
     * Rank of a possibly missing priority
     */
    public static int rankOf(TaskPriority priority) {
        return priority != null ? priority.getRank() : UNKNOWN_RANK;
    }
}

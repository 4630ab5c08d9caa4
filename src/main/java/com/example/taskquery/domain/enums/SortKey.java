package com.example.taskquery.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Keys a task list may be ordered by.
 * <p>
 * Only keys flagged {@code clientSortable} can be requested through the {@code sort} parameter.
 * {@link #ID} is reserved for the tie-break and the cursor seek order.
 */
@Getter
@RequiredArgsConstructor
public enum SortKey {

    /**
     * Manual board position. Accepted for compatibility; tasks carry no stored position yet,
     * so it contributes no ordering term.
     */
    SORT_ORDER("sortOrder", true),

    CREATED_AT("createdAt", true),

    UPDATED_AT("updatedAt", true),

    /**
     * Missing due dates go last ascending and first descending
     */
    DUE_DATE("dueDate", true),

    /**
     * Ordered by {@link TaskPriority#getRank()}
     */
    PRIORITY("priority", true),

    ID("id", false);

    private final String code;
    private final boolean clientSortable;

    /**
     * Find a key that clients may sort by
     */
    public static Optional<SortKey> findSortable(String code) {
        for (var key : values()) {
            if (key.isClientSortable() && key.getCode().equals(code)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}

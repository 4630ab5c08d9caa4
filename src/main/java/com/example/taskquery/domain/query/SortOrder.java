package com.example.taskquery.domain.query;

import com.example.taskquery.domain.enums.SortDirection;
import com.example.taskquery.domain.enums.SortKey;
import lombok.Value;

/**
 * One requested ordering term, e.g. {@code -priority} is {@code (PRIORITY, DESC)}.
 */
@Value
public class SortOrder {

    SortKey key;
    SortDirection direction;

    public static SortOrder asc(SortKey key) {
        return new SortOrder(key, SortDirection.ASC);
    }

    public static SortOrder desc(SortKey key) {
        return new SortOrder(key, SortDirection.DESC);
    }

    public boolean isDescending() {
        return direction == SortDirection.DESC;
    }
}

package com.example.taskquery.domain.enums;

/**
 * Sort direction. A leading {@code -} on a sort token selects {@link #DESC}.
 */
public enum SortDirection {
    ASC,
    DESC
}

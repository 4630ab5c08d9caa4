package com.example.taskquery.exception;

/**
 * Machine-readable reason attached to a rejected query parameter.
 */
public enum IssueCode {

    /**
     * Value is not one of the allowed enum codes (status, priority, sort key)
     */
    INVALID_ENUM,

    /**
     * Value cannot be parsed (date, limit, cursor encoding)
     */
    INVALID_FORMAT,

    /**
     * Mandatory value is missing
     */
    REQUIRED,

    /**
     * Individually valid values contradict each other (dueDateFrom after dueDateTo)
     */
    CONSTRAINT_VIOLATION,

    /**
     * Numeric value outside its allowed range
     */
    INVALID_RANGE,

    /**
     * An explicit sort was combined with a cursor
     */
    INCOMPATIBLE_WITH_CURSOR,

    /**
     * Cursor signature does not match its payload
     */
    INVALID_SIGNATURE,

    /**
     * Cursor was issued longer ago than the configured time to live
     */
    EXPIRED,

    /**
     * Cursor was issued for another project or another filter set
     */
    QUERY_MISMATCH
}

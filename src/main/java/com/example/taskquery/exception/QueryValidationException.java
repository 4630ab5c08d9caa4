package com.example.taskquery.exception;

/**
 * Exception for filter, sort or limit input that cannot be turned into a query
 */
public class QueryValidationException extends TaskQueryException {

    public QueryValidationException(String field, IssueCode code, String rejectedValue) {
        super(field, code, rejectedValue, formatMessage(field, code, rejectedValue));
    }

    public QueryValidationException(String field, IssueCode code, String rejectedValue, Throwable cause) {
        super(field, code, rejectedValue, formatMessage(field, code, rejectedValue), cause);
    }

    public static QueryValidationException invalidEnum(String field, String rejectedValue) {
        return new QueryValidationException(field, IssueCode.INVALID_ENUM, rejectedValue);
    }

    public static QueryValidationException invalidFormat(String field, String rejectedValue, Throwable cause) {
        return new QueryValidationException(field, IssueCode.INVALID_FORMAT, rejectedValue, cause);
    }

    private static String formatMessage(String field, IssueCode code, String rejectedValue) {
        if (rejectedValue == null) {
            return String.format("%s: %s", field, code);
        }
        return String.format("%s: %s (rejected: %s)", field, code, rejectedValue);
    }
}

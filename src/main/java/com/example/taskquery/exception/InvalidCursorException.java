package com.example.taskquery.exception;

/**
 * Exception for a pagination cursor that cannot be honoured.
 * <p>
 * The code tells the client whether to restart from the first page
 * ({@link IssueCode#EXPIRED}, {@link IssueCode#QUERY_MISMATCH}) or whether the token was damaged
 * ({@link IssueCode#INVALID_FORMAT}, {@link IssueCode#INVALID_SIGNATURE}).
 */
public class InvalidCursorException extends TaskQueryException {

    public static final String FIELD = "cursor";

    public InvalidCursorException(IssueCode code) {
        super(FIELD, code, null, "Invalid cursor: " + code);
    }

    public InvalidCursorException(IssueCode code, Throwable cause) {
        super(FIELD, code, null, "Invalid cursor: " + code, cause);
    }

    public static InvalidCursorException invalidFormat() {
        return new InvalidCursorException(IssueCode.INVALID_FORMAT);
    }

    public static InvalidCursorException invalidFormat(Throwable cause) {
        return new InvalidCursorException(IssueCode.INVALID_FORMAT, cause);
    }
}

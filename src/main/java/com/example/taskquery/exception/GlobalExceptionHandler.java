package com.example.taskquery.exception;

import com.example.taskquery.dto.ApiResponse;
import com.example.taskquery.dto.ValidationIssue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

/**
 * Global exception handler for the Task Query API.
 * Provides consistent error responses across all endpoints.
 * <p>
 * Rejections are mapped by exception type and {@link IssueCode}, never by message text.
 * Issue messages are fixed per field and code so clients can show them as is.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String PATH_FIELD = "projectId";

    @ExceptionHandler(TaskQueryException.class)
    public ResponseEntity<ApiResponse<Void>> handleTaskQueryException(TaskQueryException ex) {
        var issue = ValidationIssue.builder()
                .location(PATH_FIELD.equals(ex.getField()) ? "path" : "query")
                .field(ex.getField())
                .code(ex.getCode())
                .message(messageFor(ex.getField(), ex.getCode()))
                .rejectedValue(ex.getRejectedValue())
                .build();

        log.warn("Invalid task query: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.validationError(List.of(issue)));
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<ApiResponse<Void>> handleUnroutableRequest(Exception ex) {
        log.warn("Unroutable request: {}", ex.getMessage());

        return ResponseEntity.status(((ErrorResponse) ex).getStatusCode()).body(ApiResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataAccessException(DataAccessException ex) {
        log.error("Task store error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("Tasks could not be loaded. Please try again later."));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred. Please try again later."));
    }

    static String messageFor(String field, IssueCode code) {
        return switch (code) {
            case INVALID_ENUM -> switch (field) {
                case "status" -> "status must be a comma-separated list of todo, in_progress, done (e.g. status=todo,doing).";
                case "priority" -> "priority must be a comma-separated list of low, medium, high (e.g. priority=high,medium).";
                case "sort" -> "sort keys must be one of sortOrder, createdAt, updatedAt, dueDate, priority, optionally prefixed with - (e.g. sort=-priority,createdAt).";
                default -> field + " has an unsupported value.";
            };
            case INVALID_FORMAT -> switch (field) {
                case "dueDateFrom", "dueDateTo" -> field + " must be a date in YYYY-MM-DD format (e.g. " + field + "=2026-01-31).";
                case "limit" -> "limit must be an integer (e.g. limit=50).";
                case InvalidCursorException.FIELD -> "cursor is malformed.";
                default -> field + " has an invalid format.";
            };
            case REQUIRED -> field + " is required.";
            case CONSTRAINT_VIOLATION -> "dueDateFrom must be on or before dueDateTo (e.g. dueDateFrom=2026-01-01&dueDateTo=2026-01-10).";
            case INVALID_RANGE -> "limit must be an integer between 1 and 200 (missing or out of range values become 200).";
            case INCOMPATIBLE_WITH_CURSOR -> "sort cannot be combined with cursor.";
            case INVALID_SIGNATURE -> "cursor signature is invalid.";
            case EXPIRED -> "cursor has expired. Start again from the first page.";
            case QUERY_MISMATCH -> "cursor does not match the current query. The filters may have changed.";
        };
    }
}

package com.example.taskquery.domain.query;

import com.example.taskquery.domain.enums.TaskPriority;
import com.example.taskquery.domain.enums.TaskStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Computes the {@code qhash} binding a cursor to the query it was issued for.
 * <p>
 * The hash covers the project id and the filter dimensions only. Sort, limit and cursor are
 * left out so that every page of one listing shares the same fingerprint. Multi-valued
 * dimensions are sorted by code, so {@code status=todo,done} and {@code status=done,todo}
 * hash identically. Free text is hashed lower-cased because it matches case-insensitively.
 * The canonical form is a JSON object with a fixed key order, which keeps values containing
 * separators unambiguous.
 */
public final class QueryFingerprint {

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private QueryFingerprint() {
    }

    public static String compute(String projectId, TaskQuery query) {
        var digest = sha256(canonicalForm(projectId, query));
        return ENCODER.encodeToString(digest);
    }

    static byte[] canonicalForm(String projectId, TaskQuery query) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("projectId", projectId);
        if (!query.getStatuses().isEmpty()) {
            canonical.put("status", query.getStatuses().stream().map(TaskStatus::getCode).sorted().toList());
        }
        if (!query.getPriorities().isEmpty()) {
            canonical.put("priority", query.getPriorities().stream().map(TaskPriority::getCode).sorted().toList());
        }
        if (query.getAssigneeId() != null) {
            canonical.put("assigneeId", query.getAssigneeId());
        }
        if (query.getDueDateFrom() != null) {
            canonical.put("dueDateFrom", query.getDueDateFrom().toLocalDate().toString());
        }
        if (query.getDueDateTo() != null) {
            canonical.put("dueDateTo", query.getDueDateTo().toLocalDate().toString());
        }
        if (query.getFreeText() != null) {
            canonical.put("q", query.getFreeText().toLowerCase(Locale.ROOT));
        }
        try {
            return CANONICAL_MAPPER.writeValueAsBytes(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize query fingerprint", e);
        }
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}

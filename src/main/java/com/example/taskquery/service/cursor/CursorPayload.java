package com.example.taskquery.service.cursor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Signed content of a pagination cursor.
 * <p>
 * Wire form (JSON): {@code {"v":1,"createdAt":"...","id":"...","projectId":"...","qhash":"...","iat":...}}.
 * {@code createdAt} is RFC 3339 in UTC, truncated to microseconds.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonPropertyOrder({"v", "createdAt", "id", "projectId", "qhash", "iat"})
public class CursorPayload {

    public static final int CURRENT_VERSION = 1;

    @JsonProperty("v")
    int version;

    /**
     * Creation time of the last row of the page
     */
    @JsonProperty("createdAt")
    String createdAt;

    /**
     * Id of the last row of the page
     */
    @JsonProperty("id")
    String id;

    @JsonProperty("projectId")
    String projectId;

    @JsonProperty("qhash")
    String qhash;

    /**
     * Issue time in unix seconds
     */
    @JsonProperty("iat")
    long issuedAt;

    /**
     * Payload pointing after the given row
     */
    public static CursorPayload forRow(Instant createdAt, String id, String projectId, String qhash, Instant issuedAt) {
        return CursorPayload.builder()
                .version(CURRENT_VERSION)
                .createdAt(formatCreatedAt(createdAt))
                .id(id)
                .projectId(projectId)
                .qhash(qhash)
                .issuedAt(issuedAt.getEpochSecond())
                .build();
    }

    public static String formatCreatedAt(Instant createdAt) {
        return DateTimeFormatter.ISO_INSTANT.format(createdAt.truncatedTo(ChronoUnit.MICROS));
    }

    /**
     * Parse an RFC 3339 timestamp, truncated to microseconds
     *
     * @throws java.time.format.DateTimeParseException when the text is not RFC 3339
     */
    public static Instant parseCreatedAt(String createdAt) {
        return OffsetDateTime.parse(createdAt).toInstant().truncatedTo(ChronoUnit.MICROS);
    }
}

package com.example.taskquery.domain.query;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Position decoded from a verified cursor: rows strictly after {@code (createdAt, id)} are returned.
 */
@Value
@Builder
public class SeekKey {

    /**
     * Truncated to microseconds, the precision of the stored column
     */
    Instant createdAt;
    String id;
    String projectId;
    String qhash;
    long issuedAt;
}

package com.example.taskquery.service.cursor;

import com.example.taskquery.domain.query.SeekKey;
import com.example.taskquery.exception.InvalidCursorException;
import com.example.taskquery.exception.IssueCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Encodes, signs and verifies opaque pagination cursors.
 * <p>
 * Format: {@code base64url(JSON(payload)) + "." + base64url(HMAC-SHA256(secret, encodedPayload))},
 * both segments without padding. Nothing about issued cursors is stored server side.
 * <p>
 * Verification steps:
 * 1. {@link #decode(String)} checks the format and the signature
 * 2. {@link #verify(CursorPayload, String, String)} checks the age and binds the cursor to the
 *    project and the filter fingerprint of the current request
 */
@Slf4j
public class CursorCodec {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();
    private static final Pattern BASE64URL = Pattern.compile("[A-Za-z0-9_-]+");

    private final SecretKeySpec signingKey;
    private final Duration timeToLive;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public CursorCodec(byte[] secret, Duration timeToLive, Clock clock) {
        if (secret == null || secret.length == 0) {
            throw new IllegalArgumentException("Cursor secret must not be empty");
        }
        this.signingKey = new SecretKeySpec(secret.clone(), HMAC_ALGORITHM);
        this.timeToLive = timeToLive;
        this.clock = clock;
        this.objectMapper = JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Serialize and sign a payload
     */
    public String encode(CursorPayload payload) {
        var normalized = payload.toBuilder()
                .createdAt(CursorPayload.formatCreatedAt(CursorPayload.parseCreatedAt(payload.getCreatedAt())))
                .build();
        try {
            var encodedPayload = ENCODER.encodeToString(objectMapper.writeValueAsBytes(normalized));
            return encodedPayload + "." + sign(encodedPayload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize cursor payload", e);
        }
    }

    /**
     * Parse a cursor and check its signature.
     *
     * @throws InvalidCursorException with {@link IssueCode#INVALID_FORMAT} or {@link IssueCode#INVALID_SIGNATURE}
     */
    public CursorPayload decode(String cursor) {
        if (cursor == null) {
            throw InvalidCursorException.invalidFormat();
        }
        var separator = cursor.indexOf('.');
        if (separator <= 0 || separator == cursor.length() - 1 || cursor.indexOf('.', separator + 1) >= 0) {
            throw InvalidCursorException.invalidFormat();
        }
        var encodedPayload = cursor.substring(0, separator);
        var encodedSignature = cursor.substring(separator + 1);

        var payload = parsePayload(encodedPayload);

        if (!BASE64URL.matcher(encodedSignature).matches()) {
            throw InvalidCursorException.invalidFormat();
        }
        // compare canonical text: a changed last character may only touch base64 padding bits
        var expected = sign(encodedPayload).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, encodedSignature.getBytes(StandardCharsets.US_ASCII))) {
            throw new InvalidCursorException(IssueCode.INVALID_SIGNATURE);
        }
        return payload;
    }

    /**
     * Check that a decoded cursor is still valid for the current request.
     *
     * @param projectId project of the current request
     * @param qhash     fingerprint of the current request's filters
     * @throws InvalidCursorException with {@link IssueCode#EXPIRED} or {@link IssueCode#QUERY_MISMATCH}
     */
    public SeekKey verify(CursorPayload payload, String projectId, String qhash) {
        if (payload.getVersion() != CursorPayload.CURRENT_VERSION) {
            throw InvalidCursorException.invalidFormat();
        }
        var now = clock.instant().getEpochSecond();
        if (now - payload.getIssuedAt() > timeToLive.getSeconds()) {
            throw new InvalidCursorException(IssueCode.EXPIRED);
        }
        if (!Objects.equals(projectId, payload.getProjectId()) || !Objects.equals(qhash, payload.getQhash())) {
            throw new InvalidCursorException(IssueCode.QUERY_MISMATCH);
        }
        return SeekKey.builder()
                .createdAt(CursorPayload.parseCreatedAt(payload.getCreatedAt()))
                .id(payload.getId())
                .projectId(payload.getProjectId())
                .qhash(payload.getQhash())
                .issuedAt(payload.getIssuedAt())
                .build();
    }

    private CursorPayload parsePayload(String encodedPayload) {
        CursorPayload payload;
        try {
            payload = objectMapper.readValue(DECODER.decode(encodedPayload), CursorPayload.class);
        } catch (IllegalArgumentException | IOException e) {
            log.debug("Rejected cursor payload: {}", e.getMessage());
            throw InvalidCursorException.invalidFormat(e);
        }
        if (payload == null || isBlank(payload.getId()) || isBlank(payload.getCreatedAt())) {
            throw InvalidCursorException.invalidFormat();
        }
        try {
            return payload.toBuilder()
                    .createdAt(CursorPayload.formatCreatedAt(CursorPayload.parseCreatedAt(payload.getCreatedAt())))
                    .build();
        } catch (DateTimeParseException e) {
            throw InvalidCursorException.invalidFormat(e);
        }
    }

    private String sign(String encodedPayload) {
        try {
            var mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(signingKey);
            var signature = mac.doFinal(encodedPayload.getBytes(StandardCharsets.US_ASCII));
            return ENCODER.encodeToString(signature);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

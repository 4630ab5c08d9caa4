package com.example.taskquery.config;

import com.example.taskquery.exception.CursorSecretException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Decides which secret signs cursors.
 * <p>
 * - production-like environment: the configured secret, which must be set and must not be the placeholder
 * - any other environment: the configured secret, or a fixed development secret with a warning
 */
@Slf4j
public final class CursorSecretResolver {

    static final String PLACEHOLDER_SECRET = "default-secret-change-in-production";
    static final String DEVELOPMENT_SECRET = "dev-only-secret-change-me";

    private CursorSecretResolver() {
    }

    /**
     * @throws CursorSecretException when a production-like environment has no usable secret
     */
    public static byte[] resolve(TaskQueryProperties properties) {
        var secret = properties.getCursor().getSecret();
        var missing = secret == null || secret.isBlank();

        if (properties.isProductionLike()) {
            if (missing) {
                throw new CursorSecretException(
                        "CURSOR_SECRET must be set in environment '" + properties.getEnvironment() + "'");
            }
            if (PLACEHOLDER_SECRET.equals(secret)) {
                throw new CursorSecretException(
                        "CURSOR_SECRET still holds the placeholder value in environment '" + properties.getEnvironment() + "'");
            }
        } else if (missing) {
            log.warn("CURSOR_SECRET is not set, signing cursors with the development secret. Do not use this outside development.");
            secret = DEVELOPMENT_SECRET;
        }
        return secret.getBytes(StandardCharsets.UTF_8);
    }
}

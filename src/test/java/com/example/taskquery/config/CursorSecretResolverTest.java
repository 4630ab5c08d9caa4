package com.example.taskquery.config;

import com.example.taskquery.exception.CursorSecretException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CursorSecretResolver Tests")
class CursorSecretResolverTest {

    private static TaskQueryProperties properties(String environment, String secret) {
        var properties = new TaskQueryProperties();
        properties.setEnvironment(environment);
        properties.getCursor().setSecret(secret);
        return properties;
    }

    @Nested
    @DisplayName("Production-like Environment Tests")
    class ProductionLikeTests {

        @ParameterizedTest
        @ValueSource(strings = {"production", "prod", "staging", "PROD", " Staging "})
        @DisplayName("Missing secret should fail startup")
        void missingSecretShouldFail(String environment) {
            assertThatThrownBy(() -> CursorSecretResolver.resolve(properties(environment, null)))
                    .isInstanceOf(CursorSecretException.class)
                    .hasMessageContaining("CURSOR_SECRET");
        }

        @Test
        @DisplayName("Placeholder secret should fail startup")
        void placeholderSecretShouldFail() {
            assertThatThrownBy(() -> CursorSecretResolver.resolve(properties("production", CursorSecretResolver.PLACEHOLDER_SECRET)))
                    .isInstanceOf(CursorSecretException.class)
                    .hasMessageContaining("placeholder");
        }

        @Test
        @DisplayName("Configured secret should be used")
        void configuredSecretShouldBeUsed() {
            assertThat(CursorSecretResolver.resolve(properties("production", "s3cr3t")))
                    .isEqualTo("s3cr3t".getBytes(StandardCharsets.UTF_8));
        }
    }

    @Nested
    @DisplayName("Development Environment Tests")
    class DevelopmentTests {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"  "})
        @DisplayName("Missing secret should fall back to the development secret")
        void missingSecretShouldFallBack(String secret) {
            assertThat(CursorSecretResolver.resolve(properties("development", secret)))
                    .isEqualTo(CursorSecretResolver.DEVELOPMENT_SECRET.getBytes(StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("Configured secret should be used")
        void configuredSecretShouldBeUsed() {
            assertThat(CursorSecretResolver.resolve(properties("test", "local-secret")))
                    .isEqualTo("local-secret".getBytes(StandardCharsets.UTF_8));
        }
    }
}

package com.example.taskquery.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.Locale;
import java.util.Set;

/**
 * Configuration properties for the task query service.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "task-query")
public class TaskQueryProperties {

    private static final Set<String> PRODUCTION_LIKE = Set.of("production", "prod", "staging");

    /**
     * Deployment environment; production, prod and staging require a real cursor secret
     */
    @NotBlank
    private String environment = "development";

    /**
     * Task store backend: jdbc or memory
     */
    @Pattern(regexp = "jdbc|memory")
    private String store = "jdbc";

    @Valid
    private Cursor cursor = new Cursor();

    public boolean isProductionLike() {
        return PRODUCTION_LIKE.contains(environment.trim().toLowerCase(Locale.ROOT));
    }

    @Data
    public static class Cursor {

        /**
         * HMAC secret used to sign cursors (CURSOR_SECRET)
         */
        private String secret;

        /**
         * Maximum cursor age in seconds
         */
        @Min(1)
        private long ttlSeconds = 86400;
    }
}

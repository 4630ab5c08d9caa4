package com.example.taskquery.config;

import com.example.taskquery.service.cursor.CursorCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Cursor signing configuration.
 * <p>
 * The secret is resolved once at startup; a missing secret in a production-like environment
 * fails the application context.
 */
@Slf4j
@Configuration
public class CursorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CursorCodec cursorCodec(TaskQueryProperties properties, Clock clock) {
        var ttl = Duration.ofSeconds(properties.getCursor().getTtlSeconds());
        log.info("Cursor codec configured for environment '{}' with ttl {}", properties.getEnvironment(), ttl);
        return new CursorCodec(CursorSecretResolver.resolve(properties), ttl, clock);
    }
}

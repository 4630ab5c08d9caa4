package com.example.taskquery.config;

import com.example.taskquery.exception.IssueCode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Metrics for the task list endpoint.
 * <p>
 * Exposes Prometheus metrics for:
 * - Requests by backend
 * - Rejected requests by field and issue code
 * - Served pages, split by whether a next page exists
 * - Query time by backend
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    /**
     * Start a timer for one list request
     */
    public Timer.Sample startQueryTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record a served list request and its duration
     */
    public void recordRequest(Timer.Sample sample, String backend) {
        meterRegistry.counter("task_query_requests", "backend", backend).increment();
        sample.stop(Timer.builder("task_query_time")
                .tag("backend", backend)
                .description("Task list query time")
                .register(meterRegistry));
    }

    /**
     * Record a request rejected because of its parameters or cursor
     */
    public void recordRejection(String field, IssueCode code) {
        meterRegistry.counter("task_query_rejections",
                "field", field != null ? field : "unknown",
                "code", code.name().toLowerCase(Locale.ROOT)
        ).increment();
    }

    /**
     * Record a served page
     */
    public void recordPage(boolean hasNext) {
        meterRegistry.counter("task_query_pages", "has_next", String.valueOf(hasNext)).increment();
    }
}

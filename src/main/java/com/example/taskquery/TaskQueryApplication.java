package com.example.taskquery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Task Query Service Application
 * <p>
 * Read side of the task list: filters, sorts and pages the tasks of a project.
 * <p>
 * Features:
 * - Comma-separated status/priority filters with normalization
 * - Whitelisted multi-key sorting with deterministic tie-break
 * - Stateless keyset pagination through signed, expiring cursors
 * - PostgreSQL and in-memory backends with identical semantics
 */
@SpringBootApplication
public class TaskQueryApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskQueryApplication.class, args);
    }
}

package com.example.taskquery.domain.entity;

import com.example.taskquery.domain.enums.TaskPriority;
import com.example.taskquery.domain.enums.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Read model of a row of the {@code tasks} table.
 * <p>
 * This service never writes tasks; rows are created and updated by the task
 * management service that owns the table.
 */
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Task {

    private String id;

    /**
     * Owning project. Every read is scoped to exactly one project.
     */
    private String projectId;

    private String title;

    private String description;

    private TaskStatus status;

    /**
     * May be null when the stored code is not recognized; such rows rank lowest
     */
    private TaskPriority priority;

    private String assigneeId;

    private LocalDate dueDate;

    // === Audit Fields ===

    /**
     * Creation time. Stored with microsecond precision; the cursor seek key.
     */
    private Instant createdAt;

    private Instant updatedAt;
}

package com.locus.core.model;

/**
 * Status of a task as tracked by the workspace server.
 */
public enum TaskStatus {
    BACKLOG,
    IN_PROGRESS,
    IN_REVIEW,
    BLOCKED,
    DONE
}

package com.tandem.core.model;

/**
 * Input for creating a task; the store assigns id, timestamps and version.
 */
public record NewTask(
    long projectId,
    Long creatorId,
    String title,
    String content,
    TaskStatus status,
    boolean interactive
) {
}

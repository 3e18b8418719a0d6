package com.tandem.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A project owns tasks and anchors ownership checks.
 *
 * @param id             store-assigned identifier
 * @param name           unique project name used by agents to address the project
 * @param ownerId        user that owns the project
 * @param lastActivityAt last time a task in this project was touched, nullable
 */
public record Project(
    long id,
    String name,
    long ownerId,
    Instant lastActivityAt
) implements Serializable {
}

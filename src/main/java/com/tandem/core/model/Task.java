package com.tandem.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A unit of work shared between an agent and a human reviewer.
 * <p>
 * Invariants maintained by the state machine: {@code aiWaitingFeedback} is true exactly
 * when {@code status} is {@link TaskStatus#WAITING_HUMAN_FEEDBACK}, and a waiting task
 * always carries an {@code interactionSessionId}.
 *
 * @param id                   store-assigned identifier
 * @param projectId            owning project
 * @param creatorId            user that created the task, nullable
 * @param title                short summary
 * @param content              detailed description, nullable
 * @param status               current lifecycle status
 * @param interactive          whether completion needs a human verdict (fixed at creation)
 * @param aiWaitingFeedback    whether the agent is blocked on a human verdict
 * @param interactionSessionId session binding the agent/human exchange, nullable
 * @param feedbackContent      last feedback text submitted by the agent, nullable
 * @param feedbackAt           when {@code feedbackContent} was written, nullable
 * @param createdAt            creation time
 * @param updatedAt            last committed change
 * @param completedAt          set when a human confirms completion, nullable
 * @param version              optimistic concurrency counter, bumped on every commit
 */
public record Task(
    long id,
    long projectId,
    Long creatorId,
    String title,
    String content,
    TaskStatus status,
    boolean interactive,
    boolean aiWaitingFeedback,
    String interactionSessionId,
    String feedbackContent,
    Instant feedbackAt,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt,
    long version
) implements Serializable {

    public Task withStatus(TaskStatus newStatus, boolean waiting) {
        return new Task(id, projectId, creatorId, title, content, newStatus, interactive, waiting,
                interactionSessionId, feedbackContent, feedbackAt, createdAt, updatedAt, completedAt, version);
    }

    public Task withSession(String sessionId) {
        return new Task(id, projectId, creatorId, title, content, status, interactive, aiWaitingFeedback,
                sessionId, feedbackContent, feedbackAt, createdAt, updatedAt, completedAt, version);
    }

    public Task withFeedback(String feedback, Instant at) {
        return new Task(id, projectId, creatorId, title, content, status, interactive, aiWaitingFeedback,
                interactionSessionId, feedback, at, createdAt, updatedAt, completedAt, version);
    }

    public Task withCompletedAt(Instant at) {
        return new Task(id, projectId, creatorId, title, content, status, interactive, aiWaitingFeedback,
                interactionSessionId, feedbackContent, feedbackAt, createdAt, updatedAt, at, version);
    }

    public Task withCommit(Instant at, long newVersion) {
        return new Task(id, projectId, creatorId, title, content, status, interactive, aiWaitingFeedback,
                interactionSessionId, feedbackContent, feedbackAt, createdAt, at, completedAt, newVersion);
    }

    public boolean isCreatedBy(long userId) {
        return creatorId != null && creatorId == userId;
    }
}

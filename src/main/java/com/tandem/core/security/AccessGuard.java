package com.tandem.core.security;

import com.tandem.core.error.InteractionException;
import com.tandem.core.model.Actor;
import com.tandem.core.model.Project;
import com.tandem.core.model.Task;
import com.tandem.core.store.ProjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ownership checks for task and project operations.
 * <p>
 * A task may be acted on by the owner of its project or by the user who created it.
 * Project-scoped operations require project ownership.
 */
@Component
public class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final ProjectStore projectStore;

    public AccessGuard(ProjectStore projectStore) {
        this.projectStore = projectStore;
    }

    public boolean canAccessTask(Actor actor, Task task) {
        if (task.isCreatedBy(actor.userId())) {
            return true;
        }
        return projectStore.findById(task.projectId())
                .map(project -> project.ownerId() == actor.userId())
                .orElse(false);
    }

    /**
     * @throws InteractionException with kind {@code PERMISSION_DENIED}
     */
    public void requireTaskAccess(Actor actor, Task task) {
        if (!canAccessTask(actor, task)) {
            log.warn("Access denied: user {} on task {}", actor.userId(), task.id());
            throw InteractionException.permissionDenied("Access denied to task " + task.id());
        }
    }

    /**
     * @throws InteractionException with kind {@code PERMISSION_DENIED}
     */
    public void requireProjectOwner(Actor actor, Project project) {
        if (project.ownerId() != actor.userId()) {
            log.warn("Access denied: user {} on project {}", actor.userId(), project.name());
            throw InteractionException.permissionDenied("Access denied to project " + project.name());
        }
    }
}

package com.tandem.core.engine;

import com.tandem.core.error.InteractionException;
import com.tandem.core.events.EventBus;
import com.tandem.core.events.TandemEvent;
import com.tandem.core.logging.MdcContext;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.core.model.Actor;
import com.tandem.core.model.NewTask;
import com.tandem.core.model.Project;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskStatus;
import com.tandem.core.security.AccessGuard;
import com.tandem.core.store.ProjectStore;
import com.tandem.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Creates tasks in a project and announces them to agents waiting for new work.
 */
@Service
public class TaskIntakeService {

    private static final Logger log = LoggerFactory.getLogger(TaskIntakeService.class);

    /** Statuses a task may be created with. */
    static final Set<TaskStatus> INITIAL_STATUSES =
            EnumSet.of(TaskStatus.TODO, TaskStatus.IN_PROGRESS, TaskStatus.REVIEW);

    private final TaskStore taskStore;
    private final ProjectStore projectStore;
    private final AccessGuard accessGuard;
    private final EventBus eventBus;
    private final TandemMetrics metrics;

    public TaskIntakeService(TaskStore taskStore, ProjectStore projectStore, AccessGuard accessGuard,
                             EventBus eventBus, TandemMetrics metrics) {
        this.taskStore = taskStore;
        this.projectStore = projectStore;
        this.accessGuard = accessGuard;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Task createTask(Actor actor, String projectName, String title, String content,
                           TaskStatus status, boolean interactive) {
        if (title == null || title.isBlank()) {
            throw InteractionException.invalidArgument("title is required");
        }
        TaskStatus initial = status == null ? TaskStatus.TODO : status;
        if (!INITIAL_STATUSES.contains(initial)) {
            throw InteractionException.invalidArgument("Tasks cannot be created with status " + initial.wireValue());
        }

        Project project = projectStore.findByName(projectName)
                .orElseThrow(() -> InteractionException.notFound("Project '" + projectName + "' not found"));
        accessGuard.requireProjectOwner(actor, project);

        MdcContext.setActor(actor.userId());
        MdcContext.setProject(project.id());
        try {
            Task task = taskStore.insert(new NewTask(project.id(), actor.userId(), title, content,
                    initial, interactive));
            log.info("Created task {} '{}' in project {} (interactive={})",
                    task.id(), title, project.name(), interactive);
            metrics.recordTaskCreated(interactive);

            eventBus.publish(new TandemEvent(TandemEvent.TASK_CREATED, project.id(), task.id(), null,
                    Map.of("status", task.status().wireValue(), "interactive", interactive),
                    task.createdAt()));
            return task;
        } finally {
            MdcContext.clear();
        }
    }
}

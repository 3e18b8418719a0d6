package com.tandem.core.engine;

import com.tandem.core.error.ErrorKind;
import com.tandem.core.error.InteractionException;
import com.tandem.core.events.TandemEvent;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskStatus;
import com.tandem.support.TandemFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.tandem.support.TandemFixture.OWNER;
import static com.tandem.support.TandemFixture.STRANGER;
import static org.junit.jupiter.api.Assertions.*;

class TaskIntakeServiceTest {

    private final TandemFixture fx = new TandemFixture();

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void createsTaskAndAnnouncesIt() {
        List<TandemEvent> events = new ArrayList<>();
        fx.eventBus.subscribe(fx.project.id(), events::add);

        Task task = fx.intake.createTask(OWNER, "alpha", "Write docs", "README", null, true);

        assertEquals(TaskStatus.TODO, task.status());
        assertTrue(task.interactive());
        assertFalse(task.aiWaitingFeedback());
        assertEquals(OWNER.userId(), task.creatorId());
        assertEquals(1, events.size());
        assertEquals(TandemEvent.TASK_CREATED, events.get(0).eventType());
        assertEquals(1.0, fx.registry.get("tandem.tasks.created").tag("interactive", "true").counter().count());
    }

    @Test
    void requiresTitle() {
        var e = assertThrows(InteractionException.class,
                () -> fx.intake.createTask(OWNER, "alpha", "  ", null, null, false));
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
    }

    @Test
    void rejectsTerminalInitialStatus() {
        var e = assertThrows(InteractionException.class,
                () -> fx.intake.createTask(OWNER, "alpha", "Done already", null, TaskStatus.DONE, false));
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
    }

    @Test
    void requiresProjectOwnership() {
        var e = assertThrows(InteractionException.class,
                () -> fx.intake.createTask(STRANGER, "alpha", "Sneaky", null, null, false));
        assertEquals(ErrorKind.PERMISSION_DENIED, e.kind());
    }

    @Test
    void unknownProject() {
        var e = assertThrows(InteractionException.class,
                () -> fx.intake.createTask(OWNER, "nowhere", "Lost", null, null, false));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
    }
}

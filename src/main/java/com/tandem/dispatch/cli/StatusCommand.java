package com.tandem.dispatch.cli;

import com.tandem.core.model.Project;
import com.tandem.core.model.Task;
import com.tandem.core.store.ProjectStore;
import com.tandem.core.store.TaskStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;

/**
 * CLI command: tandem status [task-id]
 * <p>
 * With a task id, shows the task's interaction state. Without one, lists the most
 * recently updated tasks.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show task interaction status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Task ID")
    private Long taskId;

    @Option(names = {"--limit", "-n"}, description = "Number of tasks to list (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    private int limit;

    private final TaskStore taskStore;
    private final ProjectStore projectStore;

    public StatusCommand(TaskStore taskStore, ProjectStore projectStore) {
        this.taskStore = taskStore;
        this.projectStore = projectStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (taskId == null) {
            listRecent();
            return;
        }

        Optional<Task> found = taskStore.findById(taskId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Task not found: " + taskId);
            return;
        }
        Task task = found.get();
        String projectName = projectStore.findById(task.projectId()).map(Project::name).orElse("?");

        System.out.println();
        System.out.println("TASK " + task.id() + " (" + projectName + ")");
        System.out.println("Title: " + task.title());
        ConsoleOutput.status(task.status());
        ConsoleOutput.info("Interactive: " + task.interactive()
                + " | Waiting for human: " + task.aiWaitingFeedback());
        if (task.interactionSessionId() != null) {
            ConsoleOutput.info("Session: " + task.interactionSessionId());
        }
        if (task.feedbackContent() != null) {
            ConsoleOutput.info("Last feedback (" + task.feedbackAt() + "): "
                    + ConsoleOutput.truncate(task.feedbackContent(), 80));
        }
        if (task.completedAt() != null) {
            ConsoleOutput.success("Completed at " + task.completedAt());
        }
    }

    private void listRecent() {
        List<Task> tasks = taskStore.findRecent(limit);
        if (tasks.isEmpty()) {
            ConsoleOutput.info("No tasks found.");
            return;
        }
        ConsoleOutput.info("Recent tasks (" + tasks.size() + "):");
        System.out.println();
        System.out.printf("  %-8s %-24s %-12s %s%n", "ID", "STATUS", "INTERACTIVE", "TITLE");
        System.out.println("  " + "-".repeat(70));
        for (Task task : tasks) {
            System.out.printf("  %-8d %-24s %-12s %s%n", task.id(), task.status().wireValue(),
                    task.interactive() ? "yes" : "no", ConsoleOutput.truncate(task.title(), 30));
        }
    }
}

package com.tandem.dispatch.cli;

import com.tandem.core.model.InteractionLogEntry;
import com.tandem.core.store.InteractionLedger;
import com.tandem.core.store.TaskStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: tandem history &lt;task-id&gt;
 * <p>
 * Prints the task's interaction ledger, oldest entry first.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "Show a task's interaction history")
@Component
public class HistoryCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private long taskId;

    @Option(names = {"--limit", "-n"}, description = "Show only the last N entries", defaultValue = "50")
    private int limit;

    private final TaskStore taskStore;
    private final InteractionLedger ledger;

    public HistoryCommand(TaskStore taskStore, InteractionLedger ledger) {
        this.taskStore = taskStore;
        this.ledger = ledger;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (taskStore.findById(taskId).isEmpty()) {
            ConsoleOutput.error("Task not found: " + taskId);
            return;
        }

        List<InteractionLogEntry> entries = ledger.findByTask(taskId);
        if (entries.isEmpty()) {
            ConsoleOutput.info("No interactions recorded for task " + taskId + ".");
            return;
        }

        List<InteractionLogEntry> display = entries.size() > limit
                ? entries.subList(entries.size() - limit, entries.size())
                : entries;

        ConsoleOutput.info("Interactions for task " + taskId + " (" + display.size() + " of " + entries.size() + "):");
        for (InteractionLogEntry entry : display) {
            ConsoleOutput.interaction(entry);
        }
    }
}

package com.tandem.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tandem.core.wait.NewTasksOutcome;

import java.time.Instant;
import java.util.List;

/**
 * JSON response for {@code wait_for_new_tasks}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NewTasksResponse(
    @JsonProperty("project_name") String projectName,
    @JsonProperty("project_id") long projectId,
    @JsonProperty("new_tasks") List<TaskResponse> newTasks,
    @JsonProperty("total_new_tasks") int totalNewTasks,
    @JsonProperty("poll_count") int pollCount,
    @JsonProperty("wait_duration_seconds") double waitDurationSeconds,
    boolean timeout,
    @JsonProperty("timeout_seconds") Long timeoutSeconds,
    @JsonProperty("start_timestamp") Instant startTimestamp
) {

    public static NewTasksResponse from(NewTasksOutcome outcome) {
        String projectName = outcome.project().name();
        List<TaskResponse> tasks = outcome.newTasks().stream()
                .map(task -> TaskResponse.from(task, projectName))
                .toList();
        return new NewTasksResponse(projectName, outcome.project().id(), tasks, tasks.size(),
                outcome.pollCount(), WaitDurations.seconds(outcome.waited()), outcome.timedOut(),
                outcome.timedOut() ? outcome.timeout().toSeconds() : null, outcome.startedAt());
    }
}

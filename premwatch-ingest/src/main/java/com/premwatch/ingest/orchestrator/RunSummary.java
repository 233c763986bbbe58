package com.premwatch.ingest.orchestrator;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Per-task counts of one orchestrator run.
 */
public record RunSummary(
    List<TaskTally> tasks,
    List<String> unknownTasks,
    Duration elapsed
) {

    public record TaskTally(
        String task,
        int invocations,
        int loaded,
        int noData,
        int skipped,
        int failed,
        long recordsWritten
    ) {}

    public Optional<TaskTally> tally(String task) {
        return tasks.stream().filter(t -> t.task().equals(task)).findFirst();
    }

    public long totalRecords() {
        return tasks.stream().mapToLong(TaskTally::recordsWritten).sum();
    }

    public int totalInvocations() {
        return tasks.stream().mapToInt(TaskTally::invocations).sum();
    }

    public int failureCount() {
        return tasks.stream().mapToInt(TaskTally::failed).sum();
    }

    public boolean hasFailures() {
        return failureCount() > 0 || !unknownTasks.isEmpty();
    }
}

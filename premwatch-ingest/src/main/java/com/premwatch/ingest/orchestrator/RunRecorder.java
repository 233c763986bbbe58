package com.premwatch.ingest.orchestrator;

import com.premwatch.ingest.task.TaskOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable counters behind a {@link RunSummary}.
 */
final class RunRecorder {

    private final Instant start = Instant.now();
    private final Map<String, Counts> counts = new LinkedHashMap<>();
    private final List<String> unknownTasks = new ArrayList<>();

    void recordOutcome(String task, TaskOutcome outcome) {
        Counts c = counts.computeIfAbsent(task, k -> new Counts());
        c.invocations++;
        switch (outcome.status()) {
            case LOADED -> c.loaded++;
            case NO_DATA -> c.noData++;
            case SKIPPED -> c.skipped++;
        }
        c.records += outcome.recordsWritten();
    }

    void recordFailure(String task) {
        Counts c = counts.computeIfAbsent(task, k -> new Counts());
        c.invocations++;
        c.failed++;
    }

    void recordUnknown(String task) {
        unknownTasks.add(task);
    }

    RunSummary finish() {
        List<RunSummary.TaskTally> tallies = new ArrayList<>();
        counts.forEach((task, c) -> tallies.add(new RunSummary.TaskTally(
            task, c.invocations, c.loaded, c.noData, c.skipped, c.failed, c.records)));
        return new RunSummary(List.copyOf(tallies), List.copyOf(unknownTasks),
            Duration.between(start, Instant.now()));
    }

    private static final class Counts {
        int invocations;
        int loaded;
        int noData;
        int skipped;
        int failed;
        long records;
    }
}

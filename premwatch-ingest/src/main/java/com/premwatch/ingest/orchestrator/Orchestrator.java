package com.premwatch.ingest.orchestrator;

import com.premwatch.ingest.store.RecordStore;
import com.premwatch.ingest.task.IngestionTask;
import com.premwatch.ingest.task.TaskOutcome;
import com.premwatch.ingest.task.TaskParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs ingestion tasks: ad hoc by name, every parameterless task, or the whole
 * cascade where each level's inputs are the identities the store already holds.
 *
 * Runs are strictly sequential. A failing invocation is logged and counted; it never
 * stops the run.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final TaskRegistry registry;
    private final CascadePlan plan;
    private final RecordStore store;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public Orchestrator(TaskRegistry registry, CascadePlan plan, RecordStore store) {
        for (CascadeStage stage : plan.stages()) {
            if (!registry.contains(stage.taskName())) {
                throw new IllegalArgumentException("Cascade stage names unregistered task: " + stage.taskName());
            }
        }
        this.registry = registry;
        this.plan = plan;
        this.store = store;
    }

    /**
     * Run the named tasks once each, in the given order. Unknown names are reported
     * and skipped.
     */
    public RunSummary runTasks(List<String> names, TaskParameters parameters) {
        return exclusive(recorder -> {
            for (String name : names) {
                IngestionTask task = registry.find(name).orElse(null);
                if (task == null) {
                    log.error("Unknown task '{}'. Available: {}", name, registry.names());
                    recorder.recordUnknown(name);
                    continue;
                }
                invoke(task, parameters, recorder);
            }
        });
    }

    /**
     * Run every task that needs no parameter.
     */
    public RunSummary runGeneral(TaskParameters parameters) {
        return exclusive(recorder -> {
            for (IngestionTask task : registry.general()) {
                invoke(task, parameters, recorder);
            }
        });
    }

    public RunSummary runCascade() {
        return runCascade(TaskParameters.empty());
    }

    /**
     * Run every level of the plan. {@code baseParameters} (e.g. a max_time cutoff) are
     * passed to every invocation beneath the stage's own parameters.
     */
    public RunSummary runCascade(TaskParameters baseParameters) {
        return exclusive(recorder -> {
            log.info("Starting cascading update ({} levels)", plan.depth());
            int levelNumber = 0;
            for (List<CascadeStage> level : plan.getLevels()) {
                // Read every stage's inputs before any stage of this level writes
                Map<CascadeStage, Set<Object>> inputs = new LinkedHashMap<>();
                for (CascadeStage stage : level) {
                    if (!stage.isRoot()) {
                        inputs.put(stage, identities(stage));
                    }
                }

                log.info("Cascade level {}: {}", levelNumber,
                    level.stream().map(CascadeStage::taskName).toList());
                for (CascadeStage stage : level) {
                    IngestionTask task = registry.find(stage.taskName()).orElseThrow();
                    TaskParameters stageParameters = baseParameters.withAll(stage.fixedParameters());
                    if (stage.isRoot()) {
                        invoke(task, stageParameters, recorder);
                        continue;
                    }
                    Set<Object> ids = inputs.get(stage);
                    log.info("Running {} for {} {} values", task.getName(), ids.size(), stage.parameterName());
                    for (Object id : ids) {
                        invoke(task, stageParameters.with(stage.parameterName(), id), recorder);
                    }
                }
                levelNumber++;
            }
        });
    }

    private Set<Object> identities(CascadeStage stage) {
        try {
            return store.distinctIdentities(stage.sourceTable(), stage.sourceColumn());
        } catch (SQLException e) {
            log.error("Could not read {}.{} for {}; stage skipped",
                stage.sourceTable(), stage.sourceColumn(), stage.taskName(), e);
            return Set.of();
        }
    }

    private void invoke(IngestionTask task, TaskParameters parameters, RunRecorder recorder) {
        try {
            TaskOutcome outcome = task.execute(parameters);
            recorder.recordOutcome(task.getName(), outcome);
        } catch (SQLException | RuntimeException e) {
            log.error("Task {} failed ({})", task.getName(), parameters, e);
            recorder.recordFailure(task.getName());
        }
    }

    private RunSummary exclusive(Run run) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A run is already in progress");
        }
        try {
            RunRecorder recorder = new RunRecorder();
            run.execute(recorder);
            RunSummary summary = recorder.finish();
            log.info("Run complete: {} invocations, {} records, {} failures in {}s",
                summary.totalInvocations(), summary.totalRecords(), summary.failureCount(),
                summary.elapsed().getSeconds());
            return summary;
        } finally {
            running.set(false);
        }
    }

    @FunctionalInterface
    private interface Run {
        void execute(RunRecorder recorder);
    }
}

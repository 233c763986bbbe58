package com.premwatch.ingest.orchestrator;

import com.premwatch.ingest.task.TaskParameters;

/**
 * One task in a cascade level.
 *
 * A stage with a source table runs once per distinct value of {@code sourceColumn}
 * stored there, passing it as {@code parameterName}. A root stage runs once.
 *
 * @param fixedParameters parameters passed on every invocation of the stage
 */
public record CascadeStage(
    String taskName,
    String sourceTable,
    String sourceColumn,
    String parameterName,
    TaskParameters fixedParameters
) {

    public CascadeStage {
        if (fixedParameters == null) {
            fixedParameters = TaskParameters.empty();
        }
    }

    public static CascadeStage root(String taskName) {
        return new CascadeStage(taskName, null, null, null, TaskParameters.empty());
    }

    public static CascadeStage perIdentity(String taskName, String sourceTable, String parameterName) {
        return new CascadeStage(taskName, sourceTable, "id", parameterName, TaskParameters.empty());
    }

    public CascadeStage withFixed(String name, Object value) {
        return new CascadeStage(taskName, sourceTable, sourceColumn, parameterName,
            fixedParameters.with(name, value));
    }

    public boolean isRoot() {
        return sourceTable == null;
    }
}

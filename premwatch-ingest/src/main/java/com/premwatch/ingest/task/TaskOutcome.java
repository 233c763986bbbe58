package com.premwatch.ingest.task;

/**
 * Result of one task invocation.
 */
public record TaskOutcome(Status status, int recordsWritten, String message) {

    public enum Status {
        LOADED,
        NO_DATA,
        SKIPPED
    }

    public static TaskOutcome loaded(int recordsWritten) {
        return new TaskOutcome(Status.LOADED, recordsWritten, recordsWritten + " records written");
    }

    public static TaskOutcome noData(String message) {
        return new TaskOutcome(Status.NO_DATA, 0, message);
    }

    public static TaskOutcome skipped(String message) {
        return new TaskOutcome(Status.SKIPPED, 0, message);
    }
}

package com.premwatch.ingest.task;

/**
 * Thrown when a task is invoked without one of its required parameters.
 */
public class MissingParameterException extends RuntimeException {

    public MissingParameterException(String task, String parameter) {
        super("Task '" + task + "' requires parameter '" + parameter + "'");
    }
}

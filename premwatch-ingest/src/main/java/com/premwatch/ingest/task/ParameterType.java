package com.premwatch.ingest.task;

/**
 * Value type of a task parameter, used to parse command-line input.
 */
public enum ParameterType {
    INTEGER,
    STRING,
    BOOLEAN
}

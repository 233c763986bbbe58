package com.premwatch.ingest.task;

/**
 * One named input a task accepts.
 */
public record ParameterSpec(String name, ParameterType type, boolean required, String description) {

    public static ParameterSpec required(String name, ParameterType type, String description) {
        return new ParameterSpec(name, type, true, description);
    }

    public static ParameterSpec optional(String name, ParameterType type, String description) {
        return new ParameterSpec(name, type, false, description);
    }
}

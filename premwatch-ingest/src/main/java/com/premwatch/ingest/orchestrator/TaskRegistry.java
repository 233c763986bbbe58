package com.premwatch.ingest.orchestrator;

import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.RecordStore;
import com.premwatch.ingest.task.IngestionTask;
import com.premwatch.ingest.task.ParameterSpec;
import com.premwatch.ingest.task.StandardTasks;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable name-to-task lookup, built once at start-up.
 */
public final class TaskRegistry {

    private final Map<String, IngestionTask> tasks;

    private TaskRegistry(Map<String, IngestionTask> tasks) {
        this.tasks = Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registry holding every FootyStats task.
     */
    public static TaskRegistry standard(RemoteDataSource source, RecordStore store) {
        Builder builder = builder();
        StandardTasks.create(source, store).forEach(builder::register);
        return builder.build();
    }

    public Optional<IngestionTask> find(String name) {
        return Optional.ofNullable(tasks.get(name));
    }

    public boolean contains(String name) {
        return tasks.containsKey(name);
    }

    /**
     * Task names in registration order.
     */
    public Set<String> names() {
        return tasks.keySet();
    }

    public Collection<IngestionTask> all() {
        return tasks.values();
    }

    /**
     * Tasks that can run without any parameter, in registration order.
     */
    public List<IngestionTask> general() {
        return tasks.values().stream()
            .filter(task -> task.declareParameters().stream().noneMatch(ParameterSpec::required))
            .toList();
    }

    public int size() {
        return tasks.size();
    }

    public static final class Builder {

        private final Map<String, IngestionTask> tasks = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(IngestionTask task) {
            if (tasks.putIfAbsent(task.getName(), task) != null) {
                throw new IllegalArgumentException("Task already registered: " + task.getName());
            }
            return this;
        }

        public TaskRegistry build() {
            return new TaskRegistry(tasks);
        }
    }
}

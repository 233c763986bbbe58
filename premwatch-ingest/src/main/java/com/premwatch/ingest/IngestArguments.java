package com.premwatch.ingest;

import com.premwatch.ingest.task.IngestionTask;
import com.premwatch.ingest.task.ParameterSpec;
import com.premwatch.ingest.task.ParameterType;
import com.premwatch.ingest.task.TaskParameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parsed command line.
 *
 * <pre>
 * premwatch-ingest &lt;db_path&gt; (--all | --general | --task NAME [NAME ...]) [--param value ...]
 * </pre>
 *
 * The database path may also follow the task names. Names after {@code --task} that
 * no task is registered under are passed on (and reported as unknown) once the path
 * has been given.
 * <p>
 * Parameter options come from the tasks' declarations: integer options are parsed
 * as {@code long}, boolean options are flags.
 */
public final class IngestArguments {

    public enum Mode {
        ALL,
        GENERAL,
        TASKS,
        HELP
    }

    private final Path dbPath;
    private final Mode mode;
    private final List<String> taskNames;
    private final TaskParameters parameters;

    private IngestArguments(Path dbPath, Mode mode, List<String> taskNames, TaskParameters parameters) {
        this.dbPath = dbPath;
        this.mode = mode;
        this.taskNames = List.copyOf(taskNames);
        this.parameters = parameters;
    }

    public static IngestArguments parse(String[] args, Collection<IngestionTask> tasks) throws UsageException {
        Map<String, ParameterType> options = parameterTypes(tasks);
        Set<String> registered = tasks.stream().map(IngestionTask::getName).collect(Collectors.toSet());

        Path dbPath = null;
        Mode mode = null;
        List<String> taskNames = new ArrayList<>();
        Map<String, Object> values = new LinkedHashMap<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--help", "-h" -> {
                    return new IngestArguments(dbPath, Mode.HELP, List.of(), TaskParameters.empty());
                }
                case "--all" -> mode = selectMode(mode, Mode.ALL);
                case "--general" -> mode = selectMode(mode, Mode.GENERAL);
                case "--task" -> {
                    mode = selectMode(mode, Mode.TASKS);
                    while (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                        // Until the database path is seen, an unregistered name is taken as that path
                        if (dbPath == null && !taskNames.isEmpty() && !registered.contains(args[i + 1])) {
                            break;
                        }
                        taskNames.add(args[++i]);
                    }
                    if (taskNames.isEmpty()) {
                        throw new UsageException("--task needs at least one task name");
                    }
                }
                default -> {
                    if (arg.startsWith("--")) {
                        String name = arg.substring(2);
                        ParameterType type = options.get(name);
                        if (type == null) {
                            throw new UsageException("Unknown option: " + arg);
                        }
                        if (type == ParameterType.BOOLEAN) {
                            values.put(name, Boolean.TRUE);
                        } else {
                            if (i + 1 >= args.length) {
                                throw new UsageException("Option " + arg + " needs a value");
                            }
                            values.put(name, convert(name, type, args[++i]));
                        }
                    } else if (dbPath == null) {
                        dbPath = Path.of(arg);
                    } else {
                        throw new UsageException("Unexpected argument: " + arg);
                    }
                }
            }
        }

        if (dbPath == null) {
            throw new UsageException("Missing database path");
        }
        if (mode == null) {
            throw new UsageException("Choose one of --all, --general or --task");
        }
        return new IngestArguments(dbPath, mode, taskNames, TaskParameters.of(values));
    }

    private static Mode selectMode(Mode current, Mode requested) throws UsageException {
        if (current != null && current != requested) {
            throw new UsageException("Only one of --all, --general or --task may be given");
        }
        return requested;
    }

    private static Object convert(String name, ParameterType type, String value) throws UsageException {
        if (type == ParameterType.INTEGER) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new UsageException("Option --" + name + " expects an integer, got '" + value + "'");
            }
        }
        return value;
    }

    private static Map<String, ParameterType> parameterTypes(Collection<IngestionTask> tasks) {
        Map<String, ParameterType> types = new LinkedHashMap<>();
        for (IngestionTask task : tasks) {
            for (ParameterSpec spec : task.declareParameters()) {
                types.putIfAbsent(spec.name(), spec.type());
            }
        }
        return types;
    }

    /**
     * Help text listing every task and option.
     */
    public static String usage(Collection<IngestionTask> tasks) {
        StringBuilder sb = new StringBuilder();
        sb.append("Usage: premwatch-ingest <db_path> (--all | --general | --task NAME [NAME ...]) [options]\n\n");
        sb.append("  --all        cascading update of every resource\n");
        sb.append("  --general    every task that needs no parameter\n");
        sb.append("  --task       the named tasks, in order\n");
        sb.append("               (db_path may follow them; it ends the list of names)\n\n");
        sb.append("Tasks:\n");
        for (IngestionTask task : tasks) {
            sb.append(String.format("  %-15s -> %-14s", task.getName(), task.getTable()));
            List<String> required = task.declareParameters().stream()
                .filter(ParameterSpec::required).map(ParameterSpec::name).toList();
            if (!required.isEmpty()) {
                sb.append(" requires ").append(String.join(", ", required));
            }
            sb.append('\n');
        }
        sb.append("\nOptions:\n");
        Map<String, ParameterSpec> specs = new LinkedHashMap<>();
        tasks.forEach(task -> task.declareParameters().forEach(spec -> specs.putIfAbsent(spec.name(), spec)));
        specs.values().forEach(spec -> sb.append(String.format("  --%-12s %s%s\n", spec.name(),
            spec.type() == ParameterType.BOOLEAN ? "" : "<" + spec.type().name().toLowerCase(Locale.ROOT) + "> ",
            spec.description())));
        return sb.toString();
    }

    public Path getDbPath() {
        return dbPath;
    }

    public Mode getMode() {
        return mode;
    }

    public List<String> getTaskNames() {
        return taskNames;
    }

    public TaskParameters getParameters() {
        return parameters;
    }
}

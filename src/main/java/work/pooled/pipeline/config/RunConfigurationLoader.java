package work.pooled.pipeline.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.pooled.pipeline.api.PipelineRunConfiguration;
import work.pooled.pipeline.error.ConfigurationException;
import work.pooled.pipeline.error.ErrorCode;
import work.pooled.pipeline.manifest.ManifestOptions;
import work.pooled.pipeline.manifest.StageType;
import work.pooled.pipeline.model.Arm;
import work.pooled.pipeline.plan.PipelineStage;
import work.pooled.pipeline.shared.ResourceParser;
import work.pooled.pipeline.task.TaskSettings;

/**
 * Reads a {@code pipeline.toml} run configuration into a {@link PipelineRunConfiguration.Builder}.
 * Relative paths are resolved against the file's directory; command line flags are applied after.
 */
public final class RunConfigurationLoader {
    private static final Set<String> TOP_LEVEL = Set.of("run", "gates", "stages", "tasks");
    private static final String DEFAULT_TASK = "default";

    public PipelineRunConfiguration.Builder load(Path file) {
        return load(file, PipelineRunConfiguration.builder());
    }

    public PipelineRunConfiguration.Builder load(Path file, PipelineRunConfiguration.Builder builder) {
        if (!Files.isRegularFile(file)) {
            throw ConfigurationException.invalid("Configuration file not found: " + file);
        }
        try {
            return apply(Toml.parse(file), file.toAbsolutePath().getParent(), builder);
        } catch (IOException ex) {
            throw new ConfigurationException(
                ErrorCode.INVALID_CONFIGURATION,
                "Unable to read configuration " + file + ": " + ex.getMessage(),
                ex
            );
        }
    }

    public PipelineRunConfiguration.Builder apply(TomlParseResult toml, Path baseDirectory, PipelineRunConfiguration.Builder builder) {
        if (toml.hasErrors()) {
            throw ConfigurationException.invalid("Invalid TOML configuration: " + toml.errors().get(0).toString());
        }
        for (String key : toml.keySet()) {
            if (!TOP_LEVEL.contains(key)) {
                throw ConfigurationException.invalid("Unknown configuration section: " + key);
            }
        }
        applyRun(toml.getTable("run"), baseDirectory, builder);
        applyGates(toml.getTable("gates"), builder);
        applyStages(toml.getTable("stages"), builder);
        applyTasks(toml.getTable("tasks"), baseDirectory, builder);
        return builder;
    }

    private static void applyRun(TomlTable run, Path baseDirectory, PipelineRunConfiguration.Builder builder) {
        if (run == null) {
            return;
        }
        stringValue(run, "input").ifPresent(input -> builder.input(resolve(baseDirectory, input)));
        stringValue(run, "outdir").ifPresent(outdir -> builder.outputDirectory(resolve(baseDirectory, outdir)));
        if (run.contains("parallelism")) {
            var parallelism = longValue(run, "parallelism");
            if (parallelism < 1) {
                throw ConfigurationException.invalid("run.parallelism must be at least 1");
            }
            builder.parallelism((int) parallelism);
        }
        if (run.contains("resume")) {
            builder.resume(booleanValue(run, "resume"));
        }
    }

    private static void applyGates(TomlTable gates, PipelineRunConfiguration.Builder builder) {
        if (gates == null) {
            return;
        }
        for (String key : gates.keySet()) {
            var arm = Arm.from(key);
            if (booleanValue(gates, key)) {
                builder.commit(arm);
            }
        }
    }

    private static void applyStages(TomlTable stages, PipelineRunConfiguration.Builder builder) {
        if (stages == null) {
            return;
        }
        for (String name : stages.keySet()) {
            var type = StageType.fromKeyword(name);
            var table = stages.getTable(List.of(name));
            if (table == null) {
                throw ConfigurationException.invalid("stages." + name + " must be a table");
            }
            int stride = 1;
            if (table.contains("site_stride")) {
                if (!type.supportsSiteStride()) {
                    throw ConfigurationException.invalid("stages." + name + " does not support site_stride");
                }
                stride = (int) longValue(table, "site_stride");
            }
            boolean subdirs = false;
            if (table.contains("use_subdirs")) {
                if (!type.supportsSubdirectories()) {
                    throw ConfigurationException.invalid("stages." + name + " does not support use_subdirs");
                }
                subdirs = booleanValue(table, "use_subdirs");
            }
            builder.manifestOptions(type, new ManifestOptions(stride, subdirs));
        }
    }

    private static void applyTasks(TomlTable tasks, Path baseDirectory, PipelineRunConfiguration.Builder builder) {
        if (tasks == null) {
            return;
        }
        for (String name : tasks.keySet()) {
            var table = tasks.getTable(List.of(name));
            if (table == null) {
                throw ConfigurationException.invalid("tasks." + name + " must be a table");
            }
            var settings = taskSettings(name, table, baseDirectory);
            if (DEFAULT_TASK.equals(name)) {
                builder.defaultTask(settings);
            } else {
                builder.task(PipelineStage.fromId(name), settings);
            }
        }
    }

    private static TaskSettings taskSettings(String name, TomlTable table, Path baseDirectory) {
        List<String> command = List.of();
        if (table.contains("command")) {
            TomlArray array = table.getArray("command");
            if (array == null) {
                throw ConfigurationException.invalid("tasks." + name + ".command must be an array of strings");
            }
            var parts = new ArrayList<String>(array.size());
            for (int i = 0; i < array.size(); i++) {
                parts.add(String.valueOf(array.get(i)));
            }
            command = parts;
        }
        Optional<Duration> timeout = Optional.empty();
        if (table.contains("timeout")) {
            var raw = table.get("timeout");
            try {
                timeout = raw instanceof Number number
                    ? Optional.of(Duration.ofSeconds(number.longValue()))
                    : ResourceParser.parseDuration(String.valueOf(raw));
            } catch (IllegalArgumentException ex) {
                throw ConfigurationException.invalid("tasks." + name + ".timeout: " + ex.getMessage());
            }
            timeout = timeout.filter(duration -> !duration.isZero());
        }
        var config = stringValue(table, "config").map(value -> resolve(baseDirectory, value));
        return new TaskSettings(command, timeout, config);
    }

    private static Optional<String> stringValue(TomlTable table, String key) {
        if (!table.contains(key)) {
            return Optional.empty();
        }
        if (!table.isString(List.of(key))) {
            throw ConfigurationException.invalid("'" + key + "' must be a string");
        }
        return Optional.ofNullable(table.getString(List.of(key)));
    }

    private static long longValue(TomlTable table, String key) {
        if (!table.isLong(List.of(key))) {
            throw ConfigurationException.invalid("'" + key + "' must be an integer");
        }
        return table.getLong(List.of(key));
    }

    private static boolean booleanValue(TomlTable table, String key) {
        if (!table.isBoolean(List.of(key))) {
            throw ConfigurationException.invalid("'" + key + "' must be true or false");
        }
        return table.getBoolean(List.of(key));
    }

    private static Path resolve(Path baseDirectory, String value) {
        var path = Path.of(value);
        return path.isAbsolute() || baseDirectory == null ? path : baseDirectory.resolve(path).normalize();
    }
}

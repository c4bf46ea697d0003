package work.pooled.pipeline.task;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Command template, timeout and stage configuration artifact of a stage's tasks.
 */
public record TaskSettings(List<String> command, Optional<Duration> timeout, Optional<Path> config) {
    public static final TaskSettings NONE = new TaskSettings(List.of(), Optional.empty(), Optional.empty());

    public TaskSettings {
        command = command == null ? List.of() : List.copyOf(command);
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(config, "config");
    }

    /** Values set in {@code override} win over this instance's. */
    public TaskSettings overriddenBy(TaskSettings override) {
        if (override == null) {
            return this;
        }
        return new TaskSettings(
            override.command.isEmpty() ? command : override.command,
            override.timeout.isPresent() ? override.timeout : timeout,
            override.config.isPresent() ? override.config : config
        );
    }
}

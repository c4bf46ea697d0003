package work.pooled.pipeline.api;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import work.pooled.pipeline.gate.GateState;
import work.pooled.pipeline.manifest.ManifestOptions;
import work.pooled.pipeline.manifest.StageType;
import work.pooled.pipeline.model.Arm;
import work.pooled.pipeline.plan.PipelineSettings;
import work.pooled.pipeline.plan.PipelineStage;
import work.pooled.pipeline.task.TaskSettings;

/**
 * Immutable configuration of one pipeline run.
 */
public record PipelineRunConfiguration(
    Path input,
    Path outputDirectory,
    GateState gates,
    int parallelism,
    boolean resume,
    boolean planOnly,
    LogLevel logLevel,
    Map<StageType, ManifestOptions> manifestOptions,
    TaskSettings defaultTask,
    Map<PipelineStage, TaskSettings> tasks
) {
    public PipelineRunConfiguration {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(gates, "gates");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(defaultTask, "defaultTask");
        manifestOptions = Map.copyOf(manifestOptions);
        tasks = Map.copyOf(tasks);
    }

    public static Builder builder() {
        return new Builder();
    }

    public PipelineSettings toSettings() {
        return new PipelineSettings(gates, parallelism, resume, planOnly, manifestOptions, defaultTask, tasks);
    }

    public static final class Builder {
        private Path input;
        private Path outputDirectory = Path.of("results");
        private GateState gates = GateState.CLOSED;
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private boolean resume;
        private boolean planOnly;
        private LogLevel logLevel = LogLevel.INFO;
        private final Map<StageType, ManifestOptions> manifestOptions = new EnumMap<>(StageType.class);
        private TaskSettings defaultTask = TaskSettings.NONE;
        private final Map<PipelineStage, TaskSettings> tasks = new EnumMap<>(PipelineStage.class);

        public Builder input(Path input) {
            this.input = input;
            return this;
        }

        public boolean hasInput() {
            return input != null;
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder gates(GateState gates) {
            this.gates = gates;
            return this;
        }

        /** Marks {@code arm}'s review as committed. There is no way back within a run. */
        public Builder commit(Arm arm) {
            this.gates = gates.commit(arm);
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder resume(boolean resume) {
            this.resume = resume;
            return this;
        }

        public Builder planOnly(boolean planOnly) {
            this.planOnly = planOnly;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder manifestOptions(StageType type, ManifestOptions options) {
            this.manifestOptions.put(type, options);
            return this;
        }

        public Builder defaultTask(TaskSettings defaultTask) {
            this.defaultTask = defaultTask;
            return this;
        }

        public Builder task(PipelineStage stage, TaskSettings settings) {
            this.tasks.put(stage, settings);
            return this;
        }

        public PipelineRunConfiguration build() {
            return new PipelineRunConfiguration(
                input,
                outputDirectory,
                gates,
                parallelism,
                resume,
                planOnly,
                logLevel,
                manifestOptions,
                defaultTask,
                tasks
            );
        }
    }
}

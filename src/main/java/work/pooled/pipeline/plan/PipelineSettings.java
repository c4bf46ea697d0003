package work.pooled.pipeline.plan;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import work.pooled.pipeline.gate.GateState;
import work.pooled.pipeline.manifest.ManifestOptions;
import work.pooled.pipeline.manifest.StageType;
import work.pooled.pipeline.task.TaskSettings;

/**
 * Execution knobs of one run, independent of where the inputs come from.
 */
public record PipelineSettings(
    GateState gates,
    int parallelism,
    boolean resume,
    boolean planOnly,
    Map<StageType, ManifestOptions> manifestOptions,
    TaskSettings defaultTask,
    Map<PipelineStage, TaskSettings> tasks
) {
    public PipelineSettings {
        Objects.requireNonNull(gates, "gates");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        manifestOptions = manifestOptions == null || manifestOptions.isEmpty()
            ? Map.of()
            : Map.copyOf(new EnumMap<>(manifestOptions));
        Objects.requireNonNull(defaultTask, "defaultTask");
        tasks = tasks == null || tasks.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(tasks));
    }

    public ManifestOptions manifestOptions(StageType type) {
        return manifestOptions.getOrDefault(type, ManifestOptions.DEFAULT);
    }

    public TaskSettings taskSettings(PipelineStage stage) {
        return defaultTask.overriddenBy(tasks.get(stage));
    }
}

package work.pooled.pipeline.plan;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.pooled.pipeline.error.ErrorReports;
import work.pooled.pipeline.error.PipelineException;
import work.pooled.pipeline.model.GroupKey;

/**
 * What happened to one planned task.
 */
public record TaskOutcome(GroupKey key, Status status, List<Path> outputs, Optional<PipelineException> error) {
    public TaskOutcome {
        outputs = List.copyOf(outputs);
    }

    public static TaskOutcome planned(GroupKey key) {
        return new TaskOutcome(key, Status.PLANNED, List.of(), Optional.empty());
    }

    public static TaskOutcome succeeded(GroupKey key, List<Path> outputs, boolean cached) {
        return new TaskOutcome(key, cached ? Status.CACHED : Status.SUCCEEDED, outputs, Optional.empty());
    }

    public static TaskOutcome failed(GroupKey key, PipelineException error) {
        return new TaskOutcome(key, Status.FAILED, List.of(), Optional.of(error));
    }

    public boolean failed() {
        return status == Status.FAILED;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("groupKey", key.asMap());
        map.put("status", status.name().toLowerCase(Locale.ROOT));
        if (!outputs.isEmpty()) {
            map.put("outputs", outputs.size());
        }
        error.ifPresent(e -> map.put("error", ErrorReports.toMap(e)));
        return map;
    }

    public enum Status {
        PLANNED,
        SUCCEEDED,
        CACHED,
        FAILED
    }
}

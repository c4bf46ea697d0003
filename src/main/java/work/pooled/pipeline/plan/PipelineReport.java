package work.pooled.pipeline.plan;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import work.pooled.pipeline.gate.GateState;

public record PipelineReport(GateState gates, List<StageReport> stages) {
    public PipelineReport {
        stages = List.copyOf(stages);
    }

    public Optional<StageReport> stage(PipelineStage stage) {
        return stages.stream().filter(report -> report.stage() == stage).findFirst();
    }

    public int failureCount() {
        return stages.stream().mapToInt(StageReport::failureCount).sum();
    }

    public int completedCount() {
        return stages.stream().mapToInt(StageReport::completedCount).sum();
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("gates", gates.toMap());
        map.put("completedTasks", completedCount());
        map.put("failures", failureCount());
        map.put("stages", stages.stream().map(StageReport::toMap).collect(Collectors.toList()));
        return map;
    }
}

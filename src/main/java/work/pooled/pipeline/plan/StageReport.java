package work.pooled.pipeline.plan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import work.pooled.pipeline.error.ErrorReports;
import work.pooled.pipeline.error.PipelineException;
import work.pooled.pipeline.manifest.ManifestWarning;
import work.pooled.pipeline.model.Arm;
import work.pooled.pipeline.model.GroupKey;

/**
 * Per-stage section of the run summary.
 */
public record StageReport(
    PipelineStage stage,
    boolean scheduled,
    Set<Arm> awaiting,
    int inputRecords,
    List<TaskOutcome> tasks,
    List<PipelineException> planningFailures,
    List<GroupKey> skipped,
    List<ManifestWarning> warnings
) {
    public StageReport {
        awaiting = Set.copyOf(awaiting);
        tasks = List.copyOf(tasks);
        planningFailures = List.copyOf(planningFailures);
        skipped = List.copyOf(skipped);
        warnings = List.copyOf(warnings);
    }

    public static StageReport deferred(PipelineStage stage, Set<Arm> awaiting) {
        return new StageReport(stage, false, awaiting, 0, List.of(), List.of(), List.of(), List.of());
    }

    public int failureCount() {
        return planningFailures.size() + (int) tasks.stream().filter(TaskOutcome::failed).count();
    }

    public int completedCount() {
        return (int) tasks.stream().filter(outcome -> !outcome.failed()).count();
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("stage", stage.id());
        map.put("scheduled", scheduled);
        if (!scheduled) {
            map.put("awaitingReview", awaiting.stream().map(Arm::key).sorted().collect(Collectors.toList()));
            return map;
        }
        map.put("inputRecords", inputRecords);
        map.put("tasks", tasks.stream().map(TaskOutcome::toMap).collect(Collectors.toList()));
        if (!planningFailures.isEmpty()) {
            var failures = new ArrayList<Map<String, Object>>();
            planningFailures.forEach(failure -> failures.add(ErrorReports.toMap(failure)));
            map.put("failures", failures);
        }
        if (!skipped.isEmpty()) {
            map.put("skipped", skipped.stream().map(GroupKey::asMap).collect(Collectors.toList()));
        }
        if (!warnings.isEmpty()) {
            map.put("warnings", warnings.stream().map(ManifestWarning::toMap).collect(Collectors.toList()));
        }
        return map;
    }
}

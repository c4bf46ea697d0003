package work.pooled.pipeline.plan;

import java.util.List;
import work.pooled.pipeline.error.PipelineException;
import work.pooled.pipeline.model.GroupKey;

/**
 * Tasks of one stage in key order, the groups that could not be planned, and groups skipped
 * because their upstream counterpart already failed.
 */
public record StagePlan(
    PipelineStage stage,
    int inputRecords,
    List<PlannedTask> tasks,
    List<PipelineException> failures,
    List<GroupKey> skipped
) {
    public StagePlan {
        tasks = List.copyOf(tasks);
        failures = List.copyOf(failures);
        skipped = List.copyOf(skipped);
    }
}

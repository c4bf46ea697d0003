package work.pooled.pipeline.task;

import java.nio.file.Path;
import java.util.List;
import work.pooled.pipeline.error.TaskInvocationException;

/**
 * Exit status, declared outputs and statistics tables of one invocation.
 */
public record TaskResult(int exitStatus, List<Path> outputs, List<Path> statistics, boolean cached) {
    public TaskResult {
        outputs = List.copyOf(outputs);
        statistics = List.copyOf(statistics);
    }

    public static TaskResult completed(int exitStatus, List<Path> outputs, List<Path> statistics) {
        return new TaskResult(exitStatus, outputs, statistics, false);
    }

    public TaskResult asCached() {
        return new TaskResult(exitStatus, outputs, statistics, true);
    }

    /** Rejects a nonzero exit or an empty output set. */
    public TaskResult requireSuccess(TaskRequest request) {
        if (exitStatus != 0) {
            throw new TaskInvocationException(
                "Stage " + request.stageId() + " exited with status " + exitStatus,
                request.key(),
                exitStatus
            );
        }
        if (outputs.isEmpty()) {
            throw new TaskInvocationException(
                "Stage " + request.stageId() + " produced no outputs matching '" + request.outputGlob() + "'",
                request.key(),
                exitStatus
            );
        }
        return this;
    }
}

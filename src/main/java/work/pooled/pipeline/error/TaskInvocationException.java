package work.pooled.pipeline.error;

import java.util.OptionalInt;
import work.pooled.pipeline.model.GroupKey;

/**
 * The external tool failed for one group: nonzero exit, timeout, or missing declared outputs.
 */
public final class TaskInvocationException extends PipelineException {
    private final Integer exitStatus;

    public TaskInvocationException(String message, GroupKey groupKey, Integer exitStatus) {
        super(ErrorCode.TASK_INVOCATION_FAILED, message, groupKey);
        this.exitStatus = exitStatus;
    }

    public TaskInvocationException(String message, GroupKey groupKey, Throwable cause) {
        super(ErrorCode.TASK_INVOCATION_FAILED, message, groupKey, cause);
        this.exitStatus = null;
    }

    public OptionalInt exitStatus() {
        return exitStatus == null ? OptionalInt.empty() : OptionalInt.of(exitStatus);
    }
}

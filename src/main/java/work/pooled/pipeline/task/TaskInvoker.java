package work.pooled.pipeline.task;

/**
 * Runs the external tool of one stage for one group. Implementations must be safe to call
 * concurrently for distinct groups.
 */
@FunctionalInterface
public interface TaskInvoker {
    TaskResult invoke(TaskRequest request);
}

package work.pooled.pipeline.task;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps stage ids to invokers, falling back to a default invoker.
 */
public final class TaskInvokerRegistry {
    private final Map<String, TaskInvoker> invokers = new ConcurrentHashMap<>();
    private volatile TaskInvoker fallback;

    public TaskInvokerRegistry(TaskInvoker fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public TaskInvokerRegistry register(String stageId, TaskInvoker invoker) {
        invokers.put(stageId, Objects.requireNonNull(invoker, "invoker"));
        return this;
    }

    public TaskInvokerRegistry setFallback(TaskInvoker invoker) {
        this.fallback = Objects.requireNonNull(invoker, "invoker");
        return this;
    }

    public TaskInvoker resolve(String stageId) {
        return invokers.getOrDefault(stageId, fallback);
    }

    public void unregister(String stageId) {
        if (stageId != null) {
            invokers.remove(stageId);
        }
    }

    public Map<String, TaskInvoker> entries() {
        return Collections.unmodifiableMap(invokers);
    }
}

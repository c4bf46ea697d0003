package work.pooled.pipeline.gate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.pooled.pipeline.model.Arm;

/**
 * Stages allowed to run, and for every other stage the arms still awaiting review.
 */
public record SchedulePlan<S extends GatedStage>(GateState gates, List<S> scheduled, Map<S, Set<Arm>> deferred) {
    public SchedulePlan {
        scheduled = List.copyOf(scheduled);
        deferred = Collections.unmodifiableMap(new LinkedHashMap<>(deferred));
    }

    public boolean isScheduled(S stage) {
        return scheduled.contains(stage);
    }

    public Set<Arm> awaiting(S stage) {
        return deferred.getOrDefault(stage, Set.of());
    }
}

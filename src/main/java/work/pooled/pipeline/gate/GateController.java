package work.pooled.pipeline.gate;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.pooled.pipeline.model.Arm;

/**
 * Decides from configuration alone which stages run.
 *
 * <p>A stage is scheduled when every arm gating it is committed and every upstream stage is
 * scheduled. The result depends on nothing but the gate flags, so a flag flipped between runs
 * yields exactly the groups a first run with that flag would have built.
 */
public final class GateController {
    private static final Logger logger = LoggerFactory.getLogger(GateController.class);

    /**
     * @param stages the stage graph in topological order
     */
    public <S extends GatedStage> SchedulePlan<S> schedule(GateState gates, List<S> stages) {
        var scheduled = new ArrayList<S>();
        Map<S, Set<Arm>> deferred = new LinkedHashMap<>();
        for (S stage : stages) {
            var awaiting = EnumSet.noneOf(Arm.class);
            for (Arm arm : stage.gatedBy()) {
                if (!gates.committed(arm)) {
                    awaiting.add(arm);
                }
            }
            for (GatedStage upstream : stage.upstream()) {
                var upstreamAwaiting = deferred.get(upstream);
                if (upstreamAwaiting != null) {
                    awaiting.addAll(upstreamAwaiting);
                }
            }
            if (awaiting.isEmpty()) {
                scheduled.add(stage);
            } else {
                logger.info("Stage {} deferred: awaiting review of {}", stage, awaiting);
                deferred.put(stage, awaiting);
            }
        }
        return new SchedulePlan<>(gates, scheduled, deferred);
    }
}

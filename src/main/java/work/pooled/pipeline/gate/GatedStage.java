package work.pooled.pipeline.gate;

import java.util.List;
import java.util.Set;
import work.pooled.pipeline.model.Arm;

/**
 * A node of the stage graph as seen by the {@link GateController}.
 */
public interface GatedStage {
    /** Arms whose review must be committed before this stage may run. Empty for ungated stages. */
    Set<Arm> gatedBy();

    /** Stages whose outputs this stage consumes. */
    List<? extends GatedStage> upstream();
}

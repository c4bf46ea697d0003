package work.pooled.pipeline.gate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.pooled.pipeline.model.Arm;
import work.pooled.pipeline.plan.PipelineStage;

class GateControllerTest {
    private static final List<PipelineStage> GRAPH = List.of(PipelineStage.values());

    private final GateController controller = new GateController();

    @Test
    void committedArmRunsWhileTheOtherWaits() {
        var plan = controller.schedule(GateState.fromFlags(false, true), GRAPH);

        assertTrue(plan.isScheduled(PipelineStage.BARCODING_STITCH_CROP));
        assertFalse(plan.isScheduled(PipelineStage.PAINTING_STITCH_CROP));
        assertFalse(plan.isScheduled(PipelineStage.COMBINED_ANALYSIS));
        assertEquals(Set.of(Arm.PAINTING), plan.awaiting(PipelineStage.PAINTING_STITCH_CROP));
        assertEquals(Set.of(Arm.PAINTING), plan.awaiting(PipelineStage.COMBINED_ANALYSIS));
    }

    @Test
    void ungatedStagesAlwaysRun() {
        var plan = controller.schedule(GateState.CLOSED, GRAPH);
        assertEquals(
            List.of(
                PipelineStage.PAINTING_CORRECTION_CALC,
                PipelineStage.PAINTING_CORRECTION_APPLY,
                PipelineStage.PAINTING_SEGMENTATION_CHECK,
                PipelineStage.BARCODING_CORRECTION_CALC,
                PipelineStage.BARCODING_CORRECTION_APPLY,
                PipelineStage.BARCODING_PREPROCESS
            ),
            plan.scheduled()
        );
        assertEquals(Set.of(Arm.PAINTING, Arm.BARCODING), plan.awaiting(PipelineStage.COMBINED_ANALYSIS));
    }

    @Test
    void bothGatesCommittedSchedulesEverything() {
        var plan = controller.schedule(GateState.CLOSED.commit(Arm.PAINTING).commit(Arm.BARCODING), GRAPH);
        assertEquals(GRAPH, plan.scheduled());
        assertTrue(plan.deferred().isEmpty());
    }

    @Test
    void scheduleDependsOnlyOnFlags() {
        var first = controller.schedule(GateState.fromFlags(true, false), GRAPH);
        var second = controller.schedule(GateState.CLOSED.commit(Arm.PAINTING), GRAPH);
        assertEquals(first.scheduled(), second.scheduled());
        assertEquals(first.deferred(), second.deferred());
    }

    @Test
    void commitIsMonotonic() {
        var gates = GateState.fromFlags(true, false).commit(Arm.PAINTING);
        assertEquals(GateStatus.COMMITTED, gates.status(Arm.PAINTING));
        assertEquals(Set.of(Arm.PAINTING), gates.committedArms());
        assertFalse(gates.committedAll(Set.of(Arm.PAINTING, Arm.BARCODING)));
    }
}

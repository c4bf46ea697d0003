package work.pooled.pipeline.gate;

/**
 * Review state of one arm. The only transition is {@code AWAITING_REVIEW -> COMMITTED}.
 */
public enum GateStatus {
    AWAITING_REVIEW,
    COMMITTED;

    public static GateStatus fromFlag(boolean passed) {
        return passed ? COMMITTED : AWAITING_REVIEW;
    }
}

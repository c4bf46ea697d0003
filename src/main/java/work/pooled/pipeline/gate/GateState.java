package work.pooled.pipeline.gate;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.pooled.pipeline.model.Arm;

/**
 * The two quality-control flags of a run, read once from configuration.
 */
public record GateState(GateStatus painting, GateStatus barcoding) {
    public static final GateState CLOSED = new GateState(GateStatus.AWAITING_REVIEW, GateStatus.AWAITING_REVIEW);

    public GateState {
        Objects.requireNonNull(painting, "painting");
        Objects.requireNonNull(barcoding, "barcoding");
    }

    public static GateState fromFlags(boolean paintingPassed, boolean barcodingPassed) {
        return new GateState(GateStatus.fromFlag(paintingPassed), GateStatus.fromFlag(barcodingPassed));
    }

    public GateStatus status(Arm arm) {
        return switch (arm) {
            case PAINTING -> painting;
            case BARCODING -> barcoding;
        };
    }

    public boolean committed(Arm arm) {
        return status(arm) == GateStatus.COMMITTED;
    }

    /** Commits {@code arm}. Committed arms stay committed. */
    public GateState commit(Arm arm) {
        return switch (arm) {
            case PAINTING -> new GateState(GateStatus.COMMITTED, barcoding);
            case BARCODING -> new GateState(painting, GateStatus.COMMITTED);
        };
    }

    public boolean committedAll(Set<Arm> arms) {
        return arms.stream().allMatch(this::committed);
    }

    public Set<Arm> committedArms() {
        var arms = EnumSet.noneOf(Arm.class);
        for (Arm arm : Arm.values()) {
            if (committed(arm)) {
                arms.add(arm);
            }
        }
        return arms;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        for (Arm arm : Arm.values()) {
            map.put(arm.key(), status(arm).name().toLowerCase(Locale.ROOT));
        }
        return map;
    }
}

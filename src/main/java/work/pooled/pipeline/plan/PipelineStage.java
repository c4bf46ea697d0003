package work.pooled.pipeline.plan;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import work.pooled.pipeline.error.ConfigurationException;
import work.pooled.pipeline.gate.GatedStage;
import work.pooled.pipeline.manifest.StageType;
import work.pooled.pipeline.model.Arm;
import work.pooled.pipeline.model.Field;

/**
 * The stage graph, declared in topological order.
 */
public enum PipelineStage implements GatedStage {
    PAINTING_CORRECTION_CALC(
        EnumSet.of(Arm.PAINTING), StageType.CORRECTION_CALC, Keys.PLATE, List.of(), null, EnumSet.noneOf(Arm.class), "*.npy"
    ),
    PAINTING_CORRECTION_APPLY(
        EnumSet.of(Arm.PAINTING), StageType.CORRECTION_APPLY, Keys.WELL, List.of(), PAINTING_CORRECTION_CALC,
        EnumSet.noneOf(Arm.class), "*.tif*"
    ),
    PAINTING_SEGMENTATION_CHECK(
        EnumSet.of(Arm.PAINTING), StageType.SEGMENTATION_CHECK, Keys.WELL, List.of(PAINTING_CORRECTION_APPLY), null,
        EnumSet.noneOf(Arm.class), "*.png"
    ),
    PAINTING_STITCH_CROP(
        EnumSet.of(Arm.PAINTING), null, Keys.WELL, List.of(PAINTING_CORRECTION_APPLY), null,
        EnumSet.of(Arm.PAINTING), "*.tif*"
    ),
    BARCODING_CORRECTION_CALC(
        EnumSet.of(Arm.BARCODING), StageType.CORRECTION_CALC, Keys.PLATE, List.of(), null, EnumSet.noneOf(Arm.class), "*.npy"
    ),
    BARCODING_CORRECTION_APPLY(
        EnumSet.of(Arm.BARCODING), StageType.CORRECTION_APPLY, Keys.WELL, List.of(), BARCODING_CORRECTION_CALC,
        EnumSet.noneOf(Arm.class), "*.tif*"
    ),
    BARCODING_PREPROCESS(
        EnumSet.of(Arm.BARCODING), StageType.BARCODE_PREPROCESS, Keys.WELL, List.of(BARCODING_CORRECTION_APPLY), null,
        EnumSet.noneOf(Arm.class), "*.tif*"
    ),
    BARCODING_STITCH_CROP(
        EnumSet.of(Arm.BARCODING), null, Keys.WELL, List.of(BARCODING_PREPROCESS), null,
        EnumSet.of(Arm.BARCODING), "*.tif*"
    ),
    COMBINED_ANALYSIS(
        EnumSet.allOf(Arm.class), StageType.COMBINED_ANALYSIS, Keys.WELL_ACROSS_ARMS,
        List.of(PAINTING_STITCH_CROP, BARCODING_STITCH_CROP), null, EnumSet.allOf(Arm.class), "*.csv"
    );

    private final Set<Arm> arms;
    private final StageType stageType;
    private final List<Field> keyFields;
    private final List<PipelineStage> inputs;
    private final PipelineStage joinStage;
    private final Set<Arm> gatedBy;
    private final String outputGlob;

    PipelineStage(
        Set<Arm> arms,
        StageType stageType,
        List<Field> keyFields,
        List<PipelineStage> inputs,
        PipelineStage joinStage,
        Set<Arm> gatedBy,
        String outputGlob
    ) {
        this.arms = arms;
        this.stageType = stageType;
        this.keyFields = keyFields;
        this.inputs = inputs;
        this.joinStage = joinStage;
        this.gatedBy = gatedBy;
        this.outputGlob = outputGlob;
    }

    /** Lower-case name used for directories and configuration tables. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public Set<Arm> arms() {
        return EnumSet.copyOf(arms);
    }

    /** Absent for stages that receive staged files without a manifest. */
    public Optional<StageType> stageType() {
        return Optional.ofNullable(stageType);
    }

    public List<Field> keyFields() {
        return keyFields;
    }

    /** Stages whose outputs feed this one; empty when the stage reads ingested records. */
    public List<PipelineStage> inputs() {
        return inputs;
    }

    public boolean readsIngestedRecords() {
        return inputs.isEmpty();
    }

    /** Coarser earlier stage whose outputs are attached to every group. */
    public Optional<PipelineStage> joinStage() {
        return Optional.ofNullable(joinStage);
    }

    @Override
    public Set<Arm> gatedBy() {
        return gatedBy.isEmpty() ? Set.of() : EnumSet.copyOf(gatedBy);
    }

    @Override
    public List<PipelineStage> upstream() {
        var upstream = new ArrayList<PipelineStage>(inputs);
        if (joinStage != null) {
            upstream.add(joinStage);
        }
        return upstream;
    }

    public String outputGlob() {
        return outputGlob;
    }

    public static PipelineStage fromId(String value) {
        var normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (PipelineStage stage : values()) {
            if (stage.name().equals(normalized)) {
                return stage;
            }
        }
        throw ConfigurationException.invalid("Unknown stage: " + value);
    }

    private static final class Keys {
        static final List<Field> PLATE = List.of(Field.BATCH, Field.PLATE, Field.ARM);
        static final List<Field> WELL = List.of(Field.BATCH, Field.PLATE, Field.WELL, Field.ARM);
        static final List<Field> WELL_ACROSS_ARMS = List.of(Field.BATCH, Field.PLATE, Field.WELL);
    }
}

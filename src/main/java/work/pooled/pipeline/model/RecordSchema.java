package work.pooled.pipeline.model;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import work.pooled.pipeline.error.ConfigurationException;
import work.pooled.pipeline.error.ErrorCode;

/**
 * Declares which record fields a consumer requires. Everything else is optional.
 */
public record RecordSchema(String name, Set<Field> required) {
    public static final RecordSchema INGEST_PAINTING = new RecordSchema(
        "painting input",
        EnumSet.of(Field.PATH, Field.ARM, Field.BATCH, Field.PLATE, Field.WELL, Field.SITE, Field.CHANNELS, Field.FRAME_COUNT)
    );

    public static final RecordSchema INGEST_BARCODING = new RecordSchema(
        "barcoding input",
        EnumSet.of(
            Field.PATH, Field.ARM, Field.BATCH, Field.PLATE, Field.WELL, Field.SITE, Field.CYCLE, Field.CHANNELS,
            Field.FRAME_COUNT
        )
    );

    public RecordSchema {
        Objects.requireNonNull(name, "name");
        required = required == null || required.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(required));
    }

    public static RecordSchema forArm(Arm arm) {
        return switch (arm) {
            case PAINTING -> INGEST_PAINTING;
            case BARCODING -> INGEST_BARCODING;
        };
    }

    public List<Field> missing(ImageRecord record) {
        var missing = new ArrayList<Field>();
        for (Field field : Field.values()) {
            if (required.contains(field) && !record.has(field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    public void validate(ImageRecord record) {
        var missing = missing(record);
        if (!missing.isEmpty()) {
            throw new ConfigurationException(
                ErrorCode.MISSING_REQUIRED_FIELD,
                "Record " + record.file() + " is missing required " + name + " field(s): "
                    + missing.stream().map(Field::key).collect(Collectors.joining(", "))
            );
        }
    }
}

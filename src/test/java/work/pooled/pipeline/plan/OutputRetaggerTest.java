package work.pooled.pipeline.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.pooled.pipeline.manifest.FilenamePattern;
import work.pooled.pipeline.model.Arm;
import work.pooled.pipeline.model.Field;
import work.pooled.pipeline.model.GroupKey;

class OutputRetaggerTest {
    private static final Path OUT = Path.of("/runs/painting_correction_apply/B1-P1-A1-painting/output");

    private final OutputRetagger retagger = new OutputRetagger();

    @Test
    void correctedImagesInheritKeyAndParsedLocation() {
        var key = GroupKey.of(
            List.of(Field.BATCH, Field.PLATE, Field.WELL, Field.ARM),
            List.of("B1", "P1", "A1", "painting")
        );
        var records = retagger.retag(key, List.of(
            OUT.resolve(FilenamePattern.corrected("P1", "A1", 3, "Phalloidin")),
            OUT.resolve("B1-P1-A1-painting.png")
        ));

        assertEquals(1, records.size());
        var record = records.get(0);
        assertEquals(Optional.of("B1"), record.batch());
        assertEquals(Optional.of(Arm.PAINTING), record.arm());
        assertEquals(Optional.of("A1"), record.well());
        assertEquals(Optional.of(3), record.site());
        assertEquals(Optional.of("Phalloidin"), record.channel());
        assertTrue(record.cycle().isEmpty());
    }

    @Test
    void correctionFunctionsKeepPlateLevelKey() {
        var key = GroupKey.of(List.of(Field.BATCH, Field.PLATE, Field.ARM), List.of("B1", "P1", "barcoding"));
        var record = retagger.retag(key, List.of(OUT.resolve(FilenamePattern.illumCycle("P1", 2, "G")))).get(0);

        assertEquals(Optional.of(2), record.cycle());
        assertEquals(Optional.of("G"), record.channel());
        assertTrue(record.well().isEmpty());
        assertEquals(Optional.of(Arm.BARCODING), record.arm());
    }

    @Test
    void multiplexedOutputsKeepTheirChannelList() {
        var key = GroupKey.of(List.of(Field.BATCH, Field.PLATE), List.of("B1", "P1"));
        var record = retagger.retag(
            key,
            List.of(OUT.resolve(FilenamePattern.original("B2", 1, List.of("DNA", "GFP"), null)))
        ).get(0);

        assertEquals(List.of("DNA", "GFP"), record.channels());
        assertEquals(Optional.of("B2"), record.well());
        assertTrue(record.arm().isEmpty());
    }
}

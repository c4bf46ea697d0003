package work.pooled.pipeline.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.pooled.pipeline.support.PipelineTestSupport.barcoding;
import static work.pooled.pipeline.support.PipelineTestSupport.corrected;
import static work.pooled.pipeline.support.PipelineTestSupport.cycleImage;
import static work.pooled.pipeline.support.PipelineTestSupport.illum;
import static work.pooled.pipeline.support.PipelineTestSupport.illumCycle;
import static work.pooled.pipeline.support.PipelineTestSupport.painting;
import static work.pooled.pipeline.support.PipelineTestSupport.single;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import work.pooled.pipeline.error.ErrorCode;
import work.pooled.pipeline.error.ManifestException;
import work.pooled.pipeline.join.JoinedGroup;
import work.pooled.pipeline.model.Field;
import work.pooled.pipeline.model.ImageRecord;

class ManifestGeneratorTest {
    private final ManifestGenerator generator = new ManifestGenerator();

    private static JoinedGroup wellGroup(List<ImageRecord> records) {
        return JoinedGroup.standalone(single(records, Field.BATCH, Field.PLATE, Field.WELL));
    }

    private static JoinedGroup withCorrections(List<ImageRecord> records, List<ImageRecord> corrections) {
        return JoinedGroup.of(
            single(records, Field.BATCH, Field.PLATE, Field.WELL),
            single(corrections, Field.BATCH, Field.PLATE)
        );
    }

    @Test
    void oneRowPerSite() {
        var manifest = generator.generate(
            wellGroup(List.of(painting("P1", "A1", 1, "DNA", "GFP"), painting("P1", "A1", 2, "DNA", "GFP"))),
            StageType.CORRECTION_CALC
        );

        assertEquals(
            List.of("Plate", "Well", "Site", "Original_DNA", "Frame_DNA", "Original_GFP", "Frame_GFP"),
            manifest.columns()
        );
        assertEquals(2, manifest.rows().size());
        assertEquals(List.of("P1", "A1", "1"), manifest.rows().get(0).subList(0, 3));
        assertEquals("2", manifest.cell(1, "Site").orElseThrow());
        assertEquals("WellA1_PointA2_0000_ChannelDNA,GFP_Seq0000.ome.tiff", manifest.cell(1, "Original_GFP").orElseThrow());
        assertEquals("0", manifest.cell(1, "Frame_DNA").orElseThrow());
        assertEquals("1", manifest.cell(1, "Frame_GFP").orElseThrow());
        assertTrue(manifest.warnings().isEmpty());
        assertTrue(manifest.toCsv().startsWith("Plate,Well,Site,Original_DNA,Frame_DNA,Original_GFP,Frame_GFP\n"));
    }

    @Test
    void outputDoesNotDependOnInputOrder() {
        var records = new ArrayList<ImageRecord>();
        for (int site = 1; site <= 5; site++) {
            records.add(painting("P1", "A1", site, "DNA", "GFP", "Mito"));
        }
        var first = generator.generate(wellGroup(records), StageType.CORRECTION_CALC);
        Collections.reverse(records);
        var second = generator.generate(wellGroup(records), StageType.CORRECTION_CALC);
        Collections.shuffle(records, new Random(7));
        var third = generator.generate(wellGroup(records), StageType.CORRECTION_CALC);

        assertEquals(first.toCsv(), second.toCsv());
        assertEquals(first.toCsv(), third.toCsv());
        assertEquals(first.digest(), third.digest());
    }

    @Test
    void barcodingCorrectionCalcHasOneRowPerCycle() {
        var manifest = generator.generate(
            wellGroup(List.of(barcoding("P1", "A1", 1, 2, "A", "C"), barcoding("P1", "A1", 1, 1, "A", "C"))),
            StageType.CORRECTION_CALC
        );
        assertEquals(
            List.of("Plate", "Well", "Site", "Cycle", "Original_A", "Frame_A", "Original_C", "Frame_C"),
            manifest.columns()
        );
        assertEquals(List.of("1", "2"), List.of(manifest.cell(0, "Cycle").orElseThrow(), manifest.cell(1, "Cycle").orElseThrow()));
    }

    @Test
    void correctionApplyCrossesCyclesWithChannelsAndAttachesArtifacts() {
        var manifest = generator.generate(
            withCorrections(
                List.of(barcoding("P1", "A1", 1, 1, "A", "C"), barcoding("P1", "A1", 1, 2, "A", "C")),
                List.of(
                    illumCycle("P1", 1, "A"),
                    illumCycle("P1", 1, "C"),
                    illumCycle("P1", 2, "A"),
                    illumCycle("P1", 2, "C")
                )
            ),
            StageType.CORRECTION_APPLY
        );

        assertEquals(
            List.of(
                "Plate", "Well", "Site",
                "Original_Cycle01_A", "Frame_Cycle01_A", "Illum_Cycle01_A",
                "Original_Cycle01_C", "Frame_Cycle01_C", "Illum_Cycle01_C",
                "Original_Cycle02_A", "Frame_Cycle02_A", "Illum_Cycle02_A",
                "Original_Cycle02_C", "Frame_Cycle02_C", "Illum_Cycle02_C"
            ),
            manifest.columns()
        );
        assertEquals(1, manifest.rows().size());
        assertEquals("P1_Cycle02_IllumC.npy", manifest.cell(0, "Illum_Cycle02_C").orElseThrow());
        assertEquals("1", manifest.cell(0, "Frame_Cycle01_C").orElseThrow());
        assertEquals(
            FilenamePattern.original("A1", 1, List.of("A", "C"), 2),
            manifest.cell(0, "Original_Cycle02_A").orElseThrow()
        );
        assertTrue(manifest.warnings().isEmpty());
    }

    @Test
    void dapiArtifactsAttachToTheirRawChannel() {
        var manifest = generator.generate(
            withCorrections(
                List.of(barcoding("P1", "A1", 1, 1, "DAPI", "A")),
                List.of(illumCycle("P1", 1, "DAPI"), illumCycle("P1", 1, "A"))
            ),
            StageType.CORRECTION_APPLY
        );

        assertEquals("P1_Cycle01_IllumDAPI.npy", manifest.cell(0, "Illum_Cycle01_DAPI").orElseThrow());
        assertEquals("P1_Cycle01_IllumA.npy", manifest.cell(0, "Illum_Cycle01_A").orElseThrow());
        assertEquals("0", manifest.cell(0, "Frame_Cycle01_DAPI").orElseThrow());
        assertTrue(manifest.warnings().isEmpty(), manifest.warnings().toString());
    }

    @Test
    void correctionApplyWithoutArtifactsIsAJoinFailure() {
        var ex = assertThrows(
            ManifestException.class,
            () -> generator.generate(wellGroup(List.of(painting("P1", "A1", 1, "DNA"))), StageType.CORRECTION_APPLY)
        );
        assertEquals(ErrorCode.MISSING_JOIN_TARGET, ex.code());
    }

    @Test
    void absentChannelLeavesEmptyCellAndWarns() {
        var manifest = generator.generate(
            wellGroup(List.of(painting("P1", "A1", 1, "DNA", "GFP"), painting("P1", "A1", 2, "DNA"))),
            StageType.CORRECTION_CALC
        );
        assertEquals("", manifest.cell(1, "Original_GFP").orElseThrow());
        assertEquals("", manifest.cell(1, "Frame_GFP").orElseThrow());
        assertEquals(1, manifest.warnings().size());
        var warning = manifest.warnings().get(0);
        assertEquals(ErrorCode.MISSING_CHANNEL_DATA, warning.code());
        assertEquals("Original_GFP", warning.column());
        assertEquals("well=A1, site=2", warning.unit());
    }

    @Test
    void missingArtifactWarnsOncePerChannel() {
        var manifest = generator.generate(
            withCorrections(
                List.of(painting("P1", "A1", 1, "DNA", "GFP"), painting("P1", "A1", 2, "DNA", "GFP")),
                List.of(illum("P1", "DNA"))
            ),
            StageType.CORRECTION_APPLY
        );
        assertEquals("P1_IllumDNA.npy", manifest.cell(1, "Illum_DNA").orElseThrow());
        assertEquals("", manifest.cell(0, "Illum_GFP").orElseThrow());
        assertEquals(1, manifest.warnings().size());
        assertEquals("Illum_GFP", manifest.warnings().get(0).column());
    }

    @Test
    void channelLiteralShapedLikeCycleFailsGeneration() {
        var ex = assertThrows(
            ManifestException.class,
            () -> generator.generate(wellGroup(List.of(painting("P1", "A1", 1, "Cycle1"))), StageType.CORRECTION_CALC)
        );
        assertEquals(ErrorCode.AMBIGUOUS_FILENAME_PATTERN, ex.code());
    }

    @Test
    void segmentationCheckSubsamplesSites() {
        var records = new ArrayList<ImageRecord>();
        for (int site = 1; site <= 4; site++) {
            records.add(corrected("P1", "A1", site, "DNA"));
        }
        var manifest = generator.generate(wellGroup(records), StageType.SEGMENTATION_CHECK, new ManifestOptions(2, false));
        assertEquals(List.of("Plate", "Well", "Site", "Corrected_DNA"), manifest.columns());
        assertEquals(List.of("1", "3"), List.of(manifest.cell(0, "Site").orElseThrow(), manifest.cell(1, "Site").orElseThrow()));
    }

    @Test
    void siteStrideIsIgnoredOutsideSegmentationCheck() {
        var records = List.of(painting("P1", "A1", 1, "DNA"), painting("P1", "A1", 2, "DNA"));
        var manifest = generator.generate(wellGroup(records), StageType.CORRECTION_CALC, new ManifestOptions(2, false));
        assertEquals(2, manifest.rows().size());
    }

    @Test
    void subdirectoriesPrefixCellsWithStableAliases() {
        var manifest = generator.generate(
            withCorrections(
                List.of(painting("P1", "A1", 2, "DNA"), painting("P1", "A1", 1, "DNA")),
                List.of(illum("P1", "DNA"))
            ),
            StageType.CORRECTION_APPLY,
            new ManifestOptions(1, true)
        );
        assertEquals("img1/WellA1_PointA1_0000_ChannelDNA_Seq0000.ome.tiff", manifest.cell(0, "Original_DNA").orElseThrow());
        assertEquals("img2/WellA1_PointA2_0000_ChannelDNA_Seq0000.ome.tiff", manifest.cell(1, "Original_DNA").orElseThrow());
        assertEquals("P1_IllumDNA.npy", manifest.cell(0, "Illum_DNA").orElseThrow());
        assertEquals(List.of("img1", "img2"), manifest.staging().subdirs());
    }

    @Test
    void twoFilesForOneCellAreRejected() {
        var first = corrected("P1", "A1", 1, "DNA");
        var second = first.withFile(Path.of("/data/Plate_P1_Well_A1_Site_1_CorrDNA.tif"));
        var ex = assertThrows(
            ManifestException.class,
            () -> generator.generate(wellGroup(List.of(first, second)), StageType.SEGMENTATION_CHECK)
        );
        assertEquals(ErrorCode.DUPLICATE_CHANNEL_DATA, ex.code());
    }

    @Test
    void combinedAnalysisMixesPlainAndCycleColumns() {
        var records = List.of(
            corrected("P1", "A1", 1, "DNA"),
            cycleImage("P1", "A1", 1, 1, "A"),
            cycleImage("P1", "A1", 1, 2, "A")
        );
        var manifest = generator.generate(
            JoinedGroup.standalone(single(records, Field.BATCH, Field.PLATE, Field.WELL)),
            StageType.COMBINED_ANALYSIS
        );
        assertEquals(
            List.of("Plate", "Well", "Site", "Corrected_DNA", "Corrected_Cycle01_A", "Corrected_Cycle02_A"),
            manifest.columns()
        );
        assertEquals("Plate_P1_Well_A1_Site_1_Cycle02_A.tiff", manifest.cell(0, "Corrected_Cycle02_A").orElseThrow());
    }
}

package work.pooled.pipeline.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.pooled.pipeline.support.PipelineTestSupport.illum;
import static work.pooled.pipeline.support.PipelineTestSupport.painting;
import static work.pooled.pipeline.support.PipelineTestSupport.single;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.pooled.pipeline.error.ErrorCode;
import work.pooled.pipeline.error.ManifestException;
import work.pooled.pipeline.grouping.Group;
import work.pooled.pipeline.join.JoinedGroup;
import work.pooled.pipeline.model.Field;
import work.pooled.pipeline.model.GroupKey;

class StagingPlanTest {
    private static JoinedGroup joined() {
        return JoinedGroup.of(
            single(List.of(painting("P1", "A1", 2, "DNA"), painting("P1", "A1", 1, "DNA")), Field.BATCH, Field.PLATE, Field.WELL),
            single(List.of(illum("P1", "DNA")), Field.BATCH, Field.PLATE)
        );
    }

    @Test
    void flatPlacementListsImagesThenArtifacts() {
        var plan = StagingPlan.of(joined(), false);
        assertEquals(
            List.of(
                "WellA1_PointA1_0000_ChannelDNA_Seq0000.ome.tiff",
                "WellA1_PointA2_0000_ChannelDNA_Seq0000.ome.tiff",
                "P1_IllumDNA.npy"
            ),
            List.copyOf(plan.placements().keySet())
        );
        assertEquals(Path.of("/data/P1_IllumDNA.npy"), plan.placements().get("P1_IllumDNA.npy"));
        assertEquals(List.of(), plan.subdirs());
    }

    @Test
    void subdirectoryAliasesFollowSortedNames() {
        var plan = StagingPlan.of(joined(), true);
        assertEquals(List.of("img1", "img2"), plan.subdirs());
        assertEquals(
            List.of("img1/WellA1_PointA1_0000_ChannelDNA_Seq0000.ome.tiff", "img2/WellA1_PointA2_0000_ChannelDNA_Seq0000.ome.tiff", "P1_IllumDNA.npy"),
            List.copyOf(plan.placements().keySet())
        );
    }

    @Test
    void fileListNamesEverySection() {
        var list = StagingPlan.of(joined(), true).fileList();
        assertEquals(List.of("images", "subdirs", "illumination"), List.copyOf(list.keySet()));
        assertEquals(
            List.of("WellA1_PointA1_0000_ChannelDNA_Seq0000.ome.tiff", "WellA1_PointA2_0000_ChannelDNA_Seq0000.ome.tiff"),
            list.get("images")
        );
        assertEquals(List.of("img1", "img2"), list.get("subdirs"));
        assertEquals(List.of("P1_IllumDNA.npy"), list.get("illumination"));
    }

    @Test
    void sameNameFromTwoLocationsIsRejected() {
        var record = painting("P1", "A1", 1, "DNA");
        var clash = record.withFile(Path.of("/elsewhere").resolve(record.fileName()));
        var group = new Group(
            GroupKey.of(List.of(Field.WELL), List.of("A1")),
            List.of(record, clash)
        );
        var ex = assertThrows(ManifestException.class, () -> StagingPlan.of(JoinedGroup.standalone(group), false));
        assertEquals(ErrorCode.DUPLICATE_CHANNEL_DATA, ex.code());
    }
}

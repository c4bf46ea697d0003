package work.pooled.pipeline.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pooled.pipeline.error.ConfigurationException;
import work.pooled.pipeline.error.ErrorCode;
import work.pooled.pipeline.model.Arm;

class InputTableReaderTest {
    @TempDir
    Path dir;

    private final InputTableReader reader = new InputTableReader();

    @Test
    void readsCsvWithCaseInsensitiveHeaders() throws Exception {
        var table = Files.writeString(dir.resolve("samples.csv"), String.join("\n",
            "Path,Arm,Batch,Plate,Well,Site,Cycle,Channels,N_Frames",
            "raw/a1_s1.tiff,painting,B1,P1,A1,1,,\"DNA, Phalloidin\",2",
            "/abs/a1_s1_c1.tiff,barcoding,B1,P1,A1,1,1,\"A,C,G,T\",4",
            ""
        ));

        var records = reader.read(table);

        assertEquals(2, records.size());
        var painting = records.get(0);
        assertEquals(dir.toAbsolutePath().resolve("raw/a1_s1.tiff").normalize(), painting.file());
        assertEquals(Optional.of(Arm.PAINTING), painting.arm());
        assertEquals(List.of("DNA", "Phalloidin"), painting.channels());
        assertTrue(painting.cycle().isEmpty());
        var barcoding = records.get(1);
        assertEquals(Path.of("/abs/a1_s1_c1.tiff"), barcoding.file());
        assertEquals(Optional.of(1), barcoding.cycle());
        assertEquals(List.of("A", "C", "G", "T"), barcoding.channels());
    }

    @Test
    void readsJsonArrays() throws Exception {
        var table = Files.writeString(dir.resolve("samples.json"), """
            [
              {"path": "a.tiff", "arm": "painting", "batch": "B1", "plate": "P1", "well": "B3",
               "site": 4, "channels": ["DNA", "GFP"], "n_frames": 2}
            ]
            """);

        var record = reader.read(table).get(0);

        assertEquals(Optional.of("B3"), record.well());
        assertEquals(Optional.of(4), record.site());
        assertEquals(List.of("DNA", "GFP"), record.channels());
        assertEquals(Optional.of(2), record.frameCount());
    }

    @Test
    void reportsEveryBadRowAtOnce() {
        var csv = String.join("\n",
            "path,arm,batch,plate,well,site,cycle,channels,n_frames",
            "a.tiff,painting,B1,P1,A1,,,DNA,1",
            "b.tiff,barcoding,B1,P1,A1,1,,A,1",
            "c.tiff,painting,B1,P1,A1,1,,DNA,1"
        );

        var ex = assertThrows(ConfigurationException.class, () -> reader.readCsv(new StringReader(csv), dir));

        assertEquals(ErrorCode.MISSING_REQUIRED_FIELD, ex.code());
        assertTrue(ex.getMessage().contains("row 1:"), ex.getMessage());
        assertTrue(ex.getMessage().contains("row 2:"), ex.getMessage());
        assertTrue(ex.getMessage().contains("site"), ex.getMessage());
        assertTrue(ex.getMessage().contains("cycle"), ex.getMessage());
    }

    @Test
    void frameCountIsRequired() {
        var csv = String.join("\n",
            "path,arm,batch,plate,well,site,channels",
            "a.tiff,painting,B1,P1,A1,1,\"DNA,GFP\""
        );

        var ex = assertThrows(ConfigurationException.class, () -> reader.readCsv(new StringReader(csv), dir));

        assertEquals(ErrorCode.MISSING_REQUIRED_FIELD, ex.code());
        assertTrue(ex.getMessage().contains("n_frames"), ex.getMessage());
    }

    @Test
    void frameCountMustCoverEveryChannel() {
        var csv = String.join("\n",
            "path,arm,batch,plate,well,site,cycle,channels,n_frames",
            "a.tiff,barcoding,B1,P1,A1,1,1,\"A,C,G,T\",3"
        );

        var ex = assertThrows(ConfigurationException.class, () -> reader.readCsv(new StringReader(csv), dir));

        assertEquals(ErrorCode.INVALID_CONFIGURATION, ex.code());
        assertTrue(ex.getMessage().contains("'n_frames' is 3 but 4 channel(s)"), ex.getMessage());
    }

    @Test
    void malformedValuesAreConfigurationErrors() {
        var csv = String.join("\n",
            "path,arm,batch,plate,well,site,channels,n_frames",
            "a.tiff,sequencing,B1,P1,A1,1,DNA,1",
            "b.tiff,painting,B1,P1,A1,one,DNA,1"
        );

        var ex = assertThrows(ConfigurationException.class, () -> reader.readCsv(new StringReader(csv), dir));

        assertEquals(ErrorCode.INVALID_CONFIGURATION, ex.code());
        assertTrue(ex.getMessage().contains("'site' must be an integer"), ex.getMessage());
    }

    @Test
    void missingTableIsInvalidConfiguration() {
        var ex = assertThrows(ConfigurationException.class, () -> reader.read(dir.resolve("absent.csv")));
        assertEquals(ErrorCode.INVALID_CONFIGURATION, ex.code());
    }

    @Test
    void headerOnlyTableIsEmpty() throws Exception {
        var table = Files.writeString(dir.resolve("empty.csv"), "path,arm\n");
        assertTrue(reader.read(table).isEmpty());
    }
}

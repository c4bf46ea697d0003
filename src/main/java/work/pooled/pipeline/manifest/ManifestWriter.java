package work.pooled.pipeline.manifest;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * Renders manifests as CSV with a header row and {@code \n} record separators.
 */
public final class ManifestWriter {
    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setRecordSeparator("\n")
        .build();

    private ManifestWriter() {}

    public static String toCsv(Manifest manifest) {
        return toCsv(manifest.columns(), manifest.rows());
    }

    public static String toCsv(List<String> columns, List<List<String>> rows) {
        var out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, FORMAT)) {
            printer.printRecord(columns);
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("csv write error: " + ex.getMessage(), ex);
        }
        return out.toString();
    }
}

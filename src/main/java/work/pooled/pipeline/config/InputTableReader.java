package work.pooled.pipeline.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.pooled.pipeline.error.ConfigurationException;
import work.pooled.pipeline.error.ErrorCode;
import work.pooled.pipeline.model.Arm;
import work.pooled.pipeline.model.Field;
import work.pooled.pipeline.model.ImageRecord;
import work.pooled.pipeline.model.RecordSchema;

/**
 * Reads the sample sheet: one row per source file, as CSV with a header or as a JSON array of
 * objects. Every row is validated against its arm's schema; all row problems are reported together.
 */
public final class InputTableReader {
    private static final Logger logger = LoggerFactory.getLogger(InputTableReader.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final CSVFormat CSV = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .setTrim(true)
        .build();

    public List<ImageRecord> read(Path table) {
        if (!Files.isRegularFile(table)) {
            throw ConfigurationException.invalid("Input table not found: " + table);
        }
        var baseDirectory = table.toAbsolutePath().getParent();
        List<Map<String, String>> rows;
        try {
            rows = table.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
                ? readJson(table)
                : readCsv(table);
        } catch (IOException ex) {
            throw new ConfigurationException(
                ErrorCode.INVALID_CONFIGURATION,
                "Unable to read input table " + table + ": " + ex.getMessage(),
                ex
            );
        }
        var records = toRecords(rows, baseDirectory);
        if (records.isEmpty()) {
            logger.warn("Input table {} has no rows", table);
        } else {
            logger.info("Read {} record(s) from {}", records.size(), table);
        }
        return records;
    }

    public List<ImageRecord> readCsv(Reader reader, Path baseDirectory) throws IOException {
        return toRecords(parseCsv(reader), baseDirectory);
    }

    private static List<Map<String, String>> readCsv(Path table) throws IOException {
        try (Reader reader = Files.newBufferedReader(table, StandardCharsets.UTF_8)) {
            return parseCsv(reader);
        }
    }

    private static List<Map<String, String>> parseCsv(Reader reader) throws IOException {
        var rows = new ArrayList<Map<String, String>>();
        try (CSVParser parser = new CSVParser(reader, CSV)) {
            for (CSVRecord record : parser) {
                var row = new LinkedHashMap<String, String>();
                record.toMap().forEach((column, value) -> row.put(normalizeColumn(column), value));
                rows.add(row);
            }
        }
        return rows;
    }

    private static List<Map<String, String>> readJson(Path table) throws IOException {
        var root = JSON.readTree(table.toFile());
        if (root == null || !root.isArray()) {
            throw ConfigurationException.invalid("JSON input table " + table + " must be an array of objects");
        }
        var rows = new ArrayList<Map<String, String>>();
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw ConfigurationException.invalid("JSON input table " + table + " contains a non-object row");
            }
            var row = new LinkedHashMap<String, String>();
            node.fields().forEachRemaining(entry -> row.put(normalizeColumn(entry.getKey()), text(entry.getValue())));
            rows.add(row);
        }
        return rows;
    }

    private static String text(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isArray()) {
            var parts = new ArrayList<String>();
            value.forEach(item -> parts.add(item.asText()));
            return String.join(",", parts);
        }
        return value.asText();
    }

    private static List<ImageRecord> toRecords(List<Map<String, String>> rows, Path baseDirectory) {
        var records = new ArrayList<ImageRecord>(rows.size());
        var problems = new ArrayList<ConfigurationException>();
        for (int i = 0; i < rows.size(); i++) {
            try {
                records.add(toRecord(rows.get(i), baseDirectory));
            } catch (ConfigurationException ex) {
                problems.add(new ConfigurationException(ex.code(), "row " + (i + 1) + ": " + ex.getMessage()));
            }
        }
        if (!problems.isEmpty()) {
            var code = problems.stream().allMatch(p -> p.code() == ErrorCode.MISSING_REQUIRED_FIELD)
                ? ErrorCode.MISSING_REQUIRED_FIELD
                : ErrorCode.INVALID_CONFIGURATION;
            var message = problems.stream().map(Throwable::getMessage).collect(Collectors.joining("; "));
            throw new ConfigurationException(code, "Invalid input table: " + message);
        }
        return records;
    }

    static ImageRecord toRecord(Map<String, String> row, Path baseDirectory) {
        var rawPath = value(row, Field.PATH);
        if (rawPath == null) {
            throw new ConfigurationException(ErrorCode.MISSING_REQUIRED_FIELD, "missing required field(s): path");
        }
        var rawArm = value(row, Field.ARM);
        if (rawArm == null) {
            throw new ConfigurationException(ErrorCode.MISSING_REQUIRED_FIELD, "missing required field(s): arm");
        }
        var arm = Arm.from(rawArm);
        var path = Path.of(rawPath);
        if (!path.isAbsolute() && baseDirectory != null) {
            path = baseDirectory.resolve(path).normalize();
        }
        var channels = value(row, Field.CHANNELS);
        var record = ImageRecord.builder(path)
            .arm(arm)
            .batch(value(row, Field.BATCH))
            .plate(value(row, Field.PLATE))
            .well(value(row, Field.WELL))
            .site(integer(row, Field.SITE))
            .cycle(integer(row, Field.CYCLE))
            .channels(channels == null ? List.of() : splitChannels(channels))
            .channel(value(row, Field.CHANNEL))
            .frameCount(integer(row, Field.FRAME_COUNT))
            .build(RecordSchema.forArm(arm));
        checkFrames(record);
        return record;
    }

    /** Frame indices follow channel order, so every listed channel needs a frame. */
    private static void checkFrames(ImageRecord record) {
        int frames = record.frameCount().orElseThrow();
        if (frames < record.channels().size()) {
            throw ConfigurationException.invalid(
                "'" + Field.FRAME_COUNT.key() + "' is " + frames + " but " + record.channels().size()
                    + " channel(s) are listed for " + record.file()
            );
        }
    }

    private static List<String> splitChannels(String raw) {
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(channel -> !channel.isEmpty())
            .collect(Collectors.toList());
    }

    private static String value(Map<String, String> row, Field field) {
        var value = row.get(field.key());
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Integer integer(Map<String, String> row, Field field) {
        var value = value(row, field);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException ex) {
            throw ConfigurationException.invalid("'" + field.key() + "' must be an integer, got '" + value + "'");
        }
    }

    private static String normalizeColumn(String column) {
        return column == null ? "" : column.trim().toLowerCase(Locale.ROOT);
    }
}

package work.pooled.pipeline.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import work.pooled.pipeline.error.TaskInvocationException;
import work.pooled.pipeline.manifest.FilenamePattern;
import work.pooled.pipeline.model.Field;
import work.pooled.pipeline.plan.PipelineStage;
import work.pooled.pipeline.task.TaskInvoker;
import work.pooled.pipeline.task.TaskOutputs;
import work.pooled.pipeline.task.TaskRequest;
import work.pooled.pipeline.task.TaskResult;

/**
 * Stands in for the image analysis tools: reads the manifest or file list it is handed and writes
 * empty output files named the way the real tools name them.
 */
public final class ScriptedTaskInvoker implements TaskInvoker {
    private static final Pattern CHANNEL_COLUMN = Pattern.compile("(?:Original|Corrected)_(?:Cycle(\\d+)_)?(.+)");
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private volatile Predicate<TaskRequest> failWhen = request -> false;

    /** Makes every invocation matching {@code condition} exit with status 1. */
    public ScriptedTaskInvoker failWhen(Predicate<TaskRequest> condition) {
        this.failWhen = condition;
        return this;
    }

    public int calls(PipelineStage stage) {
        var count = calls.get(stage.id());
        return count == null ? 0 : count.get();
    }

    public int totalCalls() {
        return calls.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    @Override
    public TaskResult invoke(TaskRequest request) {
        calls.computeIfAbsent(request.stageId(), id -> new AtomicInteger()).incrementAndGet();
        if (failWhen.test(request)) {
            throw new TaskInvocationException("scripted failure", request.key(), 1);
        }
        var stage = PipelineStage.fromId(request.stageId());
        var names = switch (stage) {
            case PAINTING_CORRECTION_CALC, BARCODING_CORRECTION_CALC -> correctionFunctions(request);
            case PAINTING_CORRECTION_APPLY, BARCODING_CORRECTION_APPLY, BARCODING_PREPROCESS -> correctedImages(request);
            case PAINTING_SEGMENTATION_CHECK -> Set.of(request.key().label() + ".png", "Image.csv");
            case PAINTING_STITCH_CROP, BARCODING_STITCH_CROP -> stagedImages(request);
            case COMBINED_ANALYSIS -> Set.of(request.key().label() + "_Cells.csv");
        };
        try {
            Files.createDirectories(request.outputDirectory());
            for (String name : names) {
                Files.writeString(request.outputDirectory().resolve(name), name, StandardCharsets.UTF_8);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return TaskResult.completed(
            0,
            TaskOutputs.collect(request.outputDirectory(), request.outputGlob()),
            TaskOutputs.statistics(request.outputDirectory())
        );
    }

    private static Set<String> correctionFunctions(TaskRequest request) {
        var plate = request.key().get(Field.PLATE).orElseThrow();
        var names = new LinkedHashSet<String>();
        for (CSVRecord row : manifestRows(request)) {
            var cycle = row.isMapped("Cycle") && !row.get("Cycle").isEmpty() ? Integer.valueOf(row.get("Cycle")) : null;
            for (String column : row.getParser().getHeaderNames()) {
                var m = CHANNEL_COLUMN.matcher(column);
                if (m.matches() && !row.get(column).isEmpty()) {
                    names.add(cycle == null ? FilenamePattern.illum(plate, m.group(2)) : FilenamePattern.illumCycle(plate, cycle, m.group(2)));
                }
            }
        }
        return names;
    }

    private static Set<String> correctedImages(TaskRequest request) {
        var names = new LinkedHashSet<String>();
        for (CSVRecord row : manifestRows(request)) {
            var plate = row.get("Plate");
            var well = row.get("Well");
            int site = Integer.parseInt(row.get("Site"));
            for (String column : row.getParser().getHeaderNames()) {
                var m = CHANNEL_COLUMN.matcher(column);
                if (!m.matches() || row.get(column).isEmpty()) {
                    continue;
                }
                names.add(m.group(1) == null
                    ? FilenamePattern.corrected(plate, well, site, m.group(2))
                    : FilenamePattern.cycle(plate, well, site, Integer.parseInt(m.group(1)), m.group(2)));
            }
        }
        return names;
    }

    private static Set<String> stagedImages(TaskRequest request) {
        try {
            JsonNode files = JSON.readTree(request.fileList().toFile());
            var names = new LinkedHashSet<String>();
            files.get("images").forEach(node -> names.add(node.asText()));
            return names;
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private static List<CSVRecord> manifestRows(TaskRequest request) {
        var manifest = request.manifest().orElseThrow();
        var format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
        try (Reader reader = Files.newBufferedReader(manifest, StandardCharsets.UTF_8)) {
            return new ArrayList<>(format.parse(reader).getRecords());
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}

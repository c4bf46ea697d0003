package work.pooled.pipeline.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import work.pooled.pipeline.plan.PipelineReport;

/**
 * Outcome of a {@link PipelineRunner} execution, printed as JSON by the CLI.
 */
public record RunResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectWriter WRITER = MAPPER.writerWithDefaultPrettyPrinter();

    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Success or planned when nothing failed, partial when some tasks completed, failure otherwise. */
    public static RunResult fromReport(PipelineReport report, boolean planOnly, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(report.toMap());
        Status status;
        if (report.failureCount() == 0) {
            status = planOnly ? Status.PLANNED : Status.SUCCESS;
        } else {
            status = report.completedCount() > 0 ? Status.PARTIAL : Status.FAILURE;
        }
        return new RunResult(status, merged, startedAt, Instant.now());
    }

    /** A run that aborted before or while planning; {@code error} is an {@code ErrorReports} map. */
    public static RunResult failure(Map<String, Object> error, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putIfAbsent("error", error);
        return new RunResult(Status.FAILURE, merged, startedAt, Instant.now());
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public Map<String, Object> toSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("status", status.label());
        summary.put("exitCode", status.exitCode());
        summary.put("startedAt", startedAt.toString());
        summary.put("finishedAt", finishedAt.toString());
        summary.put("elapsedMillis", elapsed().toMillis());
        summary.put("metadata", metadata);
        return summary;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSummary());
        } catch (JsonProcessingException ex) {
            Map<String, Object> fallback = new LinkedHashMap<>();
            fallback.put("status", status.label());
            fallback.put("exitCode", status.exitCode());
            fallback.put("summaryError", ex.getOriginalMessage());
            try {
                return MAPPER.writeValueAsString(fallback);
            } catch (JsonProcessingException nested) {
                throw new IllegalStateException("Unable to serialize run summary", nested);
            }
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1),
        PARTIAL(2),
        PLANNED(0);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}

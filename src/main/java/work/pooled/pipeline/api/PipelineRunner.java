package work.pooled.pipeline.api;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.pooled.pipeline.config.InputTableReader;
import work.pooled.pipeline.error.ErrorReports;
import work.pooled.pipeline.error.PipelineException;
import work.pooled.pipeline.manifest.FileSystemManifestSink;
import work.pooled.pipeline.plan.PipelineExecutor;
import work.pooled.pipeline.task.ProcessTaskInvoker;
import work.pooled.pipeline.task.TaskInvokerRegistry;

/**
 * Public entry point: reads the input table, runs the stage graph and summarizes the outcome.
 */
public final class PipelineRunner {
    private static final Logger logger = LoggerFactory.getLogger(PipelineRunner.class);

    private final TaskInvokerRegistry invokers;
    private final InputTableReader reader;

    public PipelineRunner() {
        this(new TaskInvokerRegistry(new ProcessTaskInvoker()));
    }

    public PipelineRunner(TaskInvokerRegistry invokers) {
        this(invokers, new InputTableReader());
    }

    public PipelineRunner(TaskInvokerRegistry invokers, InputTableReader reader) {
        this.invokers = invokers;
        this.reader = reader;
    }

    public RunResult run(PipelineRunConfiguration configuration) {
        var startedAt = Instant.now();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("input", configuration.input().toString());
        metadata.put("outdir", configuration.outputDirectory().toString());
        try {
            var records = reader.read(configuration.input());
            metadata.put("records", records.size());
            var executor = new PipelineExecutor(new FileSystemManifestSink(configuration.outputDirectory()), invokers);
            var report = executor.execute(records, configuration.toSettings());
            var result = RunResult.fromReport(report, configuration.planOnly(), metadata, startedAt);
            logger.info("Run finished: {} ({} task(s) completed, {} failure(s))",
                result.status(), report.completedCount(), report.failureCount());
            return result;
        } catch (PipelineException | UncheckedIOException ex) {
            logger.error("Run aborted: {}", ex.getMessage());
            return RunResult.failure(ErrorReports.toMap(ex), metadata, startedAt);
        }
    }
}

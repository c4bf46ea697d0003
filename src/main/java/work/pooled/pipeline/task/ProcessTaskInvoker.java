package work.pooled.pipeline.task;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.pooled.pipeline.error.TaskInvocationException;

/**
 * Runs a stage's command template as an operating system process inside the task directory.
 *
 * <p>Placeholders: {@code {input}}, {@code {manifest}}, {@code {files}}, {@code {config}},
 * {@code {output}}, {@code {stage}} and {@code {key}}. Standard output and error go to
 * {@code task.log}. Outputs are the files under the output directory matching the stage glob;
 * statistics are the {@code *.csv} files there.
 */
public final class ProcessTaskInvoker implements TaskInvoker {
    public static final String LOG_FILE = "task.log";

    private static final Logger logger = LoggerFactory.getLogger(ProcessTaskInvoker.class);
    private static final int LOG_TAIL_LINES = 20;

    @Override
    public TaskResult invoke(TaskRequest request) {
        if (request.command().isEmpty()) {
            throw new TaskInvocationException("No command configured for stage " + request.stageId(), request.key(), (Integer) null);
        }
        var command = expand(request);
        var log = request.taskDirectory().resolve(LOG_FILE);
        try {
            Files.createDirectories(request.outputDirectory());
            var builder = new ProcessBuilder(command)
                .directory(request.taskDirectory().toFile())
                .redirectErrorStream(true)
                .redirectOutput(log.toFile());
            logger.info("→ Running {} for [{}]: {}", request.stageId(), request.key(), command);
            var process = builder.start();
            if (request.timeout().isPresent()) {
                var timeout = request.timeout().get();
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    throw new TaskInvocationException(
                        "Stage " + request.stageId() + " timed out after " + timeout,
                        request.key(),
                        (Integer) null
                    );
                }
            } else {
                process.waitFor();
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new TaskInvocationException(
                    "Stage " + request.stageId() + " failed (exit " + exitCode + "):\n" + tail(log),
                    request.key(),
                    exitCode
                );
            }
            var outputs = TaskOutputs.collect(request.outputDirectory(), request.outputGlob());
            var statistics = TaskOutputs.statistics(request.outputDirectory());
            return TaskResult.completed(exitCode, outputs, statistics).requireSuccess(request);
        } catch (IOException ex) {
            throw new TaskInvocationException("Unable to run " + command + ": " + ex.getMessage(), request.key(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TaskInvocationException("Interrupted while running stage " + request.stageId(), request.key(), ex);
        }
    }

    static List<String> expand(TaskRequest request) {
        var values = Map.of(
            "{input}", request.inputDirectory().toString(),
            "{manifest}", request.manifest().map(Path::toString).orElse(""),
            "{files}", request.fileList().toString(),
            "{config}", request.configArtifact().map(Path::toString).orElse(""),
            "{output}", request.outputDirectory().toString(),
            "{stage}", request.stageId(),
            "{key}", request.key().label()
        );
        var expanded = new ArrayList<String>(request.command().size());
        for (String argument : request.command()) {
            var value = argument;
            for (Map.Entry<String, String> placeholder : values.entrySet()) {
                value = value.replace(placeholder.getKey(), placeholder.getValue());
            }
            expanded.add(value);
        }
        return expanded;
    }

    private static String tail(Path log) {
        try {
            var lines = Files.readAllLines(log, StandardCharsets.UTF_8);
            return String.join("\n", lines.subList(Math.max(0, lines.size() - LOG_TAIL_LINES), lines.size())).trim();
        } catch (IOException ex) {
            return "(no log: " + ex.getMessage() + ")";
        }
    }
}

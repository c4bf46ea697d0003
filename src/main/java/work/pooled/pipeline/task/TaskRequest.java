package work.pooled.pipeline.task;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.pooled.pipeline.model.GroupKey;

/**
 * Everything one external tool invocation receives for one group.
 *
 * @param manifest absent for stages that only receive staged files
 * @param command  command template; see {@link ProcessTaskInvoker} for placeholders
 */
public record TaskRequest(
    String stageId,
    GroupKey key,
    Path taskDirectory,
    Path inputDirectory,
    Optional<Path> manifest,
    Path fileList,
    Optional<Path> configArtifact,
    Path outputDirectory,
    String outputGlob,
    List<String> command,
    Optional<Duration> timeout
) {
    public TaskRequest {
        Objects.requireNonNull(stageId, "stageId");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(taskDirectory, "taskDirectory");
        Objects.requireNonNull(inputDirectory, "inputDirectory");
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(fileList, "fileList");
        Objects.requireNonNull(configArtifact, "configArtifact");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(outputGlob, "outputGlob");
        command = command == null ? List.of() : List.copyOf(command);
        Objects.requireNonNull(timeout, "timeout");
    }
}

package work.pooled.pipeline.plan;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.pooled.pipeline.join.JoinedGroup;
import work.pooled.pipeline.manifest.Manifest;
import work.pooled.pipeline.manifest.StagingPlan;
import work.pooled.pipeline.model.GroupKey;
import work.pooled.pipeline.shared.Digests;
import work.pooled.pipeline.task.TaskSettings;

/**
 * One task invocation, fully described before anything runs.
 */
public record PlannedTask(PipelineStage stage, JoinedGroup group, Optional<Manifest> manifest, StagingPlan staging) {
    public PlannedTask {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(staging, "staging");
    }

    public GroupKey key() {
        return group.key();
    }

    /**
     * Digest of everything the task would read: manifest text, staged sources, the command template and
     * the configuration artifact, by path and content.
     */
    public String digest(TaskSettings settings) {
        var text = new StringBuilder(stage.id()).append('\n');
        manifest.ifPresent(m -> text.append(m.digest()));
        text.append('\n');
        staging.placements().forEach((target, source) ->
            text.append(target).append('=').append(source.toAbsolutePath().normalize()).append('\n'));
        text.append("command=").append(String.join("\u0000", settings.command())).append('\n');
        settings.config().ifPresent(config -> text.append("config=")
            .append(config.toAbsolutePath().normalize())
            .append('@')
            .append(contentDigest(config))
            .append('\n'));
        return Digests.sha256Hex(text.toString());
    }

    private static String contentDigest(Path file) {
        if (!Files.isRegularFile(file)) {
            return "absent";
        }
        try {
            return Digests.sha256Hex(Files.readAllBytes(file));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read task configuration " + file, ex);
        }
    }
}

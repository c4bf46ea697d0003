package work.pooled.pipeline.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.pooled.pipeline.model.GroupKey;

/**
 * Lays tasks out as {@code <outdir>/<stage>/<key label>/} holding {@code manifest.csv} and
 * {@code files.json}; combined manifests go to {@code <outdir>/<stage>/}.
 */
public final class FileSystemManifestSink implements ManifestSink {
    public static final String MANIFEST_FILE = "manifest.csv";
    public static final String FILE_LIST_FILE = "files.json";

    private static final Logger logger = LoggerFactory.getLogger(FileSystemManifestSink.class);
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private final Path outputDirectory;

    public FileSystemManifestSink(Path outputDirectory) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").toAbsolutePath().normalize();
    }

    @Override
    public Path taskDirectory(String stageId, GroupKey key) {
        return outputDirectory.resolve(stageId).resolve(key.label());
    }

    @Override
    public Path writeManifest(String stageId, Manifest manifest) {
        return write(taskDirectory(stageId, manifest.key()).resolve(MANIFEST_FILE), manifest.toCsv());
    }

    @Override
    public Path writeFileList(String stageId, GroupKey key, StagingPlan staging) {
        try {
            var json = JSON_WRITER.writeValueAsString(staging.fileList()) + "\n";
            return write(taskDirectory(stageId, key).resolve(FILE_LIST_FILE), json);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize file list for " + key, ex);
        }
    }

    @Override
    public Path writeCombined(String stageId, CombinedManifest combined) {
        return write(outputDirectory.resolve(stageId).resolve(combined.fileName()), combined.toCsv());
    }

    private static Path write(Path target, String content) {
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
            logger.debug("Wrote {}", target);
            return target;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write " + target, ex);
        }
    }
}

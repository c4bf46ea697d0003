package work.pooled.pipeline.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remembers, per task directory, the digest of the inputs a task ran with and what it produced.
 *
 * <p>A lookup hits only when the digest is unchanged and every recorded output still exists.
 */
public final class TaskCache {
    public static final String CACHE_FILE = ".task-cache.json";

    private static final Logger logger = LoggerFactory.getLogger(TaskCache.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    public Optional<TaskResult> lookup(Path taskDirectory, String digest) {
        var file = taskDirectory.resolve(CACHE_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        Entry entry;
        try {
            entry = JSON.readValue(file.toFile(), Entry.class);
        } catch (IOException ex) {
            logger.warn("Ignoring unreadable task cache {}: {}", file, ex.getMessage());
            return Optional.empty();
        }
        if (!digest.equals(entry.digest())) {
            logger.debug("Task cache {} is stale", file);
            return Optional.empty();
        }
        var outputs = resolve(taskDirectory, entry.outputs());
        if (outputs.isEmpty() || !outputs.stream().allMatch(Files::exists)) {
            logger.debug("Task cache {} lists missing outputs", file);
            return Optional.empty();
        }
        var statistics = resolve(taskDirectory, entry.statistics());
        return Optional.of(TaskResult.completed(0, outputs, statistics).asCached());
    }

    public void store(Path taskDirectory, String digest, TaskResult result) {
        var entry = new Entry(
            digest,
            relativize(taskDirectory, result.outputs()),
            relativize(taskDirectory, result.statistics())
        );
        try {
            Files.createDirectories(taskDirectory);
            JSON.writerWithDefaultPrettyPrinter().writeValue(taskDirectory.resolve(CACHE_FILE).toFile(), entry);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write task cache in " + taskDirectory, ex);
        }
    }

    private static List<Path> resolve(Path base, List<String> paths) {
        return paths == null ? List.of() : paths.stream().map(base::resolve).collect(Collectors.toList());
    }

    private static List<String> relativize(Path base, List<Path> paths) {
        var absoluteBase = base.toAbsolutePath().normalize();
        return paths.stream()
            .map(path -> {
                var absolute = path.toAbsolutePath().normalize();
                return absolute.startsWith(absoluteBase) ? absoluteBase.relativize(absolute).toString() : absolute.toString();
            })
            .collect(Collectors.toList());
    }

    public record Entry(String digest, List<String> outputs, List<String> statistics) {}
}

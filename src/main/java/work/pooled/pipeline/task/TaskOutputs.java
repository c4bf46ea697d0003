package work.pooled.pipeline.task;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds declared outputs and statistics tables below a task's output directory.
 */
public final class TaskOutputs {
    static final String STATISTICS_GLOB = "*.csv";
    static final String MANIFEST_NAME = "manifest.csv";

    private TaskOutputs() {}

    /** Regular files whose name matches {@code glob}, sorted by path. */
    public static List<Path> collect(Path directory, String glob) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        var matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        try (Stream<Path> files = Files.walk(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(path.getFileName()))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to list " + directory, ex);
        }
    }

    public static List<Path> statistics(Path directory) {
        return collect(directory, STATISTICS_GLOB).stream()
            .filter(path -> !MANIFEST_NAME.equals(path.getFileName().toString()))
            .collect(Collectors.toList());
    }
}

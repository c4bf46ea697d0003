package work.pooled.pipeline.task;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Materializes a staging table by linking source files into a task's input directory. Copies
 * when the file system refuses symbolic links.
 */
public final class InputStager {
    private static final Logger logger = LoggerFactory.getLogger(InputStager.class);

    public void stage(Path inputDirectory, Map<String, Path> placements) {
        try {
            Files.createDirectories(inputDirectory);
            for (Map.Entry<String, Path> placement : placements.entrySet()) {
                var target = inputDirectory.resolve(placement.getKey());
                var source = placement.getValue().toAbsolutePath();
                Files.createDirectories(target.getParent());
                Files.deleteIfExists(target);
                try {
                    Files.createSymbolicLink(target, source);
                } catch (UnsupportedOperationException | IOException ex) {
                    logger.debug("Symbolic link refused for {} ({}), copying", target, ex.getMessage());
                    Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to stage inputs into " + inputDirectory, ex);
        }
    }
}

package work.pooled.pipeline.plan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.pooled.pipeline.manifest.FilenamePattern;
import work.pooled.pipeline.manifest.FilenamePattern.ParsedName;
import work.pooled.pipeline.model.Arm;
import work.pooled.pipeline.model.Field;
import work.pooled.pipeline.model.GroupKey;
import work.pooled.pipeline.model.ImageRecord;

/**
 * Turns a task's output files into records for the next stage.
 *
 * <p>Batch, plate and arm come from the producing group's key; well, site, cycle and channel are
 * read from the documented output file names. Files no pattern recognizes are not carried forward.
 */
public final class OutputRetagger {
    private static final Logger logger = LoggerFactory.getLogger(OutputRetagger.class);

    public List<ImageRecord> retag(GroupKey key, List<Path> outputs) {
        var records = new ArrayList<ImageRecord>(outputs.size());
        for (Path output : outputs) {
            var name = output.getFileName() == null ? output.toString() : output.getFileName().toString();
            var matches = FilenamePattern.matchAll(name);
            if (matches.size() != 1) {
                logger.debug("[{}] output {} not carried forward ({} pattern match(es))", key, name, matches.size());
                continue;
            }
            records.add(toRecord(key, output, matches.get(0)));
        }
        return records;
    }

    private static ImageRecord toRecord(GroupKey key, Path output, ParsedName parsed) {
        var builder = ImageRecord.builder(output)
            .batch(key.get(Field.BATCH).orElse(null))
            .plate(key.get(Field.PLATE).orElse(parsed.plate()))
            .arm(key.get(Field.ARM).map(Arm::from).orElse(null))
            .well(parsed.well() != null ? parsed.well() : key.get(Field.WELL).orElse(null))
            .site(parsed.site())
            .cycle(parsed.cycle());
        if (parsed.singleChannel().isPresent()) {
            builder.channel(parsed.singleChannel().get());
        } else {
            builder.channels(parsed.channels());
        }
        return builder.build();
    }
}

package work.pooled.pipeline.error;

import java.nio.file.Path;
import work.pooled.pipeline.model.Field;

/**
 * A record could not contribute to any group because a key field is absent.
 */
public final class GroupingException extends PipelineException {
    private final Path file;
    private final Field field;

    public GroupingException(Path file, Field field) {
        super(
            ErrorCode.MISSING_GROUPING_FIELD,
            "Record " + file + " is missing grouping field '" + field.key() + "'",
            null
        );
        this.file = file;
        this.field = field;
    }

    public Path file() {
        return file;
    }

    public Field field() {
        return field;
    }
}

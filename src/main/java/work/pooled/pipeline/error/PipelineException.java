package work.pooled.pipeline.error;

import java.util.Objects;
import java.util.Optional;
import work.pooled.pipeline.model.GroupKey;

/**
 * Base failure carrying an {@link ErrorCode} and, when known, the group whose lineage it aborts.
 */
public class PipelineException extends RuntimeException {
    private final ErrorCode code;
    private final GroupKey groupKey;

    public PipelineException(ErrorCode code, String message, GroupKey groupKey) {
        this(code, message, groupKey, null);
    }

    public PipelineException(ErrorCode code, String message, GroupKey groupKey, Throwable cause) {
        super(decorate(message, groupKey), cause);
        this.code = Objects.requireNonNull(code, "code");
        this.groupKey = groupKey;
    }

    public ErrorCode code() {
        return code;
    }

    public Optional<GroupKey> groupKey() {
        return Optional.ofNullable(groupKey);
    }

    private static String decorate(String message, GroupKey groupKey) {
        if (groupKey == null) {
            return message;
        }
        return "[" + groupKey + "] " + message;
    }
}

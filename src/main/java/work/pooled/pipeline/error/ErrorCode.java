package work.pooled.pipeline.error;

import java.util.Locale;

/**
 * Stable identifiers for pipeline failures, surfaced in logs and in the run summary.
 */
public enum ErrorCode {
    MISSING_REQUIRED_FIELD(true),
    INVALID_CONFIGURATION(true),
    MISSING_GROUPING_FIELD(true),
    MISSING_JOIN_TARGET(true),
    AMBIGUOUS_JOIN_TARGET(true),
    AMBIGUOUS_FILENAME_PATTERN(true),
    DUPLICATE_CHANNEL_DATA(true),
    MISSING_CHANNEL_DATA(false),
    TASK_INVOCATION_FAILED(true);

    private final boolean fatal;

    ErrorCode(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean fatal() {
        return fatal;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}

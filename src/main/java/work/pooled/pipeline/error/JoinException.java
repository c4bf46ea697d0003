package work.pooled.pipeline.error;

import work.pooled.pipeline.model.GroupKey;

/**
 * A fine group found zero or several coarse groups for its projected key.
 */
public final class JoinException extends PipelineException {
    private final GroupKey projectedKey;

    private JoinException(ErrorCode code, String message, GroupKey fineKey, GroupKey projectedKey) {
        super(code, message, fineKey);
        this.projectedKey = projectedKey;
    }

    public static JoinException missingTarget(GroupKey fineKey, GroupKey projectedKey) {
        return new JoinException(
            ErrorCode.MISSING_JOIN_TARGET,
            "No upstream group matches " + projectedKey,
            fineKey,
            projectedKey
        );
    }

    public static JoinException ambiguousTarget(GroupKey fineKey, GroupKey projectedKey, int matches) {
        return new JoinException(
            ErrorCode.AMBIGUOUS_JOIN_TARGET,
            matches + " upstream groups match " + projectedKey,
            fineKey,
            projectedKey
        );
    }

    public GroupKey projectedKey() {
        return projectedKey;
    }
}

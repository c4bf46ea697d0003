package work.pooled.pipeline.error;

import work.pooled.pipeline.model.GroupKey;

public final class ManifestException extends PipelineException {
    public ManifestException(ErrorCode code, String message, GroupKey groupKey) {
        super(code, message, groupKey);
    }

    public static ManifestException ambiguousFilename(String message, GroupKey groupKey) {
        return new ManifestException(ErrorCode.AMBIGUOUS_FILENAME_PATTERN, message, groupKey);
    }

    public ManifestException withGroupKey(GroupKey groupKey) {
        if (groupKey().isPresent() || groupKey == null) {
            return this;
        }
        var rebased = new ManifestException(code(), getMessage(), groupKey);
        rebased.setStackTrace(getStackTrace());
        return rebased;
    }
}

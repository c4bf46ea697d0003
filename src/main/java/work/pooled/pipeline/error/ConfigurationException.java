package work.pooled.pipeline.error;

import work.pooled.pipeline.model.GroupKey;

/**
 * Raised when the input table or run configuration lacks something the pipeline needs.
 */
public final class ConfigurationException extends PipelineException {
    public ConfigurationException(ErrorCode code, String message) {
        super(code, message, null);
    }

    public ConfigurationException(ErrorCode code, String message, GroupKey groupKey) {
        super(code, message, groupKey);
    }

    public ConfigurationException(ErrorCode code, String message, Throwable cause) {
        super(code, message, null, cause);
    }

    public static ConfigurationException invalid(String message) {
        return new ConfigurationException(ErrorCode.INVALID_CONFIGURATION, message);
    }
}

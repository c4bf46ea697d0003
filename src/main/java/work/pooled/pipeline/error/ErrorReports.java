package work.pooled.pipeline.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalizes failures into the {@code code/message/groupKey} maps used by run summaries.
 */
public final class ErrorReports {
    private ErrorReports() {}

    public static Map<String, Object> toMap(Throwable error) {
        if (error instanceof PipelineException pe) {
            var map = toMap(pe.code().id(), pe.getMessage());
            pe.groupKey().ifPresent(key -> map.put("groupKey", key.asMap()));
            return map;
        }
        if (error == null) {
            return toMap("unexpected_error", "Unexpected error");
        }
        var message = error.getMessage() != null && !error.getMessage().isBlank()
            ? error.getMessage()
            : error.getClass().getSimpleName();
        return toMap("unexpected_error", message);
    }

    private static Map<String, Object> toMap(String code, String message) {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code);
        map.put("message", message);
        return map;
    }
}

package work.pooled.pipeline.manifest;

import java.util.LinkedHashMap;
import java.util.Map;
import work.pooled.pipeline.error.ErrorCode;
import work.pooled.pipeline.model.GroupKey;

/**
 * Non-fatal manifest problem; the affected cell is left empty.
 */
public record ManifestWarning(ErrorCode code, GroupKey key, String column, String unit, String message) {
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code.id());
        map.put("groupKey", key.asMap());
        map.put("column", column);
        map.put("unit", unit);
        map.put("message", message);
        return map;
    }
}

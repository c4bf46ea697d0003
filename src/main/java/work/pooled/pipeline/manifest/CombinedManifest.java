package work.pooled.pipeline.manifest;

import java.util.List;
import work.pooled.pipeline.model.GroupKey;

/**
 * Several manifests of one stage concatenated under a coarser key.
 */
public record CombinedManifest(GroupKey key, String fileName, List<String> columns, List<List<String>> rows) {
    public CombinedManifest {
        columns = List.copyOf(columns);
        rows = rows.stream().map(List::copyOf).toList();
    }

    public String toCsv() {
        return ManifestWriter.toCsv(columns, rows);
    }
}

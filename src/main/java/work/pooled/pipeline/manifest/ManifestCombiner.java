package work.pooled.pipeline.manifest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import work.pooled.pipeline.model.Field;
import work.pooled.pipeline.model.GroupKey;

/**
 * Concatenates the manifests of one stage per coarser key: one header, the union of columns in
 * first-seen order, rows in key order. Cells a manifest lacks stay empty.
 */
public final class ManifestCombiner {
    private final String prefix;

    public ManifestCombiner(String prefix) {
        this.prefix = prefix;
    }

    public List<CombinedManifest> combine(List<Manifest> manifests, List<Field> byFields) {
        var buckets = new TreeMap<GroupKey, List<Manifest>>();
        for (Manifest manifest : manifests) {
            buckets.computeIfAbsent(manifest.key().project(byFields), k -> new ArrayList<>()).add(manifest);
        }
        var combined = new ArrayList<CombinedManifest>(buckets.size());
        buckets.forEach((key, members) -> {
            members.sort(Comparator.comparing(Manifest::key));
            var columns = new LinkedHashSet<String>();
            members.forEach(m -> columns.addAll(m.columns()));
            var header = List.copyOf(columns);
            var rows = new ArrayList<List<String>>();
            for (Manifest member : members) {
                var positions = new HashMap<String, Integer>();
                for (int i = 0; i < member.columns().size(); i++) {
                    positions.put(member.columns().get(i), i);
                }
                for (List<String> row : member.rows()) {
                    rows.add(align(header, positions, row));
                }
            }
            combined.add(new CombinedManifest(key, fileName(key), header, rows));
        });
        return combined;
    }

    String fileName(GroupKey key) {
        return prefix + "." + key.label() + "_combined_manifest.csv";
    }

    private static List<String> align(List<String> header, Map<String, Integer> positions, List<String> row) {
        var aligned = new ArrayList<String>(header.size());
        for (String column : header) {
            var index = positions.get(column);
            aligned.add(index == null ? "" : row.get(index));
        }
        return aligned;
    }
}

package work.pooled.pipeline.manifest;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.pooled.pipeline.model.GroupKey;
import work.pooled.pipeline.shared.Digests;

/**
 * Ordered columns and rows describing one group to one task invocation.
 */
public final class Manifest {
    private final StageType stageType;
    private final GroupKey key;
    private final List<String> columns;
    private final List<List<String>> rows;
    private final List<ManifestWarning> warnings;
    private final StagingPlan staging;

    public Manifest(
        StageType stageType,
        GroupKey key,
        List<String> columns,
        List<List<String>> rows,
        List<ManifestWarning> warnings,
        StagingPlan staging
    ) {
        this.stageType = Objects.requireNonNull(stageType, "stageType");
        this.key = Objects.requireNonNull(key, "key");
        this.columns = List.copyOf(columns);
        this.rows = rows.stream().map(List::copyOf).toList();
        this.warnings = List.copyOf(warnings);
        this.staging = Objects.requireNonNull(staging, "staging");
        for (List<String> row : this.rows) {
            if (row.size() != this.columns.size()) {
                throw new IllegalArgumentException("Row width " + row.size() + " != " + this.columns.size() + " columns");
            }
        }
    }

    public StageType stageType() {
        return stageType;
    }

    public GroupKey key() {
        return key;
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<String>> rows() {
        return rows;
    }

    public List<ManifestWarning> warnings() {
        return warnings;
    }

    public StagingPlan staging() {
        return staging;
    }

    public Optional<String> cell(int row, String column) {
        int index = columns.indexOf(column);
        if (index < 0 || row < 0 || row >= rows.size()) {
            return Optional.empty();
        }
        return Optional.of(rows.get(row).get(index));
    }

    public String toCsv() {
        return ManifestWriter.toCsv(this);
    }

    public String digest() {
        return Digests.sha256Hex(toCsv());
    }

    @Override
    public String toString() {
        return "Manifest{" + stageType + ", " + key + ", rows=" + rows.size() + "}";
    }
}

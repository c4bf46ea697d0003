package work.pooled.pipeline.manifest;

import java.util.List;
import java.util.Locale;
import work.pooled.pipeline.error.ConfigurationException;

/**
 * Closed set of manifest schemas. Each type fixes its column roles and row granularity.
 */
public enum StageType {
    CORRECTION_CALC("illumcalc", List.of(ColumnRole.ORIGINAL, ColumnRole.FRAME), false, true),
    CORRECTION_APPLY("illumapply", List.of(ColumnRole.ORIGINAL, ColumnRole.FRAME, ColumnRole.ILLUM), true, false),
    SEGMENTATION_CHECK("segcheck", List.of(ColumnRole.CORRECTED), false, false),
    BARCODE_PREPROCESS("preprocess", List.of(ColumnRole.CORRECTED), true, false),
    COMBINED_ANALYSIS("combined", List.of(ColumnRole.CORRECTED), true, false);

    private final String keyword;
    private final List<ColumnRole> roles;
    private final boolean cyclesInColumns;
    private final boolean cyclesInRows;

    StageType(String keyword, List<ColumnRole> roles, boolean cyclesInColumns, boolean cyclesInRows) {
        this.keyword = keyword;
        this.roles = roles;
        this.cyclesInColumns = cyclesInColumns;
        this.cyclesInRows = cyclesInRows;
    }

    public String keyword() {
        return keyword;
    }

    public List<ColumnRole> roles() {
        return roles;
    }

    /** Channel columns are cross-producted with the group's cycles. */
    public boolean cycleAware() {
        return cyclesInColumns;
    }

    /** Rows are (well, site, cycle) and a {@code Cycle} base column is added when the group has cycles. */
    public boolean cycleInRows() {
        return cyclesInRows;
    }

    public boolean attachesCoarse() {
        return roles.contains(ColumnRole.ILLUM);
    }

    public boolean supportsSubdirectories() {
        return this == CORRECTION_APPLY;
    }

    public boolean supportsSiteStride() {
        return this == SEGMENTATION_CHECK;
    }

    public static StageType fromKeyword(String value) {
        var normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (StageType type : values()) {
            if (type.keyword.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw ConfigurationException.invalid("Unknown stage type: " + value);
    }
}

package work.pooled.pipeline.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import work.pooled.pipeline.error.ConfigurationException;
import work.pooled.pipeline.shared.NaturalOrder;

/**
 * Tuple of named metadata values identifying a group. Equality is by field names and values.
 */
public final class GroupKey implements Comparable<GroupKey> {
    private final List<Field> fields;
    private final List<String> values;

    private GroupKey(List<Field> fields, List<String> values) {
        this.fields = List.copyOf(fields);
        this.values = List.copyOf(values);
    }

    public static GroupKey of(List<Field> fields, List<String> values) {
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(values, "values");
        if (fields.size() != values.size()) {
            throw new IllegalArgumentException("GroupKey needs one value per field: " + fields + " vs " + values);
        }
        if (fields.stream().distinct().count() != fields.size()) {
            throw new IllegalArgumentException("GroupKey fields must be distinct: " + fields);
        }
        return new GroupKey(fields, values);
    }

    public List<Field> fields() {
        return fields;
    }

    public List<String> values() {
        return values;
    }

    public Optional<String> get(Field field) {
        int index = fields.indexOf(field);
        return index < 0 ? Optional.empty() : Optional.of(values.get(index));
    }

    /**
     * Restricts this key to {@code coarseFields}, in their order. Every requested field must be present.
     */
    public GroupKey project(List<Field> coarseFields) {
        List<String> projected = new ArrayList<>(coarseFields.size());
        for (Field field : coarseFields) {
            int index = fields.indexOf(field);
            if (index < 0) {
                throw ConfigurationException.invalid(
                    "Cannot project " + this + " onto '" + field.key() + "': projection may only drop fields"
                );
            }
            projected.add(values.get(index));
        }
        return new GroupKey(coarseFields, projected);
    }

    /** Values joined with {@code -}, used in file and directory names. */
    public String label() {
        return values.stream()
            .map(value -> value.replaceAll("[^A-Za-z0-9._]+", "_"))
            .collect(Collectors.joining("-"));
    }

    public Map<String, String> asMap() {
        var map = new LinkedHashMap<String, String>();
        for (int i = 0; i < fields.size(); i++) {
            map.put(fields.get(i).key(), values.get(i));
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public int compareTo(GroupKey other) {
        int size = Math.min(values.size(), other.values.size());
        for (int i = 0; i < size; i++) {
            int cmp = fields.get(i).compareTo(other.fields.get(i));
            if (cmp != 0) {
                return cmp;
            }
            cmp = NaturalOrder.INSTANCE.compare(values.get(i), other.values.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(values.size(), other.values.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupKey other)) return false;
        return fields.equals(other.fields) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, values);
    }

    @Override
    public String toString() {
        var parts = new ArrayList<String>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            parts.add(fields.get(i).key() + "=" + values.get(i));
        }
        return String.join(", ", parts);
    }
}

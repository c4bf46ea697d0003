package work.pooled.pipeline.grouping;

import java.util.List;
import work.pooled.pipeline.error.GroupingException;

/**
 * Groups in key order plus the records that could not be keyed.
 */
public record GroupingResult(List<Group> groups, List<GroupingException> failures) {
    public GroupingResult {
        groups = List.copyOf(groups);
        failures = List.copyOf(failures);
    }

    public static GroupingResult empty() {
        return new GroupingResult(List.of(), List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /** Returns the groups, or throws the first failure. */
    public List<Group> orThrow() {
        if (hasFailures()) {
            throw failures.get(0);
        }
        return groups;
    }
}

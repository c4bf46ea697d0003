package work.pooled.pipeline.join;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.pooled.pipeline.error.JoinException;
import work.pooled.pipeline.grouping.Group;
import work.pooled.pipeline.model.GroupKey;

/**
 * Mandatory inner join with cardinality exactly one on the coarse side.
 *
 * <p>Every fine group yields either one {@link JoinedGroup} or one {@link JoinException}; a failure
 * never affects the other fine groups.
 */
public final class JoinEngine {
    private static final Logger logger = LoggerFactory.getLogger(JoinEngine.class);

    public JoinResult join(List<Group> fine, List<Group> coarse, KeyProjection projection) {
        Map<GroupKey, List<Group>> index = new HashMap<>();
        for (Group group : coarse) {
            index.computeIfAbsent(group.key(), k -> new ArrayList<>(1)).add(group);
        }
        var joined = new ArrayList<JoinedGroup>(fine.size());
        var failures = new ArrayList<JoinException>();
        for (Group group : fine) {
            try {
                joined.add(joinOne(group, index, projection));
            } catch (JoinException ex) {
                logger.warn("{}", ex.getMessage());
                failures.add(ex);
            }
        }
        return new JoinResult(joined, failures);
    }

    private JoinedGroup joinOne(Group group, Map<GroupKey, List<Group>> index, KeyProjection projection) {
        var projected = projection.apply(group.key());
        var matches = index.getOrDefault(projected, List.of());
        if (matches.isEmpty()) {
            throw JoinException.missingTarget(group.key(), projected);
        }
        if (matches.size() > 1) {
            throw JoinException.ambiguousTarget(group.key(), projected, matches.size());
        }
        return JoinedGroup.of(group, matches.get(0));
    }
}

package work.pooled.pipeline.join;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.pooled.pipeline.grouping.Group;
import work.pooled.pipeline.model.GroupKey;
import work.pooled.pipeline.model.ImageRecord;

/**
 * A fine group plus the unique coarse group its key projects onto. Stages without an upstream
 * join use {@link #standalone(Group)}.
 */
public record JoinedGroup(Group group, Optional<Group> coarse) {
    public JoinedGroup {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(coarse, "coarse");
    }

    public static JoinedGroup standalone(Group group) {
        return new JoinedGroup(group, Optional.empty());
    }

    public static JoinedGroup of(Group group, Group coarse) {
        return new JoinedGroup(group, Optional.of(coarse));
    }

    public GroupKey key() {
        return group.key();
    }

    /** Records of the coarse side, empty for standalone groups. */
    public List<ImageRecord> attached() {
        return coarse.map(Group::members).orElse(List.of());
    }
}

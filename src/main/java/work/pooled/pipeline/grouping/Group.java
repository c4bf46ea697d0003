package work.pooled.pipeline.grouping;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import work.pooled.pipeline.model.GroupKey;
import work.pooled.pipeline.model.ImageRecord;

/**
 * All records sharing one {@link GroupKey}, held in {@link CanonicalOrder}.
 */
public final class Group {
    private final GroupKey key;
    private final List<ImageRecord> members;

    public Group(GroupKey key, List<ImageRecord> members) {
        this.key = Objects.requireNonNull(key, "key");
        var sorted = new ArrayList<>(Objects.requireNonNull(members, "members"));
        sorted.sort(CanonicalOrder.MEMBERS);
        this.members = List.copyOf(sorted);
    }

    public GroupKey key() {
        return key;
    }

    public List<ImageRecord> members() {
        return members;
    }

    public int size() {
        return members.size();
    }

    /** Distinct cycles carried by members, ascending. */
    public List<Integer> cycles() {
        var cycles = new TreeSet<Integer>();
        for (ImageRecord member : members) {
            member.cycle().ifPresent(cycles::add);
        }
        return List.copyOf(cycles);
    }

    /** Distinct channels in first-seen member order; a derived single channel wins over the channel list. */
    public List<String> channels() {
        var channels = new LinkedHashSet<String>();
        for (ImageRecord member : members) {
            member.channel().ifPresentOrElse(channels::add, () -> channels.addAll(member.channels()));
        }
        return List.copyOf(channels);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Group other)) return false;
        return key.equals(other.key) && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, members);
    }

    @Override
    public String toString() {
        return "Group{" + key + ", members=" + members.size() + "}";
    }
}

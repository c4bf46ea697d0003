package work.pooled.pipeline.join;

import java.util.List;
import java.util.function.Function;
import work.pooled.pipeline.model.Field;
import work.pooled.pipeline.model.GroupKey;

/**
 * Drops the fine-key fields the coarse stage does not group by, e.g. {batch, plate, well} to {batch, plate}.
 */
public record KeyProjection(List<Field> coarseFields) implements Function<GroupKey, GroupKey> {
    public KeyProjection {
        if (coarseFields == null || coarseFields.isEmpty()) {
            throw new IllegalArgumentException("A projection needs at least one coarse field");
        }
        coarseFields = List.copyOf(coarseFields);
    }

    public static KeyProjection onto(Field... coarseFields) {
        return new KeyProjection(List.of(coarseFields));
    }

    @Override
    public GroupKey apply(GroupKey fineKey) {
        return fineKey.project(coarseFields);
    }
}

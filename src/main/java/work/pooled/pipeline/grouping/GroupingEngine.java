package work.pooled.pipeline.grouping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.pooled.pipeline.error.GroupingException;
import work.pooled.pipeline.model.Field;
import work.pooled.pipeline.model.GroupKey;
import work.pooled.pipeline.model.ImageRecord;

/**
 * Partitions a finite record set by a composite key.
 *
 * <p>Every input record ends up in exactly one group or in the failure list; nothing is dropped.
 */
public final class GroupingEngine {
    private static final Logger logger = LoggerFactory.getLogger(GroupingEngine.class);

    public GroupingResult partition(Collection<ImageRecord> records, List<Field> keyFields) {
        if (keyFields == null || keyFields.isEmpty()) {
            throw new IllegalArgumentException("At least one grouping field is required");
        }
        if (records == null || records.isEmpty()) {
            return GroupingResult.empty();
        }
        Map<GroupKey, List<ImageRecord>> buckets = new TreeMap<>();
        var failures = new ArrayList<GroupingException>();
        for (ImageRecord record : records) {
            try {
                buckets.computeIfAbsent(keyOf(record, keyFields), k -> new ArrayList<>()).add(record);
            } catch (GroupingException ex) {
                logger.error("{}", ex.getMessage());
                failures.add(ex);
            }
        }
        var groups = new ArrayList<Group>(buckets.size());
        buckets.forEach((key, members) -> groups.add(new Group(key, members)));
        logger.debug("Grouped {} record(s) by {} into {} group(s)", records.size(), keyFields, groups.size());
        return new GroupingResult(groups, failures);
    }

    public static GroupKey keyOf(ImageRecord record, List<Field> keyFields) {
        var values = new ArrayList<String>(keyFields.size());
        for (Field field : keyFields) {
            var value = record.value(field);
            if (value.isEmpty()) {
                throw new GroupingException(record.file(), field);
            }
            values.add(value.get());
        }
        return GroupKey.of(keyFields, values);
    }
}

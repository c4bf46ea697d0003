package work.pooled.pipeline.grouping;

import java.util.Comparator;
import work.pooled.pipeline.model.ImageRecord;
import work.pooled.pipeline.shared.NaturalOrder;

/**
 * Member order inside a group: well, site, cycle (absent first), channel, file name, full path.
 */
public final class CanonicalOrder {
    public static final Comparator<ImageRecord> MEMBERS = Comparator
        .comparing((ImageRecord r) -> r.well().orElse(""), NaturalOrder.INSTANCE)
        .thenComparing(r -> r.site().orElse(Integer.MIN_VALUE))
        .thenComparing(r -> r.cycle().orElse(Integer.MIN_VALUE))
        .thenComparing(CanonicalOrder::channelToken, NaturalOrder.INSTANCE)
        .thenComparing(ImageRecord::fileName)
        .thenComparing(r -> r.file().toString());

    private CanonicalOrder() {}

    private static String channelToken(ImageRecord record) {
        return record.channel().orElseGet(() -> String.join(",", record.channels()));
    }
}

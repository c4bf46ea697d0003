package work.pooled.pipeline.manifest;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.pooled.pipeline.model.ImageRecord;

/**
 * A record with its plate, well, site, cycle and per-channel frame offsets settled.
 * Fields the record and its file name both lack stay null.
 */
public record ResolvedImage(
    ImageRecord record,
    String plate,
    String well,
    Integer site,
    Integer cycle,
    List<ChannelFrame> frames
) {
    public ResolvedImage {
        Objects.requireNonNull(record, "record");
        frames = List.copyOf(frames);
    }

    public List<String> channels() {
        return frames.stream().map(ChannelFrame::channel).toList();
    }

    public Optional<ChannelFrame> frame(String channel) {
        return frames.stream().filter(f -> f.channel().equals(channel)).findFirst();
    }

    public String fileName() {
        return record.fileName();
    }

    /** A logical channel and its zero-based frame inside the physical file. */
    public record ChannelFrame(String channel, int frame) {}
}

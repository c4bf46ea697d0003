package work.pooled.pipeline.manifest;

/**
 * Role prefix of a channel column: {@code <Role>_<Channel>} or {@code <Role>_Cycle<NN>_<Channel>}.
 */
public enum ColumnRole {
    /** Raw acquisition file, possibly multiplexed. */
    ORIGINAL("Original"),
    /** Frame offset of the channel inside its original file. */
    FRAME("Frame"),
    /** Correction artifact attached from the coarse group. */
    ILLUM("Illum"),
    /** Single-channel derived image. */
    CORRECTED("Corrected");

    private final String prefix;

    ColumnRole(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public String column(Integer cycle, String channel) {
        if (cycle == null) {
            return prefix + "_" + channel;
        }
        return String.format("%s_Cycle%02d_%s", prefix, cycle, channel);
    }
}

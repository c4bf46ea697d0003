package work.pooled.pipeline.model;

/**
 * Named metadata fields of an {@link ImageRecord}. Keys match the input table headers.
 */
public enum Field {
    PATH("path"),
    ARM("arm"),
    BATCH("batch"),
    PLATE("plate"),
    WELL("well"),
    SITE("site"),
    CYCLE("cycle"),
    CHANNELS("channels"),
    CHANNEL("channel"),
    FRAME_COUNT("n_frames");

    private final String key;

    Field(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}

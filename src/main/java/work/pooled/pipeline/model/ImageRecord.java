package work.pooled.pipeline.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One file plus the experimental metadata it was ingested (or derived) with.
 *
 * <p>Instances are immutable. Stages that learn something new about a file, such as the single
 * channel of a corrected image, create a new record through the {@code with*} methods.
 */
public final class ImageRecord {
    private final Path file;
    private final Arm arm;
    private final String batch;
    private final String plate;
    private final String well;
    private final Integer site;
    private final Integer cycle;
    private final List<String> channels;
    private final String channel;
    private final Integer frameCount;

    private ImageRecord(Builder builder) {
        this.file = Objects.requireNonNull(builder.file, "file");
        this.arm = builder.arm;
        this.batch = blankToNull(builder.batch);
        this.plate = blankToNull(builder.plate);
        this.well = blankToNull(builder.well);
        this.site = builder.site;
        this.cycle = builder.cycle;
        this.channels = builder.channels == null ? List.of() : List.copyOf(builder.channels);
        this.channel = blankToNull(builder.channel);
        this.frameCount = builder.frameCount;
    }

    public static Builder builder(Path file) {
        return new Builder().file(file);
    }

    public Builder toBuilder() {
        return new Builder()
            .file(file)
            .arm(arm)
            .batch(batch)
            .plate(plate)
            .well(well)
            .site(site)
            .cycle(cycle)
            .channels(channels)
            .channel(channel)
            .frameCount(frameCount);
    }

    public Path file() {
        return file;
    }

    public String fileName() {
        var name = file.getFileName();
        return name == null ? file.toString() : name.toString();
    }

    public Optional<Arm> arm() {
        return Optional.ofNullable(arm);
    }

    public Optional<String> batch() {
        return Optional.ofNullable(batch);
    }

    public Optional<String> plate() {
        return Optional.ofNullable(plate);
    }

    public Optional<String> well() {
        return Optional.ofNullable(well);
    }

    public Optional<Integer> site() {
        return Optional.ofNullable(site);
    }

    public Optional<Integer> cycle() {
        return Optional.ofNullable(cycle);
    }

    /** Channels physically present in the file, in frame order. Empty when unknown. */
    public List<String> channels() {
        return channels;
    }

    /** The single logical channel of a file split out of a multi-channel acquisition. */
    public Optional<String> channel() {
        return Optional.ofNullable(channel);
    }

    public Optional<Integer> frameCount() {
        return Optional.ofNullable(frameCount);
    }

    public boolean has(Field field) {
        return value(field).isPresent();
    }

    /**
     * String form of a field, as used for grouping keys. Channel lists are joined with commas.
     */
    public Optional<String> value(Field field) {
        return switch (field) {
            case PATH -> Optional.of(file.toString());
            case ARM -> arm().map(Arm::key);
            case BATCH -> batch();
            case PLATE -> plate();
            case WELL -> well();
            case SITE -> site().map(String::valueOf);
            case CYCLE -> cycle().map(String::valueOf);
            case CHANNELS -> channels.isEmpty() ? Optional.empty() : Optional.of(String.join(",", channels));
            case CHANNEL -> channel();
            case FRAME_COUNT -> frameCount().map(String::valueOf);
        };
    }

    public ImageRecord withChannel(String channel) {
        return toBuilder().channel(channel).build();
    }

    public ImageRecord withWell(String well) {
        return toBuilder().well(well).build();
    }

    public ImageRecord withFile(Path file) {
        return toBuilder().file(file).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageRecord other)) return false;
        return file.equals(other.file)
            && arm == other.arm
            && Objects.equals(batch, other.batch)
            && Objects.equals(plate, other.plate)
            && Objects.equals(well, other.well)
            && Objects.equals(site, other.site)
            && Objects.equals(cycle, other.cycle)
            && channels.equals(other.channels)
            && Objects.equals(channel, other.channel)
            && Objects.equals(frameCount, other.frameCount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, arm, batch, plate, well, site, cycle, channels, channel, frameCount);
    }

    @Override
    public String toString() {
        var builder = new StringBuilder("ImageRecord{").append(fileName());
        for (Field field : Field.values()) {
            if (field == Field.PATH) continue;
            value(field).ifPresent(v -> builder.append(", ").append(field.key()).append('=').append(v));
        }
        return builder.append('}').toString();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static final class Builder {
        private Path file;
        private Arm arm;
        private String batch;
        private String plate;
        private String well;
        private Integer site;
        private Integer cycle;
        private List<String> channels;
        private String channel;
        private Integer frameCount;

        private Builder() {}

        public Builder file(Path file) {
            this.file = file;
            return this;
        }

        public Builder arm(Arm arm) {
            this.arm = arm;
            return this;
        }

        public Builder batch(String batch) {
            this.batch = batch;
            return this;
        }

        public Builder plate(String plate) {
            this.plate = plate;
            return this;
        }

        public Builder well(String well) {
            this.well = well;
            return this;
        }

        public Builder site(Integer site) {
            this.site = site;
            return this;
        }

        public Builder cycle(Integer cycle) {
            this.cycle = cycle;
            return this;
        }

        public Builder channels(List<String> channels) {
            this.channels = channels;
            return this;
        }

        public Builder channel(String channel) {
            this.channel = channel;
            return this;
        }

        public Builder frameCount(Integer frameCount) {
            this.frameCount = frameCount;
            return this;
        }

        public ImageRecord build() {
            return new ImageRecord(this);
        }

        /**
         * Builds the record and rejects it when a field {@code schema} requires is absent.
         */
        public ImageRecord build(RecordSchema schema) {
            var record = new ImageRecord(this);
            schema.validate(record);
            return record;
        }
    }
}

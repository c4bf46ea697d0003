package work.pooled.pipeline.manifest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.pooled.pipeline.error.ErrorCode;
import work.pooled.pipeline.error.ManifestException;
import work.pooled.pipeline.join.JoinedGroup;
import work.pooled.pipeline.model.Field;
import work.pooled.pipeline.model.GroupKey;
import work.pooled.pipeline.model.ImageRecord;
import work.pooled.pipeline.shared.NaturalOrder;

/**
 * Turns a joined group into the manifest of one task invocation.
 *
 * <p>Column order: {@code Plate, Well, Site} (plus {@code Cycle} when rows are per cycle), then one
 * column per role for every channel slot. Slots without a cycle come first in first-seen channel
 * order; cycle slots follow, cycles ascending. Rows follow well, site and cycle order. Output is a
 * pure function of the group's content.
 */
public final class ManifestGenerator {
    private static final Logger logger = LoggerFactory.getLogger(ManifestGenerator.class);

    private final FilenameResolver resolver;

    public ManifestGenerator() {
        this(new FilenameResolver());
    }

    public ManifestGenerator(FilenameResolver resolver) {
        this.resolver = resolver;
    }

    public Manifest generate(JoinedGroup joined, StageType type) {
        return generate(joined, type, ManifestOptions.DEFAULT);
    }

    public Manifest generate(JoinedGroup joined, StageType type, ManifestOptions options) {
        var key = joined.key();
        if (type.attachesCoarse() && joined.coarse().isEmpty()) {
            throw new ManifestException(
                ErrorCode.MISSING_JOIN_TARGET,
                type + " manifests need attached correction artifacts",
                key
            );
        }
        var staging = StagingPlan.of(joined, options.useSubdirs() && type.supportsSubdirectories());
        var images = subsample(resolveImages(joined.group().members(), key), type, options);
        var artifacts = type.attachesCoarse() ? resolveArtifacts(joined.attached(), key) : Map.<Slot, ImageRecord>of();

        boolean cycleRows = type.cycleInRows() && images.stream().anyMatch(image -> image.cycle() != null);
        var slots = slots(images, type);
        var units = units(images, cycleRows);

        var columns = new ArrayList<>(List.of("Plate", "Well", "Site"));
        if (cycleRows) {
            columns.add("Cycle");
        }
        for (Slot slot : slots) {
            for (ColumnRole role : type.roles()) {
                columns.add(role.column(slot.cycle(), slot.channel()));
            }
        }

        var warnings = new ArrayList<ManifestWarning>();
        var reportedArtifacts = new HashSet<Slot>();
        var rows = new ArrayList<List<String>>(units.size());
        units.forEach((unit, members) -> {
            var row = new ArrayList<String>(columns.size());
            row.add(plateOf(members, key));
            row.add(unit.well());
            row.add(String.valueOf(unit.site()));
            if (cycleRows) {
                row.add(unit.cycle() == null ? "" : String.valueOf(unit.cycle()));
            }
            for (Slot slot : slots) {
                var image = imageFor(members, slot, type, key);
                if (image.isEmpty()) {
                    warnings.add(warn(key, slot.column(type.roles().get(0)), unit, "no image for channel " + slot.label()));
                }
                for (ColumnRole role : type.roles()) {
                    switch (role) {
                        case ORIGINAL, CORRECTED -> row.add(image.map(img -> staging.cell(img.record())).orElse(""));
                        case FRAME -> row.add(image
                            .flatMap(img -> img.frame(slot.channel()))
                            .map(frame -> String.valueOf(frame.frame()))
                            .orElse(""));
                        case ILLUM -> {
                            var artifact = artifactFor(artifacts, slot, unit);
                            if (artifact.isEmpty() && reportedArtifacts.add(slot)) {
                                warnings.add(warn(key, slot.column(role), unit, "no correction artifact for channel " + slot.label()));
                            }
                            row.add(artifact.map(ImageRecord::fileName).orElse(""));
                        }
                    }
                }
            }
            rows.add(row);
        });

        for (ManifestWarning warning : warnings) {
            logger.warn("[{}] {} ({}, {})", key, warning.message(), warning.column(), warning.unit());
        }
        logger.debug("{} manifest for {}: {} row(s), {} column(s)", type, key, rows.size(), columns.size());
        return new Manifest(type, key, columns, rows, warnings, staging);
    }

    private List<ResolvedImage> resolveImages(List<ImageRecord> members, GroupKey key) {
        var images = new ArrayList<ResolvedImage>(members.size());
        for (ImageRecord member : members) {
            var image = resolver.resolve(member, key);
            if (image.well() == null) {
                throw missing(member, Field.WELL, key);
            }
            if (image.site() == null) {
                throw missing(member, Field.SITE, key);
            }
            images.add(image);
        }
        return images;
    }

    private Map<Slot, ImageRecord> resolveArtifacts(List<ImageRecord> attached, GroupKey key) {
        var artifacts = new LinkedHashMap<Slot, ImageRecord>();
        for (ImageRecord record : attached) {
            var artifact = resolver.resolve(record, key);
            for (String channel : artifact.channels()) {
                var slot = new Slot(artifact.cycle(), channel);
                var previous = artifacts.putIfAbsent(slot, record);
                if (previous != null && !previous.file().equals(record.file())) {
                    throw new ManifestException(
                        ErrorCode.DUPLICATE_CHANNEL_DATA,
                        "Correction artifacts " + previous.fileName() + " and " + record.fileName()
                            + " both cover channel " + slot.label(),
                        key
                    );
                }
            }
        }
        return artifacts;
    }

    private static List<ResolvedImage> subsample(List<ResolvedImage> images, StageType type, ManifestOptions options) {
        if (!type.supportsSiteStride() || options.siteStride() == 1) {
            return images;
        }
        var sites = new TreeSet<Integer>();
        images.forEach(image -> sites.add(image.site()));
        var kept = new HashSet<Integer>();
        int index = 0;
        for (Integer site : sites) {
            if (index++ % options.siteStride() == 0) {
                kept.add(site);
            }
        }
        return images.stream().filter(image -> kept.contains(image.site())).toList();
    }

    private static List<Slot> slots(List<ResolvedImage> images, StageType type) {
        var plain = new LinkedHashSet<String>();
        var cycled = new LinkedHashSet<String>();
        var cycles = new TreeSet<Integer>();
        var present = new HashSet<Slot>();
        for (ResolvedImage image : images) {
            boolean cycleColumns = type.cycleAware() && image.cycle() != null;
            for (String channel : image.channels()) {
                if (cycleColumns) {
                    cycled.add(channel);
                    cycles.add(image.cycle());
                    present.add(new Slot(image.cycle(), channel));
                } else {
                    plain.add(channel);
                }
            }
        }
        var slots = new ArrayList<Slot>();
        plain.forEach(channel -> slots.add(new Slot(null, channel)));
        for (Integer cycle : cycles) {
            for (String channel : cycled) {
                var slot = new Slot(cycle, channel);
                if (present.contains(slot)) {
                    slots.add(slot);
                }
            }
        }
        return slots;
    }

    private static TreeMap<Unit, List<ResolvedImage>> units(List<ResolvedImage> images, boolean cycleRows) {
        var units = new TreeMap<Unit, List<ResolvedImage>>();
        for (ResolvedImage image : images) {
            var unit = new Unit(image.well(), image.site(), cycleRows ? image.cycle() : null);
            units.computeIfAbsent(unit, u -> new ArrayList<>()).add(image);
        }
        return units;
    }

    private static Optional<ResolvedImage> imageFor(List<ResolvedImage> members, Slot slot, StageType type, GroupKey key) {
        ResolvedImage found = null;
        for (ResolvedImage image : members) {
            if (!image.channels().contains(slot.channel())) {
                continue;
            }
            boolean cycleMatches = slot.cycle() == null
                ? !type.cycleAware() || image.cycle() == null
                : slot.cycle().equals(image.cycle());
            if (!cycleMatches) {
                continue;
            }
            if (found != null && !found.record().file().equals(image.record().file())) {
                throw new ManifestException(
                    ErrorCode.DUPLICATE_CHANNEL_DATA,
                    "Channel " + slot.label() + " of well " + image.well() + " site " + image.site()
                        + " is provided by both " + found.fileName() + " and " + image.fileName(),
                    key
                );
            }
            if (found == null) {
                found = image;
            }
        }
        return Optional.ofNullable(found);
    }

    private static Optional<ImageRecord> artifactFor(Map<Slot, ImageRecord> artifacts, Slot slot, Unit unit) {
        var cycle = slot.cycle() != null ? slot.cycle() : unit.cycle();
        var exact = artifacts.get(new Slot(cycle, slot.channel()));
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(artifacts.get(new Slot(null, slot.channel())));
    }

    private static String plateOf(List<ResolvedImage> members, GroupKey key) {
        return members.stream()
            .map(ResolvedImage::plate)
            .filter(plate -> plate != null)
            .findFirst()
            .or(() -> key.get(Field.PLATE))
            .orElse("");
    }

    private static ManifestWarning warn(GroupKey key, String column, Unit unit, String message) {
        return new ManifestWarning(ErrorCode.MISSING_CHANNEL_DATA, key, column, unit.toString(), message);
    }

    private static ManifestException missing(ImageRecord record, Field field, GroupKey key) {
        return new ManifestException(
            ErrorCode.MISSING_REQUIRED_FIELD,
            "No '" + field.key() + "' for " + record.fileName() + " in metadata or file name",
            key
        );
    }

    private record Slot(Integer cycle, String channel) {
        String label() {
            return cycle == null ? channel : String.format("Cycle%02d_%s", cycle, channel);
        }

        String column(ColumnRole role) {
            return role.column(cycle, channel);
        }
    }

    private record Unit(String well, int site, Integer cycle) implements Comparable<Unit> {
        private static final Comparator<Unit> ORDER = Comparator
            .comparing(Unit::well, NaturalOrder.INSTANCE)
            .thenComparingInt(Unit::site)
            .thenComparing(Unit::cycle, Comparator.nullsFirst(Comparator.naturalOrder()));

        @Override
        public int compareTo(Unit other) {
            return ORDER.compare(this, other);
        }

        @Override
        public String toString() {
            var base = "well=" + well + ", site=" + site;
            return cycle == null ? base : base + ", cycle=" + cycle;
        }
    }
}

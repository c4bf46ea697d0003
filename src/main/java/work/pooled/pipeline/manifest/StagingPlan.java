package work.pooled.pipeline.manifest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import work.pooled.pipeline.error.ErrorCode;
import work.pooled.pipeline.error.ManifestException;
import work.pooled.pipeline.join.JoinedGroup;
import work.pooled.pipeline.model.GroupKey;
import work.pooled.pipeline.model.ImageRecord;

/**
 * Where each file of a joined group lands in the task's input directory.
 *
 * <p>The table is computed from the group's content alone: image names are sorted and, when
 * subdirectories are requested, numbered {@code img1..imgN} in that order. Rendering reads it and
 * never assigns aliases itself.
 */
public final class StagingPlan {
    private final boolean subdirectories;
    private final TreeMap<String, Path> images;
    private final TreeMap<String, Path> artifacts;
    private final Map<String, String> aliases;

    private StagingPlan(boolean subdirectories, TreeMap<String, Path> images, TreeMap<String, Path> artifacts) {
        this.subdirectories = subdirectories;
        this.images = images;
        this.artifacts = artifacts;
        var aliases = new LinkedHashMap<String, String>();
        if (subdirectories) {
            int index = 1;
            for (String name : images.keySet()) {
                aliases.put(name, "img" + index++);
            }
        }
        this.aliases = aliases;
    }

    public static StagingPlan of(JoinedGroup joined, boolean subdirectories) {
        var key = joined.key();
        var images = new TreeMap<String, Path>();
        for (ImageRecord member : joined.group().members()) {
            put(images, member, key);
        }
        var artifacts = new TreeMap<String, Path>();
        for (ImageRecord artifact : joined.attached()) {
            put(artifacts, artifact, key);
        }
        return new StagingPlan(subdirectories, images, artifacts);
    }

    private static void put(Map<String, Path> target, ImageRecord record, GroupKey key) {
        var previous = target.putIfAbsent(record.fileName(), record.file());
        if (previous != null && !previous.equals(record.file())) {
            throw new ManifestException(
                ErrorCode.DUPLICATE_CHANNEL_DATA,
                "Two files named '" + record.fileName() + "': " + previous + " and " + record.file(),
                key
            );
        }
    }

    public boolean subdirectories() {
        return subdirectories;
    }

    /** Path of an image relative to the staged input directory, as written into manifest cells. */
    public String cell(ImageRecord record) {
        var name = record.fileName();
        var alias = aliases.get(name);
        return alias == null ? name : alias + "/" + name;
    }

    public List<String> images() {
        return List.copyOf(images.keySet());
    }

    public List<String> subdirs() {
        return List.copyOf(aliases.values());
    }

    public List<String> illumination() {
        return List.copyOf(artifacts.keySet());
    }

    /** Relative staged location to source file, images first, then artifacts. */
    public Map<String, Path> placements() {
        var placements = new LinkedHashMap<String, Path>();
        images.forEach((name, source) -> {
            var alias = aliases.get(name);
            placements.put(alias == null ? name : alias + "/" + name, source);
        });
        artifacts.forEach(placements::putIfAbsent);
        return placements;
    }

    /** The {@code files.json} document handed to the task. */
    public Map<String, Object> fileList() {
        var list = new LinkedHashMap<String, Object>();
        list.put("images", new ArrayList<>(images.keySet()));
        list.put("subdirs", subdirs());
        list.put("illumination", illumination());
        return list;
    }
}

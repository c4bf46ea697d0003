package work.pooled.pipeline.manifest;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.pooled.pipeline.error.ErrorCode;
import work.pooled.pipeline.error.ManifestException;
import work.pooled.pipeline.manifest.FilenamePattern.ParsedName;
import work.pooled.pipeline.manifest.ResolvedImage.ChannelFrame;
import work.pooled.pipeline.model.GroupKey;
import work.pooled.pipeline.model.ImageRecord;

/**
 * Settles channel, cycle, site and frame for a record: metadata first, file name as fallback.
 *
 * <p>When both sources carry a value they must agree. A channel literal that looks like a structural
 * token of another naming pattern ({@code Cycle1}, {@code CorrDNA}) is refused rather than guessed.
 */
public final class FilenameResolver {
    private static final Logger logger = LoggerFactory.getLogger(FilenameResolver.class);
    private static final Pattern STRUCTURAL_TOKEN =
        Pattern.compile("Cycle\\d+.*|Corr.+|Illum.+|Plate|Well|Site|Point[A-Z]?\\d*|Seq\\d*");
    private static final Pattern WELL_FALLBACK = Pattern.compile("Well_?([A-Z]\\d+)_");
    private static final Pattern SITE_FALLBACK = Pattern.compile("Site_(\\d+)_");

    public ResolvedImage resolve(ImageRecord record, GroupKey key) {
        var fromMetadata = resolveFromMetadata(record);
        var parsed = parse(record.fileName(), key);
        if (parsed.isEmpty()) {
            var image = withFallbackLocation(fromMetadata);
            checkChannels(image, key);
            return image;
        }
        var fromName = toImage(record, parsed.get());
        var merged = new ResolvedImage(
            record,
            agree("plate", fromMetadata.plate(), fromName.plate(), record, key),
            agree("well", fromMetadata.well(), fromName.well(), record, key),
            agree("site", fromMetadata.site(), fromName.site(), record, key),
            agree("cycle", fromMetadata.cycle(), fromName.cycle(), record, key),
            mergeFrames(fromMetadata, fromName, key)
        );
        checkChannels(merged, key);
        return merged;
    }

    /** Resolution that looks only at the record's metadata. */
    public ResolvedImage resolveFromMetadata(ImageRecord record) {
        var cycle = record.cycle().orElse(null);
        var frames = new ArrayList<ChannelFrame>();
        var listed = record.channels();
        if (record.channel().isPresent()) {
            var channel = record.channel().get();
            int index = listed.indexOf(channel);
            frames.add(new ChannelFrame(channel, Math.max(index, 0)));
        } else {
            for (int i = 0; i < listed.size(); i++) {
                frames.add(new ChannelFrame(listed.get(i), i));
            }
        }
        return new ResolvedImage(
            record,
            record.plate().orElse(null),
            record.well().orElse(null),
            record.site().orElse(null),
            cycle,
            frames
        );
    }

    /** Resolution that looks only at the file name; empty when no documented pattern matches. */
    public Optional<ResolvedImage> resolveFromFilename(ImageRecord record) {
        return parse(record.fileName(), null).map(parsed -> toImage(record, parsed));
    }

    Optional<ParsedName> parse(String fileName, GroupKey key) {
        var matches = FilenamePattern.matchAll(fileName);
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        var first = matches.get(0);
        for (ParsedName other : matches.subList(1, matches.size())) {
            if (!first.sameFieldsAs(other)) {
                throw ManifestException.ambiguousFilename(
                    "File name '" + fileName + "' matches both " + first.pattern() + " and " + other.pattern()
                        + " with different fields",
                    key
                );
            }
        }
        return Optional.of(first);
    }

    private ResolvedImage toImage(ImageRecord record, ParsedName parsed) {
        var frames = new ArrayList<ChannelFrame>();
        var channels = parsed.channels();
        for (int i = 0; i < channels.size(); i++) {
            frames.add(new ChannelFrame(channels.get(i), i));
        }
        return new ResolvedImage(record, parsed.plate(), parsed.well(), parsed.site(), parsed.cycle(), frames);
    }

    private ResolvedImage withFallbackLocation(ResolvedImage image) {
        var name = image.fileName();
        var well = image.well();
        var site = image.site();
        if (well == null) {
            var m = WELL_FALLBACK.matcher(name);
            well = m.find() ? m.group(1) : null;
        }
        if (site == null) {
            var m = SITE_FALLBACK.matcher(name);
            site = m.find() ? Integer.valueOf(m.group(1)) : null;
        }
        if (Objects.equals(well, image.well()) && Objects.equals(site, image.site())) {
            return image;
        }
        logger.debug("Recovered well/site of {} from its file name", name);
        return new ResolvedImage(image.record(), image.plate(), well, site, image.cycle(), image.frames());
    }

    private static List<ChannelFrame> mergeFrames(ResolvedImage fromMetadata, ResolvedImage fromName, GroupKey key) {
        if (fromMetadata.frames().isEmpty()) {
            return fromName.frames();
        }
        var metaChannels = fromMetadata.channels();
        var nameChannels = fromName.channels();
        boolean consistent;
        if (metaChannels.size() == 1 && nameChannels.size() > 1) {
            // one logical channel split out of a multiplexed file
            consistent = nameChannels.contains(metaChannels.get(0));
        } else {
            consistent = metaChannels.equals(nameChannels);
        }
        if (!consistent) {
            throw ManifestException.ambiguousFilename(
                "Channel metadata " + metaChannels + " of " + fromMetadata.fileName()
                    + " disagrees with file name channels " + nameChannels,
                key
            );
        }
        return fromMetadata.frames();
    }

    private static <T> T agree(String field, T metadata, T fromName, ImageRecord record, GroupKey key) {
        if (metadata != null && fromName != null && !metadata.equals(fromName)) {
            throw ManifestException.ambiguousFilename(
                "Field '" + field + "' of " + record.fileName() + " is " + metadata
                    + " in metadata but " + fromName + " in the file name",
                key
            );
        }
        return metadata != null ? metadata : fromName;
    }

    private static void checkChannels(ResolvedImage image, GroupKey key) {
        if (image.frames().isEmpty()) {
            throw new ManifestException(
                ErrorCode.MISSING_REQUIRED_FIELD,
                "No 'channel' for " + image.fileName() + " in metadata or file name",
                key
            );
        }
        for (String channel : image.channels()) {
            if (STRUCTURAL_TOKEN.matcher(channel).matches()) {
                throw ManifestException.ambiguousFilename(
                    "Channel '" + channel + "' of " + image.fileName()
                        + " reads as a structural file name token",
                    key
                );
            }
        }
    }
}

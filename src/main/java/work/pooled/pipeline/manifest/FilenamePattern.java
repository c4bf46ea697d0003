package work.pooled.pipeline.manifest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The documented file naming conventions, with a parser and a renderer for each.
 */
public enum FilenamePattern {
    /** {@code WellA1_PointA1_0000_ChannelDNA,GFP[_Cycle01]_Seq0000.ome.tiff}: raw multiplexed acquisition. */
    ORIGINAL(
        "Well([A-Z]\\d+)_Point[A-Z](\\d+)_\\d+_Channel([^_]+)(?:_Cycle(\\d+))?_Seq\\d+\\.ome\\.tiff?",
        false
    ) {
        @Override
        ParsedName parse(Matcher m) {
            var channels = Arrays.stream(m.group(3).split(","))
                .map(String::trim)
                .filter(ch -> !ch.isEmpty())
                .collect(Collectors.toList());
            return new ParsedName(this, null, m.group(1), Integer.valueOf(m.group(2)), toInt(m.group(4)), channels);
        }
    },
    /** {@code Plate_P1_Well_A1_Site_1_CorrDNA.tiff}: single-channel corrected image. */
    CORRECTED("Plate_(.+?)_Well_(.+?)_Site_(\\d+)_Corr(.+?)\\.tiff?", false) {
        @Override
        ParsedName parse(Matcher m) {
            return new ParsedName(this, m.group(1), m.group(2), Integer.valueOf(m.group(3)), null, List.of(m.group(4)));
        }
    },
    /** {@code Plate_P1_Well_A1_Site_1_Cycle01_A.tiff}: per-cycle barcoding image; DAPI reads as DNA. */
    CYCLE("Plate_(.+?)_Well_(.+?)_Site_(\\d+)_Cycle(\\d+)_([^_.]+)\\.tiff?", false) {
        @Override
        ParsedName parse(Matcher m) {
            return new ParsedName(
                this,
                m.group(1),
                m.group(2),
                Integer.valueOf(m.group(3)),
                Integer.valueOf(m.group(4)),
                List.of(normalizeCycleChannel(m.group(5)))
            );
        }
    },
    /** {@code P1_Cycle01_IllumDNA.npy}: per-cycle correction function. */
    ILLUM_CYCLE("(.+?)_Cycle(\\d+)_Illum(.+?)\\.npy", true) {
        @Override
        ParsedName parse(Matcher m) {
            return new ParsedName(this, m.group(1), null, null, Integer.valueOf(m.group(2)), List.of(m.group(3)));
        }
    },
    /** {@code P1_IllumDNA.npy}: correction function. */
    ILLUM("(.+?)_Illum(.+?)\\.npy", true) {
        @Override
        ParsedName parse(Matcher m) {
            return new ParsedName(this, m.group(1), null, null, null, List.of(m.group(2)));
        }

        @Override
        boolean shadowedBy(FilenamePattern other) {
            return other == ILLUM_CYCLE;
        }
    };

    private final Pattern regex;
    private final boolean artifact;

    FilenamePattern(String regex, boolean artifact) {
        this.regex = Pattern.compile(regex);
        this.artifact = artifact;
    }

    abstract ParsedName parse(Matcher matcher);

    /** A more specific pattern that also matches hides this one. */
    boolean shadowedBy(FilenamePattern other) {
        return false;
    }

    /** Correction artifacts are attached to finer groups rather than rendered as images. */
    public boolean artifact() {
        return artifact;
    }

    public Optional<ParsedName> match(String fileName) {
        var matcher = regex.matcher(fileName);
        return matcher.matches() ? Optional.of(parse(matcher)) : Optional.empty();
    }

    /** Every pattern matching {@code fileName}, after removing shadowed ones. */
    public static List<ParsedName> matchAll(String fileName) {
        var matches = new ArrayList<ParsedName>();
        for (FilenamePattern pattern : values()) {
            pattern.match(fileName).ifPresent(matches::add);
        }
        var visible = new ArrayList<ParsedName>(matches.size());
        for (ParsedName candidate : matches) {
            if (matches.stream().noneMatch(other -> candidate.pattern().shadowedBy(other.pattern()))) {
                visible.add(candidate);
            }
        }
        return visible;
    }

    public static String original(String well, int site, List<String> channels, Integer cycle) {
        var pointRow = well.isEmpty() ? "A" : well.substring(0, 1);
        var suffix = cycle == null ? "" : String.format("_Cycle%02d", cycle);
        return "Well" + well + "_Point" + pointRow + site + "_0000_Channel" + String.join(",", channels) + suffix + "_Seq0000.ome.tiff";
    }

    public static String corrected(String plate, String well, int site, String channel) {
        return "Plate_" + plate + "_Well_" + well + "_Site_" + site + "_Corr" + channel + ".tiff";
    }

    public static String cycle(String plate, String well, int site, int cycle, String channel) {
        return String.format("Plate_%s_Well_%s_Site_%d_Cycle%02d_%s.tiff", plate, well, site, cycle, channel);
    }

    public static String illum(String plate, String channel) {
        return plate + "_Illum" + channel + ".npy";
    }

    public static String illumCycle(String plate, int cycle, String channel) {
        return String.format("%s_Cycle%02d_Illum%s.npy", plate, cycle, channel);
    }

    static String normalizeCycleChannel(String channel) {
        return "DAPI".equals(channel) ? "DNA" : channel;
    }

    private static Integer toInt(String value) {
        return value == null ? null : Integer.valueOf(value);
    }

    /** Fields recovered from a file name. Absent fields are null. */
    public record ParsedName(
        FilenamePattern pattern,
        String plate,
        String well,
        Integer site,
        Integer cycle,
        List<String> channels
    ) {
        public ParsedName {
            channels = List.copyOf(channels);
        }

        public Optional<String> singleChannel() {
            return channels.size() == 1 ? Optional.of(channels.get(0)) : Optional.empty();
        }

        boolean sameFieldsAs(ParsedName other) {
            return Objects.equals(plate, other.plate)
                && Objects.equals(well, other.well)
                && Objects.equals(site, other.site)
                && Objects.equals(cycle, other.cycle)
                && channels.equals(other.channels);
        }
    }
}

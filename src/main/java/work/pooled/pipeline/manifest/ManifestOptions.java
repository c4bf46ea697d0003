package work.pooled.pipeline.manifest;

import work.pooled.pipeline.error.ConfigurationException;

/**
 * Per-stage rendering knobs: site subsampling for segmentation checks and {@code imgN} staging.
 */
public record ManifestOptions(int siteStride, boolean useSubdirs) {
    public static final ManifestOptions DEFAULT = new ManifestOptions(1, false);

    public ManifestOptions {
        if (siteStride < 1) {
            throw ConfigurationException.invalid("site_stride must be at least 1, got " + siteStride);
        }
    }
}

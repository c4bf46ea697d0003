package work.pooled.pipeline.model;

import java.util.Locale;
import work.pooled.pipeline.error.ConfigurationException;

/**
 * The two processing tracks sharing the pipeline shape: phenotype imaging and barcode sequencing.
 */
public enum Arm {
    PAINTING("painting"),
    BARCODING("barcoding");

    private final String key;

    Arm(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Arm from(String value) {
        if (value == null || value.isBlank()) {
            throw ConfigurationException.invalid("Arm value is empty");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Arm arm : values()) {
            if (arm.key.equals(normalized)) {
                return arm;
            }
        }
        if ("cellpainting".equals(normalized)) {
            return PAINTING;
        }
        throw ConfigurationException.invalid("Unsupported arm: " + value + " (expected painting|barcoding)");
    }
}

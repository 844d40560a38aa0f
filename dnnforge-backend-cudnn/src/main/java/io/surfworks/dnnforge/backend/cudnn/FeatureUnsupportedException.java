package io.surfworks.dnnforge.backend.cudnn;

/**
 * Thrown when a requested mode or algorithm needs a newer backend than the one detected.
 */
public class FeatureUnsupportedException extends RuntimeException {

    private final String feature;
    private final int requiredVersion;
    private final int detectedVersion;

    public FeatureUnsupportedException(String feature, int requiredVersion, int detectedVersion) {
        super(feature + " requires cuDNN version " + requiredVersion + " or newer, detected version "
                + detectedVersion);
        this.feature = feature;
        this.requiredVersion = requiredVersion;
        this.detectedVersion = detectedVersion;
    }

    public String feature() {
        return feature;
    }

    public int requiredVersion() {
        return requiredVersion;
    }

    public int detectedVersion() {
        return detectedVersion;
    }
}

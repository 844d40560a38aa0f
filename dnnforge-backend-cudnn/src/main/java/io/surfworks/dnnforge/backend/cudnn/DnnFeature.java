package io.surfworks.dnnforge.backend.cudnn;

/**
 * Backend capabilities that only exist from a given library version on.
 */
public enum DnnFeature {
    ND_DESCRIPTORS("3-D convolution and pooling descriptors", 3000),
    FFT_CONVOLUTION("FFT convolution", 3000),
    AUTOMATIC_ALGORITHMS("automatic algorithm selection", 3000),
    BACKWARD_ALGORITHMS("backward algorithm selection", 3000),
    LOG_SOFTMAX("log softmax", 3000);

    private final String description;
    private final int minimumVersion;

    DnnFeature(String description, int minimumVersion) {
        this.description = description;
        this.minimumVersion = minimumVersion;
    }

    public String description() {
        return description;
    }

    public int minimumVersion() {
        return minimumVersion;
    }
}

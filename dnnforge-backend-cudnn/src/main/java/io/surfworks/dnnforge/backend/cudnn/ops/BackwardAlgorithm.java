package io.surfworks.dnnforge.backend.cudnn.ops;

import java.util.Optional;

import io.surfworks.dnnforge.backend.cudnn.DnnFeature;
import io.surfworks.dnnforge.core.graph.ConfigurationException;

/**
 * Strategies for the weight-gradient and input-gradient convolutions.
 */
public enum BackwardAlgorithm {
    NONE("none", false, false, false),
    DETERMINISTIC("deterministic", false, false, false),
    FFT("fft", false, false, false),
    GUESS_ONCE("guess_once", true, false, false),
    GUESS_ON_SHAPE_CHANGE("guess_on_shape_change", true, true, false),
    TIME_ONCE("time_once", true, false, true),
    TIME_ON_SHAPE_CHANGE("time_on_shape_change", true, true, true);

    public static final BackwardAlgorithm DEFAULT = NONE;

    private final String text;
    private final boolean automatic;
    private final boolean onShapeChange;
    private final boolean timed;

    BackwardAlgorithm(String text, boolean automatic, boolean onShapeChange, boolean timed) {
        this.text = text;
        this.automatic = automatic;
        this.onShapeChange = onShapeChange;
        this.timed = timed;
    }

    public String text() {
        return text;
    }

    public boolean isAutomatic() {
        return automatic;
    }

    public boolean choosesOnShapeChange() {
        return onShapeChange;
    }

    public boolean isTimed() {
        return timed;
    }

    public Optional<DnnFeature> requiredFeature() {
        if (automatic) {
            return Optional.of(DnnFeature.AUTOMATIC_ALGORITHMS);
        }
        if (this == FFT) {
            return Optional.of(DnnFeature.BACKWARD_ALGORITHMS);
        }
        return Optional.empty();
    }

    /**
     * The 3-D backward kernels have no deterministic or FFT variant.
     */
    public boolean supportsSpatialRank(int spatialRank) {
        return spatialRank == 2 || (this != DETERMINISTIC && this != FFT);
    }

    public static BackwardAlgorithm parse(String text) {
        for (BackwardAlgorithm algorithm : values()) {
            if (algorithm.text.equals(text)) {
                return algorithm;
            }
        }
        throw new ConfigurationException("Invalid backward convolution algorithm '" + text + "'");
    }
}

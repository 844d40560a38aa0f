package io.surfworks.dnnforge.backend.cudnn.ops;

import java.util.Optional;

import io.surfworks.dnnforge.backend.cudnn.DnnFeature;
import io.surfworks.dnnforge.core.graph.ConfigurationException;

/**
 * Forward convolution strategies. The automatic variants pick a concrete
 * strategy at run time, either by heuristic ({@code guess}) or by timing
 * ({@code time}), once per node or again whenever the input shapes change.
 */
public enum ForwardAlgorithm {
    NONE("none", false, false, false),
    SMALL("small", false, false, false),
    LARGE("large", false, false, false),
    FFT("fft", false, false, false),
    GUESS_ONCE("guess_once", true, false, false),
    GUESS_ON_SHAPE_CHANGE("guess_on_shape_change", true, true, false),
    TIME_ONCE("time_once", true, false, true),
    TIME_ON_SHAPE_CHANGE("time_on_shape_change", true, true, true);

    public static final ForwardAlgorithm DEFAULT = SMALL;

    private final String text;
    private final boolean automatic;
    private final boolean onShapeChange;
    private final boolean timed;

    ForwardAlgorithm(String text, boolean automatic, boolean onShapeChange, boolean timed) {
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

    /**
     * The backend feature this strategy needs, if any.
     */
    public Optional<DnnFeature> requiredFeature() {
        if (this == FFT) {
            return Optional.of(DnnFeature.FFT_CONVOLUTION);
        }
        if (automatic) {
            return Optional.of(DnnFeature.AUTOMATIC_ALGORITHMS);
        }
        return Optional.empty();
    }

    public boolean supportsSpatialRank(int spatialRank) {
        return this != FFT || spatialRank == 2;
    }

    public static ForwardAlgorithm parse(String text) {
        for (ForwardAlgorithm algorithm : values()) {
            if (algorithm.text.equals(text)) {
                return algorithm;
            }
        }
        throw new ConfigurationException("Invalid forward convolution algorithm '" + text + "'");
    }
}

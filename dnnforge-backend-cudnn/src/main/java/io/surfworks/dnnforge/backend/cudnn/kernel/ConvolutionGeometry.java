package io.surfworks.dnnforge.backend.cudnn.kernel;

import java.util.List;

import io.surfworks.dnnforge.backend.cudnn.ops.ConvMode;

/**
 * Contents of a convolution descriptor: resolved pads, strides and mode.
 */
public record ConvolutionGeometry(List<Integer> pads, List<Integer> strides, ConvMode mode) {

    public ConvolutionGeometry {
        pads = List.copyOf(pads);
        strides = List.copyOf(strides);
    }

    public int spatialRank() {
        return strides.size();
    }

    int[] padArray() {
        return pads.stream().mapToInt(Integer::intValue).toArray();
    }

    int[] strideArray() {
        return strides.stream().mapToInt(Integer::intValue).toArray();
    }
}

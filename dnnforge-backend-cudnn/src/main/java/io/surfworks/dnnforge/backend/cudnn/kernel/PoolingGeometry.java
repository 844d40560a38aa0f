package io.surfworks.dnnforge.backend.cudnn.kernel;

import java.util.List;

import io.surfworks.dnnforge.core.ops.PoolMode;

/**
 * Contents of a pooling descriptor.
 */
public record PoolingGeometry(List<Integer> window, List<Integer> stride, List<Integer> pad, PoolMode mode) {

    public PoolingGeometry {
        window = List.copyOf(window);
        stride = List.copyOf(stride);
        pad = List.copyOf(pad);
    }

    public int spatialRank() {
        return window.size();
    }
}

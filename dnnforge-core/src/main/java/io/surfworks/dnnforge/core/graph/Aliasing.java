package io.surfworks.dnnforge.core.graph;

import java.util.Map;

/**
 * Capability: declares outputs written into the storage of an input.
 */
public interface Aliasing {

    /**
     * Maps an output index to the index of the input it overwrites.
     * Empty when the operator does not write in place.
     */
    Map<Integer, Integer> destroyMap();
}

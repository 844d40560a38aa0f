package io.surfworks.dnnforge.core.resource;

import java.util.List;

import io.surfworks.dnnforge.core.graph.Operator;

/**
 * Identifies a materialized native resource: the operator that builds it, the
 * shape input it was built from and the backend version it belongs to.
 *
 * <p>Keys built under different backend versions never compare equal, so a
 * handle is never reused across versions.
 */
public record ResourceKey(Operator operator, List<Long> shapeInput, Object versionKey) {

    public ResourceKey {
        shapeInput = List.copyOf(shapeInput);
    }
}

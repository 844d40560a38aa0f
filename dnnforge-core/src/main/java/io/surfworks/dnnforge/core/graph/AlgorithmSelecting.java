package io.surfworks.dnnforge.core.graph;

/**
 * Capability: the operator runs one of several interchangeable algorithms.
 *
 * @param <A> the algorithm enumeration
 */
public interface AlgorithmSelecting<A extends Enum<A>> {

    A algorithm();
}

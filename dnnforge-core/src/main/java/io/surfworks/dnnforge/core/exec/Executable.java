package io.surfworks.dnnforge.core.exec;

import java.util.List;

import io.surfworks.dnnforge.core.graph.Node;

/**
 * Operators that {@link GraphInterpreter} can run.
 *
 * <p>Runtime values are {@link io.surfworks.dnnforge.core.tensor.Tensor} for
 * tensor edges and {@link io.surfworks.dnnforge.core.resource.NativeHandle} for
 * handle edges.
 */
public interface Executable {

    /**
     * Computes the outputs of {@code node} from its runtime inputs.
     */
    List<Object> perform(Node node, List<Object> inputs, ExecutionContext context);
}

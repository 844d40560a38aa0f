package io.surfworks.dnnforge.core.grad;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.exec.GraphInterpreter;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Compares symbolic gradients against central finite differences.
 *
 * <p>Every element of every input is perturbed, so keep the shapes small.
 */
public final class GradientVerifier {

    /**
     * Largest disagreement found.
     *
     * @param maxAbsoluteError largest {@code |analytic - numeric|}
     * @param maxRelativeError largest error relative to {@code max(1, |numeric|)}
     */
    public record Result(double maxAbsoluteError, double maxRelativeError) {

        public boolean passes(double tolerance) {
            return maxRelativeError <= tolerance;
        }
    }

    private GradientVerifier() {
    }

    /**
     * Checks {@code d cost / d input} for every input at {@code point}.
     *
     * @param inputs graph inputs; the cost must be computable from them
     * @param cost rank-0 cost value
     * @param point runtime value for every input
     * @param contexts fresh execution context per evaluation
     * @param epsilon finite-difference step
     */
    public static Result check(List<Value> inputs, Value cost, Map<Value, Tensor> point,
                               Supplier<ExecutionContext> contexts, double epsilon) {
        List<Value> grads = Gradients.grad(cost, inputs);
        OperationGraph gradGraph = OperationGraph.of(inputs, grads);
        OperationGraph costGraph = OperationGraph.of(inputs, List.of(cost));

        List<Object> analytic;
        try (ExecutionContext context = contexts.get()) {
            analytic = GraphInterpreter.evaluate(gradGraph, copies(point), context);
        }

        double maxAbs = 0;
        double maxRel = 0;
        for (int i = 0; i < inputs.size(); i++) {
            Value input = inputs.get(i);
            double[] expected = ((Tensor) analytic.get(i)).toArray();
            Tensor base = point.get(input);
            int[] shape = base.shape();
            List<int[]> indices = new ArrayList<>();
            Tensor.forEachIndex(shape, idx -> indices.add(idx.clone()));
            for (int k = 0; k < indices.size(); k++) {
                int[] idx = indices.get(k);
                double plus = costAt(costGraph, point, input, idx, epsilon, contexts);
                double minus = costAt(costGraph, point, input, idx, -epsilon, contexts);
                double numeric = (plus - minus) / (2 * epsilon);
                double abs = Math.abs(expected[k] - numeric);
                maxAbs = Math.max(maxAbs, abs);
                maxRel = Math.max(maxRel, abs / Math.max(1, Math.abs(numeric)));
            }
        }
        return new Result(maxAbs, maxRel);
    }

    private static double costAt(OperationGraph costGraph, Map<Value, Tensor> point, Value input, int[] idx,
                                 double delta, Supplier<ExecutionContext> contexts) {
        Map<Value, Tensor> shifted = copies(point);
        Tensor t = shifted.get(input);
        t.set(t.get(idx) + delta, idx);
        try (ExecutionContext context = contexts.get()) {
            return GraphInterpreter.evaluateTensor(costGraph, shifted, context).scalarValue();
        }
    }

    private static Map<Value, Tensor> copies(Map<Value, Tensor> point) {
        Map<Value, Tensor> copy = new HashMap<>();
        point.forEach((k, v) -> copy.put(k, v.copy()));
        return copy;
    }
}

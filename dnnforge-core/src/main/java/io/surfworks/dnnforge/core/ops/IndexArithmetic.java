package io.surfworks.dnnforge.core.ops;

import java.util.Arrays;
import java.util.List;

import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.graph.Differentiable;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;
import io.surfworks.dnnforge.core.tensor.ScalarType;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Integer arithmetic on rank-0 int64 shape components.
 */
public record IndexArithmetic(Op op) implements Operator, Executable, Differentiable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "index_arith");

    public enum Op {
        ADD,
        SUB,
        MUL,
        FLOOR_DIV;

        public long apply(long a, long b) {
            return switch (this) {
                case ADD -> a + b;
                case SUB -> a - b;
                case MUL -> a * b;
                case FLOOR_DIV -> Math.floorDiv(a, b);
            };
        }
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 2) {
            throw new ShapeException("IndexArithmetic takes two inputs, got " + inputs.size());
        }
        for (Value in : inputs) {
            TensorType t = in.tensorType();
            if (t.rank() != 0 || !t.dtype().isInteger()) {
                throw new ShapeException("IndexArithmetic operands must be integer scalars, got " + t);
            }
        }
        return List.of(TensorType.scalar(ScalarType.I64));
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        long a = (long) ((Tensor) inputs.get(0)).scalarValue();
        long b = (long) ((Tensor) inputs.get(1)).scalarValue();
        return List.of(Tensor.scalar(ScalarType.I64, op.apply(a, b)));
    }

    @Override
    public List<Value> grad(Node node, List<Value> outputGrads) {
        return Arrays.asList(null, null);
    }

    @Override
    public boolean[][] connectionPattern(Node node) {
        return new boolean[][] {{false}, {false}};
    }
}

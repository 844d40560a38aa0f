package io.surfworks.dnnforge.core.ops;

import java.util.ArrayList;
import java.util.List;

import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.graph.Constant;
import io.surfworks.dnnforge.core.graph.Differentiable;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.ShapeInferring;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;
import io.surfworks.dnnforge.core.tensor.ScalarType;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Elementwise application of a {@link ScalarOp}.
 *
 * <p>Binary operands either share a rank, with size-1 axes broadcast, or one of
 * them is rank 0. The result takes the element type of the higher-rank operand.
 */
public record Elemwise(ScalarOp op) implements Operator, Executable, ShapeInferring, Differentiable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "elemwise");

    public static Value add(Value a, Value b) {
        return new Elemwise(ScalarOp.ADD).call(a, b);
    }

    public static Value sub(Value a, Value b) {
        return new Elemwise(ScalarOp.SUB).call(a, b);
    }

    public static Value mul(Value a, Value b) {
        return new Elemwise(ScalarOp.MUL).call(a, b);
    }

    public static Value div(Value a, Value b) {
        return new Elemwise(ScalarOp.DIV).call(a, b);
    }

    public static Value log(Value x) {
        return new Elemwise(ScalarOp.LOG).call(x);
    }

    public static Value exp(Value x) {
        return new Elemwise(ScalarOp.EXP).call(x);
    }

    public static Value neg(Value x) {
        return mul(x, Constant.scalar(x.tensorType().dtype(), -1));
    }

    /**
     * True if {@code node} applies {@code scalarOp}.
     */
    public static boolean isOp(Node node, ScalarOp scalarOp) {
        return node != null && node.operator() instanceof Elemwise e && e.op == scalarOp;
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != op.arity()) {
            throw new ShapeException("Elemwise " + op + " takes " + op.arity() + " inputs, got " + inputs.size());
        }
        TensorType a = inputs.get(0).tensorType();
        if (op.arity() == 1) {
            return List.of(a);
        }
        TensorType b = inputs.get(1).tensorType();
        if (a.rank() == 0) {
            return List.of(b.rank() == 0 ? a : b);
        }
        if (b.rank() == 0) {
            return List.of(a);
        }
        if (a.rank() != b.rank()) {
            throw new ShapeException("Elemwise " + op + ": rank mismatch " + a + " vs " + b);
        }
        if (a.dtype() != b.dtype()) {
            throw new ShapeException("Elemwise " + op + ": element type mismatch " + a + " vs " + b);
        }
        return List.of(a.withShape(broadcast(a.shape(), b.shape())));
    }

    private List<Integer> broadcast(List<Integer> a, List<Integer> b) {
        List<Integer> out = new ArrayList<>(a.size());
        for (int i = 0; i < a.size(); i++) {
            int da = a.get(i);
            int db = b.get(i);
            if (da == 1) {
                out.add(db);
            } else if (db == 1) {
                out.add(da);
            } else if (da == TensorType.UNKNOWN) {
                out.add(db);
            } else if (db == TensorType.UNKNOWN || da == db) {
                out.add(da);
            } else {
                throw new ShapeException("Elemwise " + op + ": cannot broadcast " + a + " with " + b);
            }
        }
        return out;
    }

    @Override
    public List<List<Integer>> inferShape(Node node, List<List<Integer>> inputShapes) {
        List<Integer> a = inputShapes.get(0);
        if (op.arity() == 1) {
            return List.of(a);
        }
        List<Integer> b = inputShapes.get(1);
        if (a.isEmpty()) {
            return List.of(b);
        }
        if (b.isEmpty()) {
            return List.of(a);
        }
        return List.of(broadcast(a, b));
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        Tensor a = (Tensor) inputs.get(0);
        Tensor b = op.arity() == 2 ? (Tensor) inputs.get(1) : null;
        TensorType outType = node.output().tensorType();
        int[] shape = b == null || b.rank() == 0 ? a.shape() : (a.rank() == 0 ? b.shape() : broadcastShape(a, b));
        ScalarType dtype = outType.dtype();
        Tensor out = Tensor.zeros(dtype, shape);
        int[] ai = new int[a.rank()];
        int[] bi = b == null ? null : new int[b.rank()];
        Tensor.forEachIndex(shape, idx -> {
            double va = read(a, idx, ai);
            double vb = b == null ? 0 : read(b, idx, bi);
            out.set(op.apply(va, vb), idx);
        });
        return List.of(out);
    }

    private static int[] broadcastShape(Tensor a, Tensor b) {
        int[] shape = new int[a.rank()];
        for (int i = 0; i < shape.length; i++) {
            int da = a.dim(i);
            int db = b.dim(i);
            if (da != db && da != 1 && db != 1) {
                throw new ShapeException("Cannot broadcast runtime shapes at axis " + i + ": " + da + " vs " + db);
            }
            shape[i] = da == 1 ? db : da;
        }
        return shape;
    }

    private static double read(Tensor t, int[] idx, int[] scratch) {
        if (t.rank() == 0) {
            return t.get();
        }
        for (int i = 0; i < scratch.length; i++) {
            scratch[i] = t.dim(i) == 1 ? 0 : idx[i];
        }
        return t.get(scratch);
    }

    @Override
    public List<Value> grad(Node node, List<Value> outputGrads) {
        Value g = outputGrads.get(0);
        Value a = node.input(0);
        return switch (op) {
            case LOG -> List.of(div(g, a));
            case EXP -> List.of(mul(g, node.output()));
            case ADD -> List.of(Shapes.reduceLike(g, a), Shapes.reduceLike(g, node.input(1)));
            case SUB -> List.of(Shapes.reduceLike(g, a), Shapes.reduceLike(neg(g), node.input(1)));
            case MUL -> List.of(
                    Shapes.reduceLike(mul(g, node.input(1)), a),
                    Shapes.reduceLike(mul(g, a), node.input(1)));
            case DIV -> {
                Value b = node.input(1);
                yield List.of(
                        Shapes.reduceLike(div(g, b), a),
                        Shapes.reduceLike(neg(div(mul(g, a), mul(b, b))), b));
            }
        };
    }
}

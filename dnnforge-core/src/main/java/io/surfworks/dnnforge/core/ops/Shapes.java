package io.surfworks.dnnforge.core.ops;

import java.util.ArrayList;
import java.util.List;

import io.surfworks.dnnforge.core.graph.Constant;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.tensor.ScalarType;

/**
 * Builds symbolic shape arithmetic. Static dimensions fold to constants at
 * construction time so rewritten graphs stay free of needless index nodes.
 */
public final class Shapes {

    private Shapes() {
    }

    public static Value constant(long value) {
        return Constant.index(value);
    }

    /**
     * Dimension {@code axis} of {@code x}: a constant when statically known,
     * otherwise a {@link ShapeI} node.
     */
    public static Value dim(Value x, int axis) {
        TensorType t = x.tensorType();
        if (t.isKnown(axis)) {
            return constant(t.dim(axis));
        }
        return new ShapeI(axis).call(x);
    }

    public static List<Value> dims(Value x) {
        int rank = x.tensorType().rank();
        List<Value> dims = new ArrayList<>(rank);
        for (int axis = 0; axis < rank; axis++) {
            dims.add(dim(x, axis));
        }
        return dims;
    }

    public static Value shapeOf(Value x) {
        return new ShapeOf().call(x);
    }

    public static Value add(Value a, Value b) {
        return arith(IndexArithmetic.Op.ADD, a, b);
    }

    public static Value sub(Value a, Value b) {
        return arith(IndexArithmetic.Op.SUB, a, b);
    }

    public static Value mul(Value a, Value b) {
        return arith(IndexArithmetic.Op.MUL, a, b);
    }

    public static Value floorDiv(Value a, Value b) {
        return arith(IndexArithmetic.Op.FLOOR_DIV, a, b);
    }

    private static Value arith(IndexArithmetic.Op op, Value a, Value b) {
        if (a instanceof Constant ca && b instanceof Constant cb) {
            return constant(op.apply((long) ca.scalarValue(), (long) cb.scalarValue()));
        }
        return new IndexArithmetic(op).call(a, b);
    }

    /**
     * A fresh uninitialized buffer with the given dimension values.
     */
    public static Value alloc(ScalarType dtype, List<Value> dims) {
        return new AllocEmpty(dtype).call(dims.toArray(new Value[0]));
    }

    /**
     * A fresh uninitialized buffer shaped like {@code x}.
     */
    public static Value emptyLike(Value x) {
        return alloc(x.tensorType().dtype(), dims(x));
    }

    /**
     * Sums {@code g} over the axes along which {@code target} was broadcast, so
     * the result has {@code target}'s shape.
     */
    public static Value reduceLike(Value g, Value target) {
        TensorType gt = g.tensorType();
        TensorType tt = target.tensorType();
        if (tt.rank() == 0) {
            return gt.rank() == 0 ? g : Sum.all(g);
        }
        List<Integer> axes = new ArrayList<>();
        for (int axis = 0; axis < tt.rank(); axis++) {
            if (tt.dim(axis) == 1 && gt.dim(axis) != 1) {
                axes.add(axis);
            }
        }
        if (axes.isEmpty()) {
            return g;
        }
        return new Sum(axes, true).call(g);
    }
}

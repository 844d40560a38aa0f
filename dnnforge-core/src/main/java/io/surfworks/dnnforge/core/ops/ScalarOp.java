package io.surfworks.dnnforge.core.ops;

/**
 * Scalar functions applied elementwise by {@link Elemwise}.
 */
public enum ScalarOp {
    ADD(2),
    SUB(2),
    MUL(2),
    DIV(2),
    LOG(1),
    EXP(1);

    private final int arity;

    ScalarOp(int arity) {
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }

    public double apply(double a, double b) {
        return switch (this) {
            case ADD -> a + b;
            case SUB -> a - b;
            case MUL -> a * b;
            case DIV -> a / b;
            case LOG -> Math.log(a);
            case EXP -> Math.exp(a);
        };
    }
}

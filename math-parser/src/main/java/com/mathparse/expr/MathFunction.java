package com.mathparse.expr;

/**
 * A registry entry: a function name, the argument counts it accepts and its implementation.
 */
public final class MathFunction {

    private final String name;
    private final Arity arity;
    private final NumericFunction implementation;

    public MathFunction(String name, Arity arity, NumericFunction implementation) {
        this.name = name;
        this.arity = arity;
        this.implementation = implementation;
    }

    public String getName() {
        return name;
    }

    public Arity getArity() {
        return arity;
    }

    public double apply(double[] args, EvaluationConfig config) {
        return implementation.apply(args, config);
    }

    @Override
    public String toString() {
        return name + " (" + arity + ")";
    }
}

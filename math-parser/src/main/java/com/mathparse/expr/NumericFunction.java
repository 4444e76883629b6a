package com.mathparse.expr;

@FunctionalInterface
public interface NumericFunction {
    double apply(double[] args, EvaluationConfig config);
}

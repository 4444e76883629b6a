package com.mathparse.expr;

import java.util.List;

/**
 * Reduces an expression tree to a single double. Evaluation is a pure function of the tree and
 * the {@link EvaluationConfig}; IEEE-754 rules decide division by zero and out-of-domain inputs.
 */
public class Evaluator {

    private final FunctionRegistry registry;

    public Evaluator(FunctionRegistry registry) {
        this.registry = registry;
    }

    public double evaluate(ExpressionNode node, EvaluationConfig config) {
        return switch (node.getKind()) {
            case LITERAL -> ((ExpressionNode.Literal) node).getValue();
            case BINARY_OP -> evaluateBinary((ExpressionNode.BinaryOp) node, config);
            case CALL -> evaluateCall((ExpressionNode.Call) node, config);
        };
    }

    private double evaluateBinary(ExpressionNode.BinaryOp op, EvaluationConfig config) {
        double a = evaluate(op.getLeft(), config);
        double b = evaluate(op.getRight(), config);
        return switch (op.getOperator()) {
            case ADD -> a + b;
            case SUB -> a - b;
            case MUL -> a * b;
            case DIV -> a / b;
            case POW -> Math.pow(a, b);
            case SCI_NOTATION -> a * Math.pow(10, b);
            case FUNCTION -> throw new IllegalStateException("FUNCTION is not a binary operator");
        };
    }

    private double evaluateCall(ExpressionNode.Call call, EvaluationConfig config) {
        MathFunction function = registry.lookup(call.getName());
        if (function == null) {
            throw new UnknownFunctionException(call.getName());
        }
        List<ExpressionNode> args = call.getArgs();
        if (!function.getArity().accepts(args.size())) {
            throw new ArityMismatchException(call.getName(), function.getArity(), args.size());
        }

        double[] values = new double[args.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = evaluate(args.get(i), config);
        }
        return function.apply(values, config);
    }
}

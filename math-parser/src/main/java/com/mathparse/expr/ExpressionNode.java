package com.mathparse.expr;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Node of an expression tree. The variants are fixed: {@link Literal}, {@link BinaryOp} and
 * {@link Call}. Every node is owned by exactly one parent and never mutated after construction.
 * Evaluation lives in {@link Evaluator}, which switches over {@link #getKind()}.
 */
public abstract class ExpressionNode {

    private final NodeKind kind;

    ExpressionNode(NodeKind kind) {
        this.kind = kind;
    }

    public NodeKind getKind() {
        return kind;
    }

    public static Literal literal(double value) {
        return new Literal(value);
    }

    public static BinaryOp binary(OperatorKind operator, ExpressionNode left, ExpressionNode right) {
        return new BinaryOp(operator, left, right);
    }

    public static Call call(String name, List<ExpressionNode> args) {
        return new Call(name, args);
    }

    public static final class Literal extends ExpressionNode {
        private final double value;

        private Literal(double value) {
            super(NodeKind.LITERAL);
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal other && Double.compare(value, other.value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    public static final class BinaryOp extends ExpressionNode {
        private final OperatorKind operator;
        private final ExpressionNode left;
        private final ExpressionNode right;

        private BinaryOp(OperatorKind operator, ExpressionNode left, ExpressionNode right) {
            super(NodeKind.BINARY_OP);
            if (!operator.isBinary()) {
                throw new IllegalArgumentException("Not a binary operator: " + operator);
            }
            this.operator = operator;
            this.left = Objects.requireNonNull(left, "left");
            this.right = Objects.requireNonNull(right, "right");
        }

        public OperatorKind getOperator() {
            return operator;
        }

        public ExpressionNode getLeft() {
            return left;
        }

        public ExpressionNode getRight() {
            return right;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BinaryOp other
                    && operator == other.operator
                    && left.equals(other.left)
                    && right.equals(other.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operator, left, right);
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.getSymbol() + " " + right + ")";
        }
    }

    public static final class Call extends ExpressionNode {
        private final String name;
        private final List<ExpressionNode> args;

        private Call(String name, List<ExpressionNode> args) {
            super(NodeKind.CALL);
            this.name = Objects.requireNonNull(name, "name");
            this.args = List.copyOf(args);
        }

        public String getName() {
            return name;
        }

        public List<ExpressionNode> getArgs() {
            return args;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Call other && name.equals(other.name) && args.equals(other.args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, args);
        }

        @Override
        public String toString() {
            return name + args.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
        }
    }
}

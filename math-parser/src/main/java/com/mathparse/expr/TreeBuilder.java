package com.mathparse.expr;

import com.mathparse.util.LoggingUtil;

import java.util.*;

/**
 * Builds an expression tree from the postfix sequence produced by {@link ShuntingYardConverter}.
 * Function calls arrive as {@code arg1 .. argN N name}; the count literal tells how many
 * operands to take back off the stack.
 */
public class TreeBuilder {

    private final FunctionRegistry registry;
    private final Evaluator evaluator;

    public TreeBuilder(FunctionRegistry registry) {
        this.registry = registry;
        this.evaluator = new Evaluator(registry);
    }

    public Optional<ExpressionNode> build(List<Token> postfix) {
        Deque<ExpressionNode> stack = new ArrayDeque<>();

        for (Token token : postfix) {
            if (token.isNumber()) {
                stack.push(ExpressionNode.literal(token.getValue()));
            } else if (token.isFunction()) {
                stack.push(buildCall(token.getFunctionName(), stack));
            } else if (token.isOperator()) {
                ExpressionNode right = pop(stack, token);
                ExpressionNode left = pop(stack, token);
                stack.push(ExpressionNode.binary(token.getOperator(), left, right));
            } else {
                throw new ExpressionSyntaxException("Unexpected '" + token + "' in postfix sequence");
            }
        }

        if (stack.size() > 1) {
            throw new ExpressionSyntaxException("Expression has " + stack.size()
                    + " unconnected terms; an operator is missing");
        }

        Optional<ExpressionNode> root = Optional.ofNullable(stack.peek());
        LoggingUtil.debug("build: " + root.map(String::valueOf).orElse("<empty>"));
        return root;
    }

    private ExpressionNode buildCall(String name, Deque<ExpressionNode> stack) {
        ExpressionNode countNode = stack.poll();
        if (countNode == null) {
            throw new ExpressionSyntaxException("Missing argument count for function " + name);
        }
        double count = evaluator.evaluate(countNode, EvaluationConfig.defaults());
        if (count < 1 || count != Math.rint(count) || count > stack.size()) {
            throw new ExpressionSyntaxException("Function " + name + " is missing arguments");
        }

        // operands come off the stack last-first
        List<ExpressionNode> args = new ArrayList<>((int) count);
        for (int i = 0; i < count; i++) {
            args.add(stack.pop());
        }
        Collections.reverse(args);

        MathFunction function = registry.lookup(name);
        if (function == null) {
            throw new UnknownFunctionException(name);
        }
        if (!function.getArity().accepts(args.size())) {
            throw new ArityMismatchException(name, function.getArity(), args.size());
        }
        return ExpressionNode.call(function.getName(), args);
    }

    private ExpressionNode pop(Deque<ExpressionNode> stack, Token operator) {
        ExpressionNode node = stack.poll();
        if (node == null) {
            throw new ExpressionSyntaxException("Operator '" + operator + "' is missing an operand");
        }
        return node;
    }
}

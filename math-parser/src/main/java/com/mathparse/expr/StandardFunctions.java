package com.mathparse.expr;

import java.util.Arrays;

public class StandardFunctions {

    /** Largest n whose factorial is still a finite double. */
    private static final int MAX_FINITE_FACTORIAL = 170;

    public static void register(FunctionRegistry registry) {
        // Trigonometry, angle unit applies to the argument
        registry.register("sin", Arity.exactly(1), (args, cfg) -> Math.sin(toRadians(args[0], cfg)));
        registry.register("cos", Arity.exactly(1), (args, cfg) -> Math.cos(toRadians(args[0], cfg)));
        registry.register("tan", Arity.exactly(1), (args, cfg) -> Math.tan(toRadians(args[0], cfg)));

        // Inverse trigonometry, angle unit applies to the result
        registry.register("arcsin", Arity.exactly(1), (args, cfg) -> fromRadians(Math.asin(args[0]), cfg));
        registry.register("arccos", Arity.exactly(1), (args, cfg) -> fromRadians(Math.acos(args[0]), cfg));
        registry.register("arctan", Arity.exactly(1), (args, cfg) -> fromRadians(Math.atan(args[0]), cfg));

        // Roots
        registry.register("sqrt", Arity.exactly(1), (args, cfg) -> Math.sqrt(args[0]));
        registry.register("rad", Arity.exactly(2), (args, cfg) -> Math.pow(args[0], 1 / args[1]));

        // Logarithms. Note the names: log is base e and ln is base 2. Existing callers rely on it.
        registry.register("log", Arity.exactly(1), (args, cfg) -> Math.log(args[0]));
        registry.register("ln", Arity.exactly(1), (args, cfg) -> Math.log(args[0]) / Math.log(2));

        // Aggregates
        registry.register("avg", Arity.atLeast(1), (args, cfg) -> Arrays.stream(args).sum() / args.length);
        registry.register("min", Arity.atLeast(1), (args, cfg) -> Arrays.stream(args).min().orElse(Double.NaN));
        registry.register("max", Arity.atLeast(1), (args, cfg) -> Arrays.stream(args).max().orElse(Double.NaN));
        registry.register("med", Arity.atLeast(1), (args, cfg) -> median(args));

        // Integer rounding
        registry.register("factorial", Arity.exactly(1), (args, cfg) -> factorial(args[0]));
        registry.register("ceil", Arity.exactly(1), (args, cfg) -> Math.ceil(args[0]));
        registry.register("floor", Arity.exactly(1), (args, cfg) -> Math.floor(args[0]));
        registry.register("int", Arity.exactly(1), (args, cfg) -> truncate(args[0]));
    }

    private static double toRadians(double angle, EvaluationConfig config) {
        return config.isDegrees() ? Math.toRadians(angle) : angle;
    }

    private static double fromRadians(double angle, EvaluationConfig config) {
        return config.isDegrees() ? Math.toDegrees(angle) : angle;
    }

    private static double median(double[] args) {
        double[] sorted = args.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[mid - 1] + sorted[mid]) / 2;
        }
        return sorted[mid];
    }

    private static double factorial(double value) {
        if (Double.isNaN(value)) return Double.NaN;
        double n = truncate(value);
        if (n > MAX_FINITE_FACTORIAL) return Double.POSITIVE_INFINITY;

        double result = 1.0;
        for (int i = 2; i <= n; i++) {
            result *= i;
        }
        return result;
    }

    private static double truncate(double value) {
        return value < 0 ? Math.ceil(value) : Math.floor(value);
    }
}

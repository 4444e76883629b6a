package com.mathparse.expr;

/**
 * Number of arguments a registered function accepts: either an exact count or a lower bound.
 */
public final class Arity {

    private final int min;
    private final boolean variadic;

    private Arity(int min, boolean variadic) {
        if (min < 0) throw new IllegalArgumentException("Arity cannot be negative: " + min);
        this.min = min;
        this.variadic = variadic;
    }

    public static Arity exactly(int count) {
        return new Arity(count, false);
    }

    public static Arity atLeast(int count) {
        return new Arity(count, true);
    }

    public boolean accepts(int count) {
        return variadic ? count >= min : count == min;
    }

    public boolean isVariadic() {
        return variadic;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Arity other && min == other.min && variadic == other.variadic;
    }

    @Override
    public int hashCode() {
        return 31 * min + (variadic ? 1 : 0);
    }

    @Override
    public String toString() {
        String noun = min == 1 ? " argument" : " arguments";
        return variadic ? "at least " + min + noun : min + noun;
    }
}

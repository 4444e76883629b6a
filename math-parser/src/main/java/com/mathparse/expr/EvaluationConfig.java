package com.mathparse.expr;

import java.util.Objects;

/**
 * Immutable settings handed to every evaluation call. Nothing in the pipeline keeps a reference
 * to it between calls, so a caller switching units never affects an evaluation in flight.
 */
public final class EvaluationConfig {

    private static final EvaluationConfig DEFAULTS = new EvaluationConfig(AngleUnit.DEGREES);

    private final AngleUnit angleUnit;

    private EvaluationConfig(AngleUnit angleUnit) {
        this.angleUnit = Objects.requireNonNull(angleUnit, "angleUnit");
    }

    public static EvaluationConfig defaults() {
        return DEFAULTS;
    }

    public static EvaluationConfig of(AngleUnit angleUnit) {
        return angleUnit == DEFAULTS.angleUnit ? DEFAULTS : new EvaluationConfig(angleUnit);
    }

    public EvaluationConfig withAngleUnit(AngleUnit unit) {
        return of(unit);
    }

    public AngleUnit getAngleUnit() {
        return angleUnit;
    }

    public boolean isDegrees() {
        return angleUnit == AngleUnit.DEGREES;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EvaluationConfig other && angleUnit == other.angleUnit;
    }

    @Override
    public int hashCode() {
        return angleUnit.hashCode();
    }

    @Override
    public String toString() {
        return "EvaluationConfig{angleUnit=" + angleUnit + "}";
    }
}

package com.mathparse.expr;

/**
 * Unit used by the trigonometric functions:
 * DEGREES: arguments of sin/cos/tan and results of arcsin/arccos/arctan are in degrees
 * RADIANS: all angles are in radians
 */
public enum AngleUnit {
    DEGREES,
    RADIANS
}

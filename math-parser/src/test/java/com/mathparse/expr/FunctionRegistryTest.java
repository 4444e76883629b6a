package com.mathparse.expr;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionRegistryTest {

    private FunctionRegistry registry;

    @BeforeEach
    public void setup() {
        registry = FunctionRegistry.standard();
    }

    @Test
    public void testStandardTable() {
        assertEquals(Set.of("sin", "cos", "tan", "arcsin", "arccos", "arctan", "sqrt", "rad", "log", "ln",
                        "avg", "min", "max", "med", "factorial", "ceil", "floor", "int"),
                registry.names());
    }

    @Test
    public void testArities() {
        assertEquals(Arity.exactly(2), registry.lookup("rad").getArity());
        assertEquals(Arity.exactly(1), registry.lookup("sqrt").getArity());
        for (String name : new String[]{"avg", "min", "max", "med"}) {
            Arity arity = registry.lookup(name).getArity();
            assertTrue(arity.isVariadic(), name);
            assertTrue(arity.accepts(1), name);
            assertTrue(arity.accepts(7), name);
            assertFalse(arity.accepts(0), name);
        }
    }

    @Test
    public void testArityDescription() {
        assertEquals("1 argument", Arity.exactly(1).toString());
        assertEquals("2 arguments", Arity.exactly(2).toString());
        assertEquals("at least 1 argument", Arity.atLeast(1).toString());
        assertFalse(Arity.exactly(2).accepts(3));
    }

    @Test
    public void testUnknownLookup() {
        assertNull(registry.lookup("foo"));
        assertFalse(registry.contains("foo"));
    }

    @Test
    public void testLookupIgnoresCase() {
        assertTrue(registry.contains("SQRT"));
        assertEquals("sqrt", registry.lookup("Sqrt").getName());
    }

    @Test
    public void testRegisterCustomFunction() {
        registry.register("hypot", Arity.exactly(2), (args, cfg) -> Math.hypot(args[0], args[1]));

        MathParser parser = new MathParser(registry);
        assertEquals(5.0, parser.evaluate("hypot(3,4)"), 1e-9);
        assertEquals(10.0, parser.evaluate("2hypot(3,4)"), 1e-9);
    }

    @Test
    public void testRegistriesAreIndependent() {
        registry.register("twice", Arity.exactly(1), (args, cfg) -> 2 * args[0]);
        assertFalse(FunctionRegistry.standard().contains("twice"));
    }
}

package com.mathparse.expr;

import java.util.*;

public class FunctionRegistry {

    private final Map<String, MathFunction> functions = new LinkedHashMap<>();

    /**
     * A new registry holding the functions of {@link StandardFunctions}.
     */
    public static FunctionRegistry standard() {
        FunctionRegistry registry = new FunctionRegistry();
        StandardFunctions.register(registry);
        return registry;
    }

    public void register(String name, Arity arity, NumericFunction implementation) {
        Objects.requireNonNull(implementation, "implementation");
        String key = name.toLowerCase(Locale.ROOT);
        functions.put(key, new MathFunction(key, arity, implementation));
    }

    public MathFunction lookup(String name) {
        return functions.get(name.toLowerCase(Locale.ROOT));
    }

    public boolean contains(String name) {
        return functions.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }
}

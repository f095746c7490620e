package com.spreadsheet.formula.functions;

import java.time.Clock;

/**
 * Populates a {@link FunctionRegistry} with every built-in function.
 */
public final class BuiltInFunctions {

    private BuiltInFunctions() {
    }

    public static FunctionRegistry createRegistry(Clock clock) {
        FunctionRegistry registry = new FunctionRegistry();
        register(registry, clock);
        return registry;
    }

    public static void register(FunctionRegistry registry, Clock clock) {
        MathFunctions.register(registry);
        LogicalFunctions.register(registry);
        TextFunctions.register(registry);
        LookupFunctions.register(registry);
        DateTimeFunctions.register(registry, clock);
        InfoFunctions.register(registry);
    }
}

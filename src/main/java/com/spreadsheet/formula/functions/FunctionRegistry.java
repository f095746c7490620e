package com.spreadsheet.formula.functions;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central dictionary of formula functions, keyed by upper-case name.
 * The parser never consults it; the evaluator looks names up at call time,
 * so adding a function needs no grammar change.
 */
public class FunctionRegistry {

    private final Map<String, FunctionDefinition> functions = new ConcurrentHashMap<>();

    /**
     * Registers (or replaces) a function that receives only non-error arguments.
     */
    public void register(String name, int minArgs, int maxArgs, FormulaFunction implementation) {
        String key = name.toUpperCase(Locale.ROOT);
        functions.put(key, new FunctionDefinition(key, minArgs, maxArgs, false, implementation));
    }

    /**
     * Registers a function that inspects error arguments itself (IFERROR, ISERROR...).
     */
    public void registerErrorTolerant(String name, int minArgs, int maxArgs, FormulaFunction implementation) {
        String key = name.toUpperCase(Locale.ROOT);
        functions.put(key, new FunctionDefinition(key, minArgs, maxArgs, true, implementation));
    }

    /**
     * @return the definition, or null when the name is unknown
     */
    public FunctionDefinition get(String name) {
        return functions.get(name.toUpperCase(Locale.ROOT));
    }

    public boolean contains(String name) {
        return functions.containsKey(name.toUpperCase(Locale.ROOT));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }
}

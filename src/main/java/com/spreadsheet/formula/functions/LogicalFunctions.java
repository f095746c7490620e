package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluation.TypeCoercion;
import com.spreadsheet.formula.models.ErrorKind;
import com.spreadsheet.formula.models.FormulaValue;

import java.util.List;
import java.util.stream.Collectors;

import static com.spreadsheet.formula.functions.FunctionDefinition.VARIADIC;
import static com.spreadsheet.formula.functions.FunctionSupport.error;
import static com.spreadsheet.formula.functions.FunctionSupport.flatten;
import static com.spreadsheet.formula.functions.FunctionSupport.optional;
import static com.spreadsheet.formula.functions.FunctionSupport.scalar;

/**
 * IF, AND, OR, NOT, IFS and IFERROR. Arguments are evaluated before the call, so
 * an error in the branch not taken still surfaces (except through IFERROR).
 */
final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("IF", 2, 3, LogicalFunctions::ifFunction);
        registry.register("AND", 1, VARIADIC, args -> FormulaValue.bool(booleans(args).stream().allMatch(b -> b)));
        registry.register("OR", 1, VARIADIC, args -> FormulaValue.bool(booleans(args).stream().anyMatch(b -> b)));
        registry.register("NOT", 1, 1, args -> FormulaValue.bool(!TypeCoercion.toBoolean(args.get(0))));
        registry.register("IFS", 2, VARIADIC, LogicalFunctions::ifs);
        registry.registerErrorTolerant("IFERROR", 2, 2, LogicalFunctions::ifError);
    }

    private static FormulaValue ifFunction(List<FormulaValue> args) {
        if (TypeCoercion.toBoolean(args.get(0))) {
            return scalar(args.get(1));
        }
        return scalar(optional(args, 2, FormulaValue.FALSE));
    }

    /**
     * Blank cells are skipped; a call with nothing left to test is #VALUE!.
     */
    private static List<Boolean> booleans(List<FormulaValue> args) {
        List<Boolean> values = flatten(args).stream()
                .filter(value -> !value.isEmpty())
                .map(TypeCoercion::toBoolean)
                .collect(Collectors.toList());
        if (values.isEmpty()) {
            throw error(ErrorKind.VALUE, "No logical values to test");
        }
        return values;
    }

    private static FormulaValue ifs(List<FormulaValue> args) {
        if (args.size() % 2 != 0) {
            throw error(ErrorKind.NOT_AVAILABLE, "IFS expects condition/value pairs");
        }
        for (int i = 0; i < args.size(); i += 2) {
            if (TypeCoercion.toBoolean(args.get(i))) {
                return scalar(args.get(i + 1));
            }
        }
        throw error(ErrorKind.NOT_AVAILABLE, "No IFS condition was true");
    }

    private static FormulaValue ifError(List<FormulaValue> args) {
        FormulaValue value = scalar(args.get(0));
        return value.isError() ? scalar(args.get(1)) : value;
    }
}

package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.ErrorKind;
import com.spreadsheet.formula.models.FormulaValue;

import static com.spreadsheet.formula.functions.FunctionSupport.scalar;

/**
 * Type tests. ISERROR and ISNA see error arguments; the others let an error
 * argument become their result.
 */
final class InfoFunctions {

    private InfoFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("ISBLANK", 1, 1, args -> FormulaValue.bool(scalar(args.get(0)).isEmpty()));
        registry.register("ISNUMBER", 1, 1, args -> FormulaValue.bool(scalar(args.get(0)).isNumber()));
        registry.register("ISTEXT", 1, 1, args -> FormulaValue.bool(scalar(args.get(0)).isString()));
        registry.registerErrorTolerant("ISERROR", 1, 1, args -> FormulaValue.bool(scalar(args.get(0)).isError()));
        registry.registerErrorTolerant("ISNA", 1, 1, args -> {
            FormulaValue value = scalar(args.get(0));
            return FormulaValue.bool(value.isError() && value.getErrorKind() == ErrorKind.NOT_AVAILABLE);
        });
    }
}

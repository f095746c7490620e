package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluation.RangeValue;
import com.spreadsheet.formula.evaluation.TypeCoercion;
import com.spreadsheet.formula.models.ErrorKind;
import com.spreadsheet.formula.models.FormulaValue;

import java.util.ArrayList;
import java.util.List;

import static com.spreadsheet.formula.functions.FunctionSupport.asRange;
import static com.spreadsheet.formula.functions.FunctionSupport.error;
import static com.spreadsheet.formula.functions.FunctionSupport.integer;
import static com.spreadsheet.formula.functions.FunctionSupport.optional;
import static com.spreadsheet.formula.functions.FunctionSupport.scalar;
import static com.spreadsheet.formula.functions.FunctionSupport.valuesEqual;

/**
 * VLOOKUP, HLOOKUP, INDEX and MATCH. The lookups only support exact matching.
 */
final class LookupFunctions {

    private static final FormulaValue ONE = FormulaValue.number(1);

    private LookupFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("VLOOKUP", 3, 4, args -> lookup(args, true));
        registry.register("HLOOKUP", 3, 4, args -> lookup(args, false));
        registry.register("INDEX", 2, 3, LookupFunctions::index);
        registry.register("MATCH", 2, 3, LookupFunctions::match);
    }

    private static FormulaValue lookup(List<FormulaValue> args, boolean vertical) {
        FormulaValue key = scalar(args.get(0));
        RangeValue table = asRange(args.get(1));
        int index = integer(args.get(2));
        if (TypeCoercion.toBoolean(optional(args, 3, FormulaValue.FALSE))) {
            throw error(ErrorKind.VALUE, "Approximate match lookups are not supported");
        }
        int limit = vertical ? table.getWidth() : table.getHeight();
        if (index < 1 || index > limit) {
            throw error(ErrorKind.REF, "Lookup index " + index + " is outside the table");
        }
        int candidates = vertical ? table.getHeight() : table.getWidth();
        for (int i = 0; i < candidates; i++) {
            FormulaValue probe = vertical ? table.get(i, 0) : table.get(0, i);
            if (valuesEqual(key, probe)) {
                return vertical ? table.get(i, index - 1) : table.get(index - 1, i);
            }
        }
        throw error(ErrorKind.NOT_AVAILABLE, "Value " + key.toDisplayString() + " not found");
    }

    /**
     * INDEX(array, row, [column]). A row or column of 0 selects the whole column or row,
     * which is only useful as the argument of another function.
     */
    private static FormulaValue index(List<FormulaValue> args) {
        RangeValue array = asRange(args.get(0));
        int row = integer(args.get(1));
        int column = integer(optional(args, 2, ONE));
        // a single row or column may be indexed by position alone
        if (args.size() == 2 && array.getHeight() == 1 && array.getWidth() > 1) {
            column = row;
            row = 1;
        }
        if (row < 0 || row > array.getHeight() || column < 0 || column > array.getWidth()) {
            throw error(ErrorKind.REF, "INDEX position is outside the range");
        }
        if (row == 0 && column == 0) {
            return array;
        }
        if (row == 0) {
            List<FormulaValue> values = new ArrayList<>();
            for (int r = 0; r < array.getHeight(); r++) {
                values.add(array.get(r, column - 1));
            }
            return new RangeValue(values, 1, array.getHeight());
        }
        if (column == 0) {
            List<FormulaValue> values = new ArrayList<>();
            for (int c = 0; c < array.getWidth(); c++) {
                values.add(array.get(row - 1, c));
            }
            return new RangeValue(values, array.getWidth(), 1);
        }
        return array.get(row - 1, column - 1);
    }

    /**
     * MATCH(value, array, [type]). Type 0 finds the first equal entry; 1 the last entry
     * not greater than the value in an ascending list; -1 the last entry not less than
     * the value in a descending list.
     */
    private static FormulaValue match(List<FormulaValue> args) {
        FormulaValue key = scalar(args.get(0));
        List<FormulaValue> values = asRange(args.get(1)).getValues();
        int type = integer(optional(args, 2, ONE));
        if (type == 0) {
            for (int i = 0; i < values.size(); i++) {
                if (valuesEqual(key, values.get(i))) {
                    return FormulaValue.number(i + 1);
                }
            }
            throw error(ErrorKind.NOT_AVAILABLE, "No exact match found");
        }
        if (type != 1 && type != -1) {
            throw error(ErrorKind.VALUE, "match_type must be -1, 0 or 1");
        }
        int found = -1;
        for (int i = 0; i < values.size(); i++) {
            FormulaValue candidate = values.get(i);
            if (candidate.isError()) {
                break;
            }
            int comparison = TypeCoercion.compare(candidate, key);
            if (type == 1 ? comparison <= 0 : comparison >= 0) {
                found = i;
            } else {
                break;
            }
        }
        if (found < 0) {
            throw error(ErrorKind.NOT_AVAILABLE, "No match found");
        }
        return FormulaValue.number(found + 1);
    }
}

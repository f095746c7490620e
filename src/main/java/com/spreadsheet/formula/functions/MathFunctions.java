package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluation.RangeValue;
import com.spreadsheet.formula.evaluation.TypeCoercion;
import com.spreadsheet.formula.models.ErrorKind;
import com.spreadsheet.formula.models.FormulaValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static com.spreadsheet.formula.functions.FunctionDefinition.VARIADIC;
import static com.spreadsheet.formula.functions.FunctionSupport.error;
import static com.spreadsheet.formula.functions.FunctionSupport.flatten;
import static com.spreadsheet.formula.functions.FunctionSupport.number;
import static com.spreadsheet.formula.functions.FunctionSupport.optional;

/**
 * Aggregates and arithmetic functions.
 * <p>
 * Aggregates accept any mix of scalars and ranges. SUM and SUMPRODUCT treat text
 * that is not a number as 0; AVERAGE, MIN, MAX, PRODUCT and MEDIAN only look at
 * numeric entries.
 */
final class MathFunctions {

    private static final int MAX_ROUND_DIGITS = 340;

    private MathFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("SUM", 0, VARIADIC, MathFunctions::sum);
        registry.register("AVERAGE", 1, VARIADIC, MathFunctions::average);
        registry.register("MIN", 1, VARIADIC, MathFunctions::min);
        registry.register("MAX", 1, VARIADIC, MathFunctions::max);
        registry.register("COUNT", 0, VARIADIC, MathFunctions::count);
        registry.register("COUNTA", 0, VARIADIC, MathFunctions::countA);
        registry.register("ROUND", 1, 2, MathFunctions::round);
        registry.register("SUMIF", 2, 3, MathFunctions::sumIf);
        registry.register("SUMPRODUCT", 1, VARIADIC, MathFunctions::sumProduct);
        registry.register("ABS", 1, 1, args -> FormulaValue.number(Math.abs(number(args.get(0)))));
        registry.register("CEILING", 1, 2, args -> roundToMultiple(args, true));
        registry.register("FLOOR", 1, 2, args -> roundToMultiple(args, false));
        registry.register("INT", 1, 1, args -> FormulaValue.number(Math.floor(number(args.get(0)))));
        registry.register("MOD", 2, 2, MathFunctions::mod);
        registry.register("POWER", 2, 2, MathFunctions::power);
        registry.register("SQRT", 1, 1, MathFunctions::sqrt);
        registry.register("PRODUCT", 1, VARIADIC, MathFunctions::product);
        registry.register("COUNTIF", 2, 2, MathFunctions::countIf);
        registry.register("MEDIAN", 1, VARIADIC, MathFunctions::median);
    }

    private static FormulaValue sum(List<FormulaValue> args) {
        double total = 0;
        for (FormulaValue value : flatten(args)) {
            total += TypeCoercion.toNumberOrZero(value);
        }
        return FormulaValue.number(total);
    }

    private static List<Double> numbersOnly(List<FormulaValue> args) {
        return flatten(args).stream()
                .filter(FunctionSupport::isNumeric)
                .map(TypeCoercion::toNumber)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static FormulaValue average(List<FormulaValue> args) {
        List<Double> numbers = numbersOnly(args);
        if (numbers.isEmpty()) {
            return FormulaValue.number(0);
        }
        double total = 0;
        for (double n : numbers) {
            total += n;
        }
        return FormulaValue.number(total / numbers.size());
    }

    private static FormulaValue min(List<FormulaValue> args) {
        return FormulaValue.number(numbersOnly(args).stream().mapToDouble(Double::doubleValue).min().orElse(0));
    }

    private static FormulaValue max(List<FormulaValue> args) {
        return FormulaValue.number(numbersOnly(args).stream().mapToDouble(Double::doubleValue).max().orElse(0));
    }

    private static FormulaValue count(List<FormulaValue> args) {
        return FormulaValue.number(numbersOnly(args).size());
    }

    private static FormulaValue countA(List<FormulaValue> args) {
        long count = flatten(args).stream()
                .filter(value -> !value.isEmpty() && !(value.isString() && value.getText().isEmpty()))
                .count();
        return FormulaValue.number(count);
    }

    /**
     * Half away from zero, like a spreadsheet; negative digits round left of the point.
     */
    private static FormulaValue round(List<FormulaValue> args) {
        double value = number(args.get(0));
        int digits = Math.max(-MAX_ROUND_DIGITS, Math.min(MAX_ROUND_DIGITS,
                FunctionSupport.integer(optional(args, 1, FormulaValue.number(0)))));
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP);
        return FormulaValue.number(rounded.doubleValue());
    }

    private static FormulaValue sumIf(List<FormulaValue> args) {
        RangeValue criteriaRange = FunctionSupport.asRange(args.get(0));
        RangeValue sumRange = FunctionSupport.asRange(optional(args, 2, args.get(0)));
        if (criteriaRange.size() != sumRange.size()) {
            throw error(ErrorKind.VALUE, "SUMIF ranges must be the same size");
        }
        Predicate<FormulaValue> test = FunctionSupport.criteria(args.get(1));
        double total = 0;
        for (int i = 0; i < criteriaRange.size(); i++) {
            if (test.test(criteriaRange.getValues().get(i))) {
                total += TypeCoercion.toNumberOrZero(sumRange.getValues().get(i));
            }
        }
        return FormulaValue.number(total);
    }

    private static FormulaValue countIf(List<FormulaValue> args) {
        Predicate<FormulaValue> test = FunctionSupport.criteria(args.get(1));
        long count = FunctionSupport.asRange(args.get(0)).getValues().stream().filter(test).count();
        return FormulaValue.number(count);
    }

    private static FormulaValue sumProduct(List<FormulaValue> args) {
        int length = FunctionSupport.asRange(args.get(0)).size();
        for (FormulaValue arg : args) {
            if (FunctionSupport.asRange(arg).size() != length) {
                throw error(ErrorKind.VALUE, "SUMPRODUCT arrays must be the same size");
            }
        }
        double total = 0;
        for (int i = 0; i < length; i++) {
            double product = 1;
            for (FormulaValue arg : args) {
                product *= TypeCoercion.toNumberOrZero(FunctionSupport.asRange(arg).getValues().get(i));
            }
            total += product;
        }
        return FormulaValue.number(total);
    }

    private static FormulaValue roundToMultiple(List<FormulaValue> args, boolean up) {
        double value = number(args.get(0));
        double significance = number(optional(args, 1, FormulaValue.number(1)));
        if (significance == 0) {
            if (up) {
                return FormulaValue.number(0);
            }
            throw error(ErrorKind.DIV_ZERO, "FLOOR significance cannot be 0");
        }
        if (value > 0 && significance < 0) {
            throw error(ErrorKind.NUM, "Significance must have the same sign as the number");
        }
        double steps = value / significance;
        return FormulaValue.number((up ? Math.ceil(steps) : Math.floor(steps)) * significance);
    }

    private static FormulaValue mod(List<FormulaValue> args) {
        double dividend = number(args.get(0));
        double divisor = number(args.get(1));
        if (divisor == 0) {
            throw error(ErrorKind.DIV_ZERO, "MOD divisor cannot be 0");
        }
        // result takes the sign of the divisor
        return FormulaValue.number(dividend - divisor * Math.floor(dividend / divisor));
    }

    private static FormulaValue power(List<FormulaValue> args) {
        double base = number(args.get(0));
        double exponent = number(args.get(1));
        if (base == 0 && exponent < 0) {
            throw error(ErrorKind.DIV_ZERO, "Zero raised to a negative power");
        }
        return FormulaValue.number(Math.pow(base, exponent));
    }

    private static FormulaValue sqrt(List<FormulaValue> args) {
        double value = number(args.get(0));
        if (value < 0) {
            throw error(ErrorKind.NUM, "SQRT of a negative number");
        }
        return FormulaValue.number(Math.sqrt(value));
    }

    private static FormulaValue product(List<FormulaValue> args) {
        List<Double> numbers = numbersOnly(args);
        if (numbers.isEmpty()) {
            return FormulaValue.number(0);
        }
        double product = 1;
        for (double n : numbers) {
            product *= n;
        }
        return FormulaValue.number(product);
    }

    private static FormulaValue median(List<FormulaValue> args) {
        List<Double> numbers = numbersOnly(args);
        if (numbers.isEmpty()) {
            throw error(ErrorKind.NUM, "MEDIAN needs at least one number");
        }
        numbers.sort(Double::compare);
        int middle = numbers.size() / 2;
        if (numbers.size() % 2 == 1) {
            return FormulaValue.number(numbers.get(middle));
        }
        return FormulaValue.number((numbers.get(middle - 1) + numbers.get(middle)) / 2);
    }
}

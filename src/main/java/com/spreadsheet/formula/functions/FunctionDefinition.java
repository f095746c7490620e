package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.models.ErrorKind;
import com.spreadsheet.formula.models.FormulaValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A registered function together with its arity and error policy.
 */
public class FunctionDefinition {

    public static final int VARIADIC = Integer.MAX_VALUE;

    private static final Logger logger = LoggerFactory.getLogger(FunctionDefinition.class);

    private final String name;
    private final int minArgs;
    private final int maxArgs;
    private final boolean errorTolerant;
    private final FormulaFunction implementation;

    public FunctionDefinition(String name, int minArgs, int maxArgs, boolean errorTolerant,
                              FormulaFunction implementation) {
        this.name = name;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.errorTolerant = errorTolerant;
        this.implementation = implementation;
    }

    public String getName() {
        return name;
    }

    /**
     * Error-tolerant functions (IFERROR, ISERROR, ...) receive error arguments
     * instead of having the first one short-circuit the call.
     */
    public boolean isErrorTolerant() {
        return errorTolerant;
    }

    /**
     * Runs the function. Never throws: wrong arity is #N/A, a declared failure is
     * its own error kind, and any other fault is logged and reported as #VALUE!.
     */
    public FormulaValue invoke(List<FormulaValue> args) {
        if (args.size() < minArgs || args.size() > maxArgs) {
            return FormulaValue.error(ErrorKind.NOT_AVAILABLE);
        }
        FormulaValue result;
        try {
            result = implementation.apply(args);
        } catch (FormulaErrorException e) {
            return FormulaValue.error(e.getErrorKind());
        } catch (ArithmeticException e) {
            return FormulaValue.error(ErrorKind.DIV_ZERO);
        } catch (RuntimeException e) {
            logger.warn("Function {} failed with {}", name, e.toString());
            return FormulaValue.error(ErrorKind.VALUE);
        }
        if (result == null) {
            return FormulaValue.EMPTY;
        }
        if (result.isNumber() && (Double.isNaN(result.getNumber()) || Double.isInfinite(result.getNumber()))) {
            return FormulaValue.error(ErrorKind.NUM);
        }
        return result;
    }
}

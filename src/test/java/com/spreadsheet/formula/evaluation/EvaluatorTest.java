package com.spreadsheet.formula.evaluation;

import com.spreadsheet.formula.functions.BuiltInFunctions;
import com.spreadsheet.formula.models.ErrorKind;
import com.spreadsheet.formula.models.FormulaValue;
import com.spreadsheet.formula.models.GridBounds;
import com.spreadsheet.formula.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Evaluator: operators, coercion, error propagation and references.
 */
class EvaluatorTest {

    private Evaluator evaluator;
    private Map<String, FormulaValue> cells;

    @BeforeEach
    void setUp() {
        evaluator = new Evaluator(BuiltInFunctions.createRegistry(Clock.systemUTC()), new GridBounds(26, 100));
        cells = new HashMap<>();
    }

    private FormulaValue eval(String formula) {
        return evaluator.evaluate(Parser.parseFormula(formula), id -> cells.getOrDefault(id, FormulaValue.EMPTY));
    }

    private void assertError(ErrorKind expected, String formula) {
        FormulaValue value = eval(formula);
        assertTrue(value.isError(), formula + " should be an error but was " + value);
        assertEquals(expected, value.getErrorKind(), formula);
    }

    /**
     * Test arithmetic precedence and associativity.
     */
    @Test
    void testArithmetic() {
        assertEquals(7, eval("=1+2*3").getNumber());
        assertEquals(9, eval("=(1+2)*3").getNumber());
        assertEquals(64, eval("=2^3^2").getNumber());
        assertEquals(4, eval("=-2^2").getNumber());
        assertEquals(2.5, eval("=5/2").getNumber());
        assertEquals(-1, eval("=1-2").getNumber());
    }

    /**
     * Test that text and booleans are coerced to numbers by arithmetic.
     */
    @Test
    void testNumericCoercion() {
        assertEquals(6, eval("=\"5\"+1").getNumber());
        assertEquals(2, eval("=TRUE+1").getNumber());
        assertError(ErrorKind.VALUE, "=\"a\"+1");
    }

    /**
     * Test that blank cells act as 0 in arithmetic and "" in concatenation.
     */
    @Test
    void testBlankCells() {
        assertEquals(FormulaValue.number(0), eval("=A1"));
        assertEquals(1, eval("=A1+1").getNumber());
        assertEquals("x", eval("=A1&\"x\"").getText());
    }

    /**
     * Test concatenation of mixed types.
     */
    @Test
    void testConcatenation() {
        assertEquals("12", eval("=1&2").getText());
        assertEquals("1.5", eval("=1.5&\"\"").getText());
        assertEquals("TRUEx", eval("=TRUE&\"x\"").getText());
    }

    /**
     * Test the cross-type order and case-insensitive string comparison.
     */
    @Test
    void testComparisons() {
        assertTrue(eval("=1<\"a\"").getBoolean());
        assertTrue(eval("=\"a\"<TRUE").getBoolean());
        assertTrue(eval("=\"ABC\"=\"abc\"").getBoolean());
        assertTrue(eval("=2<>3").getBoolean());
        assertFalse(eval("=2>=3").getBoolean());
        assertTrue(eval("=A1=0").getBoolean());
        assertTrue(eval("=A1=\"\"").getBoolean());
    }

    /**
     * Test division by zero and non-finite results.
     */
    @Test
    void testNumericErrors() {
        assertError(ErrorKind.DIV_ZERO, "=1/0");
        assertError(ErrorKind.DIV_ZERO, "=0^-1");
        assertError(ErrorKind.NUM, "=10^400");
    }

    /**
     * Test that the leftmost error wins.
     */
    @Test
    void testFirstErrorWins() {
        assertError(ErrorKind.DIV_ZERO, "=1/0+FOO()");
        assertError(ErrorKind.NAME, "=FOO()+1/0");
        cells.put("A1", FormulaValue.error(ErrorKind.NOT_AVAILABLE));
        assertError(ErrorKind.NOT_AVAILABLE, "=A1*2");
    }

    /**
     * Test unknown functions, wrong arity and parse errors.
     */
    @Test
    void testFunctionErrors() {
        assertError(ErrorKind.NAME, "=FOO(1)");
        assertError(ErrorKind.NOT_AVAILABLE, "=ABS(1,2)");
        assertError(ErrorKind.PARSE, "=SUM(1,2");
        assertError(ErrorKind.PARSE, "=1+");
    }

    /**
     * Test references outside the grid and bare ranges.
     */
    @Test
    void testReferenceErrors() {
        assertError(ErrorKind.REF, "=AA1");
        assertError(ErrorKind.REF, "=A101");
        assertError(ErrorKind.REF, "=A1:B2");
        assertError(ErrorKind.REF, "=SUM(A1:A101)");
    }

    /**
     * Test that an error inside a range argument propagates through an aggregate.
     */
    @Test
    void testErrorInsideRange() {
        cells.put("A1", FormulaValue.number(1));
        cells.put("A2", FormulaValue.error(ErrorKind.NOT_AVAILABLE));
        cells.put("A3", FormulaValue.number(3));

        assertError(ErrorKind.NOT_AVAILABLE, "=SUM(A1:A3)");
        assertEquals(4, eval("=SUM(A1,A3)").getNumber());
    }

    /**
     * Test that only error-tolerant functions see error arguments.
     */
    @Test
    void testErrorTolerantFunctions() {
        assertEquals(5, eval("=IFERROR(1/0, 5)").getNumber());
        assertEquals(3, eval("=IFERROR(3, 5)").getNumber());
        assertTrue(eval("=ISERROR(1/0)").getBoolean());
        // IF evaluates all of its arguments
        assertError(ErrorKind.DIV_ZERO, "=IF(TRUE, 1, 1/0)");
    }

    /**
     * Test that a range argument is read row by row from the cell source.
     */
    @Test
    void testRangeArgument() {
        cells.put("A1", FormulaValue.number(1));
        cells.put("B1", FormulaValue.number(2));
        cells.put("A2", FormulaValue.number(3));
        cells.put("B2", FormulaValue.number(4));

        assertEquals(10, eval("=SUM(A1:B2)").getNumber());
        assertEquals(10, eval("=SUM(B2:A1)").getNumber());
        assertEquals(3, eval("=INDEX(A1:B2,2,1)").getNumber());
    }

    /**
     * Test that an empty formula evaluates to an empty string.
     */
    @Test
    void testEmptyFormula() {
        assertEquals(FormulaValue.string(""), eval("="));
    }

    /**
     * Test that an error cell inside a range argument wins over a later argument's error.
     */
    @Test
    void testRangeErrorPrecedesLaterArgumentError() {
        cells.put("A1", FormulaValue.error(ErrorKind.NOT_AVAILABLE));
        assertError(ErrorKind.NOT_AVAILABLE, "=SUM(A1:A1, 1/0)");
        assertError(ErrorKind.NOT_AVAILABLE, "=SUM(A1, 1/0)");
        assertError(ErrorKind.DIV_ZERO, "=SUM(1/0, A1:A1)");
        assertEquals(0, eval("=COUNTIF(A1:A2, 1)").getNumber());
    }
}

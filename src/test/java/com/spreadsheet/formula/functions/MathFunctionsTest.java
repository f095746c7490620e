package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the aggregate and arithmetic functions.
 */
class MathFunctionsTest {

    private FunctionTestSheet sheet;

    @BeforeEach
    void setUp() {
        sheet = new FunctionTestSheet()
                .set("A1", "1").set("A2", "2").set("A3", "x").set("A4", "4");
    }

    /**
     * Test that aggregates skip or zero out text as documented.
     */
    @Test
    void testAggregatesWithText() {
        assertEquals(7, sheet.number("=SUM(A1:A4)"));
        assertEquals(7.0 / 3, sheet.number("=AVERAGE(A1:A4)"), 1e-12);
        assertEquals(1, sheet.number("=MIN(A1:A4)"));
        assertEquals(4, sheet.number("=MAX(A1:A4)"));
        assertEquals(3, sheet.number("=COUNT(A1:A4)"));
        assertEquals(4, sheet.number("=COUNTA(A1:A5)"));
        assertEquals(8, sheet.number("=PRODUCT(A1:A4)"));
    }

    /**
     * Test aggregates over nothing numeric.
     */
    @Test
    void testEmptyAggregates() {
        assertEquals(0, sheet.number("=SUM()"));
        assertEquals(0, sheet.number("=AVERAGE(B1:B3)"));
        assertEquals(0, sheet.number("=MAX(B1:B3)"));
        assertEquals(ErrorKind.NUM, sheet.error("=MEDIAN(B1:B3)"));
    }

    /**
     * Test that scalars and ranges mix in one call.
     */
    @Test
    void testMixedArguments() {
        assertEquals(17, sheet.number("=SUM(A1:A2, 10, A4)"));
        assertEquals(2.5, sheet.number("=MEDIAN(1,3,2,4)"));
        assertEquals(3, sheet.number("=MEDIAN(5,1,3)"));
    }

    /**
     * Test half-away-from-zero rounding.
     */
    @Test
    void testRound() {
        assertEquals(3, sheet.number("=ROUND(2.5)"));
        assertEquals(-3, sheet.number("=ROUND(-2.5)"));
        assertEquals(3.14, sheet.number("=ROUND(3.14159, 2)"));
        assertEquals(1200, sheet.number("=ROUND(1234, -2)"));
    }

    /**
     * Test SUMIF and COUNTIF criteria.
     */
    @Test
    void testConditionalAggregates() {
        sheet.set("B1", "apple").set("B2", "pear").set("B3", "APPLE")
                .set("C1", "1").set("C2", "2").set("C3", "3");

        assertEquals(6, sheet.number("=SUMIF(A1:A4, \">1\")"));
        assertEquals(4, sheet.number("=SUMIF(B1:B3, \"apple\", C1:C3)"));
        assertEquals(2, sheet.number("=SUMIF(B1:B3, \"<>apple\", C1:C3)"));
        assertEquals(1, sheet.number("=COUNTIF(A1:A4, 2)"));
        assertEquals(2, sheet.number("=COUNTIF(B1:B3, \"Apple\")"));
        assertEquals(2, sheet.number("=COUNTIF(C1:C3, \">=2\")"));
        assertEquals(ErrorKind.VALUE, sheet.error("=SUMIF(B1:B3, \"apple\", C1:C2)"));
    }

    /**
     * Test SUMPRODUCT and its size check.
     */
    @Test
    void testSumProduct() {
        sheet.set("B1", "3").set("B2", "4");

        assertEquals(11, sheet.number("=SUMPRODUCT(A1:A2, B1:B2)"));
        assertEquals(ErrorKind.VALUE, sheet.error("=SUMPRODUCT(A1:A3, B1:B2)"));
    }

    /**
     * Test CEILING and FLOOR.
     */
    @Test
    void testRoundToMultiple() {
        assertEquals(3, sheet.number("=CEILING(2.1, 1)"));
        assertEquals(4.5, sheet.number("=CEILING(4.2, 0.5)"));
        assertEquals(2, sheet.number("=FLOOR(2.9)"));
        assertEquals(0, sheet.number("=CEILING(5, 0)"));
        assertEquals(ErrorKind.DIV_ZERO, sheet.error("=FLOOR(5, 0)"));
        assertEquals(ErrorKind.NUM, sheet.error("=CEILING(5, -1)"));
    }

    /**
     * Test the single-argument math functions.
     */
    @Test
    void testScalarMath() {
        assertEquals(3, sheet.number("=ABS(-3)"));
        assertEquals(-3, sheet.number("=INT(-2.5)"));
        assertEquals(1, sheet.number("=MOD(-3, 2)"));
        assertEquals(-1, sheet.number("=MOD(3, -2)"));
        assertEquals(1024, sheet.number("=POWER(2, 10)"));
        assertEquals(4, sheet.number("=SQRT(16)"));
        assertEquals(ErrorKind.DIV_ZERO, sheet.error("=MOD(5, 0)"));
        assertEquals(ErrorKind.NUM, sheet.error("=SQRT(-1)"));
        assertEquals(ErrorKind.DIV_ZERO, sheet.error("=POWER(0, -1)"));
    }

    /**
     * Test that wrong arity is #N/A.
     */
    @Test
    void testArity() {
        assertEquals(ErrorKind.NOT_AVAILABLE, sheet.error("=ROUND(1, 2, 3)"));
        assertEquals(ErrorKind.NOT_AVAILABLE, sheet.error("=AVERAGE()"));
        assertEquals(ErrorKind.NOT_AVAILABLE, sheet.error("=MOD(1)"));
    }
}

package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the string functions.
 */
class TextFunctionsTest {

    private FunctionTestSheet sheet;

    @BeforeEach
    void setUp() {
        sheet = new FunctionTestSheet();
    }

    /**
     * Test length and case conversion.
     */
    @Test
    void testBasics() {
        assertEquals(5, sheet.number("=LEN(\"hello\")"));
        assertEquals(3, sheet.number("=LEN(1.50)"));
        assertEquals("ABC", sheet.text("=UPPER(\"abc\")"));
        assertEquals("abc", sheet.text("=LOWER(\"ABC\")"));
        assertEquals("a b", sheet.text("=TRIM(\"  a   b \")"));
        assertEquals("a1TRUE", sheet.text("=CONCATENATE(\"a\", 1, TRUE)"));
    }

    /**
     * Test substring extraction.
     */
    @Test
    void testSubstrings() {
        assertEquals("he", sheet.text("=LEFT(\"hello\", 2)"));
        assertEquals("h", sheet.text("=LEFT(\"hello\")"));
        assertEquals("llo", sheet.text("=RIGHT(\"hello\", 3)"));
        assertEquals("hello", sheet.text("=RIGHT(\"hello\", 10)"));
        assertEquals("ell", sheet.text("=MID(\"hello\", 2, 3)"));
        assertEquals("", sheet.text("=MID(\"hello\", 9, 3)"));
        assertEquals(ErrorKind.VALUE, sheet.error("=LEFT(\"hello\", -1)"));
        assertEquals(ErrorKind.VALUE, sheet.error("=MID(\"hello\", 0, 1)"));
    }

    /**
     * Test FIND (case-sensitive) against SEARCH (case-insensitive, wildcards).
     */
    @Test
    void testFindAndSearch() {
        assertEquals(3, sheet.number("=FIND(\"l\", \"hello\")"));
        assertEquals(4, sheet.number("=FIND(\"l\", \"hello\", 4)"));
        assertEquals(ErrorKind.VALUE, sheet.error("=FIND(\"L\", \"hello\")"));
        assertEquals(3, sheet.number("=SEARCH(\"L\", \"hello\")"));
        assertEquals(2, sheet.number("=SEARCH(\"h?l\", \"ahello\")"));
        assertEquals(1, sheet.number("=SEARCH(\"h*o\", \"hello\")"));
        assertEquals(ErrorKind.VALUE, sheet.error("=SEARCH(\"z\", \"hello\")"));
        assertEquals(ErrorKind.VALUE, sheet.error("=SEARCH(\"h\", \"hello\", 6)"));
    }

    /**
     * Test SUBSTITUTE and REPLACE.
     */
    @Test
    void testSubstitution() {
        assertEquals("a+b+c", sheet.text("=SUBSTITUTE(\"a-b-c\", \"-\", \"+\")"));
        assertEquals("a-b+c", sheet.text("=SUBSTITUTE(\"a-b-c\", \"-\", \"+\", 2)"));
        assertEquals("a-b-c", sheet.text("=SUBSTITUTE(\"a-b-c\", \"-\", \"+\", 3)"));
        assertEquals("aXef", sheet.text("=REPLACE(\"abcdef\", 2, 3, \"X\")"));
    }

    /**
     * Test VALUE with percent, separators and currency.
     */
    @Test
    void testValue() {
        assertEquals(1234, sheet.number("=VALUE(\"1,234\")"));
        assertEquals(0.5, sheet.number("=VALUE(\"50%\")"));
        assertEquals(12.5, sheet.number("=VALUE(\"$12.5\")"));
        assertEquals(7, sheet.number("=VALUE(7)"));
        assertEquals(ErrorKind.VALUE, sheet.error("=VALUE(\"abc\")"));
    }

    /**
     * Test that an empty needle is found at the start position, even just past the end.
     */
    @Test
    void testFindEmptyText() {
        assertEquals(1, sheet.number("=FIND(\"\", \"\")"));
        assertEquals(1, sheet.number("=FIND(\"\", \"abc\")"));
        assertEquals(4, sheet.number("=FIND(\"\", \"abc\", 4)"));
        assertEquals(1, sheet.number("=SEARCH(\"\", \"\")"));
        assertEquals(ErrorKind.VALUE, sheet.error("=FIND(\"\", \"abc\", 5)"));
        assertEquals(ErrorKind.VALUE, sheet.error("=FIND(\"c\", \"abc\", 4)"));
    }
}

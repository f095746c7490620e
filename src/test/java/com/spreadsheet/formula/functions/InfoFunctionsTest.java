package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the type-test functions and the registry contents.
 */
class InfoFunctionsTest {

    private FunctionTestSheet sheet;

    @BeforeEach
    void setUp() {
        sheet = new FunctionTestSheet().set("A1", "5").set("A2", "text");
    }

    /**
     * Test ISBLANK, ISNUMBER and ISTEXT.
     */
    @Test
    void testTypeTests() {
        assertTrue(sheet.bool("=ISBLANK(B1)"));
        assertFalse(sheet.bool("=ISBLANK(A1)"));
        assertTrue(sheet.bool("=ISNUMBER(A1)"));
        assertFalse(sheet.bool("=ISNUMBER(A2)"));
        assertTrue(sheet.bool("=ISTEXT(A2)"));
    }

    /**
     * Test that only ISERROR and ISNA look at error arguments.
     */
    @Test
    void testErrorTests() {
        assertTrue(sheet.bool("=ISERROR(1/0)"));
        assertFalse(sheet.bool("=ISERROR(A1)"));
        assertTrue(sheet.bool("=ISNA(MATCH(99, A1:A2, 0))"));
        assertFalse(sheet.bool("=ISNA(1/0)"));
        assertEquals(ErrorKind.DIV_ZERO, sheet.error("=ISNUMBER(1/0)"));
    }

    /**
     * Test that every library is registered and lookups ignore case.
     */
    @Test
    void testRegistry() {
        FunctionRegistry registry = BuiltInFunctions.createRegistry(FunctionTestSheet.FIXED_CLOCK);

        assertTrue(registry.names().containsAll(Set.of("SUM", "IF", "LEN", "VLOOKUP", "TODAY", "ISNA")));
        assertTrue(registry.contains("sum"));
        assertTrue(registry.get("IFERROR").isErrorTolerant());
        assertFalse(registry.get("IF").isErrorTolerant());
    }
}

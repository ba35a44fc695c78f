package com.vidnyan.netedit.domain.grammar;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParameterValuesTest {

    @Test
    void convert_ShouldTypePlainNumbers() {
        assertEquals(10L, ParameterValues.convert("10"));
        assertEquals(0.5, ParameterValues.convert(" 0.5 "));
        assertEquals("1u", ParameterValues.convert("1u"));
        assertEquals("{a*2}", ParameterValues.convert("{a*2}"));
    }

    @Test
    void same_ShouldCompareNumbersByValue() {
        assertTrue(ParameterValues.same(10L, 10.0));
        assertTrue(ParameterValues.same(10.0, "10"));
        assertFalse(ParameterValues.same(0.001, "0.002"));
        assertFalse(ParameterValues.same(null, "x"));
    }
}

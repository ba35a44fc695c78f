package com.vidnyan.netedit.domain.grammar;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EngineeringNotationTest {

    @Test
    void format_ShouldPickSuffixByPowerOfThousand() {
        assertEquals("2k", EngineeringNotation.format(2000.0));
        assertEquals("1Meg", EngineeringNotation.format(1e6));
        assertEquals("1u", EngineeringNotation.format(1e-6));
        assertEquals("1m", EngineeringNotation.format(0.001));
        assertEquals("2.2u", EngineeringNotation.format(2.2e-6));
        assertEquals("470", EngineeringNotation.format(470.0));
        assertEquals("0", EngineeringNotation.format(0.0));
    }

    @Test
    void format_ShouldWriteIntegersAsTheyAre() {
        assertEquals("5", EngineeringNotation.format(Integer.valueOf(5)));
        assertEquals("20000", EngineeringNotation.format(Long.valueOf(20000)));
    }

    @Test
    void parse_ShouldApplyMultipliers() {
        assertEquals(10000.0, EngineeringNotation.parse("10k").orElseThrow(), 1e-9);
        assertEquals(1e7, EngineeringNotation.parse("10Meg").orElseThrow(), 1e-3);
        assertEquals(4.7e-6, EngineeringNotation.parse("4.7u").orElseThrow(), 1e-15);
        assertEquals(1000.0, EngineeringNotation.parse("1e3").orElseThrow(), 1e-9);
        assertEquals(0.05, EngineeringNotation.parse("5%").orElseThrow(), 1e-12);
    }

    @Test
    void parse_ShouldTreatUnitLetterAsDecimalPoint() {
        assertEquals(1500.0, EngineeringNotation.parse("1k5").orElseThrow(), 1e-9);
        assertEquals(10.2, EngineeringNotation.parse("10R2").orElseThrow(), 1e-9);
    }

    @Test
    void parse_ShouldRejectNonNumbers() {
        assertTrue(EngineeringNotation.parse("abc").isEmpty());
        assertTrue(EngineeringNotation.parse("{R}").isEmpty());
    }
}

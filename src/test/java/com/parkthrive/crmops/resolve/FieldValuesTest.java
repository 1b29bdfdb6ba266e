package com.parkthrive.crmops.resolve;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FieldValuesTest {

    @Test
    void testAppend_KeepsExistingComponents() {
        assertEquals("03/01/2024", FieldValues.append(null, "03/01/2024"));
        assertEquals("03/01/2024", FieldValues.append("", "03/01/2024"));
        assertEquals("02/01/2024,03/01/2024", FieldValues.append("02/01/2024", "03/01/2024"));
        assertEquals("01/01/2024, 02/01/2024,03/01/2024", FieldValues.append("01/01/2024, 02/01/2024", "03/01/2024"));
    }

    @Test
    void testSplitAndComponent() {
        assertEquals(List.of("a", "b", "c"), FieldValues.splitList("a, b ,c"));
        assertEquals(List.of(), FieldValues.splitList("  "));
        assertEquals("b", FieldValues.component("a,b", 1));
        assertEquals("", FieldValues.component("a", 1));
        assertEquals("", FieldValues.component(null, 0));
    }

    @Test
    void testIsoToUsDate() {
        assertEquals("03/01/2024", FieldValues.isoToUsDate("2024-03-01"));
        assertEquals("3/1/2024", FieldValues.isoToUsDate("3/1/2024"));
        assertEquals("", FieldValues.isoToUsDate(null));
    }

    @Test
    void testFormatMoney() {
        assertEquals("1250", FieldValues.formatMoney("$1,250.00"));
        assertEquals("45.50", FieldValues.formatMoney("45.5"));
        assertEquals("12.35", FieldValues.formatMoney("12.345"));
        assertEquals("0", FieldValues.formatMoney("0.00"));
        assertEquals("75", FieldValues.formatMoney("75"));
        assertEquals("n/a", FieldValues.formatMoney("n/a"));
        assertEquals("", FieldValues.formatMoney(""));
    }
}

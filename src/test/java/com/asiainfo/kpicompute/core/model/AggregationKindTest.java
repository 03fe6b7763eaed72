package com.asiainfo.kpicompute.core.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class AggregationKindTest {

    @Test
    void testFromName() {
        assertEquals(AggregationKind.SUM, AggregationKind.fromName("sum"));
        assertEquals(AggregationKind.AVG, AggregationKind.fromName(" Average "));
        assertEquals(AggregationKind.RATIO, AggregationKind.fromName("RATIO"));
        assertThrows(IllegalArgumentException.class, () -> AggregationKind.fromName("median"));
        assertThrows(IllegalArgumentException.class, () -> AggregationKind.fromName(""));
    }

    @Test
    void testRatioSumsBothSides() {
        assertEquals("SUM", AggregationKind.RATIO.sqlFunction());
        assertTrue(AggregationKind.RATIO.requiresDenominator());
        assertFalse(AggregationKind.COUNT.requiresDenominator());
    }

    @Test
    void testTimeWindow() {
        TimeWindow window = new TimeWindow(null, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        assertEquals("custom", window.periodType());
        assertEquals(LocalDate.of(2024, 2, 1), window.exclusiveEnd());
        assertThrows(IllegalArgumentException.class,
                () -> TimeWindow.of(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1)));
    }
}

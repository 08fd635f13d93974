package com.geoshard.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CellIdTest {

    @Test
    void shouldOrderAsUnsignedValues() {
        CellId low = CellId.of(0x1000000000000000L);
        CellId high = CellId.of(0xb000000000000000L);

        assertTrue(high.value() < 0, "fixture should have the sign bit set");
        assertTrue(low.isBefore(high));
        assertTrue(high.isAfter(low));
        assertTrue(low.compareTo(high) < 0);
    }

    @Test
    void shouldSortAlongUnsignedOrder() {
        List<CellId> cells = new ArrayList<>(List.of(CellId.of(-1L), CellId.of(5L), CellId.of(Long.MIN_VALUE), CellId.of(0L)));

        cells.sort(null);

        assertEquals(List.of(CellId.of(0L), CellId.of(5L), CellId.of(Long.MIN_VALUE), CellId.of(-1L)), cells);
    }

    @Test
    void shouldBeEqualForSameValue() {
        assertEquals(CellId.of(42L), CellId.of(42L));
        assertEquals(0, CellId.of(42L).compareTo(CellId.of(42L)));
        assertFalse(CellId.of(42L).isBefore(CellId.of(42L)));
    }

    @Test
    void toStringShouldBeUnsignedHex() {
        assertEquals("b000000000000000", CellId.of(0xb000000000000000L).toString());
    }
}

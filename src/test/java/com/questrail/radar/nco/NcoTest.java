package com.questrail.radar.nco;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class NcoTest
{
    private static final NcoTable TABLE = new NcoTable(List.of(10.4, 10.1));

    @Test
    void frequencyIsLo1PlusLo2MinusSelectedEntry() {
        Nco nco = new Nco(812, 128, TABLE);
        assertFalse(nco.isReady());
        nco.select(1);
        assertTrue(nco.isReady());
        assertEquals(812 + 128 - 10.1, nco.frequency(), 1e-9);
    }

    @Test
    void frequencyBeforeTableOrSelectionFails() {
        Nco nco = new Nco();
        nco.setLo1(812);
        nco.setLo2(128);
        assertThrows(IllegalStateException.class, nco::frequency);
        assertThrows(IllegalStateException.class, () -> nco.select(0));

        nco.load(TABLE);
        assertThrows(IllegalStateException.class, nco::frequency);
    }

    @Test
    void selectOutsideTableFails() {
        Nco nco = new Nco(812, 128, TABLE);
        assertThrows(IllegalArgumentException.class, () -> nco.select(2));
        assertFalse(nco.isReady());
    }

    /** Loading a new table drops the previous selection. */
    @Test
    void loadResetsSelection() {
        Nco nco = new Nco(812, 128, TABLE);
        nco.select(0);
        nco.load(new NcoTable(List.of(8.5)));
        assertFalse(nco.isReady());
    }
}

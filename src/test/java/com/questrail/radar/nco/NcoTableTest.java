package com.questrail.radar.nco;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NcoTableTest
 * -----------------------------------------------------------------------------
 * Parsing of NCO files, valid and broken in each of the distinct ways.
 */
final class NcoTableTest
{
    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    private static final String HEADER = lines(
            "NCOPAR_VS       0.1",
            "%======================================",
            "% cp1l_ch1",
            "% LO1=812.0 MHz LO2=128.0 MHz",
            "%======================================");

    @Test
    void validFileYieldsFrequenciesInAddressOrder() {
        NcoTable table = NcoTable.parse(HEADER + lines(
                "NCO\t0\t 10.4\t% f12",
                "NCO\t1\t 10.1\t% f13",
                "NCO\t2\t 10.1\t% f13",
                "NCO\t3\t 10.4\t% f12"));
        assertEquals(List.of(10.4, 10.1, 10.1, 10.4), table.frequencies());
        assertEquals(4, table.size());
        assertEquals(10.1, table.frequency(2));
        assertThrows(IllegalArgumentException.class, () -> table.frequency(4));
    }

    @Test
    void missingVersionLine() {
        NcoFormatException e = assertThrows(NcoFormatException.class, () -> NcoTable.parse(lines(
                "NCO\t0\t 10.4\t% f12",
                "NCO\t1\t 10.1\t% f13")));
        assertEquals(NcoFormatException.Reason.MISSING_VERSION, e.reason());
        assertEquals(1, e.line());
    }

    @Test
    void emptyFileHasNoVersion() {
        NcoFormatException e = assertThrows(NcoFormatException.class, () -> NcoTable.parse("% nothing\n"));
        assertEquals(NcoFormatException.Reason.MISSING_VERSION, e.reason());
    }

    @Test
    void wrongVersion() {
        NcoFormatException e = assertThrows(NcoFormatException.class,
                () -> NcoTable.parse(HEADER.replace("0.1", "0.2") + "NCO 0 10.4\n"));
        assertEquals(NcoFormatException.Reason.WRONG_VERSION, e.reason());
    }

    /** A comment without its '%' leaves a fourth token on the line. */
    @Test
    void forgottenCommentMarkerIsMalformed() {
        NcoFormatException e = assertThrows(NcoFormatException.class, () -> NcoTable.parse(HEADER + lines(
                "NCO\t0\t 10.4\t% f12",
                "NCO\t1\t 10.1\t f13")));
        assertEquals(NcoFormatException.Reason.MALFORMED_ENTRY, e.reason());
        assertEquals(7, e.line());
    }

    @Test
    void skippedIndex() {
        NcoFormatException e = assertThrows(NcoFormatException.class, () -> NcoTable.parse(HEADER + lines(
                "NCO\t0\t 10.4\t% f12",
                "NCO\t1\t 10.1\t% f13",
                "NCO\t2\t 10.1\t% f13",
                "NCO\t4\t 10.4\t% f12")));
        assertEquals(NcoFormatException.Reason.WRONG_INDEX, e.reason());
        assertEquals(9, e.line());
    }

    @Test
    void frequencyWithUnitIsInvalid() {
        NcoFormatException e = assertThrows(NcoFormatException.class, () -> NcoTable.parse(HEADER + lines(
                "NCO\t0\t 10.4MHz\t% f12",
                "NCO\t1\t 10.1MHz\t% f13")));
        assertEquals(NcoFormatException.Reason.INVALID_FREQUENCY, e.reason());
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }
}

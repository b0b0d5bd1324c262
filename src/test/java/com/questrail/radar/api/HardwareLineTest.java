package com.questrail.radar.api;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class HardwareLineTest
{
    @Test
    void channelsAreNumberedOneToSix() {
        assertEquals(HardwareLine.CH1, HardwareLine.channel(1));
        assertEquals(HardwareLine.CH6, HardwareLine.channel(6));
        assertEquals(Optional.of(3), HardwareLine.CH3.channelNumber());
        assertEquals(Optional.empty(), HardwareLine.RF.channelNumber());
        assertThrows(IllegalArgumentException.class, () -> HardwareLine.channel(0));
        assertThrows(IllegalArgumentException.class, () -> HardwareLine.channel(7));
        assertEquals(6, HardwareLine.channels().size());
    }

    @Test
    void phaseLinesUseSignNames() {
        assertTrue(HardwareLine.PHASE_PLUS.isPhase());
        assertFalse(HardwareLine.PHASE_PLUS.isChannel());
        assertEquals(Optional.of(HardwareLine.PHASE_MINUS), HardwareLine.byStreamName("-"));
        assertEquals(Optional.of(HardwareLine.RXPROT), HardwareLine.byStreamName("RXPROT"));
        assertEquals(Optional.empty(), HardwareLine.byStreamName("CH7"));
    }
}

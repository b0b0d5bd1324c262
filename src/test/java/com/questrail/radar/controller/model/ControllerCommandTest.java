package com.questrail.radar.controller.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ControllerCommandTest
{
    /** Sorting by time keeps file order for equal times. */
    @Test
    void sortIsStableOnTime() {
        List<ControllerCommand> commands = new ArrayList<>(List.of(
                new ControllerCommand(2e-6, "RFOFF", 2),
                new ControllerCommand(1e-6, "RFON", 1),
                new ControllerCommand(1e-6, "PHA0", 1)));
        Collections.sort(commands);
        assertEquals(List.of("RFON", "PHA0", "RFOFF"), commands.stream().map(ControllerCommand::mnemonic).toList());
    }

    @Test
    void structuralMnemonicsAreRecognized() {
        assertTrue(new ControllerCommand(0, "SETTCR", 1).isSetTcr());
        assertTrue(new ControllerCommand(0, "REP", 1).isRep());
        assertFalse(new ControllerCommand(0, "RFON", 1).isRep());
        assertThrows(IllegalArgumentException.class, () -> new ControllerCommand(0, "", 1));
    }
}

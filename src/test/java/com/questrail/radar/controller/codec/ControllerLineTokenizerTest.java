package com.questrail.radar.controller.codec;

import com.questrail.radar.controller.ControllerException;
import com.questrail.radar.controller.model.ControllerCommand;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ControllerLineTokenizerTest
 * -----------------------------------------------------------------------------
 * Line-level parsing of {@code AT} and {@code SETTCR} statements.
 */
final class ControllerLineTokenizerTest
{
    @Test
    void atLineSplitsCommaPackedMnemonics() {
        List<ControllerCommand> commands = ControllerLineTokenizer.tokenize("AT 40 RFON,PHA0 CH1   % go", 7);
        assertEquals(3, commands.size());
        assertEquals(List.of("RFON", "PHA0", "CH1"), commands.stream().map(ControllerCommand::mnemonic).toList());
        for (ControllerCommand c : commands) {
            assertEquals(40e-6, c.time(), 1e-15);
            assertEquals(7, c.line());
        }
    }

    @Test
    void setTcrLineYieldsOneCommand() {
        List<ControllerCommand> commands = ControllerLineTokenizer.tokenize("  SETTCR 1505", 3);
        assertEquals(1, commands.size());
        assertEquals(ControllerCommand.SETTCR, commands.get(0).mnemonic());
        assertEquals(1505e-6, commands.get(0).time(), 1e-15);
    }

    @Test
    void blankAndCommentLinesYieldNothing() {
        assertEquals(List.of(), ControllerLineTokenizer.tokenize("", 1));
        assertEquals(List.of(), ControllerLineTokenizer.tokenize("   \t", 1));
        assertEquals(List.of(), ControllerLineTokenizer.tokenize("% AT 10 RFON", 1));
    }

    @Test
    void atWithoutMnemonicFails() {
        ControllerException e = assertThrows(ControllerException.class,
                () -> ControllerLineTokenizer.tokenize("AT 40", 12));
        assertEquals(12, e.line());
        assertTrue(e.getMessage().startsWith("Controller program error in line 12:"));
    }

    @Test
    void unknownStatementFails() {
        ControllerException e = assertThrows(ControllerException.class,
                () -> ControllerLineTokenizer.tokenize("LOOP 10 RFON", 5));
        assertEquals(5, e.line());
    }

    @Test
    void nonNumericTimeFails() {
        ControllerException e = assertThrows(ControllerException.class,
                () -> ControllerLineTokenizer.tokenize("AT forty RFON", 2));
        assertEquals(2, e.line());
        assertInstanceOf(NumberFormatException.class, e.getCause());
        assertThrows(ControllerException.class, () -> ControllerLineTokenizer.tokenize("SETTCR", 2));
    }
}

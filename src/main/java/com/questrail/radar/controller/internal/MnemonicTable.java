package com.questrail.radar.controller.internal;

import com.questrail.radar.api.HardwareLine;
import com.questrail.radar.core.Phase;
import com.questrail.radar.controller.model.ControllerCommand;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * MnemonicTable
 * -----------------------------------------------------------------------------
 * Static registry of every controller mnemonic the interpreter models.
 *
 * <h2>Structure</h2>
 * The table is built once, when the class is initialized. Families of
 * mnemonics that differ only by a number ({@code CH1}..{@code CH6},
 * {@code F0}..{@code F15}, {@code NCOSEL0}..{@code NCOSEL1023}) are expanded
 * into individual entries here, so dispatch is a single map lookup.
 *
 * <h2>Structural mnemonics</h2>
 * {@code SETTCR} and {@code REP} are listed for their descriptions only. They
 * change the cycle structure and are handled by
 * {@link ControllerInterpreter} before table dispatch.
 *
 * <h2>Unknown mnemonics</h2>
 * A name missing from the table is not an error here. {@link #lookup} returns
 * empty and the interpreter reports a warning.
 */
public final class MnemonicTable
{
    public static final int NCO_TABLE_SIZE = 1024;
    public static final int TRANSMIT_FREQUENCIES = 16;

    private static final Map<String, Mnemonic> TABLE = build();

    private MnemonicTable() {
    }

    public static Optional<Mnemonic> lookup(String name) {
        return Optional.ofNullable(TABLE.get(name));
    }

    public static boolean contains(String name) {
        return TABLE.containsKey(name);
    }

    /**
     * All mnemonics in registration order.
     */
    public static Map<String, Mnemonic> all() {
        return TABLE;
    }

    private static Map<String, Mnemonic> build() {
        Map<String, Mnemonic> t = new LinkedHashMap<>();

        // Hardware lines
        onOff(t, "RFON", "RFOFF", HardwareLine.RF, "RF output");
        onOff(t, "RXPROT", "RXPOFF", HardwareLine.RXPROT, "receiver protector");
        onOff(t, "LOPROT", "LOPOFF", HardwareLine.LOPROT, "local oscillator protector");
        onOff(t, "BEAMON", "BEAMOFF", HardwareLine.BEAM, "beam in klystron");
        onOff(t, "CALON", "CALOFF", HardwareLine.CAL, "noise source for calibration");
        onOff(t, "CAL100", "CAL0", HardwareLine.CAL, "noise source for calibration");
        for (HardwareLine ch : HardwareLine.channels()) {
            String name = ch.streamName();
            put(t, name, "Open sampling gate on channel board " + name.substring(2) + ", bit " + ch.bit() + " high",
                    (state, time, command) -> state.turnOn(ch, time));
            put(t, name + "OFF", "Close sampling gate on channel board " + name.substring(2) + ", bit " + ch.bit() + " low",
                    (state, time, command) -> state.turnOff(ch, time));
        }
        put(t, "ALLOFF", "Close sampling gate on all channel boards, bit 10-15 low",
                (state, time, command) -> state.allChannelsOff(time));

        // Phase
        put(t, "PHA0", "Set proper phase, bit 4 low",
                (state, time, command) -> state.setPhase(time, Phase.DEG_0));
        put(t, "PHA180", "Set proper phase, bit 4 high",
                (state, time, command) -> state.setPhase(time, Phase.DEG_180));

        // Receiver frequency
        route(t, "AD1L", 1, HardwareLine.CH1, "1, 2, 3");
        route(t, "AD1R", 1, HardwareLine.CH4, "4, 5, 6");
        route(t, "AD2L", 2, HardwareLine.CH1, "1, 2, 3");
        route(t, "AD2R", 2, HardwareLine.CH4, "4, 5, 6");
        for (int i = 0; i < NCO_TABLE_SIZE; i++) {
            int address = i;
            put(t, "NCOSEL" + i, "Load NCO memory address " + i + " into the NCO, strobe bit 29",
                    (state, time, command) -> state.selectNco(address, time));
        }
        put(t, "STFIR", "Start the FIR filters on the channel boards, bit 16 strobed",
                CycleState::startFilters);

        // No modelled timing effect
        put(t, "TRANS", "Not documented", MnemonicHandler.NO_OP);
        put(t, "RECEV", "Not documented", MnemonicHandler.NO_OP);
        put(t, "RXSYNC", "2 us pulse on bit 31 on the front of the receiver controller", MnemonicHandler.NO_OP);
        put(t, "TXSYNC", "2 us pulse on bit 31 on the front of the transmitter controller", MnemonicHandler.NO_OP);
        put(t, "CHQPULS", "High output on bit 31 for 2 us, synchronizes external hardware", MnemonicHandler.NO_OP);
        put(t, "BUFLIP", "Change side of buffer memory in channel boards, bit 17 strobed", MnemonicHandler.NO_OP);
        put(t, "STC", "Interrupt the crate computer that new data are available, bit 8 strobed", MnemonicHandler.NO_OP);
        for (int i = 0; i < TRANSMIT_FREQUENCIES; i++) {
            put(t, "F" + i, "Select transmitter frequency " + i + ", bits 0-3", MnemonicHandler.NO_OP);
        }
        // ADC sample gate bits
        for (int bit = 4; bit <= 5; bit++) {
            put(t, "BRX" + bit, "Set bit " + bit + " on receiver controller", MnemonicHandler.NO_OP);
            put(t, "BRX" + bit + "OFF", "Clear bit " + bit + " on receiver controller", MnemonicHandler.NO_OP);
            put(t, "BTX" + bit, "Set bit " + bit + " on transmitter controller", MnemonicHandler.NO_OP);
            put(t, "BTX" + bit + "OFF", "Clear bit " + bit + " on transmitter controller", MnemonicHandler.NO_OP);
        }

        put(t, ControllerCommand.SETTCR, "Set reference time in time control", MnemonicHandler.NO_OP);
        put(t, ControllerCommand.REP, "End of program, repeat cycle", MnemonicHandler.NO_OP);

        return Collections.unmodifiableMap(t);
    }

    private static void onOff(Map<String, Mnemonic> t, String on, String off, HardwareLine line, String what) {
        put(t, on, "Enable " + what + ", bit " + line.bit() + " high",
                (state, time, command) -> state.turnOn(line, time));
        put(t, off, "Disable " + what + ", bit " + line.bit() + " low",
                (state, time, command) -> state.turnOff(line, time));
    }

    private static void route(Map<String, Mnemonic> t, String name, int path, HardwareLine first, String boards) {
        put(t, name, "Route input from AD " + path + " to channel boards " + boards,
                (state, time, command) -> state.route(path, first, time));
    }

    private static void put(Map<String, Mnemonic> t, String name, String description, MnemonicHandler handler) {
        if (t.put(name, new Mnemonic(name, description, handler)) != null) {
            throw new IllegalStateException("Mnemonic " + name + " registered twice");
        }
    }
}

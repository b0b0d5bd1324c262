package com.questrail.radar.api;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * HardwareLine
 * -----------------------------------------------------------------------------
 * Identity of a single hardware line whose on/off history is tracked while a
 * controller program is replayed.
 *
 * <h2>What a HardwareLine IS</h2>
 * <ul>
 *   <li>A stable name under which a stream of {@link TimeInterval}s is
 *       reported (e.g. {@code "RF"}, {@code "CH3"})</li>
 *   <li>An association with the controller bit that the line drives, where
 *       one exists</li>
 * </ul>
 *
 * <h2>What a HardwareLine IS NOT</h2>
 * It is not a mnemonic. Several mnemonics may drive the same line
 * ({@code CALON} and {@code CAL100} both switch {@link #CAL} on). The mapping
 * from mnemonics to lines lives in the controller's mnemonic table.
 *
 * <h2>Phase pseudo-lines</h2>
 * {@link #PHASE_PLUS} and {@link #PHASE_MINUS} do not exist as separate wires;
 * they are the two polarities of the phase shifter bit. They are tracked as
 * ordinary streams only so that renderers can show phase history as plain
 * intervals.
 */
public enum HardwareLine
{
    RF("RF", 11),
    RXPROT("RXPROT", 12),
    LOPROT("LOPROT", 6),
    CAL("CAL", 15),
    BEAM("BEAM", 13),
    CH1("CH1", 10),
    CH2("CH2", 11),
    CH3("CH3", 12),
    CH4("CH4", 13),
    CH5("CH5", 14),
    CH6("CH6", 15),
    PHASE_PLUS("+", 4),
    PHASE_MINUS("-", 4);

    private static final Set<HardwareLine> CHANNELS = EnumSet.range(CH1, CH6);
    private static final Set<HardwareLine> PHASES = EnumSet.of(PHASE_PLUS, PHASE_MINUS);

    private final String streamName;
    private final int bit;

    HardwareLine(String streamName, int bit) {
        this.streamName = streamName;
        this.bit = bit;
    }

    /**
     * Name under which the stream is reported, e.g. {@code "RF"} or {@code "+"}.
     */
    public String streamName() {
        return streamName;
    }

    /**
     * Controller bit driven by this line. Transmitter and receiver controllers
     * number their bits independently, so bits are not unique across lines.
     */
    public int bit() {
        return bit;
    }

    public boolean isChannel() {
        return CHANNELS.contains(this);
    }

    public boolean isPhase() {
        return PHASES.contains(this);
    }

    /**
     * Receive channel number 1..6, if this line is a receive channel.
     */
    public Optional<Integer> channelNumber() {
        return isChannel() ? Optional.of(ordinal() - CH1.ordinal() + 1) : Optional.empty();
    }

    /**
     * Returns the receive channel line for channel number 1..6.
     *
     * @throws IllegalArgumentException if the number is out of range
     */
    public static HardwareLine channel(int number) {
        if (number < 1 || number > 6) {
            throw new IllegalArgumentException("Receive channels are numbered 1..6, not " + number);
        }
        return values()[CH1.ordinal() + number - 1];
    }

    public static Set<HardwareLine> channels() {
        return EnumSet.copyOf(CHANNELS);
    }

    public static Optional<HardwareLine> byStreamName(String name) {
        for (HardwareLine line : values()) {
            if (line.streamName.equals(name)) {
                return Optional.of(line);
            }
        }
        return Optional.empty();
    }
}

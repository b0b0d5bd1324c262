package com.questrail.radar.controller.internal;

import com.questrail.radar.api.HardwareLine;
import com.questrail.radar.api.TimeInterval;
import com.questrail.radar.controller.ControllerTimeline;
import com.questrail.radar.controller.config.ReceiverConfig;
import com.questrail.radar.controller.model.ControllerCommand;
import com.questrail.radar.controller.observability.ControllerObservabilitySink;
import com.questrail.radar.controller.observability.ControllerWarningEvent;
import com.questrail.radar.controller.observability.SubcycleClosedEvent;
import com.questrail.radar.core.FrequencySeries;
import com.questrail.radar.core.IntervalStream;
import com.questrail.radar.core.Phase;
import com.questrail.radar.core.PhaseShifter;
import com.questrail.radar.core.StreamSet;
import com.questrail.radar.core.SubcycleCollector;
import com.questrail.radar.nco.Nco;
import com.questrail.radar.nco.NcoTable;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * CycleState
 * -----------------------------------------------------------------------------
 * Mutable replay state of one controller cycle.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>the cycle stream and the subcycle collector</li>
 *   <li>the {@link StreamSet} of the running subcycle</li>
 *   <li>the phase shifter, which spans the whole cycle</li>
 *   <li>one {@link Nco} and one {@link FrequencySeries} per receive channel</li>
 *   <li>the time control register (TCR)</li>
 * </ul>
 *
 * <h2>Phase pseudo-streams</h2>
 * Besides feeding the phase shifter, {@code PHA0}/{@code PHA180} keep exactly
 * one of the {@code +}/{@code -} streams on. They are closed when a subcycle
 * closes and the phase in effect is reopened when the next one starts, so
 * they never fail subcycle validation.
 *
 * Protocol violations surface as {@link IllegalStateException} or
 * {@link IllegalArgumentException}; {@link ControllerInterpreter} attaches the
 * source line.
 */
public final class CycleState
{
    private static final double HZ_PER_MHZ = 1e6;

    private final IntervalStream cycle = new IntervalStream("CYCLE");
    private final SubcycleCollector subcycles = new SubcycleCollector();
    private final PhaseShifter phaseShifter = new PhaseShifter();
    private final Map<Integer, Nco> ncos = new TreeMap<>();
    private final Map<Integer, FrequencySeries> frequencies = new TreeMap<>();
    private final List<Double> lo1;
    private final List<Double> lo2;
    private final ControllerObservabilitySink sink;

    private StreamSet streams = new StreamSet();
    private double tcr;
    private Double filterStart;

    CycleState(ReceiverConfig config, ControllerObservabilitySink sink) {
        Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.lo1 = config.lo1();
        this.lo2 = config.lo2();

        for (int ch = 1; ch <= 6; ch++) {
            // Until a routing mnemonic runs, channels see the second path.
            Nco nco = new Nco();
            nco.setLo1(lo1.get(lo1.size() == 1 ? 0 : 1));
            nco.setLo2(lo2.get(Math.min(1, lo2.size() - 1)));
            NcoTable table = config.ncoTables().get(ch);
            if (table != null) {
                nco.load(table);
            }
            ncos.put(ch, nco);
            frequencies.put(ch, new FrequencySeries());
        }
    }

    // -------------------------------------------------------------------------
    // Cycle structure
    // -------------------------------------------------------------------------

    void openCycle() {
        cycle.turnOn(0);
        subcycles.turnOn(0);
    }

    double tcr() {
        return tcr;
    }

    void setTcr(double tcr) {
        this.tcr = tcr;
    }

    /**
     * Closes the running subcycle at {@code time}, validates and snapshots its
     * streams, and starts a fresh stream set.
     *
     * @return the phase that was in effect, to reopen in the next subcycle
     */
    Optional<Phase> closeSubcycle(double time, int line) {
        requireRunning();
        Optional<Phase> phase = Optional.empty();
        if (streams.get(HardwareLine.PHASE_PLUS).isOn()) {
            streams.get(HardwareLine.PHASE_PLUS).turnOff(time);
            phase = Optional.of(Phase.DEG_0);
        }
        if (streams.get(HardwareLine.PHASE_MINUS).isOn()) {
            streams.get(HardwareLine.PHASE_MINUS).turnOff(time);
            phase = Optional.of(Phase.DEG_180);
        }
        subcycles.turnOff(time, streams);
        streams = new StreamSet();
        SubcycleCollector.Snapshot closed = subcycles.snapshot(subcycles.size() - 1);
        sink.onSubcycleClosed(new SubcycleClosedEvent(closed.index(), closed.interval(), line));
        return phase;
    }

    void openSubcycle(double time, Optional<Phase> carriedPhase) {
        if (cycle.isOff()) {
            throw new IllegalStateException("The cycle has not been started!");
        }
        subcycles.turnOn(time);
        carriedPhase.ifPresent(p -> streams.get(phaseLine(p)).turnOn(time));
    }

    void closeCycle(double time, int line) {
        closeSubcycle(time, line);
        cycle.turnOff(time);
    }

    // -------------------------------------------------------------------------
    // Mnemonic effects
    // -------------------------------------------------------------------------

    void turnOn(HardwareLine line, double time) {
        requireRunning();
        streams.get(line).turnOn(time);
    }

    void turnOff(HardwareLine line, double time) {
        requireRunning();
        streams.get(line).turnOff(time);
    }

    void allChannelsOff(double time) {
        requireRunning();
        for (HardwareLine ch : HardwareLine.channels()) {
            if (streams.get(ch).isOn()) {
                streams.get(ch).turnOff(time);
            }
        }
    }

    void setPhase(double time, Phase phase) {
        requireRunning();
        phaseShifter.setPhase(time, phase);
        IntervalStream now = streams.get(phaseLine(phase));
        if (now.isOn()) {
            return;
        }
        IntervalStream before = streams.get(phaseLine(phase.opposite()));
        if (before.isOn()) {
            before.turnOff(time);
        }
        now.turnOn(time);
    }

    /**
     * Routes receiver path 1 or 2 into the three channels starting at
     * {@code first} and records the new center frequency of every routed
     * channel whose NCO is ready.
     */
    void route(int path, HardwareLine first, double time) {
        requireRunning();
        int index = path - 1;
        if ((lo1.size() > 1 && index >= lo1.size()) || index >= lo2.size()) {
            throw new IllegalArgumentException("Receiver has no path " + path);
        }
        // A single first oscillator feeds both paths; the split comes after it.
        double lo1Path = lo1.get(lo1.size() == 1 ? 0 : index);
        double lo2Path = lo2.get(index);
        int firstChannel = first.channelNumber().orElseThrow();
        for (int ch = firstChannel; ch < firstChannel + 3; ch++) {
            Nco nco = ncos.get(ch);
            nco.setLo1(lo1Path);
            nco.setLo2(lo2Path);
            if (nco.isReady()) {
                frequencies.get(ch).record(time, nco.frequency() * HZ_PER_MHZ);
            }
        }
    }

    void selectNco(int address, double time) {
        requireRunning();
        for (Map.Entry<Integer, Nco> e : ncos.entrySet()) {
            Nco nco = e.getValue();
            if (!nco.hasTable()) {
                continue;
            }
            nco.select(address);
            frequencies.get(e.getKey()).record(time, nco.frequency() * HZ_PER_MHZ);
        }
    }

    void startFilters(double time, ControllerCommand command) {
        requireRunning();
        if (filterStart != null) {
            sink.onWarning(new ControllerWarningEvent(ControllerWarningEvent.Kind.REDUNDANT_STFIR,
                    command.line(), command.mnemonic(),
                    "FIR filters were already started at " + filterStart + " s"));
            return;
        }
        filterStart = time;
    }

    // -------------------------------------------------------------------------
    // Result
    // -------------------------------------------------------------------------

    ControllerTimeline toTimeline() {
        List<TimeInterval> cycles = cycle.intervals();
        return new ControllerTimeline(
                cycles.get(cycles.size() - 1),
                subcycles.snapshots(),
                phaseShifter,
                frequencies,
                filterStart);
    }

    private void requireRunning() {
        if (cycle.isOff()) {
            throw new IllegalStateException("The cycle has not been started!");
        }
        if (subcycles.isOff()) {
            throw new IllegalStateException("No subcycle has been started yet!");
        }
    }

    private static HardwareLine phaseLine(Phase phase) {
        return phase == Phase.DEG_0 ? HardwareLine.PHASE_PLUS : HardwareLine.PHASE_MINUS;
    }
}

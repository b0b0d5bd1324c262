package com.questrail.radar.experiment;

import com.questrail.radar.api.HardwareLine;
import com.questrail.radar.api.TimeInterval;
import com.questrail.radar.console.eros.ExperimentFiles;
import com.questrail.radar.console.eros.ExperimentState;
import com.questrail.radar.console.eros.OperatorCommands;
import com.questrail.radar.console.interp.ConsoleInterpreter;
import com.questrail.radar.console.interp.InterpreterConfig;
import com.questrail.radar.controller.ControllerTimeline;
import com.questrail.radar.controller.codec.ControllerProgramReader;
import com.questrail.radar.controller.config.RadarSite;
import com.questrail.radar.controller.config.ReceiverConfig;
import com.questrail.radar.controller.internal.ControllerInterpreter;
import com.questrail.radar.controller.model.ControllerCommand;
import com.questrail.radar.core.FrequencySeries;
import com.questrail.radar.core.SubcycleCollector;
import com.questrail.radar.nco.NcoTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Experiment
 * -----------------------------------------------------------------------------
 * The timing of one radar experiment, split into the subcycles renderers
 * draw.
 *
 * <h2>Sources</h2>
 * <ul>
 *   <li>{@link #fromControllerProgram}: a controller program replayed against
 *       a known receiver configuration.</li>
 *   <li>{@link #fromConsoleScript}: a console script run as the operator
 *       console would run it. The controller program, oscillator settings and
 *       NCO tables are taken from what the script loaded.</li>
 * </ul>
 *
 * <h2>Assembly</h2>
 * Each subcycle snapshot is split into transmit intervals ({@code RF}),
 * receive intervals per channel and the remaining lines by name. Phase
 * shifts and frequencies are restricted to the subcycle. The baud estimate
 * only looks at the span from the first transmit interval's start to the last
 * one's end, so phase settings made while the transmitter is off do not count.
 */
public final class Experiment
{
    private static final Logger log = LoggerFactory.getLogger(Experiment.class);

    private final Path program;
    private final ControllerTimeline timeline;
    private final List<Subcycle> subcycles;

    public Experiment(Path program, ControllerTimeline timeline) {
        this.program = Objects.requireNonNull(program, "program");
        this.timeline = Objects.requireNonNull(timeline, "timeline");
        List<Subcycle> out = new ArrayList<>();
        for (SubcycleCollector.Snapshot snapshot : timeline.subcycles()) {
            out.add(assemble(snapshot, timeline));
        }
        this.subcycles = Collections.unmodifiableList(out);
    }

    // -------------------------------------------------------------------------
    // Factories
    // -------------------------------------------------------------------------

    /**
     * Reads and replays the controller program at {@code path}.
     *
     * @throws ExperimentException if the program cannot be read
     */
    public static Experiment fromControllerProgram(Path path, ReceiverConfig config) {
        List<ControllerCommand> commands;
        try {
            commands = ControllerProgramReader.read(path);
        } catch (IOException e) {
            throw new ExperimentException("Could not read controller program " + path, e);
        }
        log.info("Replaying {} ({} commands)", path, commands.size());
        return new Experiment(path, new ControllerInterpreter(config).run(commands));
    }

    /**
     * Runs the console script at {@code path} for {@code site} and replays
     * the controller program it loaded.
     *
     * <p>File names in the script are looked up relative to the script's
     * directory and its parent, see {@link ExperimentFiles}.</p>
     *
     * @throws ExperimentException if the script loads no controller program
     *         or a file it names cannot be read
     */
    public static Experiment fromConsoleScript(Path path, RadarSite site) {
        Path directory = path.toAbsolutePath().getParent();
        List<Path> roots = new ArrayList<>();
        roots.add(directory);
        if (directory.getParent() != null) {
            roots.add(directory.getParent());
        }
        ExperimentFiles files = new ExperimentFiles(roots);

        InterpreterConfig config = InterpreterConfig.builder()
                .withSourceName(path.getFileName().toString())
                .withWorkingDirectory(directory)
                .build();
        ConsoleInterpreter console = new ConsoleInterpreter(config, new ExperimentState(site), new OperatorCommands(files));
        try {
            console.source(path);
        } catch (IOException e) {
            throw new ExperimentException("Could not read console script " + path, e);
        }

        ExperimentState state = console.effectiveState(ExperimentState.class);
        log.debug("Console script {} left {}", path, state);
        Path tlan = new TlanResolver(files).resolve(state);
        return fromControllerProgram(tlan, receiverConfig(state, files));
    }

    static ReceiverConfig receiverConfig(ExperimentState state, ExperimentFiles files) {
        ReceiverConfig.Builder builder = ReceiverConfig.builder()
                .withLo1(state.lo(1))
                .withLo2(state.lo(2));
        Map<String, NcoTable> read = new TreeMap<>();
        for (Map.Entry<Integer, String> e : state.ncoFiles().entrySet()) {
            String name = e.getValue();
            NcoTable table = read.get(name);
            if (table == null) {
                Path file = files.find(name, ".nco")
                        .orElseThrow(() -> new ExperimentException("NCO file " + name + " not found"));
                try {
                    table = NcoTable.read(file);
                } catch (IOException ex) {
                    throw new ExperimentException("Could not read NCO file " + file, ex);
                }
                read.put(name, table);
            }
            builder.withNcoTable(e.getKey(), table);
        }
        return builder.build();
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    /**
     * The controller program the timeline was replayed from.
     */
    public Path program() {
        return program;
    }

    public ControllerTimeline timeline() {
        return timeline;
    }

    public List<Subcycle> subcycles() {
        return subcycles;
    }

    /**
     * @param number subcycle number, counting from 1
     */
    public Subcycle subcycle(int number) {
        if (number < 1 || number > subcycles.size()) {
            throw new IllegalArgumentException("Select a subcycle between 1 and " + subcycles.size()
                    + ", not " + number);
        }
        return subcycles.get(number - 1);
    }

    public <R> List<R> render(SubcycleRenderer<R> renderer) {
        List<R> out = new ArrayList<>(subcycles.size());
        for (Subcycle s : subcycles) {
            out.add(renderer.render(s));
        }
        return out;
    }

    // -------------------------------------------------------------------------
    // Assembly
    // -------------------------------------------------------------------------

    private static Subcycle assemble(SubcycleCollector.Snapshot snapshot, ControllerTimeline timeline) {
        TimeInterval interval = snapshot.interval();
        Map<Integer, List<TimeInterval>> receive = new TreeMap<>();
        Map<String, List<TimeInterval>> settings = new LinkedHashMap<>();
        for (HardwareLine line : HardwareLine.values()) {
            List<TimeInterval> intervals = snapshot.intervals(line);
            if (line == HardwareLine.RF) {
                continue;
            }
            if (line.isChannel()) {
                if (!intervals.isEmpty()) {
                    receive.put(line.channelNumber().orElseThrow(), intervals);
                }
            } else {
                settings.put(line.streamName(), intervals);
            }
        }

        Map<Integer, FrequencySeries> frequencies = new TreeMap<>();
        for (Map.Entry<Integer, FrequencySeries> e : timeline.allFrequencies().entrySet()) {
            FrequencySeries within = restrict(e.getValue(), interval);
            if (!within.isEmpty()) {
                frequencies.put(e.getKey(), within);
            }
        }

        return new Subcycle(
                snapshot.index(),
                interval,
                snapshot.intervals(HardwareLine.RF),
                receive,
                settings,
                timeline.phaseShifter().phaseShiftsWithin(interval),
                frequencies,
                estimateBaudLength(timeline, snapshot.intervals(HardwareLine.RF)));
    }

    private static OptionalDouble estimateBaudLength(ControllerTimeline timeline, List<TimeInterval> transmit) {
        if (transmit.isEmpty()) {
            return OptionalDouble.empty();
        }
        TimeInterval span = new TimeInterval(transmit.get(0).begin(), transmit.get(transmit.size() - 1).end());
        return timeline.phaseShifter().estimateBaudLength(span);
    }

    /**
     * Like {@link FrequencySeries#shiftsWithin}, but a channel whose first
     * frequency is set inside the subcycle starts there instead of failing.
     */
    private static FrequencySeries restrict(FrequencySeries series, TimeInterval interval) {
        if (series.isEmpty() || series.entries().firstKey() <= interval.begin()) {
            return series.isEmpty() ? series : series.shiftsWithin(interval);
        }
        FrequencySeries out = new FrequencySeries();
        for (Map.Entry<Double, Double> e : series.entries().subMap(interval.begin(), true, interval.end(), false).entrySet()) {
            out.record(e.getKey(), e.getValue());
        }
        return out;
    }
}

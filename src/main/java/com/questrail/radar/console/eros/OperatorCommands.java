package com.questrail.radar.console.eros;

import com.questrail.radar.api.TextFiles;
import com.questrail.radar.console.interp.CommandCatalog;
import com.questrail.radar.console.interp.CommandContext;
import com.questrail.radar.console.interp.CommandHandler;
import com.questrail.radar.console.interp.ExecResult;
import com.questrail.radar.console.interp.Procedure;
import com.questrail.radar.console.interp.Scope;
import com.questrail.radar.controller.config.RadarSite;
import com.questrail.radar.nco.NcoFormatException;
import com.questrail.radar.nco.NcoTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OperatorCommands
 * -----------------------------------------------------------------------------
 * The radar operator commands console scripts use besides plain Tcl.
 *
 * <h2>Commands that change the {@link ExperimentState}</h2>
 * <ul>
 *   <li>{@code loadradar controller -f file ?-l loops? ?-s sync?}</li>
 *   <li>{@code loadfrequency ?options? ?receiver? file channels}</li>
 *   <li>{@code selectlo ?lo1|lo2? path MHz}</li>
 *   <li>{@code loadfilter ?receiver? file channels ?options?}</li>
 *   <li>{@code startdata ?receiver? corrfile expid iper ?antenna?}</li>
 * </ul>
 *
 * <h2>Blocks and experiments</h2>
 * {@code block} defines a procedure. {@code callblock} calls one and takes
 * over the experiment state it left behind. {@code gotoblock} ends the
 * running block. {@code runexperiment} runs another script with its own
 * argument vector, read back by {@code argv}.
 *
 * <h2>Queries</h2>
 * {@code readfrequencyfile}, {@code isradar}, {@code isuhf}, {@code isvhf},
 * {@code isesr}, {@code iskir}, {@code issod}, {@code getstarttime},
 * {@code upar}. Boolean queries answer {@code 1} or {@code 0}.
 *
 * <h2>Descriptive commands</h2>
 * Commands that only drive hardware or bookkeeping on the radar computers are
 * logged at INFO and otherwise ignored.
 *
 * Requires the interpreter's root state to be an {@link ExperimentState}.
 */
public final class OperatorCommands implements CommandCatalog
{
    private static final Logger log = LoggerFactory.getLogger(OperatorCommands.class);

    static final List<String> CONTROLLERS = List.of(
            "transmitter", "receiver", "ion line receiver", "plasma line receiver");

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final ExperimentFiles files;
    private final Map<String, CommandHandler> commands;

    public OperatorCommands(ExperimentFiles files) {
        this.files = Objects.requireNonNull(files, "files");
        this.commands = Collections.unmodifiableMap(build());
    }

    @Override
    public Optional<CommandHandler> lookup(String name) {
        return Optional.ofNullable(commands.get(name));
    }

    public Set<String> names() {
        return commands.keySet();
    }

    /**
     * Defines {@code 32p} and {@code 42p}, which ESR scripts test to find
     * out which antenna they run on.
     */
    @Override
    public void prepare(Scope root) {
        ExperimentState state = root.state(ExperimentState.class);
        root.setVariable("32p", flag(state.antenna().equals("32p")));
        root.setVariable("42p", flag(state.antenna().equals("42p")));
    }

    private Map<String, CommandHandler> build() {
        Map<String, CommandHandler> t = new LinkedHashMap<>();

        t.put("loadradar", this::loadradar);
        t.put("loadfrequency", this::loadfrequency);
        t.put("selectlo", this::selectlo);
        t.put("loadfilter", this::loadfilter);
        t.put("startdata", this::startdata);

        t.put("block", this::block);
        t.put("callblock", this::callblock);
        t.put("gotoblock", this::gotoblock);
        t.put("runexperiment", this::runexperiment);
        t.put("argv", (ctx, args) -> ExecResult.normal(String.join(" ", ctx.scope().argv())));

        t.put("readfrequencyfile", this::readfrequencyfile);
        t.put("isradar", OperatorCommands::isradar);
        for (RadarSite site : RadarSite.values()) {
            t.put("is" + site.name().toLowerCase(),
                    (ctx, args) -> ExecResult.normal(flag(state(ctx).site() == site)));
        }
        t.put("getstarttime", (ctx, args) -> ExecResult.normal("-1"));
        t.put("upar", OperatorCommands::upar);

        describe(t, "armradar", "Set controller start address and registers and wait for a start pulse");
        describe(t, "disablerecording", "Disable data recording");
        describe(t, "disp", "Display a message on the operator console");
        describe(t, "loadfile", "Load a Tcl file on the radar computer");
        describe(t, "logbook", "Write into the experiment logbook");
        describe(t, "mount", "Mount a disk; not meant for experiment scripts");
        describe(t, "setfrequency", "Set channel frequencies directly");
        describe(t, "setpanelpath", "Route antenna panels to the receiver ADCs");
        describe(t, "startradar", "Start the radar controllers at a given time");
        describe(t, "stopdata", "Stop the correlator and the recorder");
        describe(t, "stopradar", "Stop radar controllers");
        describe(t, "sync", "Wait for a synchronisation point");
        describe(t, "timestamp", "Format a time stamp");
        describe(t, "transferlo", "Transfer control of the local oscillators");
        describe(t, "writeexperimentfile", "Copy experiment files to the data directory");
        return t;
    }

    // -------------------------------------------------------------------------
    // State-changing commands
    // -------------------------------------------------------------------------

    private ExecResult loadradar(CommandContext ctx, List<String> args) {
        requireArgs(args, 1, "loadradar controller ?-f file? ?-l loops? ?-s sync?");
        String controller = complete(CONTROLLERS, args.get(0), "controller");
        for (int i = 1; i + 1 < args.size(); i += 2) {
            String option = args.get(i);
            String value = args.get(i + 1);
            switch (option) {
                case "-f" -> {
                    ExperimentState.LoadedFile kind = controller.equals("transmitter")
                            ? ExperimentState.LoadedFile.TBIN
                            : ExperimentState.LoadedFile.RBIN;
                    state(ctx).setLoadedFile(kind, value);
                    log.info("Load {} controller with compiled program {}", controller, value);
                }
                case "-l" -> log.info("Set loop counter of {} controller to {}", controller, integer(value));
                case "-s" -> log.info("Set synchronisation period of {} controller to {} µs",
                        controller, number(value) / 10);
                default -> log.warn("Ignoring unknown loadradar option {} {}", option, value);
            }
        }
        return ExecResult.EMPTY;
    }

    private ExecResult loadfrequency(CommandContext ctx, List<String> args) {
        requireArgs(args, 2, "loadfrequency ?options? ?receiver? file channels");
        String file = args.get(args.size() - 2);
        List<Integer> channels = channels(args.get(args.size() - 1));
        for (int ch : channels) {
            state(ctx).setNcoFile(ch, file);
        }
        log.info("Load frequencies from file {} into channels {}", file, channels);
        return ExecResult.EMPTY;
    }

    private ExecResult selectlo(CommandContext ctx, List<String> args) {
        if (args.size() != 2 && args.size() != 3) {
            throw new IllegalArgumentException("wrong # args: should be \"selectlo ?lo1|lo2? path frequency\"");
        }
        ExperimentState state = state(ctx);
        RadarSite site = state.site();
        String alias = args.get(args.size() - 2);
        double frequency = number(args.get(args.size() - 1));
        int path = site.pathNumber(alias).orElseThrow(() ->
                new IllegalArgumentException("Unknown receiver path '" + alias + "' at " + site));
        int oscillator;
        if (args.size() == 3) {
            String name = args.get(0);
            char last = name.isEmpty() ? ' ' : name.charAt(name.length() - 1);
            if (last != '1' && last != '2') {
                throw new IllegalArgumentException("Local oscillator must be lo1 or lo2, not '" + name + "'");
            }
            oscillator = last - '0';
        } else {
            oscillator = site.defaultOscillator().orElseThrow(() ->
                    new IllegalArgumentException("At " + site + ", the local oscillator must be specified!"));
        }
        state.setLo(oscillator, path, frequency);
        log.info("Select local oscillator LO{} path {} frequency {} MHz", oscillator, alias, frequency);
        return ExecResult.EMPTY;
    }

    private ExecResult loadfilter(CommandContext ctx, List<String> args) {
        requireArgs(args, 2, "loadfilter ?receiver? file channels ?options?");
        String line = "ionline";
        int first = 0;
        if ("plasmaline".startsWith(args.get(0))) {
            line = "plasmaline";
            first = 1;
        } else if ("ionline".startsWith(args.get(0))) {
            first = 1;
        }
        requireArgs(args, first + 2, "loadfilter ?receiver? file channels ?options?");
        String file = args.get(first);
        state(ctx).setLoadedFile(ExperimentState.LoadedFile.FILTER, file);
        boolean check = args.subList(first + 2, args.size()).contains("-T");
        log.info("{} filter {} for {} into channels {}", check ? "Check" : "Load", file, line,
                channels(args.get(first + 1)));
        return ExecResult.EMPTY;
    }

    private ExecResult startdata(CommandContext ctx, List<String> args) {
        List<String> rest = args;
        String receiver = "ion";
        if (!rest.isEmpty() && List.of("ion", "-ion", "pla", "-pla").contains(rest.get(0))) {
            receiver = rest.get(0);
            rest = rest.subList(1, rest.size());
        }
        requireArgs(rest, 3, "startdata ?receiver? corrfile expid iper ?antenna?");
        ExperimentState state = state(ctx);
        boolean esr = state.site() == RadarSite.ESR;
        if (!esr && receiver.endsWith("pla")) {
            log.info("No plasma line receiver at {}, startdata ignored", state.site());
            return ExecResult.EMPTY;
        }
        if (esr && rest.size() < 4) {
            throw new IllegalArgumentException("Must specify antenna (32m or 42m)!");
        }
        String antenna = esr ? rest.get(3) : state.antenna();
        state.setLoadedFile(ExperimentState.LoadedFile.CORRELATOR, rest.get(0));
        log.info("Start correlator with {} and recorder, expid {}, integration time {} s, antenna {}",
                rest.get(0), rest.get(1), rest.get(2), antenna);
        return ExecResult.EMPTY;
    }

    // -------------------------------------------------------------------------
    // Blocks and experiments
    // -------------------------------------------------------------------------

    private ExecResult block(CommandContext ctx, List<String> args) {
        if (args.size() != 3) {
            throw new IllegalArgumentException("wrong # args: should be \"block name args body\"");
        }
        log.info("Define BLOCK {}", args.get(0));
        ctx.interpreter().defineProcedure(ctx.scope(), Procedure.parse(args.get(0), args.get(1), args.get(2),
                ctx.command().source(), ctx.argumentLine(2)));
        return ExecResult.EMPTY;
    }

    private ExecResult callblock(CommandContext ctx, List<String> args) {
        requireArgs(args, 1, "callblock name ?arg ...?");
        log.info("Enter BLOCK {}", args.get(0));
        ExecResult result = ctx.interpreter().invoke(ctx.scope(), ctx.command(), args);
        Optional<Scope.LogEntry> call = ctx.scope().lastLogEntry();
        if (call.isPresent() && call.get().child().isPresent()) {
            int callee = call.get().child().getAsInt();
            ctx.scope().state().mergeFrom(ctx.interpreter().scopes().effectiveState(callee));
        }
        return result;
    }

    private ExecResult gotoblock(CommandContext ctx, List<String> args) {
        String target = String.join(" ", args);
        log.info("Terminate current BLOCK, next BLOCK is called with {}", target);
        return new ExecResult.JumpBlock(target);
    }

    private ExecResult runexperiment(CommandContext ctx, List<String> args) {
        requireArgs(args, 1, "runexperiment path ?start? ?arg ...?");
        Path path = files.find(args.get(0), ".elan").orElseThrow(() ->
                new IllegalArgumentException("Experiment file " + args.get(0) + " not found"));
        List<String> argv = args.size() > 2 ? args.subList(2, args.size()) : List.of();
        ctx.scope().setArgv(argv);
        log.info("Run experiment {} with arguments {}", path, argv);
        String script;
        try {
            script = TextFiles.read(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return ctx.interpreter().runScript(ctx.scope(), script, path.getFileName().toString());
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    private ExecResult readfrequencyfile(CommandContext ctx, List<String> args) {
        requireArgs(args, 2, "readfrequencyfile file address");
        if (args.size() > 2) {
            log.warn("readfrequencyfile reads one address at a time, using {}", args.get(1));
        }
        Path path = files.find(args.get(0), ".nco").orElseThrow(() ->
                new IllegalArgumentException("Frequency file " + args.get(0) + " not found"));
        NcoTable table;
        try {
            table = NcoTable.read(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (NcoFormatException e) {
            throw new IllegalArgumentException(path + ": " + e.getMessage(), e);
        }
        return ExecResult.normal(Double.toString(table.frequency(integer(args.get(1)))));
    }

    private static ExecResult isradar(CommandContext ctx, List<String> args) {
        RadarSite site = state(ctx).site();
        if (args.isEmpty()) {
            return ExecResult.normal(site.name());
        }
        return ExecResult.normal(flag(args.contains(site.name())));
    }

    private static ExecResult upar(CommandContext ctx, List<String> args) {
        if (args.isEmpty() || args.size() > 3) {
            throw new IllegalArgumentException("wrong # args: should be \"upar ?option? name ?value?\"");
        }
        if (args.size() == 1 && !args.get(0).equals("all")) {
            log.info("User parameter {} is not available here, returning 0", args.get(0));
            return ExecResult.normal("0");
        }
        log.info("Ignoring upar {}", args);
        return ExecResult.EMPTY;
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static void describe(Map<String, CommandHandler> t, String name, String description) {
        t.put(name, (ctx, args) -> {
            log.info("{}: {} {}", description, name, String.join(" ", args));
            return ExecResult.EMPTY;
        });
    }

    private static ExperimentState state(CommandContext ctx) {
        return ctx.scope().state(ExperimentState.class);
    }

    /**
     * The single candidate {@code prefix} abbreviates; an exact match wins.
     */
    static String complete(List<String> candidates, String prefix, String what) {
        if (candidates.contains(prefix)) {
            return prefix;
        }
        List<String> matches = new ArrayList<>();
        for (String c : candidates) {
            if (c.startsWith(prefix)) {
                matches.add(c);
            }
        }
        if (matches.size() == 1) {
            return matches.get(0);
        }
        if (matches.isEmpty()) {
            throw new IllegalArgumentException("Unknown " + what + " '" + prefix + "', expected one of " + candidates);
        }
        throw new IllegalArgumentException("Ambiguous " + what + " '" + prefix + "', could be any of " + matches);
    }

    /**
     * Channel numbers written anywhere in {@code spec}, e.g. {@code "1,2 3"}.
     */
    static List<Integer> channels(String spec) {
        List<Integer> channels = new ArrayList<>();
        Matcher m = DIGITS.matcher(spec);
        while (m.find()) {
            int ch = Integer.parseInt(m.group());
            if (ch < 1 || ch > ExperimentState.CHANNELS) {
                throw new IllegalArgumentException("Receive channels are numbered 1.."
                        + ExperimentState.CHANNELS + ", not " + ch);
            }
            channels.add(ch);
        }
        if (channels.isEmpty()) {
            throw new IllegalArgumentException("No channel numbers in '" + spec + "'");
        }
        return channels;
    }

    private static String flag(boolean b) {
        return b ? "1" : "0";
    }

    private static int integer(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("expected integer but got \"" + text + "\"", e);
        }
    }

    private static double number(String text) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("expected number but got \"" + text + "\"", e);
        }
    }

    private static void requireArgs(List<String> args, int min, String usage) {
        if (args.size() < min) {
            throw new IllegalArgumentException("wrong # args: should be \"" + usage + "\"");
        }
    }
}

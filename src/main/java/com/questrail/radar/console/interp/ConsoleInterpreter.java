package com.questrail.radar.console.interp;

import com.questrail.radar.api.TextFiles;
import com.questrail.radar.console.parser.ConsoleCommand;
import com.questrail.radar.console.parser.ConsoleException;
import com.questrail.radar.console.parser.ConsoleTokenizer;
import com.questrail.radar.console.parser.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ConsoleInterpreter
 * -----------------------------------------------------------------------------
 * Executes console scripts: a Tcl dialect extended with application commands.
 *
 * <h2>Execution of one command</h2>
 * <ol>
 *   <li>Every word is substituted according to its {@link
 *       com.questrail.radar.console.parser.WordKind}.</li>
 *   <li>The first word is resolved: procedures visible from the scope first,
 *       then built-ins, then the {@link CommandCatalog}. An unknown name is a
 *       {@link ConsoleException} located at that word.</li>
 *   <li>The command and its result are appended to the scope's log.</li>
 * </ol>
 *
 * <h2>Control flow</h2>
 * Commands return an {@link ExecResult}. {@code Return} and {@code JumpBlock}
 * end the procedure body they occur in; {@code JumpBlock} also ends a script
 * run by {@link #runScript}. A {@code Break} or {@code Continue} reaching a
 * procedure or the top level is an error.
 *
 * <h2>Errors</h2>
 * Handler failures ({@link IllegalArgumentException},
 * {@link IllegalStateException}, {@link ArithmeticException}, I/O) are
 * rethrown as {@link ConsoleException} located at the failing command.
 *
 * Not thread-safe; one interpreter runs one script at a time.
 */
public final class ConsoleInterpreter
{
    private static final Logger log = LoggerFactory.getLogger(ConsoleInterpreter.class);

    static final int MAX_CALL_DEPTH = 200;

    private final InterpreterConfig config;
    private final ScopeArena scopes;
    private final Map<String, CommandHandler> builtins;
    private final CommandCatalog catalog;
    private final Substitutor substitutor = new Substitutor(this);
    private ConsoleCommand lastCommand;
    private int callDepth;

    public ConsoleInterpreter(InterpreterConfig config) {
        this(config, DomainState.NONE, CommandCatalog.EMPTY);
    }

    public ConsoleInterpreter(InterpreterConfig config, DomainState rootState, CommandCatalog catalog) {
        this.config = Objects.requireNonNull(config, "config");
        this.scopes = new ScopeArena(Objects.requireNonNull(rootState, "rootState"));
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.builtins = BuiltinCommands.create();
        catalog.prepare(scopes.root());
    }

    public InterpreterConfig config() {
        return config;
    }

    public ScopeArena scopes() {
        return scopes;
    }

    public Scope rootScope() {
        return scopes.root();
    }

    /**
     * Root state with the changes of every procedure call merged in.
     */
    public DomainState effectiveState() {
        return scopes.effectiveState(0);
    }

    public <T extends DomainState> T effectiveState(Class<T> type) {
        DomainState state = effectiveState();
        if (!type.isInstance(state)) {
            throw new IllegalStateException("Interpreter state is not a " + type.getSimpleName());
        }
        return type.cast(state);
    }

    // -------------------------------------------------------------------------
    // Top level
    // -------------------------------------------------------------------------

    /**
     * Runs {@code script} in the root scope and returns its result.
     */
    public String eval(String script) {
        return eval(script, config.sourceName());
    }

    public String eval(String script, String sourceName) {
        ExecResult result = evalScript(scopes.root(), script, sourceName, 1);
        return consumeAtBoundary(result).value();
    }

    /**
     * Reads {@code path} and runs it in the root scope.
     */
    public String source(Path path) throws IOException {
        String script = TextFiles.read(path);
        log.debug("Running console script {}", path);
        return eval(script, path.toString());
    }

    // -------------------------------------------------------------------------
    // Evaluation, used by command handlers
    // -------------------------------------------------------------------------

    /**
     * Runs the commands of {@code script} in {@code scope} until one returns
     * anything but {@link ExecResult.Normal}.
     */
    public ExecResult evalScript(Scope scope, String script, String sourceName, int firstLine) {
        ExecResult result = ExecResult.EMPTY;
        for (ConsoleCommand command : ConsoleTokenizer.tokenize(script, sourceName, firstLine)) {
            result = execute(scope, command);
            if (!result.isNormal()) {
                return result;
            }
        }
        return result;
    }

    /**
     * Runs a whole script file's text as a unit: a {@code gotoblock} inside
     * it ends the script rather than propagating further.
     */
    public ExecResult runScript(Scope scope, String script, String sourceName) {
        ExecResult result = evalScript(scope, script, sourceName, 1);
        if (result instanceof ExecResult.JumpBlock jump) {
            log.debug("Script {} left by gotoblock {}", sourceName, jump.target());
            return ExecResult.EMPTY;
        }
        return result;
    }

    /**
     * Reads {@code fileName}, relative to the working directory, and runs it
     * with {@link #runScript}.
     */
    public ExecResult sourceFile(Scope scope, String fileName) {
        Path path = config.workingDirectory().resolve(fileName);
        try {
            return runScript(scope, TextFiles.read(path), path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Substitutes and runs one command.
     */
    public ExecResult execute(Scope scope, ConsoleCommand command) {
        List<String> words = new ArrayList<>(command.size());
        for (int i = 0; i < command.size(); i++) {
            Word w = command.word(i);
            switch (w.kind()) {
                case BRACED -> words.add(w.text());
                case BRACKETED -> words.add(evalNested(scope, w.text(), command, i).value());
                default -> words.add(substitutor.substitute(scope, w.text(), SubstitutionMode.ALL, command, i));
            }
        }
        return invoke(scope, command, words);
    }

    /**
     * Dispatches already substituted {@code words} as a command issued by
     * {@code origin}.
     */
    public ExecResult invoke(Scope scope, ConsoleCommand origin, List<String> words) {
        if (words.isEmpty()) {
            return ExecResult.EMPTY;
        }
        lastCommand = origin;
        scope.takeChild();
        String name = words.get(0);
        List<String> args = List.copyOf(words.subList(1, words.size()));
        ExecResult result;
        try {
            Optional<Procedure> procedure = scopes.resolveProcedure(scope, name);
            if (procedure.isPresent()) {
                result = callProcedure(scope, procedure.get(), args);
            } else {
                CommandHandler handler = builtins.get(name);
                if (handler == null) {
                    handler = catalog.lookup(name).orElseThrow(() ->
                            ConsoleException.at(origin, 0, "Function '" + name + "' is not known in Tcl scope!"));
                }
                result = handler.execute(new CommandContext(this, scope, origin), args);
            }
        } catch (IllegalArgumentException | IllegalStateException | ArithmeticException e) {
            throw ConsoleException.at(origin, e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw ConsoleException.at(origin, "Could not read file: " + e.getCause().getMessage(), e);
        }
        scope.append(new Scope.LogEntry(words, result.value(), scope.takeChild()));
        return result;
    }

    /**
     * Runs {@code procedure} in a new child scope of {@code caller}.
     */
    public ExecResult callProcedure(Scope caller, Procedure procedure, List<String> args) {
        Map<String, String> bound = procedure.bind(args);
        if (callDepth >= MAX_CALL_DEPTH) {
            throw new IllegalStateException("Too many nested procedure calls, is " + procedure.name() + " recursive?");
        }
        Scope child = scopes.createChild(caller);
        bound.forEach(child::setVariable);
        callDepth++;
        ExecResult result;
        try {
            result = evalScript(child, procedure.body(), procedure.source(), procedure.line());
        } finally {
            callDepth--;
        }
        caller.markChild(child.id());
        return consumeAtBoundary(result);
    }

    /**
     * Runs {@code script}, found inside word {@code wordIndex} of
     * {@code origin}, in {@code scope}.
     */
    public ExecResult evalNested(Scope scope, String script, ConsoleCommand origin, int wordIndex) {
        return evalScript(scope, script, origin.source(), origin.word(wordIndex).line());
    }

    public String substitute(Scope scope, String text, ConsoleCommand origin, int wordIndex) {
        return substitutor.substitute(scope, text, SubstitutionMode.ALL, origin, wordIndex);
    }

    String substitute(Scope scope, String text, SubstitutionMode mode, ConsoleCommand origin, int wordIndex) {
        return substitutor.substitute(scope, text, mode, origin, wordIndex);
    }

    public String evaluateExpression(Scope scope, String expression, ConsoleCommand origin, int wordIndex) {
        return ExpressionEvaluator.evaluate(this, scope, expression, origin, wordIndex);
    }

    public void defineProcedure(Scope scope, Procedure procedure) {
        if (builtins.containsKey(procedure.name())) {
            log.warn("Procedure {} hides the built-in command of the same name", procedure.name());
        }
        scope.define(procedure);
    }

    private ExecResult consumeAtBoundary(ExecResult result) {
        if (result instanceof ExecResult.Return r) {
            return ExecResult.normal(r.value());
        }
        if (result instanceof ExecResult.JumpBlock jump) {
            log.debug("Block left by gotoblock {}", jump.target());
            return ExecResult.EMPTY;
        }
        if (result instanceof ExecResult.Break || result instanceof ExecResult.Continue) {
            String keyword = result instanceof ExecResult.Break ? "break" : "continue";
            throw ConsoleException.at(lastCommand, "invoked \"" + keyword + "\" outside of a loop");
        }
        return result;
    }
}

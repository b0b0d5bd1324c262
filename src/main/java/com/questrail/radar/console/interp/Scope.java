package com.questrail.radar.console.interp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Scope
 * -----------------------------------------------------------------------------
 * Execution context of a console script or procedure body.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>variables, copied from the parent when the scope is created</li>
 *   <li>procedures defined in this scope; ancestors' procedures are resolved
 *       through {@link ScopeArena}</li>
 *   <li>the {@link DomainState}, also a copy of the parent's</li>
 *   <li>the argument vector of the running experiment</li>
 *   <li>a log with one entry per executed command</li>
 * </ul>
 *
 * A scope refers to its parent by arena index, never by reference.
 */
public final class Scope
{
    /**
     * One executed command: its substituted words, its result and, for
     * procedure calls, the index of the scope the body ran in.
     */
    public record LogEntry(List<String> words, String result, int childScope) {
        public static final int NO_SCOPE = -1;

        public LogEntry {
            words = List.copyOf(Objects.requireNonNull(words, "words"));
            Objects.requireNonNull(result, "result");
        }

        public OptionalInt child() {
            return childScope == NO_SCOPE ? OptionalInt.empty() : OptionalInt.of(childScope);
        }
    }

    private final int id;
    private final int parentId;
    private final Map<String, String> variables;
    private final Map<String, Procedure> procedures = new LinkedHashMap<>();
    private final DomainState state;
    private final List<LogEntry> log = new ArrayList<>();
    private List<String> argv;
    private int pendingChild = LogEntry.NO_SCOPE;

    Scope(int id, int parentId, Map<String, String> variables, DomainState state, List<String> argv) {
        this.id = id;
        this.parentId = parentId;
        this.variables = new LinkedHashMap<>(variables);
        this.state = Objects.requireNonNull(state, "state");
        this.argv = List.copyOf(argv);
    }

    public int id() {
        return id;
    }

    /**
     * Arena index of the parent scope, or -1 for the root scope.
     */
    public int parentId() {
        return parentId;
    }

    public boolean isRoot() {
        return parentId < 0;
    }

    // -------------------------------------------------------------------------
    // Variables
    // -------------------------------------------------------------------------

    public Optional<String> variable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    public void setVariable(String name, String value) {
        variables.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
    }

    public Map<String, String> variables() {
        return Collections.unmodifiableMap(variables);
    }

    // -------------------------------------------------------------------------
    // Procedures
    // -------------------------------------------------------------------------

    public Optional<Procedure> ownProcedure(String name) {
        return Optional.ofNullable(procedures.get(name));
    }

    public void define(Procedure procedure) {
        procedures.put(procedure.name(), procedure);
    }

    public Map<String, Procedure> procedures() {
        return Collections.unmodifiableMap(procedures);
    }

    // -------------------------------------------------------------------------
    // Domain state and experiment arguments
    // -------------------------------------------------------------------------

    public DomainState state() {
        return state;
    }

    public <T extends DomainState> T state(Class<T> type) {
        if (!type.isInstance(state)) {
            throw new IllegalStateException("Scope state is not a " + type.getSimpleName());
        }
        return type.cast(state);
    }

    public List<String> argv() {
        return argv;
    }

    public void setArgv(List<String> argv) {
        this.argv = List.copyOf(argv);
    }

    // -------------------------------------------------------------------------
    // Log
    // -------------------------------------------------------------------------

    public List<LogEntry> log() {
        return Collections.unmodifiableList(log);
    }

    public Optional<LogEntry> lastLogEntry() {
        return log.isEmpty() ? Optional.empty() : Optional.of(log.get(log.size() - 1));
    }

    void append(LogEntry entry) {
        log.add(entry);
    }

    void markChild(int childId) {
        pendingChild = childId;
    }

    int takeChild() {
        int child = pendingChild;
        pendingChild = LogEntry.NO_SCOPE;
        return child;
    }
}

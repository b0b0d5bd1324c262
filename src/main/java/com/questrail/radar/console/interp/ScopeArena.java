package com.questrail.radar.console.interp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Owns every {@link Scope} an interpreter creates, indexed by creation order.
 * Index 0 is the root scope.
 */
public final class ScopeArena
{
    private final List<Scope> scopes = new ArrayList<>();

    ScopeArena(DomainState rootState) {
        scopes.add(new Scope(0, -1, new LinkedHashMap<>(), rootState, List.of()));
    }

    public Scope root() {
        return scopes.get(0);
    }

    public Scope get(int id) {
        if (id < 0 || id >= scopes.size()) {
            throw new IllegalArgumentException("No scope with index " + id);
        }
        return scopes.get(id);
    }

    public int size() {
        return scopes.size();
    }

    Scope createChild(Scope parent) {
        Scope child = new Scope(scopes.size(), parent.id(), parent.variables(), parent.state().copy(), parent.argv());
        scopes.add(child);
        return child;
    }

    /**
     * Finds {@code name} in {@code scope} or the nearest ancestor defining it.
     */
    public Optional<Procedure> resolveProcedure(Scope scope, String name) {
        Scope s = scope;
        while (true) {
            Optional<Procedure> own = s.ownProcedure(name);
            if (own.isPresent() || s.isRoot()) {
                return own;
            }
            s = get(s.parentId());
        }
    }

    /**
     * State of scope {@code id} with the effective states of every procedure
     * call in its log merged in, recursively.
     */
    public DomainState effectiveState(int id) {
        Scope scope = get(id);
        DomainState folded = scope.state().copy();
        for (Scope.LogEntry entry : scope.log()) {
            entry.child().ifPresent(child -> folded.mergeFrom(effectiveState(child)));
        }
        return folded;
    }
}

package com.questrail.radar.console.interp;

import java.util.Optional;

/**
 * Application commands consulted after procedures and built-ins.
 */
public interface CommandCatalog
{
    CommandCatalog EMPTY = name -> Optional.empty();

    Optional<CommandHandler> lookup(String name);

    /**
     * Seeds the root scope before the first script runs.
     */
    default void prepare(Scope root) {
    }
}

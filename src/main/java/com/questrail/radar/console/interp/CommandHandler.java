package com.questrail.radar.console.interp;

import java.util.List;

/**
 * Implementation of one console command.
 *
 * <p>{@code args} are the substituted words after the command name.
 * Handlers report bad usage by throwing {@link IllegalArgumentException} or
 * {@link IllegalStateException}; the interpreter turns those into a located
 * {@link com.questrail.radar.console.parser.ConsoleException}.</p>
 */
@FunctionalInterface
public interface CommandHandler
{
    ExecResult execute(CommandContext context, List<String> args);
}

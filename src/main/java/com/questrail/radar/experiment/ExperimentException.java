package com.questrail.radar.experiment;

/**
 * Indicates that an experiment could not be assembled.
 *
 * This typically reflects:
 * <ul>
 *   <li>A console script that loads no controller program</li>
 *   <li>A controller program or NCO file that cannot be found or read</li>
 * </ul>
 *
 * Errors inside the programs themselves keep their own types
 * ({@code ControllerException}, {@code ConsoleException},
 * {@code NcoFormatException}) and are not wrapped.
 */
public final class ExperimentException extends RuntimeException
{
    public ExperimentException(String message) {
        super(message);
    }

    public ExperimentException(String message, Throwable cause) {
        super(message, cause);
    }
}

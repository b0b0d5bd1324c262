package com.questrail.radar.console.parser;

/**
 * ConsoleException
 * -----------------------------------------------------------------------------
 * Raised when a console script cannot be tokenized or executed.
 *
 * <h2>Location</h2>
 * Every instance carries the source name, the line and the character range it
 * refers to, and renders them as a prefix of the message:
 * <pre>
 *   beata.elan, line 12, chars 5–9: Function 'lodradar' is not known in Tcl scope!
 * </pre>
 * {@link #detail()} returns the message without that prefix.
 */
public final class ConsoleException extends RuntimeException
{
    private final String source;
    private final int line;
    private final int start;
    private final int end;
    private final String detail;

    public ConsoleException(String source, int line, int start, int end, String message) {
        this(source, line, start, end, message, null);
    }

    public ConsoleException(String source, int line, int start, int end, String message, Throwable cause) {
        super(source + ", line " + line + ", chars " + start + "–" + end + ": " + message, cause);
        this.source = source;
        this.line = line;
        this.start = start;
        this.end = end;
        this.detail = message;
    }

    /**
     * Error located at the whole command.
     */
    public static ConsoleException at(ConsoleCommand command, String message) {
        return new ConsoleException(command.source(), command.line(), command.start(), command.end(), message);
    }

    public static ConsoleException at(ConsoleCommand command, String message, Throwable cause) {
        return new ConsoleException(command.source(), command.line(), command.start(), command.end(), message, cause);
    }

    /**
     * Error located at one word of the command.
     */
    public static ConsoleException at(ConsoleCommand command, int wordIndex, String message) {
        Word w = command.word(Math.min(Math.max(wordIndex, 0), command.size() - 1));
        return new ConsoleException(command.source(), w.line(), w.start(), w.end(), message);
    }

    public String source() {
        return source;
    }

    public int line() {
        return line;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    public String detail() {
        return detail;
    }
}

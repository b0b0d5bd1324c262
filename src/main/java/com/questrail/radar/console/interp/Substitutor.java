package com.questrail.radar.console.interp;

import com.questrail.radar.console.parser.ConsoleCommand;
import com.questrail.radar.console.parser.ConsoleException;
import com.questrail.radar.console.parser.ConsoleTokenizer;

/**
 * Substitutor
 * -----------------------------------------------------------------------------
 * Performs command, variable and backslash substitution on the text of a
 * word, in one left-to-right pass.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>{@code [script]} is replaced by the result of {@code script}.</li>
 *   <li>{@code $name} and {@code ${name}} are replaced by the variable's
 *       value. Names consist of letters, digits, underscores and {@code ::};
 *       a {@code $} not followed by a name stays literal.</li>
 *   <li>{@code \n}, {@code \t}, {@code \r}, {@code \a}, {@code \b},
 *       {@code \f} and {@code \v} become control characters, a backslash
 *       before a newline and its following blanks becomes one space, and
 *       any other escaped character stands for itself. {@code \x},
 *       {@code \o}, {@code &#92;u} and {@code &#92;U} are rejected.</li>
 * </ul>
 * Text produced by a substitution is never scanned again, so an escaped
 * {@code $} or {@code [} stays literal.
 */
final class Substitutor
{
    private final ConsoleInterpreter interpreter;

    Substitutor(ConsoleInterpreter interpreter) {
        this.interpreter = interpreter;
    }

    String substitute(Scope scope, String text, SubstitutionMode mode, ConsoleCommand command, int wordIndex) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\\') {
                if (!mode.backslashes()) {
                    out.append(c);
                    i++;
                    continue;
                }
                i = backslash(text, i, out, command, wordIndex);
            } else if (c == '[' && mode.commands()) {
                int close = ConsoleTokenizer.findCloseBracket(text, i);
                if (close < 0) {
                    throw ConsoleException.at(command, wordIndex, "Missing close-bracket");
                }
                out.append(interpreter.evalNested(scope, text.substring(i + 1, close), command, wordIndex).value());
                i = close + 1;
            } else if (c == '$' && mode.variables()) {
                i = variable(scope, text, i, out, command, wordIndex);
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Value of variable {@code name}.
     *
     * @throws ConsoleException when the variable does not exist
     */
    static String lookup(Scope scope, String name, ConsoleCommand command, int wordIndex) {
        return scope.variable(name).orElseThrow(() ->
                ConsoleException.at(command, wordIndex, "Variable '" + name + "' is not known in Tcl scope!"));
    }

    /**
     * Length of the variable name starting at {@code from}.
     */
    static int nameLength(String text, int from) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_') {
                i++;
            } else if (c == ':' && i + 1 < text.length() && text.charAt(i + 1) == ':') {
                i += 2;
            } else {
                break;
            }
        }
        return i - from;
    }

    private int variable(Scope scope, String text, int dollar, StringBuilder out,
                         ConsoleCommand command, int wordIndex) {
        int start = dollar + 1;
        if (start < text.length() && text.charAt(start) == '{') {
            int close = text.indexOf('}', start);
            if (close < 0) {
                throw ConsoleException.at(command, wordIndex, "Missing close-brace for variable name");
            }
            out.append(lookup(scope, text.substring(start + 1, close), command, wordIndex));
            return close + 1;
        }
        int length = nameLength(text, start);
        if (length == 0) {
            out.append('$');
            return start;
        }
        out.append(lookup(scope, text.substring(start, start + length), command, wordIndex));
        return start + length;
    }

    private static int backslash(String text, int at, StringBuilder out, ConsoleCommand command, int wordIndex) {
        if (at + 1 >= text.length()) {
            out.append('\\');
            return at + 1;
        }
        int continuation = ConsoleTokenizer.continuationLength(text, at);
        if (continuation > 0) {
            out.append(' ');
            int i = at + continuation;
            while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
                i++;
            }
            return i;
        }
        char next = text.charAt(at + 1);
        switch (next) {
            case 'n' -> out.append('\n');
            case 't' -> out.append('\t');
            case 'r' -> out.append('\r');
            case 'a' -> out.append('\u0007');
            case 'b' -> out.append('\b');
            case 'f' -> out.append('\f');
            case 'v' -> out.append('\u000B');
            case 'x', 'o', 'u', 'U' -> throw ConsoleException.at(command, wordIndex,
                    "Could not handle escape sequence \\" + next);
            default -> out.append(next);
        }
        return at + 2;
    }
}

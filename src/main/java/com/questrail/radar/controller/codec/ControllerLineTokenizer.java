package com.questrail.radar.controller.codec;

import com.questrail.radar.controller.ControllerException;
import com.questrail.radar.controller.model.ControllerCommand;

import java.util.ArrayList;
import java.util.List;

/**
 * ControllerLineTokenizer
 * -----------------------------------------------------------------------------
 * Turns one line of a controller program into {@link ControllerCommand}s.
 *
 * <h2>Accepted forms</h2>
 * <pre>
 *   AT 40 RFON,PHA0 CH1      % three commands at 40 µs
 *   SETTCR 1505              % one SETTCR command at 1505 µs
 * </pre>
 * Text after {@code %} is a comment. Blank and comment-only lines produce no
 * commands. Times are written in microseconds and converted to seconds.
 *
 * Any other statement is rejected with a {@link ControllerException} carrying
 * the line number.
 */
public final class ControllerLineTokenizer
{
    static final double MICROSECOND = 1e-6;

    private ControllerLineTokenizer() {
    }

    public static List<ControllerCommand> tokenize(String line, int lineNumber) {
        String code = line;
        int pct = code.indexOf('%');
        if (pct >= 0) {
            code = code.substring(0, pct);
        }
        code = code.trim();
        if (code.isEmpty()) {
            return List.of();
        }

        String[] args = code.split("\\s+");
        switch (args[0]) {
            case "AT" -> {
                if (args.length < 3) {
                    throw new ControllerException(lineNumber,
                            "Line starting with 'AT' must include time and command(s)!");
                }
                double time = parseTime(args[1], lineNumber);
                List<ControllerCommand> commands = new ArrayList<>();
                for (int i = 2; i < args.length; i++) {
                    for (String mnemonic : args[i].split(",")) {
                        if (!mnemonic.isEmpty()) {
                            commands.add(new ControllerCommand(time, mnemonic, lineNumber));
                        }
                    }
                }
                return commands;
            }
            case ControllerCommand.SETTCR -> {
                if (args.length < 2) {
                    throw new ControllerException(lineNumber, "Line starting with 'SETTCR' must include a time!");
                }
                return List.of(new ControllerCommand(parseTime(args[1], lineNumber), ControllerCommand.SETTCR, lineNumber));
            }
            default -> throw new ControllerException(lineNumber,
                    "Line must start with 'AT' or 'SETTCR'. Use '%' for comments.");
        }
    }

    private static double parseTime(String token, int lineNumber) {
        double micros;
        try {
            micros = Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new ControllerException(lineNumber, "Time '" + token + "' is not a number", e);
        }
        if (!Double.isFinite(micros) || micros < 0) {
            throw new ControllerException(lineNumber, "Time '" + token + "' must be a non-negative number");
        }
        return micros * MICROSECOND;
    }
}

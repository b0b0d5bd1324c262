package com.questrail.radar.controller.codec;

import com.questrail.radar.api.TextFiles;
import com.questrail.radar.controller.model.ControllerCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads a whole controller program into commands, in file order.
 *
 * <p>Reading stops at the first {@code REP}: the hardware repeats the cycle
 * from there, so later lines can never run and are not parsed.</p>
 */
public final class ControllerProgramReader
{
    private ControllerProgramReader() {
    }

    public static List<ControllerCommand> read(Path path) throws IOException {
        return read(new StringReader(TextFiles.read(path)));
    }

    public static List<ControllerCommand> parse(String program) {
        try {
            return read(new StringReader(program));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<ControllerCommand> read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader b ? b : new BufferedReader(source);
        List<ControllerCommand> commands = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            for (ControllerCommand command : ControllerLineTokenizer.tokenize(line, lineNumber)) {
                commands.add(command);
                if (command.isRep()) {
                    return Collections.unmodifiableList(commands);
                }
            }
        }
        return Collections.unmodifiableList(commands);
    }
}

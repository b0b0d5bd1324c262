package com.questrail.radar.nco;

import com.questrail.radar.api.TextFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * NcoTable
 * -----------------------------------------------------------------------------
 * Frequency table loaded into the numerically controlled oscillator of a
 * receive channel.
 *
 * <h2>File format</h2>
 * <pre>
 *   NCOPAR_VS       0.1
 *   %======================
 *   % LO1=812.0 MHz LO2=128.0 MHz
 *   NCO  0  10.4   % f12
 *   NCO  1  10.1   % f13
 * </pre>
 * Text after {@code %} is a comment. The first non-comment line must be the
 * version line; every further non-comment line is an {@code NCO} entry whose
 * indices run 0, 1, 2, ... Frequencies are in MHz.
 */
public final class NcoTable
{
    static final String VERSION_KEY = "NCOPAR_VS";
    static final String VERSION = "0.1";

    private final List<Double> frequencies;

    public NcoTable(List<Double> frequenciesMHz) {
        this.frequencies = List.copyOf(Objects.requireNonNull(frequenciesMHz, "frequenciesMHz"));
    }

    /**
     * Frequencies in MHz, indexed by NCO table address.
     */
    public List<Double> frequencies() {
        return frequencies;
    }

    public int size() {
        return frequencies.size();
    }

    /**
     * @throws IllegalArgumentException if {@code index} is not a table address
     */
    public double frequency(int index) {
        if (index < 0 || index >= frequencies.size()) {
            throw new IllegalArgumentException(
                    "NCO address " + index + " is not in table of size " + frequencies.size());
        }
        return frequencies.get(index);
    }

    public static NcoTable read(Path path) throws IOException {
        return parse(TextFiles.read(path));
    }

    /**
     * @throws NcoFormatException if the text is not a valid NCO file
     */
    public static NcoTable parse(String text) {
        Objects.requireNonNull(text, "text");

        List<Double> freqs = new ArrayList<>();
        boolean versionSeen = false;
        String[] lines = text.split("\\R", -1);

        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            String code = stripComment(lines[i]).trim();
            if (code.isEmpty()) {
                continue;
            }
            String[] tokens = code.split("\\s+");

            if (!versionSeen) {
                if (!VERSION_KEY.equals(tokens[0])) {
                    throw new NcoFormatException(NcoFormatException.Reason.MISSING_VERSION, lineNo,
                            "File must start with '" + VERSION_KEY + " " + VERSION + "'");
                }
                if (tokens.length != 2 || !VERSION.equals(tokens[1])) {
                    throw new NcoFormatException(NcoFormatException.Reason.WRONG_VERSION, lineNo,
                            "Unsupported NCO file version '" + code + "'");
                }
                versionSeen = true;
                continue;
            }

            if (tokens.length != 3 || !"NCO".equals(tokens[0])) {
                throw new NcoFormatException(NcoFormatException.Reason.MALFORMED_ENTRY, lineNo,
                        "Expected 'NCO <index> <frequency>', got '" + code + "'");
            }

            double freq;
            try {
                freq = Double.parseDouble(tokens[2]);
            } catch (NumberFormatException e) {
                throw new NcoFormatException(NcoFormatException.Reason.INVALID_FREQUENCY, lineNo,
                        "Frequency '" + tokens[2] + "' is not a number", e);
            }

            int index;
            try {
                index = Integer.parseInt(tokens[1]);
            } catch (NumberFormatException e) {
                throw new NcoFormatException(NcoFormatException.Reason.MALFORMED_ENTRY, lineNo,
                        "NCO index '" + tokens[1] + "' is not an integer", e);
            }
            if (index != freqs.size()) {
                throw new NcoFormatException(NcoFormatException.Reason.WRONG_INDEX, lineNo,
                        "Expected NCO index " + freqs.size() + ", got " + index);
            }
            freqs.add(freq);
        }

        if (!versionSeen) {
            throw new NcoFormatException(NcoFormatException.Reason.MISSING_VERSION, 0,
                    "File has no '" + VERSION_KEY + "' line");
        }
        return new NcoTable(freqs);
    }

    private static String stripComment(String line) {
        int pct = line.indexOf('%');
        return pct >= 0 ? line.substring(0, pct) : line;
    }

    @Override
    public String toString() {
        return "NcoTable" + frequencies;
    }
}

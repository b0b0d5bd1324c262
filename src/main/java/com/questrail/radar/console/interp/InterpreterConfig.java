package com.questrail.radar.console.interp;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration of a {@link ConsoleInterpreter}.
 *
 * <ul>
 *   <li>{@code maxLoopIterations}: body executions allowed per
 *       {@code for}/{@code while} loop before it fails</li>
 *   <li>{@code output}: where {@code puts} writes</li>
 *   <li>{@code sourceName}: name used in error locations of top-level
 *       scripts</li>
 *   <li>{@code workingDirectory}: base for relative file names</li>
 * </ul>
 */
public record InterpreterConfig(
    int maxLoopIterations,
    PrintStream output,
    String sourceName,
    Path workingDirectory
) {
    public static final int DEFAULT_MAX_LOOP_ITERATIONS = 1000;

    public InterpreterConfig {
        if (maxLoopIterations < 1) {
            throw new IllegalArgumentException("maxLoopIterations must be >= 1");
        }
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
    }

    public static InterpreterConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxLoopIterations = DEFAULT_MAX_LOOP_ITERATIONS;
        private PrintStream output = System.out;
        private String sourceName = "console";
        private Path workingDirectory = Path.of("");

        public Builder withMaxLoopIterations(int maxLoopIterations) {
            this.maxLoopIterations = maxLoopIterations;
            return this;
        }

        public Builder withOutput(PrintStream output) {
            this.output = output;
            return this;
        }

        public Builder withSourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder withWorkingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public InterpreterConfig build() {
            return new InterpreterConfig(maxLoopIterations, output, sourceName, workingDirectory);
        }
    }
}

package com.questrail.radar.experiment;

import com.questrail.radar.console.eros.ExperimentFiles;
import com.questrail.radar.console.eros.ExperimentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * TlanResolver
 * -----------------------------------------------------------------------------
 * Finds the controller program source a console script ran.
 *
 * <h2>Resolution order</h2>
 * <ol>
 *   <li>The last receiver program loaded ({@code .rbin}), else the last
 *       transmitter program ({@code .tbin}), with its extension replaced by
 *       {@code .tlan}.</li>
 *   <li>If that file does not exist, the {@code .tlan} file in the same
 *       directory whose name shares the longest prefix with the compiled
 *       program's name.</li>
 * </ol>
 * Compiled programs are not guaranteed to carry their source's name, so the
 * second step is a guess and is logged as such.
 */
public final class TlanResolver
{
    private static final Logger log = LoggerFactory.getLogger(TlanResolver.class);

    static final String TLAN = ".tlan";

    private final ExperimentFiles files;

    public TlanResolver(ExperimentFiles files) {
        this.files = Objects.requireNonNull(files, "files");
    }

    /**
     * @throws ExperimentException if no program was loaded or no source is
     *         found for it
     */
    public Path resolve(ExperimentState state) {
        String compiled = state.loadedFile(ExperimentState.LoadedFile.RBIN)
                .or(() -> state.loadedFile(ExperimentState.LoadedFile.TBIN))
                .orElseThrow(() -> new ExperimentException("The script did not load any controller program"));

        String source = swapExtension(compiled);
        Optional<Path> exact = files.find(source);
        if (exact.isPresent() && Files.isRegularFile(exact.get())) {
            return exact.get();
        }

        String directory = parentName(source);
        Path dir = files.find(directory.isEmpty() ? "." : directory)
                .filter(Files::isDirectory)
                .orElseThrow(() -> new ExperimentException("No directory " + directory + " for program " + compiled));
        Path closest = closest(dir, baseName(source))
                .orElseThrow(() -> new ExperimentException("No " + TLAN + " file in " + dir + " for program " + compiled));
        log.warn("{} not found, guessing {} as the source of {}", source, closest, compiled);
        return closest;
    }

    static String swapExtension(String file) {
        String base = baseName(file);
        int dot = base.lastIndexOf('.');
        String stripped = dot > 0 ? file.substring(0, file.length() - (base.length() - dot)) : file;
        return stripped + TLAN;
    }

    private static Optional<Path> closest(Path dir, String stem) {
        List<Path> candidates;
        try (Stream<Path> entries = Files.list(dir)) {
            candidates = entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(TLAN))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        Path best = null;
        int bestLength = -1;
        for (Path candidate : candidates) {
            int length = commonPrefix(candidate.getFileName().toString(), stem);
            if (length > bestLength) {
                best = candidate;
                bestLength = length;
            }
        }
        return Optional.ofNullable(best);
    }

    private static int commonPrefix(String a, String b) {
        int n = Math.min(a.length(), b.length());
        int i = 0;
        while (i < n && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return i;
    }

    private static String baseName(String file) {
        int slash = file.lastIndexOf('/');
        return slash < 0 ? file : file.substring(slash + 1);
    }

    private static String parentName(String file) {
        int slash = file.lastIndexOf('/');
        return slash < 0 ? "" : file.substring(0, slash);
    }
}

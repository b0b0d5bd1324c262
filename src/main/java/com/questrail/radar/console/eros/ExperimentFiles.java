package com.questrail.radar.console.eros;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds experiment files named the way console scripts name them.
 *
 * <p>Scripts refer to files by their location on the radar computers, e.g.
 * {@code /kst/exp/beata/beata}. Such a name is tried as given, then with the
 * {@code /kst/exp/} prefix removed below each search root, then below
 * {@code kst/exp} in each search root.</p>
 */
public final class ExperimentFiles
{
    public static final String EXPERIMENT_ROOT = "/kst/exp/";

    private final List<Path> roots;

    public ExperimentFiles(List<Path> roots) {
        this.roots = List.copyOf(roots);
    }

    public static ExperimentFiles under(Path... roots) {
        return new ExperimentFiles(List.of(roots));
    }

    /**
     * @param extension appended to {@code name} unless already present, e.g.
     *                  {@code ".elan"}
     */
    public Optional<Path> find(String name, String extension) {
        return find(name.endsWith(extension) ? name : name + extension);
    }

    /**
     * First existing file or directory among the candidates for {@code name}.
     */
    public Optional<Path> find(String name) {
        for (Path candidate : candidates(name)) {
            if (Files.exists(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    List<Path> candidates(String name) {
        List<Path> candidates = new ArrayList<>();
        Path given = Path.of(name);
        if (given.isAbsolute()) {
            candidates.add(given);
        }
        String relative = name.startsWith(EXPERIMENT_ROOT) ? name.substring(EXPERIMENT_ROOT.length()) : name;
        for (Path root : roots) {
            candidates.add(root.resolve(relative));
        }
        if (!Path.of(relative).isAbsolute()) {
            for (Path root : roots) {
                candidates.add(root.resolve("kst").resolve("exp").resolve(relative));
            }
        }
        return candidates;
    }
}

package com.questrail.radar.console.eros;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class ExperimentFilesTest
{
    @TempDir
    Path root;

    @Test
    void radarComputerPathsAreFoundBelowTheSearchRoot() throws IOException {
        Path file = Files.createDirectories(root.resolve("beata")).resolve("beata.elan");
        Files.writeString(file, "");
        ExperimentFiles files = ExperimentFiles.under(root);

        assertEquals(file, files.find("/kst/exp/beata/beata", ".elan").orElseThrow());
        assertEquals(file, files.find("beata/beata.elan", ".elan").orElseThrow());
    }

    @Test
    void kstExpDirectoryBelowTheRootIsSearchedToo() throws IOException {
        Path file = Files.createDirectories(root.resolve("kst/exp/cp1")).resolve("cp1.nco");
        Files.writeString(file, "");

        assertEquals(file, ExperimentFiles.under(root).find("cp1/cp1", ".nco").orElseThrow());
    }

    @Test
    void missingFileIsEmpty() {
        assertTrue(ExperimentFiles.under(root).find("nothing", ".elan").isEmpty());
    }
}

package com.questrail.radar.experiment;

import com.questrail.radar.console.eros.ExperimentFiles;
import com.questrail.radar.console.eros.ExperimentState;
import com.questrail.radar.controller.config.RadarSite;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class TlanResolverTest
{
    @TempDir
    Path root;

    private TlanResolver resolver() {
        return new TlanResolver(ExperimentFiles.under(root));
    }

    private static ExperimentState loaded(ExperimentState.LoadedFile kind, String file) {
        ExperimentState state = new ExperimentState(RadarSite.UHF);
        state.setLoadedFile(kind, file);
        return state;
    }

    private Path touch(String name) throws IOException {
        Path file = root.resolve(name);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, "AT 10 REP\n");
    }

    @Test
    void extensionIsReplaced() {
        assertEquals("/kst/exp/beata/beata.tlan", TlanResolver.swapExtension("/kst/exp/beata/beata.rbin"));
        assertEquals("a/b.c.tlan", TlanResolver.swapExtension("a/b.c.tbin"));
        assertEquals("dir.x/plain.tlan", TlanResolver.swapExtension("dir.x/plain"));
    }

    @Test
    void receiverProgramIsPreferred() throws IOException {
        Path rx = touch("beata/beata.tlan");
        touch("beata/beata_tx.tlan");
        ExperimentState state = loaded(ExperimentState.LoadedFile.TBIN, "/kst/exp/beata/beata_tx.tbin");
        state.setLoadedFile(ExperimentState.LoadedFile.RBIN, "/kst/exp/beata/beata.rbin");

        assertEquals(rx, resolver().resolve(state));
    }

    @Test
    void transmitterProgramIsUsedWithoutReceiverProgram() throws IOException {
        Path tx = touch("beata/beata_tx.tlan");

        assertEquals(tx, resolver().resolve(loaded(ExperimentState.LoadedFile.TBIN, "/kst/exp/beata/beata_tx.tbin")));
    }

    @Test
    void closestNameIsGuessedWhenTheSourceIsMissing() throws IOException {
        Path guess = touch("beata/beata_v2.tlan");
        touch("beata/other.tlan");
        touch("beata/beata.nco");

        assertEquals(guess, resolver().resolve(loaded(ExperimentState.LoadedFile.RBIN, "/kst/exp/beata/beata.rbin")));
    }

    @Test
    void scriptWithoutProgramFails() {
        ExperimentException e = assertThrows(ExperimentException.class,
                () -> resolver().resolve(new ExperimentState(RadarSite.UHF)));
        assertEquals("The script did not load any controller program", e.getMessage());
    }

    @Test
    void missingDirectoryOrSourceFails() throws IOException {
        assertThrows(ExperimentException.class,
                () -> resolver().resolve(loaded(ExperimentState.LoadedFile.RBIN, "/kst/exp/none/none.rbin")));

        touch("empty/readme.txt");
        assertThrows(ExperimentException.class,
                () -> resolver().resolve(loaded(ExperimentState.LoadedFile.RBIN, "/kst/exp/empty/x.rbin")));
    }
}

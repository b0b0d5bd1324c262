package com.questrail.radar.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class TextFilesTest
{
    @TempDir
    Path temp;

    @Test
    void readsUtf8() throws IOException {
        Path file = Files.write(temp.resolve("a.elan"), "% Tromsø 180°\n".getBytes(StandardCharsets.UTF_8));

        assertEquals("% Tromsø 180°\n", TextFiles.read(file));
    }

    @Test
    void fallsBackToLatin1() throws IOException {
        Path file = Files.write(temp.resolve("b.elan"), "% Tromsø\n".getBytes(StandardCharsets.ISO_8859_1));

        assertEquals("% Tromsø\n", TextFiles.read(file));
    }
}

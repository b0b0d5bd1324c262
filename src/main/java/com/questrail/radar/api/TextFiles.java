package com.questrail.radar.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the text files of an experiment: console scripts, controller
 * programs and NCO tables.
 * <p>
 * Files are decoded as UTF-8. Older files written on the site machines are
 * Latin-1, typically in comments; a file that is not valid UTF-8 is read as
 * ISO-8859-1 instead, which maps every byte to a character.
 */
public final class TextFiles
{
    private static final Logger log = LoggerFactory.getLogger(TextFiles.class);

    private TextFiles() {
    }

    public static String read(Path path) throws IOException {
        return decode(Files.readAllBytes(path), path);
    }

    static String decode(byte[] bytes, Path path) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("{} is not valid UTF-8, reading it as ISO-8859-1", path);
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }
}

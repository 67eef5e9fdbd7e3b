package com.example.imageguard;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class FileFingerprinterTest {
    private final FileFingerprinter fingerprinter = new FileFingerprinter();

    @Test
    void identicalContentUnderDifferentNamesSharesFingerprint() throws Exception {
        Path dir = Files.createTempDirectory("fingerprint");
        Path first = Files.writeString(dir.resolve("a.png"), "same bytes");
        Path second = Files.writeString(dir.resolve("copy-of-a.jpg"), "same bytes");

        assertEquals(fingerprinter.fingerprint(first), fingerprinter.fingerprint(second));
        assertEquals(fingerprinter.fingerprint(first),
                fingerprinter.fingerprint("same bytes".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void producesLowercaseSha256Hex() {
        String empty = fingerprinter.fingerprint(new byte[0]);

        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", empty);
        assertNotEquals(empty, fingerprinter.fingerprint(new byte[]{1}));
    }
}

package com.cmflineage.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContentHasherTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldProduceKnownSha256ForEmptyContent() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                ContentHasher.fingerprint(new byte[0]));
    }

    @Test
    void shouldHashFileStreamAndBytesIdentically() throws IOException {
        byte[] content = new byte[200_000];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) (i % 251);
        }
        Path file = tempDir.resolve("model.pt");
        Files.write(file, content);

        String fromBytes = ContentHasher.fingerprint(content);
        assertEquals(fromBytes, ContentHasher.fingerprint(file));
        assertEquals(fromBytes, ContentHasher.fingerprint(new ByteArrayInputStream(content)));
    }

    @Test
    void shouldChangeWhenContentChanges() {
        String first = ContentHasher.fingerprint("a,b\n1,2\n".getBytes(StandardCharsets.UTF_8));
        String second = ContentHasher.fingerprint("a,b\n1,3\n".getBytes(StandardCharsets.UTF_8));

        assertNotEquals(first, second);
        assertTrue(ContentHasher.isFingerprint(first));
    }

    @Test
    void shouldRejectMalformedFingerprints() {
        assertFalse(ContentHasher.isFingerprint(null));
        assertFalse(ContentHasher.isFingerprint("abc"));
        assertFalse(ContentHasher.isFingerprint("E3B0C44298FC1C149AFBF4C8996FB92427AE41E4649B934CA495991B7852B855"));
    }
}

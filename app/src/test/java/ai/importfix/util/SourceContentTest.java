package ai.importfix.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SourceContent Tests")
class SourceContentTest {

    @Test
    @DisplayName("BOM is stripped from text and byte offsets refer to the stripped text")
    void testBomStripped() {
        var content = SourceContent.of("\uFEFFimport os");

        assertEquals("import os", content.text());
        assertEquals("import os".getBytes(StandardCharsets.UTF_8).length, content.byteLength());
        assertEquals("import", content.substringFromBytes(0, 6));
        assertEquals("os", content.substringFromBytes(7, 9));
    }

    @Test
    @DisplayName("Multi-byte characters are sliced on byte offsets")
    void testMultiByteSlicing() {
        var content = SourceContent.of("s = 'é✓'\nx");

        // é is two bytes and ✓ is three
        assertEquals(13, content.byteLength());
        assertEquals("'é✓'", content.substringFromBytes(4, 11));
        assertEquals("x", content.substringFromBytes(12, 13));
    }

    @Test
    @DisplayName("Out of range requests return empty or are truncated")
    void testOutOfRange() {
        var content = SourceContent.of("hello");

        assertEquals("", content.substringFromBytes(-1, 3));
        assertEquals("", content.substringFromBytes(3, 1));
        assertEquals("", content.substringFromBytes(5, 10));
        assertEquals("llo", content.substringFromBytes(2, 99));
        assertEquals("", content.substringFromBytes(2, 2));
    }

    @Test
    @DisplayName("Reading a file decodes UTF-8 and strips the BOM")
    void testRead(@TempDir Path dir) throws Exception {
        var file = dir.resolve("m.py");
        Files.writeString(file, "\uFEFFx = 'ü'\n", StandardCharsets.UTF_8);

        assertEquals("x = 'ü'\n", SourceContent.read(file).text());
    }
}

package ai.importfix.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

/**
 * Source text together with its UTF-8 bytes. Tree-sitter reports node positions as UTF-8 byte offsets, so node text
 * is sliced from the bytes rather than the {@link String}.
 */
public final class SourceContent {
    private static final Logger log = LogManager.getLogger(SourceContent.class);

    private static final char BOM = '\uFEFF';

    private final String text;
    private final byte[] utf8Bytes;

    private SourceContent(String text, byte[] utf8Bytes) {
        this.text = text;
        this.utf8Bytes = utf8Bytes;
    }

    public static SourceContent of(String src) {
        var stripped = !src.isEmpty() && src.charAt(0) == BOM ? src.substring(1) : src;
        return new SourceContent(stripped, stripped.getBytes(StandardCharsets.UTF_8));
    }

    public static SourceContent read(Path file) throws IOException {
        return of(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * Extracts the text in the UTF-8 byte range [startByte, endByte). Out-of-range requests are clamped or answered
     * with the empty string.
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            log.warn(
                    "Requested bytes outside valid range (length: {} bytes): startByte={}, endByte={}",
                    utf8Bytes.length,
                    startByte,
                    endByte);
            return "";
        }
        if (startByte >= utf8Bytes.length) {
            return "";
        }
        if (endByte > utf8Bytes.length) {
            log.debug("End byte offset {} exceeds source byte length {}, truncating", endByte, utf8Bytes.length);
            endByte = utf8Bytes.length;
        }
        int len = endByte - startByte;
        if (len == 0) return "";
        return new String(utf8Bytes, startByte, len, StandardCharsets.UTF_8);
    }

    public String substringFrom(TSNode node) {
        if (node.isNull()) {
            return "";
        }
        return substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return utf8Bytes.length;
    }

    @Override
    public String toString() {
        return "SourceContent[byteLength=" + utf8Bytes.length + "]";
    }
}

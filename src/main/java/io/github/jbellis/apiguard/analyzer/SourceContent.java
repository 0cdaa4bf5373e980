package io.github.jbellis.apiguard.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;

/**
 * Wrapper for a source text and its UTF-8 bytes. Tree-sitter reports UTF-8 byte offsets while the rest of the
 * pipeline works on Java String indexes; this class converts between the two.
 */
public final class SourceContent {
    private static final Logger log = LogManager.getLogger(SourceContent.class);

    private final String text;
    private final byte[] utf8Bytes;
    // charIndexByByte[b] is the String index of the character starting at or containing byte b
    private final int[] charIndexByByte;

    private SourceContent(String text, byte[] utf8Bytes) {
        this.text = text;
        this.utf8Bytes = utf8Bytes;
        this.charIndexByByte = buildByteToCharIndex(text, utf8Bytes.length);
    }

    /**
     * Creates a SourceContent for the given text. A leading UTF-8 byte order mark is dropped, as the
     * parser never sees it either.
     */
    public static SourceContent of(String src) {
        var text = stripUtf8Bom(src);
        return new SourceContent(text, text.getBytes(StandardCharsets.UTF_8));
    }

    static String stripUtf8Bom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }

    private static int[] buildByteToCharIndex(String text, int byteLength) {
        var map = new int[byteLength + 1];
        int b = 0;
        for (int i = 0; i < text.length(); i++) {
            int cp = text.codePointAt(i);
            int width = utf8Width(cp);
            for (int k = 0; k < width && b + k < map.length; k++) {
                map[b + k] = i;
            }
            b += width;
            if (Character.isSupplementaryCodePoint(cp)) {
                i++;
            }
        }
        map[byteLength] = text.length();
        return map;
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) return 1;
        if (codePoint < 0x800) return 2;
        if (codePoint < 0x10000) return 3;
        return 4;
    }

    /**
     * Converts a UTF-8 byte offset into a Java String character index. Out-of-range offsets are clamped.
     */
    public int byteOffsetToCharPosition(int byteOffset) {
        if (byteOffset <= 0) return 0;
        if (byteOffset >= utf8Bytes.length) {
            if (byteOffset > utf8Bytes.length) {
                log.debug("Byte offset {} exceeds source byte length {}, clamping", byteOffset, utf8Bytes.length);
            }
            return text.length();
        }
        return charIndexByByte[byteOffset];
    }

    /**
     * Extracts a substring using UTF-8 byte offsets [startByte, endByte).
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            log.warn("Requested bytes outside valid range (length: {} bytes): startByte={}, endByte={}",
                     utf8Bytes.length, startByte, endByte);
            return "";
        }
        return text.substring(byteOffsetToCharPosition(startByte), byteOffsetToCharPosition(endByte));
    }

    public String text() {
        return text;
    }

    public byte[] utf8Bytes() {
        return utf8Bytes;
    }

    public int byteLength() {
        return utf8Bytes.length;
    }

    @Override
    public String toString() {
        return "SourceContent[byteLength=" + utf8Bytes.length + ']';
    }
}

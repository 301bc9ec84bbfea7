package com.complexityscan.core.parser;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Strict UTF-8 decoding of source files.
 *
 * <p>Malformed input is reported instead of being silently replaced, because replacement
 * characters would shift the byte offsets the parser reports.
 */
public final class SourceDecoder {

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private SourceDecoder() {
        // Utility class - no instantiation
    }

    /**
     * Removes a leading UTF-8 byte order mark, if present.
     *
     * @param content raw bytes
     * @return the same array when there is no BOM, otherwise a trimmed copy
     */
    public static byte[] stripBom(byte[] content) {
        if (content.length >= 3
            && content[0] == UTF8_BOM[0] && content[1] == UTF8_BOM[1] && content[2] == UTF8_BOM[2]) {
            return Arrays.copyOfRange(content, 3, content.length);
        }
        return content;
    }

    /**
     * Decodes bytes as UTF-8, rejecting malformed or unmappable sequences.
     *
     * @param content bytes without BOM
     * @return decoded text
     * @throws CharacterCodingException if the bytes are not valid UTF-8
     */
    public static String decodeStrict(byte[] content) throws CharacterCodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder.decode(ByteBuffer.wrap(content)).toString();
    }

    /**
     * Counts lines the way editors do: a trailing newline does not start a new line.
     *
     * @param text decoded text
     * @return number of lines, 0 for empty text
     */
    public static int countLines(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        int lines = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                lines++;
            } else if (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n')) {
                lines++;
            }
        }
        char last = text.charAt(text.length() - 1);
        if (last != '\n' && last != '\r') {
            lines++;
        }
        return lines;
    }
}

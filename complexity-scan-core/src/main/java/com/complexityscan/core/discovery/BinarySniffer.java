package com.complexityscan.core.discovery;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Heuristic binary detection over a file's leading bytes.
 *
 * <p>A window is binary when it contains a NUL byte or when fewer than 70% of its bytes
 * are text bytes (TAB, LF, CR, FF, printable ASCII, or any byte of a multi-byte UTF-8
 * sequence). Empty files are text.
 */
public final class BinarySniffer {

    public static final int WINDOW_BYTES = 8 * 1024;
    static final double MIN_TEXT_RATIO = 0.70;

    private BinarySniffer() {
        // Utility class - no instantiation
    }

    /**
     * Reads up to {@link #WINDOW_BYTES} from a file and classifies them.
     *
     * @param file file to sniff
     * @return true if the file looks binary
     * @throws IOException if the file cannot be read
     */
    public static boolean isBinary(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            byte[] window = in.readNBytes(WINDOW_BYTES);
            return isBinary(window, window.length);
        }
    }

    /**
     * Classifies a byte window.
     *
     * @param bytes buffer
     * @param length number of valid bytes in the buffer
     * @return true if the window looks binary
     */
    public static boolean isBinary(byte[] bytes, int length) {
        if (length == 0) {
            return false;
        }
        int text = 0;
        for (int i = 0; i < length; i++) {
            int b = bytes[i] & 0xFF;
            if (b == 0) {
                return true;
            }
            if (isTextByte(b)) {
                text++;
            }
        }
        return text < MIN_TEXT_RATIO * length;
    }

    private static boolean isTextByte(int b) {
        return b == '\t' || b == '\n' || b == '\r' || b == '\f' || (b >= 0x20 && b < 0x7F) || b >= 0x80;
    }
}

package com.complexityscan.core.util;

import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Utility methods for paths and file content.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class - no instantiation
    }

    /**
     * Path of {@code file} relative to {@code root}, with forward slashes on every platform.
     *
     * @param root scan root
     * @param file file below the root
     * @return relative unix-style path
     */
    public static String toUnixRelativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    /**
     * Gets the file extension, lowercased and without the dot.
     *
     * @param path file path
     * @return extension, or empty string when the name has none (dotfiles have none)
     */
    public static String getExtension(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Lowercase hex SHA-256 digest of the given bytes.
     *
     * @param content bytes to hash
     * @return 64-character hex string
     */
    public static String sha256Hex(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Whether a file or directory name is hidden by unix convention.
     *
     * @param path path to check
     * @return true if the last name element starts with a dot
     */
    public static boolean isHidden(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().startsWith(".");
    }
}

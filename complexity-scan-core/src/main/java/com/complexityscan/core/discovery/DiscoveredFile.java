package com.complexityscan.core.discovery;

import com.complexityscan.core.language.LanguageProfile;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A source file accepted by discovery and ready to be analyzed.
 *
 * @param path absolute path
 * @param relativePath root-relative path with forward slashes
 * @param language resolved language
 * @param sizeBytes size at discovery time
 */
public record DiscoveredFile(
    Path path,
    String relativePath,
    LanguageProfile language,
    long sizeBytes
) {
    public DiscoveredFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(language, "language must not be null");
    }
}

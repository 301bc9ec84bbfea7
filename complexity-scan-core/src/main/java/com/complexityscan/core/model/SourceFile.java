package com.complexityscan.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A file that was considered for analysis.
 *
 * <p>The path is relative to the scanned root and always uses forward slashes, so
 * reports are identical across platforms.
 *
 * @param path root-relative path with {@code /} separators
 * @param language detected language id, {@code null} when unrecognized
 * @param sizeBytes file size in bytes
 * @param contentHash lowercase hex SHA-256 of the file bytes, empty if never read
 * @param status processing outcome
 */
@JsonPropertyOrder({"path", "language", "size_bytes", "sha256", "status"})
public record SourceFile(
    @JsonProperty("path") String path,
    @JsonProperty("language") String language,
    @JsonProperty("size_bytes") long sizeBytes,
    @JsonProperty("sha256") String contentHash,
    @JsonProperty("status") ParseStatus status
) {
    public SourceFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (contentHash == null) {
            contentHash = "";
        }
        if (sizeBytes < 0) {
            sizeBytes = 0;
        }
    }

    /**
     * Returns a copy with a different status.
     *
     * @param newStatus replacement status
     * @return new source file
     */
    public SourceFile withStatus(ParseStatus newStatus) {
        return new SourceFile(path, language, sizeBytes, contentHash, newStatus);
    }
}

package com.complexityscan.core.renderer;

import java.util.Objects;

/**
 * A serialized report ready to be written somewhere.
 *
 * @param content report text
 * @param contentType MIME type of the content
 */
public record RenderedReport(
    String content,
    String contentType
) {
    public static final String JSON = "application/json";

    /**
     * Compact constructor with validation.
     */
    public RenderedReport {
        Objects.requireNonNull(content, "content must not be null");
        if (contentType == null || contentType.isBlank()) {
            contentType = JSON;
        }
    }

    public static RenderedReport json(String content) {
        return new RenderedReport(content, JSON);
    }
}

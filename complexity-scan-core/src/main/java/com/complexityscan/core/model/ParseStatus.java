package com.complexityscan.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Outcome of processing a single file.
 *
 * <p>Only {@link Kind#SUCCESS} files contribute functions. A {@link Kind#PARSE_FAILURE}
 * carries a human-readable reason; skipped files never reach the parser.
 *
 * @param kind status category
 * @param reason failure or skip reason, {@code null} on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"kind", "reason"})
public record ParseStatus(
    @JsonProperty("kind") Kind kind,
    @JsonProperty("reason") String reason
) {
    private static final ParseStatus SUCCESS = new ParseStatus(Kind.SUCCESS, null);

    public ParseStatus {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.PARSE_FAILURE && (reason == null || reason.isBlank())) {
            reason = "unknown parse failure";
        }
    }

    public static ParseStatus success() {
        return SUCCESS;
    }

    public static ParseStatus failure(String reason) {
        return new ParseStatus(Kind.PARSE_FAILURE, reason);
    }

    public static ParseStatus skippedBinary(String reason) {
        return new ParseStatus(Kind.SKIPPED_BINARY, reason);
    }

    public static ParseStatus skippedUnrecognized(String extension) {
        return new ParseStatus(Kind.SKIPPED_UNRECOGNIZED, "unrecognized extension: " + extension);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    /**
     * Whether the file was handed to a parser (successfully or not).
     *
     * @return true for success and parse failure
     */
    @JsonIgnore
    public boolean isAttempted() {
        return kind == Kind.SUCCESS || kind == Kind.PARSE_FAILURE;
    }

    /**
     * Status categories.
     */
    public enum Kind {
        SUCCESS("success"),
        PARSE_FAILURE("parse_failure"),
        SKIPPED_BINARY("skipped_binary"),
        SKIPPED_UNRECOGNIZED("skipped_unrecognized");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }
}

package com.complexityscan.core.aggregate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Breakpoints of the repository complexity buckets.
 *
 * <p>A total below {@code simple} is simple, below {@code medium} is medium, below
 * {@code large} is large, anything else is complex.
 *
 * @param simple exclusive upper bound of the simple bucket
 * @param medium exclusive upper bound of the medium bucket
 * @param large exclusive upper bound of the large bucket
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BucketThresholds(
    @JsonProperty("simple") long simple,
    @JsonProperty("medium") long medium,
    @JsonProperty("large") long large
) {
    public static final long DEFAULT_SIMPLE = 5_000;
    public static final long DEFAULT_MEDIUM = 25_000;
    public static final long DEFAULT_LARGE = 100_000;

    public BucketThresholds {
        if (simple <= 0 || medium <= simple || large <= medium) {
            throw new IllegalArgumentException(
                "Thresholds must be positive and strictly increasing: " + simple + ", " + medium + ", " + large);
        }
    }

    public static BucketThresholds defaults() {
        return new BucketThresholds(DEFAULT_SIMPLE, DEFAULT_MEDIUM, DEFAULT_LARGE);
    }
}

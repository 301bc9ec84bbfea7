package com.complexityscan.core.config;

import com.complexityscan.core.aggregate.BucketThresholds;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of one scan.
 *
 * <p>Loaded from {@code complexity-scan.yaml} in the scanned root (or an explicit file).
 * Every key is optional; missing keys take the defaults below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * ignorePatterns:
 *   - "generated/"
 *   - "*_pb2.py"
 * useDefaultIgnores: true
 * respectGitignore: true
 * includeHidden: false
 * workers: 0            # 0 = one per available core
 * timeoutSeconds: 300
 * topN: 10
 * maxFileBytes: 2097152
 * failOnSyntaxErrors: false
 * thresholds:
 *   simple: 5000
 *   medium: 25000
 *   large: 100000
 * }</pre>
 *
 * @param ignorePatterns extra gitignore-style patterns
 * @param useDefaultIgnores apply the built-in ignore set (node_modules/, dist/, ...)
 * @param respectGitignore apply the root {@code .gitignore}
 * @param includeHidden descend into dot-files and dot-directories
 * @param workers worker threads, 0 for one per core
 * @param timeoutSeconds wall-clock limit of the whole scan
 * @param topN length of the ranked function list
 * @param maxFileBytes larger files are skipped as generated or binary
 * @param failOnSyntaxErrors count files with recovered syntax errors as failures
 * @param includeFiles emit per-file metrics in the report
 * @param thresholds complexity bucket breakpoints
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerConfig(
    @JsonProperty("ignorePatterns") List<String> ignorePatterns,
    @JsonProperty("useDefaultIgnores") Boolean useDefaultIgnores,
    @JsonProperty("respectGitignore") Boolean respectGitignore,
    @JsonProperty("includeHidden") Boolean includeHidden,
    @JsonProperty("workers") Integer workers,
    @JsonProperty("timeoutSeconds") Long timeoutSeconds,
    @JsonProperty("topN") Integer topN,
    @JsonProperty("maxFileBytes") Long maxFileBytes,
    @JsonProperty("failOnSyntaxErrors") Boolean failOnSyntaxErrors,
    @JsonProperty("includeFiles") Boolean includeFiles,
    @JsonProperty("thresholds") BucketThresholds thresholds
) {
    public static final String DEFAULT_FILE_NAME = "complexity-scan.yaml";
    public static final long DEFAULT_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_TOP_N = 10;
    public static final long DEFAULT_MAX_FILE_BYTES = 2L * 1024 * 1024;

    /**
     * Compact constructor applying defaults and validation.
     */
    public AnalyzerConfig {
        ignorePatterns = ignorePatterns == null ? List.of() : List.copyOf(ignorePatterns);
        if (useDefaultIgnores == null) {
            useDefaultIgnores = true;
        }
        if (respectGitignore == null) {
            respectGitignore = true;
        }
        if (includeHidden == null) {
            includeHidden = false;
        }
        if (workers == null || workers < 0) {
            workers = 0;
        }
        if (timeoutSeconds == null || timeoutSeconds <= 0) {
            timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        }
        if (topN == null || topN < 0) {
            topN = DEFAULT_TOP_N;
        }
        if (maxFileBytes == null || maxFileBytes <= 0) {
            maxFileBytes = DEFAULT_MAX_FILE_BYTES;
        }
        if (failOnSyntaxErrors == null) {
            failOnSyntaxErrors = false;
        }
        if (includeFiles == null) {
            includeFiles = false;
        }
        if (thresholds == null) {
            thresholds = BucketThresholds.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static AnalyzerConfig defaults() {
        return builder().build();
    }

    /**
     * Worker count to actually use.
     *
     * @return configured workers, or available processors when 0
     */
    public int effectiveWorkers() {
        return workers == 0 ? Math.max(1, Runtime.getRuntime().availableProcessors()) : workers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .ignorePatterns(ignorePatterns)
            .useDefaultIgnores(useDefaultIgnores)
            .respectGitignore(respectGitignore)
            .includeHidden(includeHidden)
            .workers(workers)
            .timeoutSeconds(timeoutSeconds)
            .topN(topN)
            .maxFileBytes(maxFileBytes)
            .failOnSyntaxErrors(failOnSyntaxErrors)
            .includeFiles(includeFiles)
            .thresholds(thresholds);
    }

    /**
     * Builder used to layer command-line overrides on top of a loaded file.
     */
    public static class Builder {
        private final List<String> ignorePatterns = new ArrayList<>();
        private Boolean useDefaultIgnores;
        private Boolean respectGitignore;
        private Boolean includeHidden;
        private Integer workers;
        private Long timeoutSeconds;
        private Integer topN;
        private Long maxFileBytes;
        private Boolean failOnSyntaxErrors;
        private Boolean includeFiles;
        private BucketThresholds thresholds;

        public Builder ignorePatterns(List<String> patterns) {
            this.ignorePatterns.clear();
            this.ignorePatterns.addAll(patterns);
            return this;
        }

        public Builder addIgnorePatterns(List<String> patterns) {
            this.ignorePatterns.addAll(patterns);
            return this;
        }

        public Builder useDefaultIgnores(Boolean value) {
            this.useDefaultIgnores = value;
            return this;
        }

        public Builder respectGitignore(Boolean value) {
            this.respectGitignore = value;
            return this;
        }

        public Builder includeHidden(Boolean value) {
            this.includeHidden = value;
            return this;
        }

        public Builder workers(Integer value) {
            this.workers = value;
            return this;
        }

        public Builder timeoutSeconds(Long value) {
            this.timeoutSeconds = value;
            return this;
        }

        public Builder topN(Integer value) {
            this.topN = value;
            return this;
        }

        public Builder maxFileBytes(Long value) {
            this.maxFileBytes = value;
            return this;
        }

        public Builder failOnSyntaxErrors(Boolean value) {
            this.failOnSyntaxErrors = value;
            return this;
        }

        public Builder includeFiles(Boolean value) {
            this.includeFiles = value;
            return this;
        }

        public Builder thresholds(BucketThresholds value) {
            this.thresholds = value;
            return this;
        }

        public AnalyzerConfig build() {
            return new AnalyzerConfig(
                ignorePatterns,
                useDefaultIgnores,
                respectGitignore,
                includeHidden,
                workers,
                timeoutSeconds,
                topN,
                maxFileBytes,
                failOnSyntaxErrors,
                includeFiles,
                thresholds
            );
        }
    }
}

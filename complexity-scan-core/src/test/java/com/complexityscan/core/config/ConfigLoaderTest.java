package com.complexityscan.core.config;

import com.complexityscan.core.aggregate.BucketThresholds;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("complexity-scan.yaml");
        Files.writeString(configFile, """
            ignorePatterns:
              - "generated/"
              - "*_pb2.py"
            respectGitignore: false
            workers: 4
            timeoutSeconds: 60
            topN: 25
            failOnSyntaxErrors: true
            thresholds:
              simple: 100
              medium: 200
              large: 300
            """);

        AnalyzerConfig config = ConfigLoader.load(configFile);

        assertThat(config.ignorePatterns()).containsExactly("generated/", "*_pb2.py");
        assertThat(config.respectGitignore()).isFalse();
        assertThat(config.useDefaultIgnores()).isTrue();
        assertThat(config.workers()).isEqualTo(4);
        assertThat(config.effectiveWorkers()).isEqualTo(4);
        assertThat(config.timeoutSeconds()).isEqualTo(60L);
        assertThat(config.topN()).isEqualTo(25);
        assertThat(config.failOnSyntaxErrors()).isTrue();
        assertThat(config.thresholds()).isEqualTo(new BucketThresholds(100, 200, 300));
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("complexity-scan.yaml");
        Files.writeString(configFile, "topN: 3\n");

        AnalyzerConfig config = ConfigLoader.load(configFile);

        assertThat(config.topN()).isEqualTo(3);
        assertThat(config.timeoutSeconds()).isEqualTo(AnalyzerConfig.DEFAULT_TIMEOUT_SECONDS);
        assertThat(config.maxFileBytes()).isEqualTo(AnalyzerConfig.DEFAULT_MAX_FILE_BYTES);
        assertThat(config.thresholds()).isEqualTo(BucketThresholds.defaults());
        assertThat(config.includeHidden()).isFalse();
        assertThat(config.effectiveWorkers()).isPositive();
    }

    @Test
    void load_missingFile_returnsDefaults() {
        AnalyzerConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("complexity-scan.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("complexity-scan.yaml");
        Files.writeString(configFile, "topN: [unclosed\n");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_thresholdsOutOfOrder_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("complexity-scan.yaml");
        Files.writeString(configFile, """
            thresholds:
              simple: 500
              medium: 100
              large: 900
            """);

        assertThat(ConfigLoader.load(configFile).thresholds()).isEqualTo(BucketThresholds.defaults());
    }

    @Test
    void loadForRoot_prefersExplicitPathOverRootFile() throws IOException {
        Files.writeString(tempDir.resolve(AnalyzerConfig.DEFAULT_FILE_NAME), "topN: 7\n");
        Path explicit = tempDir.resolve("other.yaml");
        Files.writeString(explicit, "topN: 9\n");

        assertThat(ConfigLoader.loadForRoot(tempDir, null).topN()).isEqualTo(7);
        assertThat(ConfigLoader.loadForRoot(tempDir, explicit).topN()).isEqualTo(9);
    }

    @Test
    void toBuilder_overridesKeepOtherValues() {
        AnalyzerConfig base = AnalyzerConfig.builder().topN(5).workers(2).build();

        AnalyzerConfig overridden = base.toBuilder()
            .workers(8)
            .addIgnorePatterns(java.util.List.of("tmp/"))
            .build();

        assertThat(overridden.topN()).isEqualTo(5);
        assertThat(overridden.workers()).isEqualTo(8);
        assertThat(overridden.ignorePatterns()).containsExactly("tmp/");
    }
}

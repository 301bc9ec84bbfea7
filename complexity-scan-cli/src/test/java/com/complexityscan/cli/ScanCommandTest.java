package com.complexityscan.cli;

import com.complexityscan.ComplexityScanCLI;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ScanCommand} driven through the root command line.
 */
class ScanCommandTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() throws IOException {
        Path source = tempDir.resolve("repo/src/app.py");
        Files.createDirectories(source.getParent());
        Files.writeString(source, """
            def decide(a, b):
                if a or b:
                    return 1
                return 0
            """);

        out = new StringWriter();
        err = new StringWriter();
        commandLine = ComplexityScanCLI.newCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    private int run(String... args) {
        return commandLine.execute(args);
    }

    @Test
    void scan_writesJsonReportToStdout() throws IOException {
        // When
        int exitCode = run("-q", "scan", tempDir.resolve("repo").toString());

        // Then
        assertThat(exitCode).isEqualTo(ComplexityScanCLI.EXIT_OK);
        JsonNode report = mapper.readTree(out.toString());
        assertThat(report.get("summary").get("total_files").asInt()).isEqualTo(1);
        assertThat(report.get("summary").get("total_cyclomatic_complexity").asInt()).isEqualTo(3);
        assertThat(report.get("top_complex_functions").get(0).get("name").asText()).isEqualTo("decide");
        assertThat(report.has("files")).isFalse();
        assertThat(err.toString()).contains("Complexity Summary:");
    }

    @Test
    void scan_withOutputFile_writesReportThereAndKeepsStdoutEmpty() throws IOException {
        // Given
        Path target = tempDir.resolve("out/report.json");

        // When
        int exitCode = run("-q", "scan", tempDir.resolve("repo").toString(), "-o", target.toString(),
            "--include-files");

        // Then
        assertThat(exitCode).isEqualTo(ComplexityScanCLI.EXIT_OK);
        assertThat(out.toString()).isEmpty();
        JsonNode report = mapper.readTree(Files.readString(target));
        assertThat(report.get("files")).hasSize(1);
        assertThat(report.get("files").get(0).get("path").asText()).isEqualTo("src/app.py");
    }

    @Test
    void scan_ignorePattern_excludesFiles() throws IOException {
        // When
        int exitCode = run("-q", "scan", tempDir.resolve("repo").toString(), "-i", "src/");

        // Then
        assertThat(exitCode).isEqualTo(ComplexityScanCLI.EXIT_OK);
        assertThat(mapper.readTree(out.toString()).get("summary").get("total_files").asInt()).isZero();
    }

    @Test
    void scan_missingRoot_exitsWithRootNotFound() {
        int exitCode = run("-q", "scan", tempDir.resolve("nope").toString());

        assertThat(exitCode).isEqualTo(ComplexityScanCLI.EXIT_ROOT_NOT_FOUND);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).contains("Root directory not found");
    }

    @Test
    void scan_unknownOption_exitsWithUsageError() {
        int exitCode = run("scan", "--bogus");

        assertThat(exitCode).isEqualTo(ComplexityScanCLI.EXIT_USAGE);
    }

    @Test
    void scan_configFileInRoot_isApplied() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("repo/complexity-scan.yaml"), "topN: 0\n");

        // When
        int exitCode = run("-q", "scan", tempDir.resolve("repo").toString());

        // Then
        assertThat(exitCode).isEqualTo(ComplexityScanCLI.EXIT_OK);
        assertThat(mapper.readTree(out.toString()).get("top_complex_functions")).isEmpty();
    }

    @Test
    void languages_listsEveryProfile() {
        int exitCode = run("languages");

        assertThat(exitCode).isEqualTo(ComplexityScanCLI.EXIT_OK);
        assertThat(out.toString())
            .contains("Python (ID: python)")
            .contains("Extensions: ts, tsx, mts, cts")
            .contains("Rust (ID: rust)");
    }
}

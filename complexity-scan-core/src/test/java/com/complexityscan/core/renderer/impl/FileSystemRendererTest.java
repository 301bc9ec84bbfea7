package com.complexityscan.core.renderer.impl;

import com.complexityscan.core.renderer.RenderContext;
import com.complexityscan.core.renderer.RenderedReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_createsParentDirectoriesAndWritesContent() throws IOException {
        // Given
        Path target = tempDir.resolve("reports/nested/complexity.json");

        // When
        renderer.render(RenderedReport.json("{\"a\":1}\n"), RenderContext.file(target.toString()));

        // Then
        assertThat(target).exists();
        assertThat(Files.readString(target)).isEqualTo("{\"a\":1}\n");
    }

    @Test
    void render_replacesExistingFileWithoutLeavingTempFiles() throws IOException {
        // Given
        Path target = tempDir.resolve("complexity.json");
        Files.writeString(target, "old");

        // When
        renderer.render(RenderedReport.json("new"), RenderContext.file(target.toString()));

        // Then
        assertThat(Files.readString(target)).isEqualTo("new");
        try (Stream<Path> entries = Files.list(tempDir)) {
            assertThat(entries).containsExactly(target);
        }
    }

    @Test
    void render_withoutOutputPath_throws() {
        assertThatThrownBy(() -> renderer.render(RenderedReport.json("{}"), RenderContext.console(null)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("output path");
    }

    @Test
    void render_targetIsDirectory_throwsIllegalState() throws IOException {
        // Given
        Path directory = Files.createDirectory(tempDir.resolve("taken"));
        Files.writeString(directory.resolve("child"), "x");

        // When / Then
        assertThatThrownBy(() -> renderer.render(RenderedReport.json("{}"), RenderContext.file(directory.toString())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to write report");
    }
}

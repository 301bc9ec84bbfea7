package com.complexityscan.core.renderer.impl;

import com.complexityscan.core.renderer.OutputRenderer;
import com.complexityscan.core.renderer.RenderContext;
import com.complexityscan.core.renderer.RenderedReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Renderer that writes the report to a file.
 *
 * <p>The report is written to a temporary file next to the target and then moved into
 * place, so readers never observe a partially written report. Parent directories are
 * created as needed and an existing file is replaced.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * new FileSystemRenderer().render(RenderedReport.json(json), RenderContext.file("out/complexity.json"));
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(RenderedReport report, RenderContext context) {
        if (context.outputPath() == null || context.outputPath().isBlank()) {
            throw new IllegalStateException("filesystem renderer requires an output path");
        }
        Path target = Paths.get(context.outputPath()).toAbsolutePath();
        Path directory = target.getParent();
        logger.info("Writing report to: {}", target);

        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
            Files.writeString(temp, report.content(), StandardCharsets.UTF_8);
            moveIntoPlace(temp, target);
            logger.debug("Wrote report: {} ({} characters)", target, report.content().length());
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new IllegalStateException("Failed to write report: " + target, e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}; replacing non-atomically", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupFailure) {
            logger.warn("Could not remove temporary file {}: {}", temp, cleanupFailure.getMessage());
        }
    }
}

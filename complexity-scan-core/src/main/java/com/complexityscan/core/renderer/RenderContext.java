package com.complexityscan.core.renderer;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Context provided to renderers during execution.
 *
 * @param outputPath target file path, {@code null} for console output
 * @param console writer standing in for standard output
 */
public record RenderContext(
    String outputPath,
    PrintWriter console
) {
    /**
     * Compact constructor with defaults.
     */
    public RenderContext {
        if (console == null) {
            console = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        }
    }

    public static RenderContext console(PrintWriter console) {
        return new RenderContext(null, console);
    }

    public static RenderContext file(String outputPath) {
        return new RenderContext(outputPath, null);
    }
}

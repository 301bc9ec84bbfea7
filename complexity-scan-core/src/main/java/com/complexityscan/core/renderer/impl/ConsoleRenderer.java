package com.complexityscan.core.renderer.impl;

import com.complexityscan.core.renderer.OutputRenderer;
import com.complexityscan.core.renderer.RenderContext;
import com.complexityscan.core.renderer.RenderedReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;

/**
 * Renderer that prints the report to standard output.
 *
 * <p>Standard output carries nothing but the report, so it can be piped straight into
 * another tool; diagnostics go to the log on standard error.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(RenderedReport report, RenderContext context) {
        PrintWriter console = context.console();
        console.print(report.content());
        console.flush();
        if (console.checkError()) {
            throw new IllegalStateException("Failed to write report to standard output");
        }
        logger.debug("Wrote {} characters of {} to console", report.content().length(), report.contentType());
    }
}

package com.complexityscan.core.renderer;

/**
 * Writes a serialized report to a destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI). Two are
 * built in: {@code console} (standard output) and {@code filesystem} (atomic file write).
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class ConsoleRenderer implements OutputRenderer {
 *     @Override
 *     public String getId() {
 *         return "console";
 *     }
 *
 *     @Override
 *     public void render(RenderedReport report, RenderContext context) {
 *         context.console().print(report.content());
 *         context.console().flush();
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.complexityscan.core.renderer.OutputRenderer}
 *
 * @see RenderedReport
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * @return lowercase renderer identifier
     */
    String getId();

    /**
     * Writes the report to the target destination.
     *
     * @param report the serialized report
     * @param context rendering context with the destination
     * @throws IllegalStateException if the destination is missing or cannot be written
     */
    void render(RenderedReport report, RenderContext context);
}

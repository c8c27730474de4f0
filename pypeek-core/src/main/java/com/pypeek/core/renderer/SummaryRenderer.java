package com.pypeek.core.renderer;

import com.pypeek.core.model.ModuleSummary;

/**
 * Interface for renderers that present a module summary.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI) and selected by id
 * ({@code --format} on the command line, {@code output.format} in {@code pypeek.yaml}).
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class NameListRenderer implements SummaryRenderer {
 *     @Override
 *     public String getId() {
 *         return "names";
 *     }
 *
 *     @Override
 *     public void render(String fileName, ModuleSummary summary, RenderContext context) {
 *         summary.topLevelFunctions().forEach(f -> System.out.println(f.name()));
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.pypeek.core.renderer.SummaryRenderer}
 *
 * @see RenderContext
 */
public interface SummaryRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Should be lowercase (e.g., "console", "json").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Writes the summary of one file to standard output.
     *
     * @param fileName name of the summarized file
     * @param summary the summary to present
     * @param context renderer settings
     */
    void render(String fileName, ModuleSummary summary, RenderContext context);
}

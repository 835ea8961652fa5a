package com.ecoauditor.core.renderer;

/**
 * Interface for renderers that deliver generated reports and graph descriptions.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.ecoauditor.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g., "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * <p>Implementations throw {@link IllegalStateException} when the destination cannot be
     * written.
     *
     * @param output the generated files to render
     * @param context rendering context with target directory and settings
     * @throws IllegalStateException if the output cannot be delivered
     */
    void render(GeneratedOutput output, RenderContext context);
}

package com.semanticdiff.core.renderer;

/**
 * Interface for output renderers that deliver generated reports to a destination.
 *
 * <p>The built-in renderers print to the console ({@code console}) or write files below
 * an output directory ({@code filesystem}).
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * @return unique renderer identifier, lowercase
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * @param output the generated files to render
     * @param context rendering context with the output directory
     * @throws IllegalStateException if the output cannot be delivered
     */
    void render(GeneratedOutput output, RenderContext context);
}

package com.semanticdiff.core.renderer.impl;

import com.semanticdiff.core.renderer.GeneratedFile;
import com.semanticdiff.core.renderer.GeneratedOutput;
import com.semanticdiff.core.renderer.OutputRenderer;
import com.semanticdiff.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.Objects;

/**
 * Renderer that prints generated reports to a console stream.
 *
 * <p>Report content is printed as-is, so the output of a single report can be piped into
 * other tools.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private final PrintWriter out;

    /**
     * Creates a renderer printing to the given writer.
     *
     * @param out target writer
     */
    public ConsoleRenderer(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        log.debug("Rendering {} files to console", output.files().size());

        for (GeneratedFile file : output.files()) {
            out.println(file.content());
        }
        out.flush();
    }
}

package com.semanticdiff.core.renderer.impl;

import com.semanticdiff.core.generator.GeneratedReport;
import com.semanticdiff.core.renderer.GeneratedOutput;
import com.semanticdiff.core.renderer.RenderContext;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private final StringWriter buffer = new StringWriter();
    private final ConsoleRenderer renderer = new ConsoleRenderer(new PrintWriter(buffer));

    @Test
    void render_singleReport_printsContentOnly() {
        renderer.render(GeneratedOutput.of(new GeneratedReport("changelog", "# Changelog", "md")),
            new RenderContext("."));

        assertThat(buffer.toString()).isEqualTo("# Changelog" + System.lineSeparator());
    }

    @Test
    void render_multipleReports_printsEachInOrder() {
        renderer.render(
            GeneratedOutput.of(
                new GeneratedReport("changelog", "A", "md"),
                new GeneratedReport("diff", "B", "json")),
            new RenderContext("."));

        assertThat(buffer.toString()).isEqualTo("A" + System.lineSeparator() + "B" + System.lineSeparator());
    }
}

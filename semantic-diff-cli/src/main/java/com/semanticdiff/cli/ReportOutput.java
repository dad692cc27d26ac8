package com.semanticdiff.cli;

import com.semanticdiff.core.generator.GeneratedReport;
import com.semanticdiff.core.renderer.GeneratedFile;
import com.semanticdiff.core.renderer.GeneratedOutput;
import com.semanticdiff.core.renderer.OutputRenderer;
import com.semanticdiff.core.renderer.RenderContext;
import com.semanticdiff.core.renderer.impl.ConsoleRenderer;
import com.semanticdiff.core.renderer.impl.FileSystemRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Sends a generated report either to the console or to a file.
 */
final class ReportOutput {

    private static final Logger log = LoggerFactory.getLogger(ReportOutput.class);

    private ReportOutput() {
        // Utility class
    }

    /**
     * Resolves a relative output file against the configured output directory.
     *
     * @param outputFile file given on the command line, may be null
     * @param outputDirectory {@code output.directory} from the configuration
     * @return absolute or directory-relative file, or null when no file was given
     */
    static Path resolve(Path outputFile, String outputDirectory) {
        if (outputFile == null || outputFile.isAbsolute()) {
            return outputFile;
        }
        return Paths.get(outputDirectory).resolve(outputFile);
    }

    /**
     * Renders a report.
     *
     * @param report report to render
     * @param outputFile target file, or null to print to {@code out}
     * @param out console writer
     */
    static void emit(GeneratedReport report, Path outputFile, PrintWriter out) {
        OutputRenderer renderer;
        GeneratedOutput output;
        RenderContext context;

        if (outputFile == null) {
            renderer = new ConsoleRenderer(out);
            output = GeneratedOutput.of(report);
            context = new RenderContext(".");
        } else {
            Path absolute = outputFile.toAbsolutePath();
            renderer = new FileSystemRenderer();
            output = new GeneratedOutput(List.of(new GeneratedFile(
                absolute.getFileName().toString(), report.content(), null)));
            context = new RenderContext(absolute.getParent().toString());
        }
        log.debug("Rendering {} with the {} renderer", report.fileName(), renderer.getId());
        renderer.render(output, context);
    }
}

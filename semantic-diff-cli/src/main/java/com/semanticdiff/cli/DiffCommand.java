package com.semanticdiff.cli;

import com.semanticdiff.core.config.ConfigLoader;
import com.semanticdiff.core.config.SemanticDiffConfig;
import com.semanticdiff.core.diff.DiffReport;
import com.semanticdiff.core.diff.DiffSummary;
import com.semanticdiff.core.diff.StructuralDiffEngine;
import com.semanticdiff.core.generator.GeneratedReport;
import com.semanticdiff.core.generator.ReportGenerators;
import com.semanticdiff.core.generator.ReportType;
import com.semanticdiff.core.io.OntologyReader;
import com.semanticdiff.core.model.Ontology;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to compare two versions of a model.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Markdown changelog
 * semanticdiff diff -s v1.json -t v2.json
 *
 * # git-style unified diff, written to a file
 * semanticdiff diff -s v1.json -t v2.json -f unified -o changes.diff
 *
 * # Fail a CI step when the model changed
 * semanticdiff diff -s v1.json -t v2.json --fail-on-changes
 * }</pre>
 */
@Command(
    name = "diff",
    description = "Compare two versions of an ontology",
    mixinStandardHelpOptions = true
)
public class DiffCommand implements Callable<Integer> {

    /** Exit code returned by {@code --fail-on-changes} when the versions differ. */
    static final int EXIT_CHANGES_FOUND = 2;

    private static final Logger log = LoggerFactory.getLogger(DiffCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-s", "--source"}, description = "Source (old) model file", required = true)
    private Path sourceFile;

    @Option(names = {"-t", "--target"}, description = "Target (new) model file", required = true)
    private Path targetFile;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: changelog, unified or json (default: from config)"
    )
    private String format;

    @Option(
        names = {"-o", "--output"},
        description = "Write the report to this file instead of stdout; relative paths resolve against output.directory"
    )
    private Path outputFile;

    @Option(names = {"--fail-on-changes"}, description = "Exit with code 2 if the versions differ")
    private boolean failOnChanges;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: semanticdiff.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            SemanticDiffConfig config = ConfigLoader.load(configPath);
            OntologyReader reader = new OntologyReader(config.model().duplicateNames());

            Ontology source = reader.read(sourceFile);
            Ontology target = reader.read(targetFile);
            log.info("Comparing {} v{} with {} v{}", source.name(), source.version(), target.name(), target.version());

            DiffReport report = new StructuralDiffEngine().diff(source, target);
            GeneratedReport generated = generate(report, effectiveFormat(config));
            Path reportFile = ReportOutput.resolve(outputFile, config.output().directory());
            ReportOutput.emit(generated, reportFile, out);

            DiffSummary summary = report.summary();
            if (reportFile != null) {
                out.printf("✓ %d changes (%d added, %d removed, %d modified) written to %s%n",
                    summary.totalChanges(), summary.added(), summary.removed(), summary.modified(), reportFile);
            }
            out.flush();

            if (failOnChanges && report.hasChanges()) {
                return EXIT_CHANGES_FOUND;
            }
            return 0;

        } catch (Exception e) {
            log.error("Diff failed", e);
            err.println("✗ Diff failed: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private String effectiveFormat(SemanticDiffConfig config) {
        if (format != null) {
            return format.toLowerCase();
        }
        return "json".equalsIgnoreCase(config.output().format()) ? "json" : "changelog";
    }

    private GeneratedReport generate(DiffReport report, String effectiveFormat) {
        return switch (effectiveFormat) {
            case "changelog" -> ReportGenerators.require("markdown").generate(report, ReportType.CHANGELOG);
            case "unified" -> ReportGenerators.require("markdown").generate(report, ReportType.UNIFIED_DIFF);
            case "json" -> ReportGenerators.require("json").generate(report, ReportType.CHANGELOG);
            default -> throw new IllegalArgumentException(
                "Unknown format: " + effectiveFormat + " (expected changelog, unified or json)");
        };
    }
}

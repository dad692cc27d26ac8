package com.semanticdiff.cli;

import com.semanticdiff.core.config.ConfigLoader;
import com.semanticdiff.core.config.SemanticDiffConfig;
import com.semanticdiff.core.debt.AnalyzerSettings;
import com.semanticdiff.core.debt.ConflictSeverity;
import com.semanticdiff.core.debt.CrossModelConflictAnalyzer;
import com.semanticdiff.core.debt.SemanticDebtReport;
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
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to analyze semantic debt across every model in a directory.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * semanticdiff analyze -i ./ontologies
 * semanticdiff analyze -i ./ontologies --pattern "sales-*.json" -f json -o debt.json --threshold 0.9
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Detect conflicting definitions across multiple ontologies",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-i", "--input"}, description = "Directory containing model files", required = true)
    private Path inputDir;

    @Option(names = {"--pattern"}, description = "File name pattern (default: *.json)")
    private String pattern = "*.json";

    @Option(names = {"-f", "--format"}, description = "Output format: markdown or json (default: from config)")
    private String format;

    @Option(
        names = {"-o", "--output"},
        description = "Write the report to this file instead of stdout; relative paths resolve against output.directory"
    )
    private Path outputFile;

    @Option(names = {"--threshold"}, description = "Business rule similarity threshold, 0..1 (default: from config)")
    private Double threshold;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: semanticdiff.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            SemanticDiffConfig config = ConfigLoader.load(configPath);
            AnalyzerSettings settings = config.analyzer().toSettings();
            if (threshold != null) {
                settings = new AnalyzerSettings(threshold, settings.ruleComparison());
            }

            Map<String, Ontology> models = new OntologyReader(config.model().duplicateNames())
                .readDirectory(inputDir, pattern);
            log.info("Loaded {} models from {}", models.size(), inputDir);

            SemanticDebtReport report = new CrossModelConflictAnalyzer(settings).analyze(models);

            String effectiveFormat = format != null ? format.toLowerCase() : config.output().format();
            GeneratedReport generated = ReportGenerators.require(effectiveFormat)
                .generate(report, ReportType.SEMANTIC_DEBT);
            Path reportFile = ReportOutput.resolve(outputFile, config.output().directory());
            ReportOutput.emit(generated, reportFile, out);

            if (reportFile != null) {
                out.printf("✓ %d conflicts (%d critical, %d warning, %d info) written to %s%n",
                    report.conflicts().size(),
                    report.count(ConflictSeverity.CRITICAL),
                    report.count(ConflictSeverity.WARNING),
                    report.count(ConflictSeverity.INFO),
                    reportFile);
            }
            out.flush();
            return 0;

        } catch (Exception e) {
            log.error("Analysis failed", e);
            err.println("✗ Analysis failed: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}

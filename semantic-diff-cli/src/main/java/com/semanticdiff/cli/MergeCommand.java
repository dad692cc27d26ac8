package com.semanticdiff.cli;

import com.semanticdiff.core.config.ConfigLoader;
import com.semanticdiff.core.config.SemanticDiffConfig;
import com.semanticdiff.core.generator.ReportGenerators;
import com.semanticdiff.core.generator.ReportType;
import com.semanticdiff.core.io.OntologyReader;
import com.semanticdiff.core.io.OntologyWriter;
import com.semanticdiff.core.merge.MergeConflict;
import com.semanticdiff.core.merge.MergeResult;
import com.semanticdiff.core.merge.MergeStrategy;
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
 * Command to merge two edits of a common base model.
 *
 * <p>With {@code --out} the merged model is written to that file and a Markdown merge
 * summary is printed; without it the merged model is printed as JSON and the conflicts are
 * listed on stderr.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * semanticdiff merge -b base.json -o ours.json -t theirs.json --strategy union --out merged.json
 * }</pre>
 */
@Command(
    name = "merge",
    description = "Three-way merge of two versions of an ontology",
    mixinStandardHelpOptions = true
)
public class MergeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MergeCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-b", "--base"}, description = "Common ancestor model file", required = true)
    private Path baseFile;

    @Option(names = {"-o", "--ours"}, description = "Our model file", required = true)
    private Path oursFile;

    @Option(names = {"-t", "--theirs"}, description = "Their model file", required = true)
    private Path theirsFile;

    @Option(
        names = {"--strategy"},
        description = "Conflict strategy: ours, theirs or union (default: from config)"
    )
    private String strategy;

    @Option(names = {"--out"}, description = "Write the merged model to this file")
    private Path outputFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: semanticdiff.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            SemanticDiffConfig config = ConfigLoader.load(configPath);
            OntologyReader reader = new OntologyReader(config.model().duplicateNames());

            Ontology base = reader.read(baseFile);
            Ontology ours = reader.read(oursFile);
            Ontology theirs = reader.read(theirsFile);

            MergeStrategy effectiveStrategy = strategy == null
                ? config.merge().defaultStrategy()
                : MergeStrategy.fromString(strategy);
            log.info("Merging {} and {} onto {} with strategy {}",
                ours.name(), theirs.name(), base.name(), effectiveStrategy.label());

            MergeResult result = config.merge().createEngine().merge(base, ours, theirs, effectiveStrategy);
            OntologyWriter writer = new OntologyWriter();

            if (outputFile != null) {
                writer.write(result.merged(), outputFile);
                out.println(ReportGenerators.require("markdown")
                    .generate(result, ReportType.MERGE_SUMMARY)
                    .content());
                out.println("✓ Merged model written to " + outputFile);
            } else {
                out.println(writer.writeString(result.merged()));
                for (MergeConflict conflict : result.conflicts()) {
                    err.println("! Conflict at " + conflict.path() + " (resolved: " + conflict.resolution().label() + ")");
                }
            }
            out.flush();
            err.flush();
            return 0;

        } catch (Exception e) {
            log.error("Merge failed", e);
            err.println("✗ Merge failed: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}

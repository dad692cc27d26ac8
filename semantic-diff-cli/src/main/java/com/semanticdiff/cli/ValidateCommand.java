package com.semanticdiff.cli;

import com.semanticdiff.core.io.DuplicateNamePolicy;
import com.semanticdiff.core.io.ModelValidationException;
import com.semanticdiff.core.io.OntologyReader;
import com.semanticdiff.core.model.Ontology;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to validate model files.
 *
 * <p>Reports missing names and duplicate names; exits with 1 if any file is invalid.
 */
@Command(
    name = "validate",
    description = "Validate ontology model files",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", description = "Model files to validate")
    private List<Path> modelFiles;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        OntologyReader reader = new OntologyReader(DuplicateNamePolicy.REJECT);

        int invalid = 0;
        for (Path file : modelFiles) {
            try {
                Ontology ontology = reader.read(file);
                out.printf("✓ %s: %s v%s (%d entities, %d relationships, %d rules)%n",
                    file, ontology.name(), ontology.version(),
                    ontology.entities().size(), ontology.relationships().size(), ontology.businessRules().size());
            } catch (ModelValidationException e) {
                invalid++;
                err.println("✗ " + file + ":");
                e.getErrors().forEach(error -> err.println("  - " + error));
            } catch (IOException e) {
                invalid++;
                log.debug("Failed to read {}", file, e);
                err.println("✗ " + file + ": " + e.getMessage());
            }
        }

        out.flush();
        err.flush();
        return invalid == 0 ? 0 : 1;
    }
}

package com.semanticdiff.cli;

import com.semanticdiff.SemanticDiffCLI;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the {@link SemanticDiffCLI} command tree.
 */
class SemanticDiffCLITest {

    @TempDir
    Path tempDir;

    @Test
    void execute_subcommandWithGlobalOptions_runsSubcommand() throws IOException {
        Path file = ModelFiles.write(tempDir, "sales.json", ModelFiles.SALES_V1);
        StringWriter out = new StringWriter();
        CommandLine commandLine = SemanticDiffCLI.createCommandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("-q", "validate", file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Sales v1.0");
    }

    @Test
    void execute_version_printsVersion() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = SemanticDiffCLI.createCommandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("SemanticDiff 1.0.0-SNAPSHOT");
    }

    @Test
    void subcommands_areRegistered() {
        assertThat(SemanticDiffCLI.createCommandLine().getSubcommands())
            .containsOnlyKeys("diff", "merge", "analyze", "validate");
    }
}

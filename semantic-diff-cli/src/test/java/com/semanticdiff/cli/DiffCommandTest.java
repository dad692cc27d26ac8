package com.semanticdiff.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DiffCommand}.
 */
class DiffCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;
    private Path v1;
    private Path v2;

    @BeforeEach
    void setUp() throws IOException {
        commandLine = new CommandLine(new DiffCommand());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        v1 = ModelFiles.write(tempDir, "sales-v1.json", ModelFiles.SALES_V1);
        v2 = ModelFiles.write(tempDir, "sales-v2.json", ModelFiles.SALES_V2);
    }

    @Test
    void call_defaultFormat_printsChangelog() {
        int exitCode = commandLine.execute("-s", v1.toString(), "-t", v2.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("# Changelog: Sales → Sales")
            .contains("- ➕ Added: 1")
            .contains("- **property**: `Customer.Email`");
    }

    @Test
    void call_unifiedFormat_printsUnifiedDiff() {
        int exitCode = commandLine.execute("-s", v1.toString(), "-t", v2.toString(), "-f", "unified");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .startsWith("--- Sales v1.0\n+++ Sales v1.1\n")
            .contains("+property: Customer.Email = type=String, required=false");
    }

    @Test
    void call_jsonToFile_writesReportAndPrintsSummary() throws IOException {
        Path report = tempDir.resolve("reports/diff.json");

        int exitCode = commandLine.execute("-s", v1.toString(), "-t", v2.toString(), "-f", "json", "-o", report.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(report)).contains("\"total_changes\" : 1");
        assertThat(out.toString()).contains("✓ 1 changes (1 added, 0 removed, 0 modified) written to");
    }

    @Test
    void call_failOnChangesWithChanges_returnsChangesFoundCode() {
        int exitCode = commandLine.execute("-s", v1.toString(), "-t", v2.toString(), "--fail-on-changes");

        assertThat(exitCode).isEqualTo(DiffCommand.EXIT_CHANGES_FOUND);
    }

    @Test
    void call_failOnChangesWithoutChanges_returnsZero() {
        int exitCode = commandLine.execute("-s", v1.toString(), "-t", v1.toString(), "--fail-on-changes");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("- Total changes: 0");
    }

    @Test
    void call_missingSource_returnsError() {
        int exitCode = commandLine.execute("-s", tempDir.resolve("missing.json").toString(), "-t", v2.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Diff failed:");
    }

    @Test
    void call_unknownFormat_returnsError() {
        int exitCode = commandLine.execute("-s", v1.toString(), "-t", v2.toString(), "-f", "xml");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown format: xml");
    }

    @Test
    void call_relativeOutputFile_resolvesAgainstConfiguredDirectory() throws IOException {
        Path reports = tempDir.resolve("reports");
        Path config = tempDir.resolve("semanticdiff.yaml");
        Files.writeString(config, "output:\n  directory: \"" + reports.toString().replace("\\", "/") + "\"\n");

        int exitCode = commandLine.execute("-s", v1.toString(), "-t", v2.toString(),
            "-c", config.toString(), "-o", "changes.md");

        assertThat(exitCode).isZero();
        assertThat(Files.readString(reports.resolve("changes.md"))).startsWith("# Changelog: Sales → Sales");
    }
}

package com.semanticdiff.core.renderer;

import com.semanticdiff.core.generator.GeneratedReport;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Collection of generated files to be rendered.
 *
 * @param files list of generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Wraps generated reports, one file per report.
     *
     * @param reports reports to wrap
     * @return output holding one file per report
     */
    public static GeneratedOutput of(GeneratedReport... reports) {
        return new GeneratedOutput(Arrays.stream(reports).map(GeneratedFile::of).toList());
    }
}

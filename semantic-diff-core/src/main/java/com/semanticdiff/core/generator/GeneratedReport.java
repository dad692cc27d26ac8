package com.semanticdiff.core.generator;

import java.util.Objects;

/**
 * Represents a generated report.
 *
 * @param name report name, used as the base file name
 * @param content report content
 * @param fileExtension file extension for this content
 */
public record GeneratedReport(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedReport {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * Returns the file name of this report.
     *
     * @return {@code name.extension}
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}

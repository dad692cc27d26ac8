package com.semanticdiff.core.renderer;

import com.semanticdiff.core.generator.GeneratedReport;

import java.util.Objects;

/**
 * Represents a generated file to be rendered.
 *
 * @param relativePath relative path for the file (e.g., "changelog.md")
 * @param content file content
 * @param contentType MIME type of the content, may be null
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Creates a file from a generated report, named after the report.
     *
     * @param report generated report
     * @return file holding the report content
     */
    public static GeneratedFile of(GeneratedReport report) {
        return new GeneratedFile(report.fileName(), report.content(), contentTypeOf(report.fileExtension()));
    }

    private static String contentTypeOf(String extension) {
        return switch (extension) {
            case "md" -> "text/markdown";
            case "json" -> "application/json";
            case "diff" -> "text/x-diff";
            default -> "text/plain";
        };
    }
}

package com.codelens.core.model;

import java.util.Objects;

/**
 * Position of an entity or relationship in a source file.
 *
 * @param filePath file path relative to the project root, {@code /}-separated
 * @param lineStart first line (1-indexed)
 * @param lineEnd last line (1-indexed), or {@code null} when unknown
 * @param columnStart first column (0-indexed)
 */
public record Location(
    String filePath,
    int lineStart,
    Integer lineEnd,
    int columnStart
) {
    /**
     * Compact constructor with validation.
     */
    public Location {
        Objects.requireNonNull(filePath, "filePath must not be null");
        if (lineStart < 1) {
            throw new IllegalArgumentException("lineStart must be >= 1, got " + lineStart);
        }
        if (lineEnd != null && lineEnd < lineStart) {
            throw new IllegalArgumentException(
                "lineEnd (" + lineEnd + ") must not be before lineStart (" + lineStart + ")");
        }
        if (columnStart < 0) {
            throw new IllegalArgumentException("columnStart must be >= 0, got " + columnStart);
        }
    }

    /**
     * Creates a single-line location with unknown end.
     *
     * @param filePath file path
     * @param line line number (1-indexed)
     * @return location
     */
    public static Location at(String filePath, int line) {
        return new Location(filePath, line, null, 0);
    }

    @Override
    public String toString() {
        return filePath + ":" + lineStart;
    }
}

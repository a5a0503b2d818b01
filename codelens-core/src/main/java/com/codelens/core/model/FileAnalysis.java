package com.codelens.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entities, relationships and errors extracted from one source file.
 *
 * <p>A non-empty error list means the file was only partially analyzed: parse-level
 * entities are absent.
 *
 * @param filePath path relative to the project root
 * @param entities top-level entities in traversal order; methods live inside their class
 * @param relationships relationships found in the file
 * @param errors human-readable error messages
 * @param metadata file metadata such as {@code is_test_file}
 */
public record FileAnalysis(
    String filePath,
    List<CodeEntity> entities,
    List<Relationship> relationships,
    List<String> errors,
    Map<String, Object> metadata
) {
    public static final String IS_TEST_FILE = "is_test_file";

    /**
     * Compact constructor with validation.
     */
    public FileAnalysis {
        Objects.requireNonNull(filePath, "filePath must not be null");
        entities = entities == null ? List.of() : List.copyOf(entities);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        errors = errors == null ? List.of() : List.copyOf(errors);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Creates an analysis that holds a single error and nothing else.
     *
     * @param filePath file path
     * @param error error message
     * @return failed analysis
     */
    public static FileAnalysis failed(String filePath, String error) {
        return new FileAnalysis(filePath, List.of(), List.of(), List.of(error), Map.of());
    }

    public FileAnalysis withMetadata(String key, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(metadata);
        updated.put(key, value);
        return new FileAnalysis(filePath, entities, relationships, errors, updated);
    }

    public List<FunctionEntity> functions() {
        return entities.stream()
            .filter(FunctionEntity.class::isInstance)
            .map(FunctionEntity.class::cast)
            .toList();
    }

    public List<ClassEntity> classes() {
        return entities.stream()
            .filter(ClassEntity.class::isInstance)
            .map(ClassEntity.class::cast)
            .toList();
    }

    public List<ImportEntity> imports() {
        return entities.stream()
            .filter(ImportEntity.class::isInstance)
            .map(ImportEntity.class::cast)
            .toList();
    }

    public boolean partial() {
        return !errors.isEmpty();
    }

    public boolean testFile() {
        return Boolean.TRUE.equals(metadata.get(IS_TEST_FILE));
    }

    /**
     * Returns the last path segment.
     *
     * @return file name
     */
    public String fileName() {
        int slash = filePath.lastIndexOf('/');
        return slash < 0 ? filePath : filePath.substring(slash + 1);
    }
}

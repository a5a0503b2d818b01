package com.codelens.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A directed, name-based edge between two code entities.
 *
 * <p>Source and target are plain names, not resolved references. A call to {@code self.save}
 * is recorded as target {@code self.save} whatever {@code self} turns out to be at runtime.
 * Targets that match no known entity stay unresolved; a relationship is evidence of a
 * dependency, not a verified binding.
 *
 * @param source source entity name ({@code func}, {@code Class.method}, or {@code file::name} when cross-file)
 * @param target target entity name as written in the source
 * @param kind relationship kind
 * @param sourceLocation where the relationship appears, or null
 * @param metadata additional metadata ({@code cross_file}, {@code source_file}, {@code target_file})
 */
public record Relationship(
    String source,
    String target,
    RelationshipKind kind,
    Location sourceLocation,
    Map<String, Object> metadata
) {
    public static final String CROSS_FILE = "cross_file";
    public static final String SOURCE_FILE = "source_file";
    public static final String TARGET_FILE = "target_file";

    /**
     * Compact constructor with validation.
     */
    public Relationship {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (source.isEmpty() || target.isEmpty()) {
            throw new IllegalArgumentException("source and target must not be empty");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Relationship of(String source, String target, RelationshipKind kind, Location sourceLocation) {
        return new Relationship(source, target, kind, sourceLocation, Map.of());
    }

    public boolean crossFile() {
        return Boolean.TRUE.equals(metadata.get(CROSS_FILE));
    }

    /**
     * Returns the {@code source_file}/{@code target_file} metadata value, or null.
     *
     * @param key metadata key
     * @return file path or null
     */
    public String fileMetadata(String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }
}

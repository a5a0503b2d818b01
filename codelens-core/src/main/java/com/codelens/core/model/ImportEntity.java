package com.codelens.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One name bound by an {@code import} or {@code from ... import} statement.
 *
 * <p>{@code import a.b as c} yields name {@code c}, module {@code a.b}, alias {@code c};
 * {@code from .x import y} yields name {@code y}, module {@code .x}, from-style.
 *
 * @param name bound name (alias when present)
 * @param kind always {@link EntityKind#IMPORT}
 * @param location statement location
 * @param module imported module, relative dots included; empty for {@code from . import y}
 * @param alias alias or null
 * @param fromImport whether this is a {@code from ... import} statement
 * @param metadata additional metadata
 */
public record ImportEntity(
    String name,
    EntityKind kind,
    Location location,
    String module,
    String alias,
    boolean fromImport,
    Map<String, Object> metadata
) implements CodeEntity {

    public ImportEntity {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(location, "location must not be null");
        if (kind != EntityKind.IMPORT) {
            throw new IllegalArgumentException("Import entity must have the import kind, got " + kind.value());
        }
        module = module == null ? "" : module;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ImportEntity of(String name, Location location, String module, String alias, boolean fromImport) {
        return new ImportEntity(name, EntityKind.IMPORT, location, module, alias, fromImport, Map.of());
    }

    /**
     * Imports carry no docstring.
     */
    @Override
    public String docstring() {
        return null;
    }

    @Override
    public String sourceCode() {
        return null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitImport(this);
    }
}

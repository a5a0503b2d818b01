package com.codelens.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A function or method definition.
 *
 * <p>Metadata keys: {@code is_async}, {@code decorators}, {@code args}, {@code line_count}.
 *
 * @param name function name
 * @param kind {@link EntityKind#FUNCTION} or {@link EntityKind#ASYNC_FUNCTION}
 * @param location definition location
 * @param docstring cleaned docstring or null
 * @param sourceCode source preview or null
 * @param metadata additional metadata
 */
public record FunctionEntity(
    String name,
    EntityKind kind,
    Location location,
    String docstring,
    String sourceCode,
    Map<String, Object> metadata
) implements CodeEntity {

    public FunctionEntity {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(location, "location must not be null");
        if (kind != EntityKind.FUNCTION && kind != EntityKind.ASYNC_FUNCTION) {
            throw new IllegalArgumentException("Function entity must have a function kind, got " + kind.value());
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean async() {
        return kind == EntityKind.ASYNC_FUNCTION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}

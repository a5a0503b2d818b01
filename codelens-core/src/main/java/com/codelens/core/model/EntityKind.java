package com.codelens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of code entities extracted from Python sources.
 */
public enum EntityKind {
    /** Plain {@code def} function or method */
    FUNCTION("function"),

    /** {@code async def} function or method */
    ASYNC_FUNCTION("async_function"),

    /** Class definition */
    CLASS("class"),

    /** One imported name */
    IMPORT("import");

    private final String value;

    EntityKind(String value) {
        this.value = value;
    }

    /**
     * Returns the serialized name, e.g. {@code async_function}.
     *
     * @return serialized name
     */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves a serialized name.
     *
     * @param value serialized name
     * @return matching kind
     * @throws IllegalArgumentException if no kind matches
     */
    @JsonCreator
    public static EntityKind fromValue(String value) {
        for (EntityKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown entity kind: " + value);
    }
}

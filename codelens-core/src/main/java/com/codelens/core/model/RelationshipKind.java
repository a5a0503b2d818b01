package com.codelens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of relationships between code entities.
 */
public enum RelationshipKind {
    /** Function or method calls another callable */
    CALLS("calls"),

    /** Class derives from a base class */
    INHERITS("inherits"),

    /** Module imports a name */
    IMPORTS("imports"),

    /** Entity uses another entity */
    USES("uses"),

    /** Generic dependency relationship */
    DEPENDS_ON("depends_on");

    private final String value;

    RelationshipKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

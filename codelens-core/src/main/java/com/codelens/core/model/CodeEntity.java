package com.codelens.core.model;

import java.util.Map;

/**
 * A named code construct found in a Python source file.
 *
 * <p>The set of implementations is closed: {@link FunctionEntity}, {@link ClassEntity} and
 * {@link ImportEntity}. Consumers that need per-variant behavior go through
 * {@link #accept(Visitor)} so that adding a variant breaks every consumer at compile time.
 */
public interface CodeEntity {

    String name();

    EntityKind kind();

    Location location();

    /**
     * Returns the cleaned docstring, or {@code null} if the entity has none.
     *
     * @return docstring or null
     */
    String docstring();

    /**
     * Returns the first lines of the definition, or {@code null} when not captured.
     *
     * @return source preview or null
     */
    String sourceCode();

    Map<String, Object> metadata();

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive dispatch over the entity variants.
     *
     * @param <R> result type
     */
    interface Visitor<R> {
        R visitFunction(FunctionEntity function);

        R visitClass(ClassEntity cls);

        R visitImport(ImportEntity imported);
    }
}

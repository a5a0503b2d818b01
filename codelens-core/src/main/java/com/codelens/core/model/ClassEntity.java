package com.codelens.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A class definition with its methods and base classes.
 *
 * <p>Methods are only known once the class body has been walked, so instances are
 * assembled through {@link Builder}; the builder's method list never escapes it.
 *
 * <p>Metadata keys: {@code decorators}, {@code method_count}.
 *
 * @param name class name
 * @param kind always {@link EntityKind#CLASS}
 * @param location definition location
 * @param docstring cleaned docstring or null
 * @param sourceCode source preview or null
 * @param methods methods in definition order
 * @param baseClasses dotted base-class names in declaration order
 * @param metadata additional metadata
 */
public record ClassEntity(
    String name,
    EntityKind kind,
    Location location,
    String docstring,
    String sourceCode,
    List<FunctionEntity> methods,
    List<String> baseClasses,
    Map<String, Object> metadata
) implements CodeEntity {

    public ClassEntity {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(location, "location must not be null");
        if (kind != EntityKind.CLASS) {
            throw new IllegalArgumentException("Class entity must have the class kind, got " + kind.value());
        }
        methods = methods == null ? List.of() : List.copyOf(methods);
        baseClasses = baseClasses == null ? List.of() : List.copyOf(baseClasses);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Builder builder(String name, Location location) {
        return new Builder(name, location);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitClass(this);
    }

    /**
     * Accumulates methods while a class body is walked.
     */
    public static final class Builder {
        private final String name;
        private final Location location;
        private final List<FunctionEntity> methods = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private List<String> baseClasses = List.of();
        private String docstring;
        private String sourceCode;

        private Builder(String name, Location location) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.location = Objects.requireNonNull(location, "location must not be null");
        }

        public Builder docstring(String docstring) {
            this.docstring = docstring;
            return this;
        }

        public Builder sourceCode(String sourceCode) {
            this.sourceCode = sourceCode;
            return this;
        }

        public Builder baseClasses(List<String> baseClasses) {
            this.baseClasses = List.copyOf(baseClasses);
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public Builder addMethod(FunctionEntity method) {
            methods.add(Objects.requireNonNull(method, "method must not be null"));
            return this;
        }

        /**
         * Freezes the accumulated state. The builder may keep collecting afterwards
         * without affecting the returned value.
         *
         * @return immutable class entity
         */
        public ClassEntity build() {
            Map<String, Object> finalMetadata = new LinkedHashMap<>(metadata);
            finalMetadata.put("method_count", methods.size());
            return new ClassEntity(name, EntityKind.CLASS, location, docstring, sourceCode,
                methods, baseClasses, finalMetadata);
        }
    }
}

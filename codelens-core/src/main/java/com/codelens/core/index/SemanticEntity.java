package com.codelens.core.index;

import com.codelens.core.domain.DomainContext;
import com.codelens.core.model.EntityKind;
import com.codelens.core.scoring.ContextScore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Index entry for a top-level entity.
 *
 * @param name entity name
 * @param filePath file defining the entity
 * @param domainContext domain tags of the entity
 * @param contextScore quality score of the entity
 * @param entityKind entity kind
 */
public record SemanticEntity(
    @JsonProperty("name") String name,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("domain_context") DomainContext domainContext,
    @JsonProperty("context_score") ContextScore contextScore,
    @JsonProperty("entity_type") EntityKind entityKind
) {
    public SemanticEntity {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(domainContext, "domainContext must not be null");
        Objects.requireNonNull(contextScore, "contextScore must not be null");
    }
}

package com.codelens.core.index;

import com.codelens.core.domain.DomainContext;
import com.codelens.core.scoring.ContextScore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Index entry for a file.
 *
 * @param filePath file path relative to the project root
 * @param domainContext domain tags of the file
 * @param contextScore quality score of the file
 * @param entities names of the top-level entities in the file
 */
public record SemanticFile(
    @JsonProperty("file_path") String filePath,
    @JsonProperty("domain_context") DomainContext domainContext,
    @JsonProperty("context_score") ContextScore contextScore,
    @JsonProperty("entities") List<String> entities
) {
    public SemanticFile {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(domainContext, "domainContext must not be null");
        Objects.requireNonNull(contextScore, "contextScore must not be null");
        entities = entities == null ? List.of() : List.copyOf(entities);
    }
}

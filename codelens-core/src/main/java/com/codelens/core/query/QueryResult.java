package com.codelens.core.query;

import com.codelens.core.scoring.QualityTier;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A ranked match for a query.
 *
 * @param entityName entity name, or file name for file results
 * @param filePath file path
 * @param relevanceScore relevance in (0, 1]
 * @param domainTags tag labels, highest confidence first
 * @param contextScore quality tier
 * @param shortContext one-line summary, or null
 * @param reasoning why the result matched
 */
public record QueryResult(
    @JsonProperty("entity_name") String entityName,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("relevance_score") double relevanceScore,
    @JsonProperty("domain_tags") List<String> domainTags,
    @JsonProperty("context_score") QualityTier contextScore,
    @JsonProperty("short_context") String shortContext,
    @JsonProperty("reasoning") List<String> reasoning
) {
    public QueryResult {
        domainTags = domainTags == null ? List.of() : List.copyOf(domainTags);
        reasoning = reasoning == null ? List.of() : List.copyOf(reasoning);
    }
}

package com.codelens.core.index;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary counters of a semantic index.
 *
 * @param totalFiles indexed files
 * @param totalEntities indexed entities
 * @param totalWorkflows detected workflows
 * @param domainRelatedFiles files marked as domain-related
 * @param highQualityEntities entities in the HIGH tier
 */
public record IndexMetadata(
    @JsonProperty("total_files") int totalFiles,
    @JsonProperty("total_entities") int totalEntities,
    @JsonProperty("total_workflows") int totalWorkflows,
    @JsonProperty("domain_related_files") int domainRelatedFiles,
    @JsonProperty("high_quality_entities") int highQualityEntities
) {
}

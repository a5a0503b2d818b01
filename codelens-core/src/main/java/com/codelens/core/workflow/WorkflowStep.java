package com.codelens.core.workflow;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One entity on a workflow path.
 *
 * @param entityName entity name
 * @param filePath file defining the entity
 * @param domainTags tag labels of the entity, highest confidence first
 * @param role position in the workflow
 */
public record WorkflowStep(
    @JsonProperty("entity_name") String entityName,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("domain_tags") List<String> domainTags,
    @JsonProperty("role") WorkflowRole role
) {
    public WorkflowStep {
        Objects.requireNonNull(entityName, "entityName must not be null");
        domainTags = domainTags == null ? List.of() : List.copyOf(domainTags);
    }
}

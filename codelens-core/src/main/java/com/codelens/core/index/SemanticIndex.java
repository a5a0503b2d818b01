package com.codelens.core.index;

import com.codelens.core.workflow.WorkflowHint;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Queryable semantic model of a project.
 *
 * @param projectName project name
 * @param files file entries keyed by file path
 * @param entities entity entries keyed by {@code file::name}
 * @param workflows detected workflows
 * @param metadata summary counters
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SemanticIndex(
    @JsonProperty("project_name") String projectName,
    @JsonProperty("files") Map<String, SemanticFile> files,
    @JsonProperty("entities") Map<String, SemanticEntity> entities,
    @JsonProperty("workflows") List<WorkflowHint> workflows,
    @JsonProperty("metadata") IndexMetadata metadata
) {
    public SemanticIndex {
        Objects.requireNonNull(projectName, "projectName must not be null");
        files = files == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(files));
        entities = entities == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entities));
        workflows = workflows == null ? List.of() : List.copyOf(workflows);
        Objects.requireNonNull(metadata, "metadata must not be null");
    }
}

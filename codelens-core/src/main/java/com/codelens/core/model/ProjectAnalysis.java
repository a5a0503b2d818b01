package com.codelens.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Analysis results for a whole project.
 *
 * @param projectName project name
 * @param fileAnalyses per-file results in collection order
 * @param crossFileRelationships relationships re-emitted with {@code file::name} ends
 * @param errors project-level errors
 */
public record ProjectAnalysis(
    String projectName,
    List<FileAnalysis> fileAnalyses,
    List<Relationship> crossFileRelationships,
    List<String> errors
) {
    /**
     * Compact constructor with validation.
     */
    public ProjectAnalysis {
        Objects.requireNonNull(projectName, "projectName must not be null");
        fileAnalyses = fileAnalyses == null ? List.of() : List.copyOf(fileAnalyses);
        crossFileRelationships = crossFileRelationships == null ? List.of() : List.copyOf(crossFileRelationships);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public List<CodeEntity> allEntities() {
        return fileAnalyses.stream()
            .flatMap(analysis -> analysis.entities().stream())
            .toList();
    }

    public List<FunctionEntity> allFunctions() {
        return fileAnalyses.stream()
            .flatMap(analysis -> analysis.functions().stream())
            .toList();
    }

    public List<ClassEntity> allClasses() {
        return fileAnalyses.stream()
            .flatMap(analysis -> analysis.classes().stream())
            .toList();
    }

    /**
     * Returns every file-level relationship followed by the cross-file ones.
     *
     * @return all relationships
     */
    public List<Relationship> allRelationships() {
        return Stream.concat(
                fileAnalyses.stream().flatMap(analysis -> analysis.relationships().stream()),
                crossFileRelationships.stream())
            .toList();
    }
}

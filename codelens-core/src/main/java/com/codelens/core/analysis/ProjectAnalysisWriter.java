package com.codelens.core.analysis;

import com.codelens.core.model.ClassEntity;
import com.codelens.core.model.CodeEntity;
import com.codelens.core.model.FileAnalysis;
import com.codelens.core.model.FunctionEntity;
import com.codelens.core.model.ImportEntity;
import com.codelens.core.model.Location;
import com.codelens.core.model.ProjectAnalysis;
import com.codelens.core.model.Relationship;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link ProjectAnalysis} as JSON.
 *
 * <p>Layout:
 * <pre>{@code
 * {
 *   "project_name": "...",
 *   "file_analyses": [{"file_path", "entities", "relationships", "errors", "summary"}],
 *   "all_relationships": [... cross-file relationships ...],
 *   "errors": [...],
 *   "summary": {"total_files", "total_entities", "total_functions", "total_classes", "total_relationships"}
 * }
 * }</pre>
 */
public class ProjectAnalysisWriter {

    private static final Logger log = LoggerFactory.getLogger(ProjectAnalysisWriter.class);

    private final ObjectMapper mapper;

    public ProjectAnalysisWriter() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes the analysis to a file, creating parent directories.
     *
     * @param analysis project analysis
     * @param output target file
     * @throws AnalysisException if the file cannot be written
     */
    public void write(ProjectAnalysis analysis, Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(output.toFile(), toJson(analysis));
            log.info("Saved project analysis to {}", output);
        } catch (IOException e) {
            throw new AnalysisException("Failed to save project analysis to " + output, e);
        }
    }

    public ObjectNode toJson(ProjectAnalysis analysis) {
        ObjectNode root = mapper.createObjectNode();
        root.put("project_name", analysis.projectName());

        ArrayNode files = root.putArray("file_analyses");
        for (FileAnalysis fileAnalysis : analysis.fileAnalyses()) {
            files.add(fileJson(fileAnalysis));
        }

        ArrayNode relationships = root.putArray("all_relationships");
        analysis.crossFileRelationships().forEach(relationship -> relationships.add(relationshipJson(relationship)));

        ArrayNode errors = root.putArray("errors");
        analysis.errors().forEach(errors::add);

        ObjectNode summary = root.putObject("summary");
        summary.put("total_files", analysis.fileAnalyses().size());
        summary.put("total_entities", analysis.allEntities().size());
        summary.put("total_functions", analysis.allFunctions().size());
        summary.put("total_classes", analysis.allClasses().size());
        summary.put("total_relationships", analysis.crossFileRelationships().size());
        return root;
    }

    private ObjectNode fileJson(FileAnalysis analysis) {
        ObjectNode node = mapper.createObjectNode();
        node.put("file_path", analysis.filePath());

        ArrayNode entities = node.putArray("entities");
        analysis.entities().forEach(entity -> entities.add(entityJson(entity)));

        ArrayNode relationships = node.putArray("relationships");
        analysis.relationships().forEach(relationship -> relationships.add(relationshipJson(relationship)));

        ArrayNode errors = node.putArray("errors");
        analysis.errors().forEach(errors::add);

        ObjectNode summary = node.putObject("summary");
        summary.put("total_entities", analysis.entities().size());
        summary.put("functions", analysis.functions().size());
        summary.put("classes", analysis.classes().size());
        summary.put("imports", analysis.imports().size());
        summary.put("relationships", analysis.relationships().size());
        return node;
    }

    private ObjectNode entityJson(CodeEntity entity) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", entity.name());
        node.put("type", entity.kind().value());

        Location location = entity.location();
        ObjectNode locationNode = node.putObject("location");
        locationNode.put("file_path", location.filePath());
        locationNode.put("line_start", location.lineStart());
        if (location.lineEnd() == null) {
            locationNode.putNull("line_end");
        } else {
            locationNode.put("line_end", location.lineEnd());
        }
        locationNode.put("column_start", location.columnStart());

        node.put("docstring", entity.docstring());
        node.put("source_code", entity.sourceCode());
        node.set("metadata", mapper.valueToTree(entity.metadata()));

        return entity.accept(new CodeEntity.Visitor<ObjectNode>() {
            @Override
            public ObjectNode visitFunction(FunctionEntity function) {
                return node;
            }

            @Override
            public ObjectNode visitClass(ClassEntity classEntity) {
                ArrayNode methods = node.putArray("methods");
                classEntity.methods().forEach(method -> methods.add(entityJson(method)));
                ArrayNode bases = node.putArray("base_classes");
                classEntity.baseClasses().forEach(bases::add);
                return node;
            }

            @Override
            public ObjectNode visitImport(ImportEntity importEntity) {
                node.put("module", importEntity.module());
                node.put("alias", importEntity.alias());
                node.put("is_from", importEntity.fromImport());
                return node;
            }
        });
    }

    private ObjectNode relationshipJson(Relationship relationship) {
        ObjectNode node = mapper.createObjectNode();
        node.put("source", relationship.source());
        node.put("target", relationship.target());
        node.put("type", relationship.kind().value());
        Location location = relationship.sourceLocation();
        if (location == null) {
            node.putNull("source_location");
        } else {
            ObjectNode locationNode = node.putObject("source_location");
            locationNode.put("file_path", location.filePath());
            locationNode.put("line_start", location.lineStart());
        }
        node.set("metadata", mapper.valueToTree(relationship.metadata()));
        return node;
    }
}

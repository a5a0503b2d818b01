package com.codelens.core.analysis;

import com.codelens.core.model.CodeEntity;
import com.codelens.core.model.EntityKind;
import com.codelens.core.model.FileAnalysis;
import com.codelens.core.model.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Links relationships to entities defined in other files.
 *
 * <p>Resolution is by name only. Every function and class name defined at the top level of a
 * file is mapped to that file; when two files define the same name the file parsed last wins
 * and the collision is logged. A relationship whose target maps to a different file than the
 * one it was found in is re-emitted with {@code file::name} ends and the metadata
 * {@code cross_file}, {@code source_file} and {@code target_file}.
 */
public class CrossFileResolver {

    private static final Logger log = LoggerFactory.getLogger(CrossFileResolver.class);

    static final String QUALIFIER = "::";

    /**
     * Resolves cross-file relationships.
     *
     * @param fileAnalyses analyses in collection order
     * @return cross-file relationships in file order
     */
    public List<Relationship> resolve(List<FileAnalysis> fileAnalyses) {
        Map<String, String> definedIn = new HashMap<>();
        for (FileAnalysis analysis : fileAnalyses) {
            for (CodeEntity entity : analysis.entities()) {
                if (entity.kind() == EntityKind.IMPORT) {
                    continue;
                }
                String previous = definedIn.put(entity.name(), analysis.filePath());
                if (previous != null && !previous.equals(analysis.filePath())) {
                    log.warn("Entity name '{}' is defined in both {} and {}; using {}",
                        entity.name(), previous, analysis.filePath(), analysis.filePath());
                }
            }
        }

        List<Relationship> resolved = new ArrayList<>();
        for (FileAnalysis analysis : fileAnalyses) {
            for (Relationship relationship : analysis.relationships()) {
                String targetFile = definedIn.get(relationship.target());
                if (targetFile == null || targetFile.equals(analysis.filePath())) {
                    continue;
                }
                Map<String, Object> metadata = new LinkedHashMap<>(relationship.metadata());
                metadata.put(Relationship.CROSS_FILE, true);
                metadata.put(Relationship.SOURCE_FILE, analysis.filePath());
                metadata.put(Relationship.TARGET_FILE, targetFile);
                resolved.add(new Relationship(
                    qualified(analysis.filePath(), relationship.source()),
                    qualified(targetFile, relationship.target()),
                    relationship.kind(),
                    relationship.sourceLocation(),
                    metadata
                ));
            }
        }

        log.info("Built {} cross-file relationships", resolved.size());
        return resolved;
    }

    /**
     * Returns the {@code file::name} key of an entity.
     *
     * @param filePath file the entity is defined in
     * @param name entity name
     * @return qualified key
     */
    public static String qualified(String filePath, String name) {
        return filePath + QUALIFIER + name;
    }
}

package com.codelens.core.rag;

import com.codelens.core.model.ClassEntity;
import com.codelens.core.model.FileAnalysis;
import com.codelens.core.model.FunctionEntity;
import com.codelens.core.model.ImportEntity;
import com.codelens.core.model.Relationship;
import com.codelens.core.model.RelationshipKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders imports, functions and classes as one-line chunks:
 *
 * <pre>
 * Imports: os, frappe
 * Function: make_gl_entries at line 12. Calls: validate, save
 * Function: JournalEntry.on_submit at line 40. Calls: make_gl_entries
 * Class: JournalEntry at line 30
 * </pre>
 */
public class DefaultChunkProducer implements ChunkProducer {

    static final String NO_ENTITIES = "No code entities found in analysis";

    @Override
    public List<String> chunks(FileAnalysis analysis) {
        Map<String, Set<String>> callees = new LinkedHashMap<>();
        for (Relationship relationship : analysis.relationships()) {
            if (relationship.kind() == RelationshipKind.CALLS) {
                callees.computeIfAbsent(relationship.source(), key -> new LinkedHashSet<>()).add(relationship.target());
            }
        }

        List<String> chunks = new ArrayList<>();
        List<ImportEntity> imports = analysis.imports();
        if (!imports.isEmpty()) {
            chunks.add("Imports: " + String.join(", ", imports.stream().map(ImportEntity::name).toList()));
        }

        for (FunctionEntity function : analysis.functions()) {
            chunks.add(functionChunk(function.name(), function, callees));
        }
        for (ClassEntity classEntity : analysis.classes()) {
            for (FunctionEntity method : classEntity.methods()) {
                chunks.add(functionChunk(classEntity.name() + "." + method.name(), method, callees));
            }
        }
        for (ClassEntity classEntity : analysis.classes()) {
            chunks.add("Class: " + classEntity.name() + " at line " + classEntity.location().lineStart());
        }

        return chunks.isEmpty() ? List.of(NO_ENTITIES) : chunks;
    }

    private static String functionChunk(String name, FunctionEntity function, Map<String, Set<String>> callees) {
        String chunk = "Function: " + name + " at line " + function.location().lineStart();
        Set<String> calls = callees.get(name);
        if (calls != null && !calls.isEmpty()) {
            chunk += ". Calls: " + String.join(", ", calls);
        }
        return chunk;
    }
}

package com.codelens.core.workflow;

import com.codelens.core.domain.DomainContext;
import com.codelens.core.domain.DomainTagger;
import com.codelens.core.model.CodeEntity;
import com.codelens.core.model.EntityKind;
import com.codelens.core.model.FileAnalysis;
import com.codelens.core.model.ProjectAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds business processes by searching the call graph between tagged entities.
 *
 * <p>For each pattern, every entity whose primary tag is a start concept is paired with every
 * entity whose primary tag is an end concept. A shortest call path between the two becomes a
 * {@link WorkflowHint}; pairs without a path are skipped. Overlapping hints found through
 * different pairs or patterns are all reported.
 */
public class WorkflowDetector {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDetector.class);

    private static final String PATH_SEPARATOR = " -> ";

    private final List<WorkflowPattern> patterns;

    public WorkflowDetector() {
        this(WorkflowPattern.accounting());
    }

    public WorkflowDetector(List<WorkflowPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Tags every entity with {@code tagger}, then detects workflows.
     *
     * @param project project analysis
     * @param tagger tagger for entity contexts
     * @return workflow hints
     */
    public List<WorkflowHint> detect(ProjectAnalysis project, DomainTagger tagger) {
        return detect(project, candidates(project, tagger));
    }

    /**
     * Detects workflows over already tagged entities.
     *
     * @param project project analysis providing the call relationships
     * @param candidates entity name to file and context, in discovery order
     * @return workflow hints in pattern order
     */
    public List<WorkflowHint> detect(ProjectAnalysis project, Map<String, CandidateEntity> candidates) {
        log.info("Starting workflow detection over {} entities", candidates.size());
        CallGraph graph = CallGraph.of(project.allRelationships());
        log.debug("Call graph has {} callers", graph.size());

        List<WorkflowHint> hints = new ArrayList<>();
        for (WorkflowPattern pattern : patterns) {
            List<String> starts = withPrimaryTag(candidates, pattern.startConcepts());
            List<String> ends = withPrimaryTag(candidates, pattern.endConcepts());
            for (String start : starts) {
                for (String end : ends) {
                    if (start.equals(end)) {
                        continue;
                    }
                    Optional<List<String>> path = graph.shortestPath(start, end);
                    path.flatMap(nodes -> toHint(pattern, nodes, candidates)).ifPresent(hints::add);
                }
            }
        }

        log.info("Detected {} workflow hints", hints.size());
        return hints;
    }

    /**
     * Maps each function and class name to its file and entity context. A name defined in
     * several files keeps the last definition.
     */
    public static Map<String, CandidateEntity> candidates(ProjectAnalysis project, DomainTagger tagger) {
        Map<String, CandidateEntity> candidates = new LinkedHashMap<>();
        for (FileAnalysis file : project.fileAnalyses()) {
            for (CodeEntity entity : file.entities()) {
                if (entity.kind() != EntityKind.IMPORT) {
                    candidates.put(entity.name(), new CandidateEntity(file.filePath(), tagger.tagEntity(entity)));
                }
            }
        }
        return candidates;
    }

    private static List<String> withPrimaryTag(Map<String, CandidateEntity> candidates, Set<String> concepts) {
        List<String> names = new ArrayList<>();
        candidates.forEach((name, candidate) -> {
            String primary = candidate.context().primaryTag();
            if (primary != null && concepts.contains(primary)) {
                names.add(name);
            }
        });
        return names;
    }

    private static Optional<WorkflowHint> toHint(WorkflowPattern pattern, List<String> path,
                                                 Map<String, CandidateEntity> candidates) {
        if (path.size() < 2) {
            return Optional.empty();
        }
        List<WorkflowStep> steps = new ArrayList<>();
        double totalConfidence = 0.0;
        for (int i = 0; i < path.size(); i++) {
            CandidateEntity candidate = candidates.get(path.get(i));
            if (candidate == null) {
                continue;
            }
            DomainContext context = candidate.context();
            steps.add(new WorkflowStep(path.get(i), candidate.filePath(), context.tagLabels(),
                WorkflowRole.at(i, path.size())));
            totalConfidence += context.topConfidence();
        }
        if (steps.isEmpty()) {
            return Optional.empty();
        }

        List<String> reasoning = List.of(
            "Found call path: " + String.join(PATH_SEPARATOR, path),
            "Matches " + pattern.name() + " pattern",
            "Business process: " + pattern.businessProcess());
        String name = pattern.name() + ": "
            + String.join(PATH_SEPARATOR, steps.stream().map(WorkflowStep::entityName).toList());
        double confidence = Math.min(totalConfidence / steps.size(), 1.0);
        return Optional.of(new WorkflowHint(name, steps, confidence, reasoning, pattern.businessProcess()));
    }
}

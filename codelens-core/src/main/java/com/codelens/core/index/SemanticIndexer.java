package com.codelens.core.index;

import com.codelens.core.analysis.CrossFileResolver;
import com.codelens.core.domain.DomainContext;
import com.codelens.core.domain.DomainTagger;
import com.codelens.core.model.CodeEntity;
import com.codelens.core.model.EntityKind;
import com.codelens.core.model.FileAnalysis;
import com.codelens.core.model.ProjectAnalysis;
import com.codelens.core.scoring.ContextScore;
import com.codelens.core.scoring.ContextScorer;
import com.codelens.core.scoring.QualityTier;
import com.codelens.core.workflow.CandidateEntity;
import com.codelens.core.workflow.WorkflowDetector;
import com.codelens.core.workflow.WorkflowHint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link SemanticIndex} from a completed {@link ProjectAnalysis}.
 *
 * <p>Every file and every top-level entity is tagged and scored. Workflow detection runs once,
 * after all entities have been tagged, and reuses those entity contexts.
 */
public class SemanticIndexer {

    private static final Logger log = LoggerFactory.getLogger(SemanticIndexer.class);

    private final DomainTagger tagger;
    private final ContextScorer scorer;
    private final WorkflowDetector workflowDetector;

    public SemanticIndexer() {
        this(new DomainTagger(), new ContextScorer(), new WorkflowDetector());
    }

    public SemanticIndexer(DomainTagger tagger, ContextScorer scorer, WorkflowDetector workflowDetector) {
        this.tagger = tagger;
        this.scorer = scorer;
        this.workflowDetector = workflowDetector;
    }

    public SemanticIndex build(ProjectAnalysis project) {
        log.info("Building semantic index for {}", project.projectName());

        Map<String, SemanticFile> files = new LinkedHashMap<>();
        Map<String, SemanticEntity> entities = new LinkedHashMap<>();
        Map<String, CandidateEntity> candidates = new LinkedHashMap<>();

        for (FileAnalysis file : project.fileAnalyses()) {
            DomainContext fileContext = tagger.tagFile(file);
            ContextScore fileScore = scorer.scoreFile(file, project);

            List<String> entityNames = new ArrayList<>();
            for (CodeEntity entity : file.entities()) {
                DomainContext entityContext = tagger.tagEntity(entity);
                ContextScore entityScore = scorer.scoreEntity(entity, file, project);
                entities.put(CrossFileResolver.qualified(file.filePath(), entity.name()),
                    new SemanticEntity(entity.name(), file.filePath(), entityContext, entityScore, entity.kind()));
                entityNames.add(entity.name());
                if (entity.kind() != EntityKind.IMPORT) {
                    candidates.put(entity.name(), new CandidateEntity(file.filePath(), entityContext));
                }
            }
            files.put(file.filePath(), new SemanticFile(file.filePath(), fileContext, fileScore, entityNames));
        }

        List<WorkflowHint> workflows = workflowDetector.detect(project, candidates);

        IndexMetadata metadata = new IndexMetadata(
            files.size(),
            entities.size(),
            workflows.size(),
            (int) files.values().stream().filter(file -> file.domainContext().domainRelated()).count(),
            (int) entities.values().stream().filter(entity -> entity.contextScore().tier() == QualityTier.HIGH).count()
        );
        log.info("Built semantic index: {}", metadata);
        return new SemanticIndex(project.projectName(), files, entities, workflows, metadata);
    }
}

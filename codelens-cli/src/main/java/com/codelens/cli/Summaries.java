package com.codelens.cli;

import com.codelens.core.index.IndexMetadata;
import com.codelens.core.index.SemanticIndex;
import com.codelens.core.model.ProjectAnalysis;
import com.codelens.core.query.QueryResult;
import com.codelens.core.workflow.WorkflowHint;
import com.codelens.core.workflow.WorkflowStep;

import java.util.Locale;

/**
 * Console output shared by the commands.
 */
final class Summaries {

    private static final int MAX_LISTED_ERRORS = 10;

    private Summaries() {
    }

    static void printAnalysis(ProjectAnalysis analysis) {
        System.out.println("Project: " + analysis.projectName());
        System.out.println("  Files:                  " + analysis.fileAnalyses().size());
        System.out.println("  Entities:               " + analysis.allEntities().size());
        System.out.println("  Functions:              " + analysis.allFunctions().size());
        System.out.println("  Classes:                " + analysis.allClasses().size());
        System.out.println("  Cross-file relations:   " + analysis.crossFileRelationships().size());
        System.out.println("  Errors:                 " + analysis.errors().size());
        analysis.errors().stream().limit(MAX_LISTED_ERRORS).forEach(error -> System.out.println("    - " + error));
        if (analysis.errors().size() > MAX_LISTED_ERRORS) {
            System.out.println("    ... and " + (analysis.errors().size() - MAX_LISTED_ERRORS) + " more");
        }
    }

    static void printIndex(SemanticIndex index) {
        IndexMetadata metadata = index.metadata();
        System.out.println("Semantic index: " + index.projectName());
        System.out.println("  Files:                  " + metadata.totalFiles());
        System.out.println("  Entities:               " + metadata.totalEntities());
        System.out.println("  Workflows:              " + metadata.totalWorkflows());
        System.out.println("  Domain-related files:   " + metadata.domainRelatedFiles());
        System.out.println("  High-quality entities:  " + metadata.highQualityEntities());
    }

    static void printResult(int rank, QueryResult result) {
        System.out.printf(Locale.ROOT, "%d. %s (%s) relevance %.2f [%s]%n",
            rank, result.entityName(), result.filePath(), result.relevanceScore(), result.contextScore());
        if (result.shortContext() != null) {
            System.out.println("   " + result.shortContext());
        }
        if (!result.domainTags().isEmpty()) {
            System.out.println("   Tags: " + String.join(", ", result.domainTags()));
        }
        result.reasoning().forEach(reason -> System.out.println("   - " + reason));
    }

    static void printWorkflow(WorkflowHint workflow) {
        System.out.printf(Locale.ROOT, "• %s (confidence %.2f, process %s)%n",
            workflow.name(), workflow.confidence(), workflow.businessProcess());
        for (WorkflowStep step : workflow.steps()) {
            System.out.printf("    %-10s %s (%s)%n", step.role().value(), step.entityName(), step.filePath());
        }
        System.out.println();
    }
}

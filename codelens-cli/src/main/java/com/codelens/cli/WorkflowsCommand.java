package com.codelens.cli;

import com.codelens.core.index.SemanticIndex;
import com.codelens.core.index.SemanticIndexStore;
import com.codelens.core.query.SemanticQueryEngine;
import com.codelens.core.workflow.WorkflowHint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the workflows of a saved semantic index.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # All workflows
 * codelens workflows erpnext_semantic_index.json
 *
 * # Workflows mentioning payments
 * codelens workflows erpnext_semantic_index.json payment
 * }</pre>
 */
@Command(
    name = "workflows",
    description = "List workflows detected in a semantic index",
    mixinStandardHelpOptions = true
)
public class WorkflowsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WorkflowsCommand.class);

    @Parameters(index = "0", description = "Semantic index file")
    private Path indexFile;

    @Parameters(index = "1..*", arity = "0..*", description = "Optional filter words")
    private List<String> words;

    @Override
    public Integer call() {
        try {
            SemanticIndex index = new SemanticIndexStore().load(indexFile);
            List<WorkflowHint> workflows = words == null || words.isEmpty()
                ? index.workflows()
                : new SemanticQueryEngine(index).workflowsFor(String.join(" ", words));

            System.out.println("Workflows: " + workflows.size());
            System.out.println();
            workflows.forEach(Summaries::printWorkflow);
            return 0;
        } catch (Exception e) {
            log.error("Listing workflows failed", e);
            System.err.println("✗ Listing workflows failed: " + e.getMessage());
            return 1;
        }
    }
}

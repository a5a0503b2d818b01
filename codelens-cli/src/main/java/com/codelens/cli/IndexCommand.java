package com.codelens.cli;

import com.codelens.core.analysis.ProjectAnalyzer;
import com.codelens.core.config.CodeLensConfig;
import com.codelens.core.config.ConfigLoader;
import com.codelens.core.domain.DomainTagger;
import com.codelens.core.domain.DomainVocabulary;
import com.codelens.core.index.SemanticIndex;
import com.codelens.core.index.SemanticIndexStore;
import com.codelens.core.index.SemanticIndexer;
import com.codelens.core.model.ProjectAnalysis;
import com.codelens.core.scoring.ContextScorer;
import com.codelens.core.workflow.WorkflowDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to build the semantic index of a project and save it as JSON.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codelens index /path/to/erpnext
 * codelens index /path/to/erpnext -o index.json
 * }</pre>
 */
@Command(
    name = "index",
    description = "Analyze a Python project and save its semantic index",
    mixinStandardHelpOptions = true
)
public class IndexCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(IndexCommand.class);

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: codelens.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Index file (default: <output directory>/<project>_semantic_index.json)"
    )
    private Path outputFile;

    @Override
    public Integer call() {
        try {
            CodeLensConfig config = ConfigLoader.load(configPath);
            ProjectAnalysis analysis = new ProjectAnalyzer(config).analyze(projectPath);
            Summaries.printAnalysis(analysis);

            DomainTagger tagger = new DomainTagger(DomainVocabulary.from(config.domain()));
            SemanticIndexer indexer = new SemanticIndexer(tagger, new ContextScorer(), new WorkflowDetector());
            SemanticIndex index = indexer.build(analysis);

            Path target = outputFile != null
                ? outputFile
                : Paths.get(config.output().directory(), analysis.projectName() + "_semantic_index.json");
            new SemanticIndexStore().save(index, target);

            Summaries.printIndex(index);
            System.out.println("✓ Semantic index saved to: " + target.toAbsolutePath());
            return 0;
        } catch (Exception e) {
            log.error("Indexing failed", e);
            System.err.println("✗ Indexing failed: " + e.getMessage());
            return 1;
        }
    }
}

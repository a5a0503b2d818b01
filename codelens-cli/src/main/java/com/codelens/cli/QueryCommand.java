package com.codelens.cli;

import com.codelens.core.config.CodeLensConfig;
import com.codelens.core.config.ConfigLoader;
import com.codelens.core.index.SemanticIndex;
import com.codelens.core.index.SemanticIndexStore;
import com.codelens.core.query.QueryResult;
import com.codelens.core.query.SemanticQueryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to rank the entities of a saved semantic index against a query.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codelens query erpnext_semantic_index.json "ledger posting"
 * codelens query erpnext_semantic_index.json "tax" --files -n 5
 * }</pre>
 */
@Command(
    name = "query",
    description = "Query a semantic index",
    mixinStandardHelpOptions = true
)
public class QueryCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(QueryCommand.class);

    @Parameters(index = "0", description = "Semantic index file")
    private Path indexFile;

    @Parameters(index = "1..*", arity = "1..*", description = "Query words")
    private List<String> words;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: codelens.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-n", "--max-results"}, description = "Maximum number of results (overrides config)")
    private Integer maxResults;

    @Option(names = {"--files"}, description = "Rank files instead of entities")
    private boolean files;

    @Override
    public Integer call() {
        try {
            CodeLensConfig config = ConfigLoader.load(configPath);
            int limit = maxResults != null ? maxResults : config.query().maxResults();
            String query = String.join(" ", words);

            SemanticIndex index = new SemanticIndexStore().load(indexFile);
            SemanticQueryEngine engine = new SemanticQueryEngine(index);
            List<QueryResult> results = files ? engine.queryFiles(query, limit) : engine.query(query, limit);

            System.out.println("Query: " + query);
            System.out.println();
            if (results.isEmpty()) {
                System.out.println("  No results.");
            }
            for (int i = 0; i < results.size(); i++) {
                Summaries.printResult(i + 1, results.get(i));
            }
            return 0;
        } catch (Exception e) {
            log.error("Query failed", e);
            System.err.println("✗ Query failed: " + e.getMessage());
            return 1;
        }
    }
}

package com.codelens.core.query;

import com.codelens.core.domain.DomainContext;
import com.codelens.core.index.SemanticEntity;
import com.codelens.core.index.SemanticFile;
import com.codelens.core.index.SemanticIndex;
import com.codelens.core.scoring.QualityTier;
import com.codelens.core.workflow.WorkflowHint;
import com.codelens.core.workflow.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ranks the entries of a {@link SemanticIndex} against a free-text query.
 *
 * <p>Relevance is the fraction of query tokens found among an entry's search terms, plus
 * 0.3 when a query token occurs inside the raw name, 0.2 for domain-related entries, 0.3 when
 * a query token occurs inside the primary tag, and a tier bonus (HIGH 0.1, MEDIUM 0.05,
 * LOW 0.02), capped at 1.0. Entries sharing no term with the query are never returned.
 * Ties are broken by name, then by file path.
 */
public class SemanticQueryEngine {

    private static final Logger log = LoggerFactory.getLogger(SemanticQueryEngine.class);

    private static final Comparator<QueryResult> RANKING = Comparator
        .comparingDouble(QueryResult::relevanceScore).reversed()
        .thenComparing(QueryResult::entityName)
        .thenComparing(QueryResult::filePath);

    private final SemanticIndex index;
    private final Map<String, Set<String>> entityTerms = new HashMap<>();
    private final Map<String, Set<String>> fileTerms = new HashMap<>();

    public SemanticQueryEngine(SemanticIndex index) {
        this.index = index;
        index.entities().forEach((key, entity) ->
            entityTerms.put(key, SearchTerms.indexTerms(entity.name(), entity.domainContext())));
        index.files().forEach((path, file) ->
            fileTerms.put(path, SearchTerms.indexTerms(fileName(path), file.domainContext())));
    }

    /**
     * Ranks entities against the query.
     *
     * @param query free-text query
     * @param maxResults maximum number of results
     * @return results by descending relevance
     */
    public List<QueryResult> query(String query, int maxResults) {
        log.info("Executing semantic query: '{}'", query);
        Set<String> queryTokens = SearchTerms.queryTokens(query);
        log.debug("Query terms: {}", queryTokens);

        List<QueryResult> results = new ArrayList<>();
        if (!queryTokens.isEmpty()) {
            index.entities().forEach((key, entity) -> {
                Set<String> matched = matchedTerms(entityTerms.get(key), queryTokens);
                if (!matched.isEmpty()) {
                    results.add(result(entity.name(), entity.filePath(), entity.domainContext(),
                        entity.contextScore().tier(), matched, queryTokens));
                }
            });
        }
        List<QueryResult> ranked = rank(results, maxResults);
        log.info("Query returned {} results", ranked.size());
        return ranked;
    }

    /**
     * Ranks files against the query with the same formula as {@link #query(String, int)}.
     *
     * @param query free-text query
     * @param maxResults maximum number of results
     * @return file results by descending relevance; the entity name is the file name
     */
    public List<QueryResult> queryFiles(String query, int maxResults) {
        Set<String> queryTokens = SearchTerms.queryTokens(query);
        List<QueryResult> results = new ArrayList<>();
        if (!queryTokens.isEmpty()) {
            index.files().forEach((path, file) -> {
                Set<String> matched = matchedTerms(fileTerms.get(path), queryTokens);
                if (!matched.isEmpty()) {
                    results.add(result(fileName(path), file.filePath(), file.domainContext(),
                        file.contextScore().tier(), matched, queryTokens));
                }
            });
        }
        return rank(results, maxResults);
    }

    /**
     * Returns the workflows whose business process, name or step tags mention a query token,
     * most confident first.
     *
     * @param query free-text query
     * @return matching workflows
     */
    public List<WorkflowHint> workflowsFor(String query) {
        Set<String> queryTokens = SearchTerms.queryTokens(query);
        List<WorkflowHint> matches = new ArrayList<>();
        for (WorkflowHint workflow : index.workflows()) {
            if (mentionsAny(workflow, queryTokens)) {
                matches.add(workflow);
            }
        }
        matches.sort(Comparator.comparingDouble(WorkflowHint::confidence).reversed());
        return matches;
    }

    /**
     * Computes the relevance of an entry whose search terms share {@code matched} with the query.
     *
     * @param name raw entry name
     * @param context domain context of the entry
     * @param tier quality tier of the entry
     * @param matched query tokens present in the entry's search terms
     * @param queryTokens all query tokens
     * @return relevance in [0, 1]
     */
    static double relevance(String name, DomainContext context, QualityTier tier,
                            Set<String> matched, Set<String> queryTokens) {
        if (matched.isEmpty()) {
            return 0.0;
        }
        double relevance = (double) matched.size() / queryTokens.size();

        String lowerName = name.toLowerCase(Locale.ROOT);
        if (queryTokens.stream().anyMatch(lowerName::contains)) {
            relevance += 0.3;
        }
        if (context.domainRelated()) {
            relevance += 0.2;
        }
        String primaryTag = context.primaryTag() == null ? null : context.primaryTag().toLowerCase(Locale.ROOT);
        if (primaryTag != null && queryTokens.stream().anyMatch(primaryTag::contains)) {
            relevance += 0.3;
        }
        relevance += tierBonus(tier);
        return Math.min(relevance, 1.0);
    }

    private static double tierBonus(QualityTier tier) {
        if (tier == null) {
            return 0.0;
        }
        return switch (tier) {
            case HIGH -> 0.1;
            case MEDIUM -> 0.05;
            case LOW -> 0.02;
        };
    }

    private static QueryResult result(String name, String filePath, DomainContext context, QualityTier tier,
                                      Set<String> matched, Set<String> queryTokens) {
        List<String> reasoning = new ArrayList<>();
        reasoning.add("Matches query terms: " + String.join(", ", new TreeSet<>(matched)));
        if (context.domainRelated()) {
            reasoning.add("Identified as accounting-related code");
        }
        if (tier == QualityTier.HIGH) {
            reasoning.add("High-quality, well-documented code");
        }
        String shortContext = context.primaryTag() == null ? null : "Primary domain: " + context.primaryTag();
        return new QueryResult(name, filePath, relevance(name, context, tier, matched, queryTokens),
            context.tagLabels(), tier, shortContext, reasoning);
    }

    private static List<QueryResult> rank(List<QueryResult> results, int maxResults) {
        return results.stream()
            .sorted(RANKING)
            .limit(Math.max(maxResults, 0))
            .toList();
    }

    private static Set<String> matchedTerms(Set<String> terms, Set<String> queryTokens) {
        Set<String> matched = new TreeSet<>(queryTokens);
        matched.retainAll(terms == null ? Set.of() : terms);
        return matched;
    }

    private static boolean mentionsAny(WorkflowHint workflow, Set<String> queryTokens) {
        String name = workflow.name().toLowerCase(Locale.ROOT);
        String process = workflow.businessProcess() == null ? "" : workflow.businessProcess().toLowerCase(Locale.ROOT);
        for (String token : queryTokens) {
            if (name.contains(token) || process.contains(token)) {
                return true;
            }
            for (WorkflowStep step : workflow.steps()) {
                if (step.domainTags().stream().anyMatch(tag -> tag.toLowerCase(Locale.ROOT).contains(token))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }
}

package com.codelens.core.scoring;

import com.codelens.core.analysis.CrossFileResolver;
import com.codelens.core.model.CodeEntity;
import com.codelens.core.model.EntityKind;
import com.codelens.core.model.FileAnalysis;
import com.codelens.core.model.ProjectAnalysis;
import com.codelens.core.model.Relationship;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores files and entities on four heuristics and reduces them to a {@link QualityTier}.
 *
 * <p>File weights: domain relevance 0.4, relationship density 0.3, docstring quality 0.2,
 * test coverage 0.1. Entity weights: 0.3, 0.3, 0.3, 0.1. Keyword checks here are plain
 * substring tests on lower-cased text, so {@code accounts_payable.py} counts for
 * {@code account}.
 */
public class ContextScorer {

    private static final List<String> FILE_KEYWORDS = List.of(
        "account", "ledger", "journal", "invoice", "payment", "tax",
        "balance", "posting", "transaction", "finance", "erp");

    private static final List<String> ENTITY_KEYWORDS = List.of(
        "account", "ledger", "journal", "invoice", "payment", "tax",
        "balance", "posting", "transaction", "debit", "credit", "gl");

    private static final List<String> BUSINESS_VERBS = List.of("create", "post", "validate", "calculate", "process");

    private static final List<String> SECTION_MARKERS = List.of("Args:", "Returns:", "Raises:");

    private static final List<String> DESCRIPTIVE_WORDS = List.of(
        "function", "class", "method", "calculate", "create", "validate");

    private static final String TEST_MARKER = "test";

    public ContextScore scoreFile(FileAnalysis file, ProjectAnalysis project) {
        List<String> reasoning = new ArrayList<>();

        double domainRelevance = fileDomainRelevance(file);
        reasoning.add(bucket(domainRelevance, 0.7, 0.3,
            "High domain relevance - appears to be core accounting logic",
            "Medium domain relevance - contains some accounting concepts",
            "Low domain relevance - utility or generic code"));

        double density = fileRelationshipDensity(file, project);
        reasoning.add(bucket(density, 0.7, 0.3,
            "High connectivity - central to the codebase",
            "Medium connectivity - moderately connected",
            "Low connectivity - peripheral code"));

        double docstrings = fileDocstringQuality(file);
        reasoning.add(bucket(docstrings, 0.7, 0.3,
            "Well documented - good docstring coverage",
            "Partially documented - some docstrings present",
            "Poorly documented - missing docstrings"));

        double tests = fileTestCoverage(file);
        reasoning.add(tests > 0.5
            ? "Likely well tested - test file or test-related"
            : "Test coverage unclear - not identified as test code");

        double combined = domainRelevance * 0.4 + density * 0.3 + docstrings * 0.2 + tests * 0.1;
        return new ContextScore(QualityTier.forScore(combined), domainRelevance, density, docstrings, tests, reasoning);
    }

    public ContextScore scoreEntity(CodeEntity entity, FileAnalysis file, ProjectAnalysis project) {
        List<String> reasoning = new ArrayList<>();

        double domainRelevance = entityDomainRelevance(entity);
        reasoning.add(bucket(domainRelevance, 0.7, 0.3,
            "High domain relevance - core accounting function/class",
            "Medium domain relevance - accounting-related",
            "Low domain relevance - utility function"));

        double density = entityRelationshipDensity(entity, file, project);
        reasoning.add(bucket(density, 0.7, 0.3,
            "Highly connected - called by many other functions",
            "Moderately connected - has some dependencies",
            "Low connectivity - rarely used"));

        double docstrings = entityDocstringQuality(entity);
        reasoning.add(bucket(docstrings, 0.8, 0.4,
            "Well documented - comprehensive docstring",
            "Partially documented - basic docstring",
            "Undocumented - missing or poor docstring"));

        double tests = 0.0;
        reasoning.add("Test coverage assessment requires test file analysis");

        double combined = domainRelevance * 0.3 + density * 0.3 + docstrings * 0.3 + tests * 0.1;
        return new ContextScore(QualityTier.forScore(combined), domainRelevance, density, docstrings, tests, reasoning);
    }

    double fileDomainRelevance(FileAnalysis file) {
        String fileName = file.fileName().toLowerCase(Locale.ROOT);
        long keywordMatches = FILE_KEYWORDS.stream().filter(fileName::contains).count();
        double base = Math.min(keywordMatches * 0.2, 0.6);
        double entityBoost = Math.min(file.entities().size() * 0.02, 0.3);
        double relationshipBoost = Math.min(file.relationships().size() * 0.01, 0.1);
        return Math.min(base + entityBoost + relationshipBoost, 1.0);
    }

    double fileRelationshipDensity(FileAnalysis file, ProjectAnalysis project) {
        if (file.entities().isEmpty()) {
            return 0.0;
        }
        long crossFile = project.crossFileRelationships().stream()
            .filter(relationship -> file.filePath().equals(relationship.fileMetadata(Relationship.SOURCE_FILE))
                || file.filePath().equals(relationship.fileMetadata(Relationship.TARGET_FILE)))
            .count();
        double total = crossFile + file.relationships().size();
        return Math.min(total / file.entities().size() * 0.1, 1.0);
    }

    double fileDocstringQuality(FileAnalysis file) {
        if (file.entities().isEmpty()) {
            return 0.0;
        }
        int count = file.entities().size();
        long documented = file.entities().stream().filter(entity -> hasText(entity.docstring())).count();
        long totalLength = file.entities().stream()
            .map(CodeEntity::docstring)
            .mapToLong(docstring -> docstring == null ? 0 : docstring.length())
            .sum();
        double coverage = (double) documented / count;
        double lengthScore = Math.min((double) totalLength / count * 0.001, 0.5);
        return Math.min(coverage * 0.5 + lengthScore, 1.0);
    }

    double fileTestCoverage(FileAnalysis file) {
        for (String segment : file.filePath().split("/")) {
            if (segment.toLowerCase(Locale.ROOT).contains(TEST_MARKER)) {
                return 0.8;
            }
        }
        boolean hasTestFunctions = file.entities().stream()
            .anyMatch(entity -> entity.kind() == EntityKind.FUNCTION
                && entity.name().toLowerCase(Locale.ROOT).startsWith(TEST_MARKER));
        return hasTestFunctions ? 0.6 : 0.0;
    }

    double entityDomainRelevance(CodeEntity entity) {
        String name = entity.name().toLowerCase(Locale.ROOT);
        String docstring = entity.docstring() == null ? "" : entity.docstring().toLowerCase(Locale.ROOT);

        long nameMatches = ENTITY_KEYWORDS.stream().filter(name::contains).count();
        long docMatches = ENTITY_KEYWORDS.stream().filter(docstring::contains).count();
        double score = Math.min(nameMatches * 0.3 + docMatches * 0.2, 1.0);

        if (BUSINESS_VERBS.stream().anyMatch(name::contains)) {
            score = Math.min(score + 0.2, 1.0);
        }
        return score;
    }

    double entityRelationshipDensity(CodeEntity entity, FileAnalysis file, ProjectAnalysis project) {
        String name = entity.name();
        long local = file.relationships().stream()
            .filter(relationship -> relationship.source().equals(name) || relationship.target().equals(name))
            .count();
        String qualified = CrossFileResolver.qualified(file.filePath(), name);
        long crossFile = project.crossFileRelationships().stream()
            .filter(relationship -> relationship.source().equals(qualified) || relationship.target().equals(qualified))
            .count();
        return Math.min((local + crossFile) * 0.2, 1.0);
    }

    double entityDocstringQuality(CodeEntity entity) {
        if (!hasText(entity.docstring())) {
            return 0.0;
        }
        String docstring = entity.docstring().strip();

        double lengthScore = Math.min(docstring.length() * 0.002, 0.6);
        double contentScore = 0.0;
        if (docstring.split("\\s+").length > 5) {
            contentScore += 0.2;
        }
        if (SECTION_MARKERS.stream().anyMatch(docstring::contains)) {
            contentScore += 0.2;
        }
        String lower = docstring.toLowerCase(Locale.ROOT);
        if (DESCRIPTIVE_WORDS.stream().anyMatch(lower::contains)) {
            contentScore += 0.2;
        }
        return Math.min(lengthScore + contentScore, 1.0);
    }

    private static String bucket(double value, double high, double medium,
                                 String highReason, String mediumReason, String lowReason) {
        if (value > high) {
            return highReason;
        }
        return value > medium ? mediumReason : lowReason;
    }

    private static boolean hasText(String text) {
        return text != null && !text.isEmpty();
    }
}

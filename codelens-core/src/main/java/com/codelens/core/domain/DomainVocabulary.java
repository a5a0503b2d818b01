package com.codelens.core.domain;

import com.codelens.core.config.CodeLensConfig.DomainSettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Concept keywords and path patterns that define a business domain.
 *
 * <p>Keywords match case-insensitively on word boundaries. Underscores, punctuation and
 * camelCase transitions all count as boundaries, so the keyword {@code tax} matches
 * {@code calculate_tax_amount}, {@code calculateTaxAmount} and {@code tax_utils.py}, while
 * {@code general_ledger} matches {@code GeneralLedger}.
 *
 * <p>Concept order is preserved: it decides the order of tags with equal confidence.
 */
public final class DomainVocabulary {

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[\\p{Ll}\\p{N}])(?=\\p{Lu})|(?<=\\p{Lu})(?=\\p{Lu}\\p{Ll})");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Map<String, List<String>> ACCOUNTING_CONCEPTS = accountingConcepts();

    private static final List<String> ACCOUNTING_PATH_PATTERNS = List.of(
        "accounts", "accounting", "finance", "ledger", "journal", "erpnext.*accounts");

    private final Map<String, List<Keyword>> concepts;
    private final Map<String, Pattern> pathPatterns;

    private DomainVocabulary(Map<String, List<String>> concepts, List<String> pathPatterns) {
        Map<String, List<Keyword>> compiled = new LinkedHashMap<>();
        concepts.forEach((concept, keywords) ->
            compiled.put(concept, keywords.stream().map(Keyword::new).toList()));
        this.concepts = Collections.unmodifiableMap(compiled);

        Map<String, Pattern> paths = new LinkedHashMap<>();
        for (String pattern : pathPatterns) {
            paths.put(".*" + pattern + ".*", Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
        }
        this.pathPatterns = Collections.unmodifiableMap(paths);
    }

    /**
     * Returns the built-in accounting vocabulary.
     *
     * @return accounting vocabulary
     */
    public static DomainVocabulary accounting() {
        return new DomainVocabulary(ACCOUNTING_CONCEPTS, ACCOUNTING_PATH_PATTERNS);
    }

    /**
     * Builds a vocabulary from configuration; absent values keep the accounting defaults.
     *
     * @param settings domain settings, may be null
     * @return vocabulary
     */
    public static DomainVocabulary from(DomainSettings settings) {
        if (settings == null) {
            return accounting();
        }
        Map<String, List<String>> concepts = settings.concepts() == null || settings.concepts().isEmpty()
            ? ACCOUNTING_CONCEPTS
            : settings.concepts();
        List<String> paths = settings.pathPatterns() == null ? ACCOUNTING_PATH_PATTERNS : settings.pathPatterns();
        return new DomainVocabulary(concepts, paths);
    }

    public Set<String> concepts() {
        return concepts.keySet();
    }

    /**
     * Finds the keywords of every concept that occur in {@code text}.
     *
     * @param text text to search
     * @return concept to matched keywords, in concept order; concepts without matches are absent
     */
    public Map<String, List<String>> match(String text) {
        Map<String, List<String>> matches = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return matches;
        }
        String normalized = normalize(text);
        concepts.forEach((concept, keywords) -> {
            List<String> found = new ArrayList<>();
            for (Keyword keyword : keywords) {
                if (keyword.pattern().matcher(normalized).find()) {
                    found.add(keyword.text());
                }
            }
            if (!found.isEmpty()) {
                matches.put(concept, found);
            }
        });
        return matches;
    }

    /**
     * Returns the display form ({@code .*pattern.*}) of every path pattern found in {@code path}.
     *
     * @param path file path
     * @return matching patterns in declaration order
     */
    public List<String> matchPath(String path) {
        List<String> matched = new ArrayList<>();
        pathPatterns.forEach((display, pattern) -> {
            if (pattern.matcher(path).find()) {
                matched.add(display);
            }
        });
        return matched;
    }

    /**
     * Lower-cases text and turns every word boundary into a single space.
     */
    static String normalize(String text) {
        String split = CAMEL_BOUNDARY.matcher(text).replaceAll(" ");
        return NON_WORD.matcher(split.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private record Keyword(String text, Pattern pattern) {
        Keyword(String text) {
            this(text, Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(normalize(text)) + "(?![\\p{L}\\p{N}])"));
        }
    }

    private static Map<String, List<String>> accountingConcepts() {
        Map<String, List<String>> concepts = new LinkedHashMap<>();
        concepts.put("ledger", List.of(
            "ledger", "posting", "entry", "debit", "credit", "balance", "general_ledger", "gl_entry", "ledger_entry"));
        concepts.put("journal_entry", List.of(
            "journal", "jv", "journal_entry", "journal_voucher", "accounting_entry", "entry"));
        concepts.put("trial_balance", List.of("trial_balance", "trial", "balance_sheet", "balances"));
        concepts.put("profit_and_loss", List.of("profit_loss", "pnl", "income_statement", "profit", "loss"));
        concepts.put("reconciliation", List.of("reconcile", "reconciliation", "matching", "clearance"));
        concepts.put("tax", List.of("tax", "gst", "vat", "taxation", "tax_entry"));
        concepts.put("invoice", List.of("invoice", "billing", "bill", "sales_invoice", "purchase_invoice"));
        concepts.put("payment", List.of("payment", "pay", "settlement", "payment_entry"));
        concepts.put("deferred_revenue", List.of("deferred", "revenue", "accrual", "deferred_revenue"));
        concepts.put("reports", List.of("report", "reporting", "financial_report", "statement"));
        return Collections.unmodifiableMap(concepts);
    }
}

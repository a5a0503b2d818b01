package com.codelens.core.query;

import com.codelens.core.domain.DomainContext;
import com.codelens.core.domain.DomainTag;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tokenization shared by indexed names and queries. Tokens of two characters or fewer are
 * dropped on both sides.
 */
final class SearchTerms {

    private static final int MIN_TOKEN_LENGTH = 3;

    private static final Pattern CASE_TRANSITION = Pattern.compile("(?<=[\\p{Ll}\\p{N}])(?=\\p{Lu})|(?<=\\p{Lu})(?=\\p{Lu}\\p{Ll})");
    private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_]");

    private SearchTerms() {
    }

    /**
     * Splits a name on separators and case transitions: {@code postGLEntry.py} yields
     * {@code post} and {@code entry}.
     *
     * @param name entity or file name; a file extension is removed first
     * @return lower-case tokens
     */
    static Set<String> nameTokens(String name) {
        String stem = stripExtension(name);
        Set<String> tokens = new LinkedHashSet<>();
        for (String part : SEPARATORS.split(CASE_TRANSITION.matcher(stem).replaceAll(" "))) {
            addToken(tokens, part);
        }
        return tokens;
    }

    /**
     * Splits a query on whitespace after removing punctuation from each word.
     *
     * @param query free-text query
     * @return lower-case tokens in query order
     */
    static Set<String> queryTokens(String query) {
        Set<String> tokens = new LinkedHashSet<>();
        if (query == null) {
            return tokens;
        }
        for (String word : WHITESPACE.split(query.toLowerCase(Locale.ROOT).strip())) {
            addToken(tokens, NON_WORD.matcher(word).replaceAll(""));
        }
        return tokens;
    }

    /**
     * Returns the name tokens of {@code name} together with the tag labels of {@code context}.
     */
    static Set<String> indexTerms(String name, DomainContext context) {
        Set<String> terms = nameTokens(name);
        for (DomainTag tag : context.tags()) {
            terms.add(tag.tag().toLowerCase(Locale.ROOT));
        }
        if (context.primaryTag() != null) {
            terms.add(context.primaryTag().toLowerCase(Locale.ROOT));
        }
        return terms;
    }

    private static void addToken(Set<String> tokens, String token) {
        String normalized = token.toLowerCase(Locale.ROOT).strip();
        if (normalized.length() >= MIN_TOKEN_LENGTH) {
            tokens.add(normalized);
        }
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}

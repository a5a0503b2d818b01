package com.codelens.core.domain;

import com.codelens.core.model.CodeEntity;
import com.codelens.core.model.FileAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule-based classifier that tags files and entities with domain concepts.
 *
 * <p>Every text source (a file name, an entity name, a docstring) contributes
 * {@code min(0.2 * matched keywords, 0.8)} to each concept it mentions. Contributions are
 * summed per concept and capped at 1.0. For files, a matching path pattern adds 0.3 to every
 * concept found and marks the file as domain-related even when no keyword matched. Concepts
 * below 0.1 are dropped; the remaining tags are sorted by descending confidence and the first
 * one becomes the primary tag.
 */
public class DomainTagger {

    private static final Logger log = LoggerFactory.getLogger(DomainTagger.class);

    static final double KEYWORD_WEIGHT = 0.2;
    static final double MAX_TEXT_CONFIDENCE = 0.8;
    static final double PATH_BOOST = 0.3;
    static final double MIN_CONFIDENCE = 0.1;
    private static final int LISTED_KEYWORDS = 3;

    private final DomainVocabulary vocabulary;

    public DomainTagger() {
        this(DomainVocabulary.accounting());
    }

    public DomainTagger(DomainVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * Tags a file from its name, its path and the names and docstrings of its entities.
     *
     * @param analysis file analysis
     * @return domain context of the file
     */
    public DomainContext tagFile(FileAnalysis analysis) {
        List<String> pathReasons = vocabulary.matchPath(analysis.filePath()).stream()
            .map(pattern -> "File path matches accounting pattern: " + pattern)
            .toList();

        List<DomainTag> found = new ArrayList<>(tagText(analysis.fileName(), "file name"));
        for (CodeEntity entity : analysis.entities()) {
            found.addAll(tagText(entity.name(), "name of " + entity.name()));
        }
        for (CodeEntity entity : analysis.entities()) {
            if (entity.docstring() != null) {
                found.addAll(tagText(entity.docstring(), "docstring of " + entity.name()));
            }
        }

        DomainContext context = aggregate(found, pathReasons);
        log.debug("Tagged {}: {} tags, primary: {}", analysis.fileName(), context.tags().size(), context.primaryTag());
        return context;
    }

    /**
     * Tags an entity from its name and docstring.
     *
     * @param entity entity to tag
     * @return domain context of the entity
     */
    public DomainContext tagEntity(CodeEntity entity) {
        List<DomainTag> found = new ArrayList<>(tagText(entity.name(), "entity name"));
        if (entity.docstring() != null) {
            found.addAll(tagText(entity.docstring(), "docstring"));
        }
        return aggregate(found, List.of());
    }

    /**
     * Tags a single piece of text.
     *
     * @param text text to search
     * @param source description of the text used in the reasoning
     * @return one tag per concept mentioned in the text
     */
    public List<DomainTag> tagText(String text, String source) {
        List<DomainTag> tags = new ArrayList<>();
        vocabulary.match(text).forEach((concept, keywords) -> {
            double confidence = Math.min(keywords.size() * KEYWORD_WEIGHT, MAX_TEXT_CONFIDENCE);
            String reason = "Found " + keywords.size() + " keyword matches in " + source + ": "
                + String.join(", ", keywords.subList(0, Math.min(LISTED_KEYWORDS, keywords.size())));
            if (keywords.size() > LISTED_KEYWORDS) {
                reason += " (and " + (keywords.size() - LISTED_KEYWORDS) + " more)";
            }
            tags.add(new DomainTag(concept, confidence, List.of(reason)));
        });
        return tags;
    }

    private static DomainContext aggregate(List<DomainTag> found, List<String> pathReasons) {
        Map<String, Double> scores = new LinkedHashMap<>();
        Map<String, List<String>> reasons = new LinkedHashMap<>();
        for (DomainTag tag : found) {
            scores.merge(tag.tag(), tag.confidence(), Double::sum);
            reasons.computeIfAbsent(tag.tag(), key -> new ArrayList<>()).addAll(tag.reasoning());
        }
        if (!pathReasons.isEmpty()) {
            for (String concept : scores.keySet()) {
                scores.merge(concept, PATH_BOOST, Double::sum);
                reasons.get(concept).addAll(pathReasons);
            }
        }

        List<DomainTag> tags = new ArrayList<>();
        scores.forEach((concept, score) -> {
            double confidence = Math.min(score, 1.0);
            if (confidence >= MIN_CONFIDENCE) {
                tags.add(new DomainTag(concept, confidence, reasons.get(concept)));
            }
        });
        tags.sort(Comparator.comparingDouble(DomainTag::confidence).reversed());

        String primaryTag = tags.isEmpty() ? null : tags.get(0).tag();
        boolean domainRelated = !pathReasons.isEmpty() || primaryTag != null;
        return new DomainContext(tags, primaryTag, domainRelated);
    }
}

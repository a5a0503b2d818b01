package com.codelens.core.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Quality assessment of a file or entity.
 *
 * @param tier overall tier
 * @param domainRelevance how strongly the code relates to the domain, in [0, 1]
 * @param relationshipDensity how connected the code is, in [0, 1]
 * @param docstringQuality documentation quality, in [0, 1]
 * @param testCoverage test coverage heuristic, in [0, 1]
 * @param reasoning one line per sub-score
 */
public record ContextScore(
    @JsonProperty("overall_score") QualityTier tier,
    @JsonProperty("domain_relevance") double domainRelevance,
    @JsonProperty("relationship_density") double relationshipDensity,
    @JsonProperty("docstring_quality") double docstringQuality,
    @JsonProperty("test_coverage") double testCoverage,
    @JsonProperty("reasoning") List<String> reasoning
) {
    public ContextScore {
        Objects.requireNonNull(tier, "tier must not be null");
        reasoning = reasoning == null ? List.of() : List.copyOf(reasoning);
    }
}

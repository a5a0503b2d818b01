package com.codelens.core.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A concept label assigned to a file or entity.
 *
 * @param tag concept label, e.g. {@code ledger}
 * @param confidence confidence in [0, 1]
 * @param reasoning why the tag was applied
 */
public record DomainTag(
    @JsonProperty("tag") String tag,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("reasoning") List<String> reasoning
) {
    public DomainTag {
        Objects.requireNonNull(tag, "tag must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
        reasoning = reasoning == null ? List.of() : List.copyOf(reasoning);
    }
}

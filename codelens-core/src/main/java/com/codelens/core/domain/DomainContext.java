package com.codelens.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Domain classification of a file or entity.
 *
 * @param tags tags ordered by descending confidence
 * @param primaryTag label of the first tag, or null when untagged
 * @param domainRelated whether the file or entity belongs to the domain
 */
public record DomainContext(
    @JsonProperty("tags") List<DomainTag> tags,
    @JsonProperty("primary_tag") String primaryTag,
    @JsonProperty("is_accounting_related") boolean domainRelated
) {
    public DomainContext {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static DomainContext empty() {
        return new DomainContext(List.of(), null, false);
    }

    /**
     * Returns the confidence of the highest-ranked tag, or 0 when there are no tags.
     *
     * @return top confidence
     */
    @JsonIgnore
    public double topConfidence() {
        return tags.isEmpty() ? 0.0 : tags.get(0).confidence();
    }

    @JsonIgnore
    public List<String> tagLabels() {
        return tags.stream().map(DomainTag::tag).toList();
    }
}

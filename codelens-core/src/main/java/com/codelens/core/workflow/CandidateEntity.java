package com.codelens.core.workflow;

import com.codelens.core.domain.DomainContext;

/**
 * A tagged entity that may start or end a workflow.
 *
 * @param filePath file defining the entity
 * @param context domain context of the entity
 */
public record CandidateEntity(String filePath, DomainContext context) {
}

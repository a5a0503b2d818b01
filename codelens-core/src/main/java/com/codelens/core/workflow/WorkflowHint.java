package com.codelens.core.workflow;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A business process inferred from a call path between tagged entities.
 *
 * @param name pattern name followed by the step names, e.g. {@code journal_to_ledger: a -> b}
 * @param steps steps in call order
 * @param confidence mean top-tag confidence of the steps
 * @param reasoning how the workflow was found
 * @param businessProcess business process label, e.g. {@code ledger_posting}
 */
public record WorkflowHint(
    @JsonProperty("name") String name,
    @JsonProperty("steps") List<WorkflowStep> steps,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("reasoning") List<String> reasoning,
    @JsonProperty("business_process") String businessProcess
) {
    public WorkflowHint {
        Objects.requireNonNull(name, "name must not be null");
        steps = steps == null ? List.of() : List.copyOf(steps);
        reasoning = reasoning == null ? List.of() : List.copyOf(reasoning);
    }
}

package com.codelens.core.workflow;

import java.util.List;
import java.util.Set;

/**
 * A concept-to-concept path worth reporting as a business process.
 *
 * @param name pattern name
 * @param startConcepts primary tags of possible first steps
 * @param endConcepts primary tags of possible last steps
 * @param intermediateConcepts concepts expected along the way; informational only
 * @param businessProcess business process label
 */
public record WorkflowPattern(
    String name,
    Set<String> startConcepts,
    Set<String> endConcepts,
    Set<String> intermediateConcepts,
    String businessProcess
) {
    public WorkflowPattern {
        startConcepts = Set.copyOf(startConcepts);
        endConcepts = Set.copyOf(endConcepts);
        intermediateConcepts = intermediateConcepts == null ? Set.of() : Set.copyOf(intermediateConcepts);
    }

    /**
     * Returns the accounting patterns in detection order.
     *
     * @return accounting workflow patterns
     */
    public static List<WorkflowPattern> accounting() {
        return List.of(
            new WorkflowPattern("journal_to_ledger",
                Set.of("journal_entry"), Set.of("ledger", "general_ledger"),
                Set.of("posting", "entry"), "ledger_posting"),
            new WorkflowPattern("invoice_to_payment",
                Set.of("invoice"), Set.of("payment"),
                Set.of("reconciliation"), "payment_processing"),
            new WorkflowPattern("ledger_to_reports",
                Set.of("ledger", "general_ledger"), Set.of("reports", "trial_balance", "profit_and_loss"),
                Set.of("calculation", "aggregation"), "financial_reporting"),
            new WorkflowPattern("tax_calculation",
                Set.of("invoice", "payment"), Set.of("tax"),
                Set.of("calculation"), "tax_processing")
        );
    }
}

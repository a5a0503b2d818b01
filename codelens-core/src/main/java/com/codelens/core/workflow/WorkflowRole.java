package com.codelens.core.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Position of a step within a workflow.
 */
public enum WorkflowRole {
    INITIATOR,
    PROCESSOR,
    FINALIZER;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkflowRole fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    /**
     * Role of the node at {@code index} on a path of {@code length} nodes.
     *
     * @param index zero-based position
     * @param length number of nodes on the path
     * @return role
     */
    public static WorkflowRole at(int index, int length) {
        if (index == 0) {
            return INITIATOR;
        }
        return index == length - 1 ? FINALIZER : PROCESSOR;
    }
}

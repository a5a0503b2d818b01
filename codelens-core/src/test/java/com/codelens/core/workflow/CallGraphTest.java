package com.codelens.core.workflow;

import com.codelens.core.model.Location;
import com.codelens.core.model.Relationship;
import com.codelens.core.model.RelationshipKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CallGraph}.
 */
class CallGraphTest {

    @Test
    void of_onlyCallRelationships_becomeEdges() {
        CallGraph graph = CallGraph.of(List.of(
            calls("a", "b"),
            Relationship.of("A", "Base", RelationshipKind.INHERITS, Location.at("m.py", 1))));

        assertThat(graph.calleesOf("a")).containsExactly("b");
        assertThat(graph.calleesOf("A")).isEmpty();
        assertThat(graph.size()).isEqualTo(1);
    }

    @Test
    void shortestPath_prefersFewestHops() {
        CallGraph graph = CallGraph.of(List.of(
            calls("start", "long1"), calls("long1", "long2"), calls("long2", "end"),
            calls("start", "short"), calls("short", "end")));

        assertThat(graph.shortestPath("start", "end")).contains(List.of("start", "short", "end"));
    }

    @Test
    void shortestPath_equalLengths_followsFirstSeenCallee() {
        CallGraph graph = CallGraph.of(List.of(
            calls("start", "left"), calls("start", "right"),
            calls("right", "end"), calls("left", "end")));

        for (int i = 0; i < 5; i++) {
            assertThat(graph.shortestPath("start", "end")).contains(List.of("start", "left", "end"));
        }
    }

    @Test
    void shortestPath_cycle_terminatesWithoutPath() {
        CallGraph graph = CallGraph.of(List.of(calls("a", "b"), calls("b", "a")));

        assertThat(graph.shortestPath("a", "missing")).isEmpty();
    }

    @Test
    void shortestPath_startEqualsEnd_isSingleNode() {
        CallGraph graph = CallGraph.of(List.of());

        assertThat(graph.shortestPath("a", "a")).contains(List.of("a"));
    }

    private static Relationship calls(String source, String target) {
        return Relationship.of(source, target, RelationshipKind.CALLS, Location.at("m.py", 1));
    }
}

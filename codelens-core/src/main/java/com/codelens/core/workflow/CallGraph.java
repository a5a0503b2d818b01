package com.codelens.core.workflow;

import com.codelens.core.model.Relationship;
import com.codelens.core.model.RelationshipKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed caller to callee graph built from {@code CALLS} relationships.
 *
 * <p>Callees are kept in the order they were first seen, which makes path search repeatable.
 */
public final class CallGraph {

    private final Map<String, Set<String>> callees = new LinkedHashMap<>();

    private CallGraph() {
    }

    public static CallGraph of(List<Relationship> relationships) {
        CallGraph graph = new CallGraph();
        for (Relationship relationship : relationships) {
            if (relationship.kind() == RelationshipKind.CALLS) {
                graph.callees.computeIfAbsent(relationship.source(), key -> new LinkedHashSet<>())
                    .add(relationship.target());
            }
        }
        return graph;
    }

    public Set<String> calleesOf(String caller) {
        return Collections.unmodifiableSet(callees.getOrDefault(caller, Set.of()));
    }

    public int size() {
        return callees.size();
    }

    /**
     * Breadth-first search from {@code start} to {@code end}.
     *
     * @param start first node
     * @param end last node
     * @return a shortest path including both ends, or empty when {@code end} is unreachable
     */
    public Optional<List<String>> shortestPath(String start, String end) {
        Set<String> visited = new HashSet<>();
        Deque<List<String>> queue = new ArrayDeque<>();
        queue.add(List.of(start));

        while (!queue.isEmpty()) {
            List<String> path = queue.poll();
            String current = path.get(path.size() - 1);
            if (current.equals(end)) {
                return Optional.of(path);
            }
            if (!visited.add(current)) {
                continue;
            }
            for (String next : calleesOf(current)) {
                if (!visited.contains(next)) {
                    List<String> extended = new ArrayList<>(path);
                    extended.add(next);
                    queue.add(List.copyOf(extended));
                }
            }
        }
        return Optional.empty();
    }
}

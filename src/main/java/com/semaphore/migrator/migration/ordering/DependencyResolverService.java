package com.semaphore.migrator.migration.ordering;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orders tables so that every table comes after the tables it references.
 *
 * Uses Kahn's algorithm over the subgraph induced by the tables that have source data; the ready
 * set is kept in lexical order so the result is reproducible. References to tables outside that
 * set are considered satisfied. Self references never constrain the order.
 */
public class DependencyResolverService {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolverService.class);

    public MigrationPlan plan(Set<String> tables, DependencyGraph graph, Map<String, String> chronologicalTables) {
        List<String> ordered = order(tables, graph);

        SortedSet<String> selfReferencing = new TreeSet<>();
        for (String table : ordered) {
            if (graph.isSelfReferencing(table)) {
                selfReferencing.add(table);
                log.debug("Table {} references itself; rows will be resolved with a deferred pass", table);
            }
        }

        Map<String, String> chronological = new LinkedHashMap<>();
        if (chronologicalTables != null) {
            new TreeMap<>(chronologicalTables).forEach((table, field) -> {
                if (tables.contains(table)) {
                    chronological.put(table, field);
                }
            });
        }

        return MigrationPlan.builder()
                .orderedTables(List.copyOf(ordered))
                .selfReferencingTables(selfReferencing)
                .chronologicalFields(chronological)
                .build();
    }

    public List<String> order(Set<String> tables, DependencyGraph graph) {
        Map<String, Integer> inDegree = new TreeMap<>();
        Map<String, List<String>> dependents = new HashMap<>();

        for (String table : tables) {
            int count = 0;
            for (String dep : graph.dependenciesOf(table)) {
                if (tables.contains(dep)) {
                    count++;
                    dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(table);
                    log.debug("FK dependency: {} -> {}", table, dep);
                }
            }
            inDegree.put(table, count);
        }

        PriorityQueue<String> ready = new PriorityQueue<>();
        inDegree.forEach((table, degree) -> {
            if (degree == 0) {
                ready.add(table);
            }
        });

        List<String> sorted = new ArrayList<>(tables.size());
        while (!ready.isEmpty()) {
            String table = ready.poll();
            sorted.add(table);
            for (String dependent : dependents.getOrDefault(table, List.of())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (sorted.size() < tables.size()) {
            Set<String> unresolved = new TreeSet<>(tables);
            sorted.forEach(unresolved::remove);
            List<Set<String>> cycles = findCycles(unresolved, graph);
            log.error("Circular FK dependencies detected: {}", cycles);
            throw new CyclicDependencyException(cycles.isEmpty() ? List.of(unresolved) : cycles);
        }

        log.info("Processing order: {}", sorted);
        return sorted;
    }

    /**
     * Strongly connected components with more than one table (Tarjan), restricted to
     * {@code tables}. Tables that merely depend on a cycle are not reported.
     */
    private List<Set<String>> findCycles(Set<String> tables, DependencyGraph graph) {
        TarjanState state = new TarjanState();
        for (String table : tables) {
            if (!state.index.containsKey(table)) {
                strongConnect(table, tables, graph, state);
            }
        }
        return state.components;
    }

    private void strongConnect(String table, Set<String> tables, DependencyGraph graph, TarjanState state) {
        state.index.put(table, state.counter);
        state.lowLink.put(table, state.counter);
        state.counter++;
        state.stack.push(table);
        state.onStack.add(table);

        for (String dep : graph.dependenciesOf(table)) {
            if (!tables.contains(dep)) {
                continue;
            }
            if (!state.index.containsKey(dep)) {
                strongConnect(dep, tables, graph, state);
                state.lowLink.put(table, Math.min(state.lowLink.get(table), state.lowLink.get(dep)));
            } else if (state.onStack.contains(dep)) {
                state.lowLink.put(table, Math.min(state.lowLink.get(table), state.index.get(dep)));
            }
        }

        if (state.lowLink.get(table).equals(state.index.get(table))) {
            SortedSet<String> component = new TreeSet<>();
            String member;
            do {
                member = state.stack.pop();
                state.onStack.remove(member);
                component.add(member);
            } while (!member.equals(table));
            if (component.size() > 1) {
                state.components.add(component);
            }
        }
    }

    private static final class TarjanState {
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new TreeSet<>();
        private final List<Set<String>> components = new ArrayList<>();
        private int counter;
    }
}

package com.semaphore.migrator.migration.ordering;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Two or more distinct tables reference each other through foreign keys. Fatal: no insert
 * order exists, so nothing is emitted.
 */
public class CyclicDependencyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<Set<String>> cycles;

    public CyclicDependencyException(List<Set<String>> cycles) {
        super("Cyclic foreign key dependency between tables: " + cycles.stream()
                .map(c -> String.join(", ", c))
                .collect(Collectors.joining("; ", "{", "}")));
        this.cycles = List.copyOf(cycles);
    }

    public List<Set<String>> getCycles() {
        return cycles;
    }
}

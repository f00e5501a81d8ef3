package fr.lapetina.configgraph.domain.exception;

import fr.lapetina.configgraph.domain.model.ErrorType;

import java.util.List;

/**
 * Thrown when a section is re-entered while it is still being resolved.
 * The section path is the full cycle, ending with the re-entered section.
 */
public final class CyclicDependencyException extends ConfigGraphException {

    public CyclicDependencyException(List<String> cycle) {
        super(ErrorType.CYCLIC_DEPENDENCY, "Cyclic dependency on section '"
                + cycle.get(cycle.size() - 1) + "'", cycle, null);
    }

    public CyclicDependencyException(String message, List<String> cycle) {
        super(ErrorType.CYCLIC_DEPENDENCY, message, cycle, null);
    }

    /**
     * Returns the cycle, for example {@code [a, b, a]}.
     */
    public List<String> getCycle() {
        return getSectionPath();
    }
}

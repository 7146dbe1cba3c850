package info.isaksson.erland.onemodel.dae;

import info.isaksson.erland.onemodel.ir.DaeState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link EquationDependencyResolver}.
 *
 * <p>{@link #indexedStates()} are the ODE and algebraic states in declaration order; their
 * 1-based position is the row of the initial condition vector, the mass matrix and the
 * right-hand side. {@link #substitutions()} lists substitution states so that each one comes
 * after everything it depends on.</p>
 */
public final class EvaluationOrder {

    private final List<DaeState> indexedStates;
    private final List<DaeState> substitutions;
    private final Map<String, Integer> indices;

    EvaluationOrder(List<DaeState> indexedStates, List<DaeState> substitutions) {
        this.indexedStates = List.copyOf(indexedStates);
        this.substitutions = List.copyOf(substitutions);
        Map<String, Integer> idx = new LinkedHashMap<>();
        int i = 1;
        for (DaeState s : this.indexedStates) {
            idx.put(s.id, i++);
        }
        this.indices = Collections.unmodifiableMap(idx);
    }

    public List<DaeState> indexedStates() {
        return indexedStates;
    }

    public List<DaeState> substitutions() {
        return substitutions;
    }

    /** 1-based state vector index, or {@code -1} for states that are not indexed. */
    public int indexOf(String stateId) {
        Integer i = indices.get(stateId);
        return i == null ? -1 : i;
    }

    public int size() {
        return indexedStates.size();
    }
}

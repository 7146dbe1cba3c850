package info.isaksson.erland.onemodel.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Substitution variables whose dependencies can never be satisfied.
 *
 * <p>Covers both cyclic definitions and references to undefined symbols; the resolver cannot
 * tell the two apart once a scan makes no progress.</p>
 */
public class DependencyResolutionException extends OneModelException {

    private final Map<String, List<String>> unresolved;

    /**
     * @param unresolved variable id to the identifiers it still waits for, in declaration order
     */
    public DependencyResolutionException(Map<String, List<String>> unresolved) {
        super("CyclicOrMissingDependencyError",
                "Dependencies of substitution variables cannot be satisfied: " + describe(unresolved),
                ctx("variables", String.join(",", unresolved.keySet())));
        this.unresolved = Collections.unmodifiableMap(new LinkedHashMap<>(unresolved));
    }

    public Map<String, List<String>> getUnresolved() {
        return unresolved;
    }

    private static String describe(Map<String, List<String>> unresolved) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<String>> e : unresolved.entrySet()) {
            if (sb.length() > 0) sb.append("; ");
            sb.append(e.getKey()).append(" <- ").append(e.getValue());
        }
        return sb.toString();
    }
}

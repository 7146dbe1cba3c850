package info.isaksson.erland.onemodel.dae;

import info.isaksson.erland.onemodel.error.DependencyResolutionException;
import info.isaksson.erland.onemodel.ir.DaeParameter;
import info.isaksson.erland.onemodel.ir.DaeState;
import info.isaksson.erland.onemodel.ir.ModelAccessor;
import info.isaksson.erland.onemodel.ir.StateType;
import info.isaksson.erland.onemodel.math.MathLexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders substitution states so each is evaluated after its dependencies.
 *
 * <p>Parameters, ODE and algebraic states and the time variable are known up front. Every pass
 * resolves all remaining substitution states whose identifiers are known at the start of the
 * pass, in declaration order. A pass that resolves nothing while states remain fails; a cycle
 * and a reference to an undefined name are reported the same way.</p>
 */
public final class EquationDependencyResolver {

    /** Simulation time; always available to equations. */
    public static final String TIME = "t";

    private static final Logger log = LoggerFactory.getLogger(EquationDependencyResolver.class);

    private EquationDependencyResolver() {}

    public static EvaluationOrder resolve(ModelAccessor model) {
        if (model == null) throw new IllegalArgumentException("model must not be null");

        Set<String> known = new HashSet<>();
        known.add(TIME);
        for (DaeParameter p : model.getParameters()) {
            known.add(p.id);
        }

        List<DaeState> indexed = new ArrayList<>();
        List<DaeState> pending = new ArrayList<>();
        for (DaeState s : model.getStates()) {
            if (s.type.isIndexed()) {
                indexed.add(s);
                known.add(s.id);
            } else if (s.type == StateType.SUBSTITUTION) {
                pending.add(s);
            }
        }

        List<DaeState> ordered = new ArrayList<>();
        int pass = 0;
        while (!pending.isEmpty()) {
            pass++;
            List<DaeState> resolvedThisPass = new ArrayList<>();
            for (DaeState s : pending) {
                if (known.containsAll(MathLexer.identifierNames(s.equation))) {
                    resolvedThisPass.add(s);
                }
            }
            if (resolvedThisPass.isEmpty()) {
                throw new DependencyResolutionException(missing(pending, known));
            }
            for (DaeState s : resolvedThisPass) {
                known.add(s.id);
            }
            ordered.addAll(resolvedThisPass);
            pending.removeAll(resolvedThisPass);
            log.debug("dependency pass {}: resolved {}", pass, ids(resolvedThisPass));
        }

        return new EvaluationOrder(indexed, ordered);
    }

    private static Map<String, List<String>> missing(List<DaeState> pending, Set<String> known) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (DaeState s : pending) {
            List<String> unknown = new ArrayList<>();
            for (String id : MathLexer.identifierNames(s.equation)) {
                if (!known.contains(id)) unknown.add(id);
            }
            out.put(s.id, unknown);
        }
        return out;
    }

    private static List<String> ids(List<DaeState> states) {
        List<String> out = new ArrayList<>(states.size());
        for (DaeState s : states) out.add(s.id);
        return out;
    }
}

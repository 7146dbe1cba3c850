package info.isaksson.erland.onemodel.dae;

import info.isaksson.erland.onemodel.flatten.FlatEntry;
import info.isaksson.erland.onemodel.flatten.FlatModel;
import info.isaksson.erland.onemodel.flatten.FlatReaction;
import info.isaksson.erland.onemodel.flatten.FlatRule;
import info.isaksson.erland.onemodel.ir.DaeModel;
import info.isaksson.erland.onemodel.ir.DaeParameter;
import info.isaksson.erland.onemodel.ir.DaeState;
import info.isaksson.erland.onemodel.ir.StateType;
import info.isaksson.erland.onemodel.math.MathExpr;
import info.isaksson.erland.onemodel.math.MathTextRenderer;
import info.isaksson.erland.onemodel.model.ModelWarning;
import info.isaksson.erland.onemodel.model.ModelWarnings;
import info.isaksson.erland.onemodel.model.OmParameter;
import info.isaksson.erland.onemodel.model.OmSpecies;
import info.isaksson.erland.onemodel.model.RuleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts a flattened reaction network into a {@link DaeModel}.
 *
 * <p>Each species becomes a state in flatten order. Without a rule its equation is the sum of
 * the kinetic laws of the reactions it takes part in: {@code -(law)} per reactant occurrence and
 * {@code +(law)} per product occurrence, in reaction order; {@code 0} when it takes part in none.
 * An assignment rule makes the species a substitution state, an algebraic rule an algebraic
 * state.</p>
 */
public final class DaeModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(DaeModelBuilder.class);

    private final ModelWarnings warnings;
    private final MathTextRenderer renderer = new MathTextRenderer();

    public DaeModelBuilder() {
        this(new ModelWarnings());
    }

    public DaeModelBuilder(ModelWarnings warnings) {
        this.warnings = warnings == null ? new ModelWarnings() : warnings;
    }

    public DaeModel build(FlatModel flat, Map<String, Object> options) {
        if (flat == null) throw new IllegalArgumentException("flat must not be null");

        List<DaeParameter> parameters = new ArrayList<>();
        for (FlatEntry<OmParameter> p : flat.getParameters()) {
            parameters.add(new DaeParameter(p.id, p.entity.getValue(), p.documentation()));
        }

        Map<String, FlatRule> rulesByVariable = new LinkedHashMap<>();
        for (FlatRule r : flat.getRules()) {
            FlatRule previous = rulesByVariable.put(r.variableId, r);
            if (previous != null) {
                warnings.warn(ModelWarning.REDECLARATION,
                        "Rule '" + r.id + "' replaces rule '" + previous.id + "' for '" + r.variableId + "'",
                        "variable", r.variableId, "rule", r.id);
            }
        }

        Map<String, List<String>> terms = new LinkedHashMap<>();
        Map<String, Set<String>> reactionsBySpecies = new LinkedHashMap<>();
        for (FlatReaction r : flat.getReactions()) {
            MathExpr law = flat.kineticLaw(r);
            if (law == null) continue;
            String rendered = renderer.render(law);
            for (String id : r.reactantIds) {
                terms.computeIfAbsent(id, k -> new ArrayList<>()).add("-(" + rendered + ")");
                reactionsBySpecies.computeIfAbsent(id, k -> new LinkedHashSet<>()).add(r.id);
            }
            for (String id : r.productIds) {
                terms.computeIfAbsent(id, k -> new ArrayList<>()).add("+(" + rendered + ")");
                reactionsBySpecies.computeIfAbsent(id, k -> new LinkedHashSet<>()).add(r.id);
            }
        }

        List<DaeState> states = new ArrayList<>();
        for (FlatEntry<OmSpecies> s : flat.getSpecies()) {
            FlatRule rule = rulesByVariable.get(s.id);
            Set<String> reactions = reactionsBySpecies.getOrDefault(s.id, Set.of());
            if (rule != null) {
                if (!reactions.isEmpty()) {
                    warnings.warn(ModelWarning.RULE_OVERRIDES_REACTIONS,
                            "Species '" + s.id + "' is set by rule '" + rule.id + "'; reactions " + reactions + " are ignored for it",
                            "species", s.id, "rule", rule.id);
                }
                StateType type = rule.rule.getRuleType() == RuleType.ALGEBRAIC ? StateType.ALGEBRAIC : StateType.SUBSTITUTION;
                String equation = renderer.render(flat.expression(rule));
                states.add(new DaeState(s.id, type, equation, s.entity.getInitialValue(), s.documentation(),
                        "rule " + rule.id));
            } else {
                String equation = odeEquation(terms.getOrDefault(s.id, List.of()));
                String comment = reactions.isEmpty() ? "" : "reactions " + String.join(", ", reactions);
                states.add(new DaeState(s.id, StateType.ODE, equation, s.entity.getInitialValue(), s.documentation(), comment));
            }
        }

        Map<String, Object> opts = options == null ? DaeModel.defaultOptions() : options;
        log.debug("built DAE model '{}': {} parameters, {} states", flat.getName(), parameters.size(), states.size());
        return new DaeModel(flat.getName(), parameters, states, opts);
    }

    private static String odeEquation(List<String> terms) {
        if (terms.isEmpty()) return "0";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < terms.size(); i++) {
            String t = terms.get(i);
            sb.append(i == 0 && t.startsWith("+") ? t.substring(1) : t);
        }
        return sb.toString();
    }
}

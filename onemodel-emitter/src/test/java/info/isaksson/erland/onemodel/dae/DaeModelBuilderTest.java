package info.isaksson.erland.onemodel.dae;

import info.isaksson.erland.onemodel.TestModels;
import info.isaksson.erland.onemodel.flatten.Flattener;
import info.isaksson.erland.onemodel.ir.DaeModel;
import info.isaksson.erland.onemodel.ir.DaeState;
import info.isaksson.erland.onemodel.ir.StateType;
import info.isaksson.erland.onemodel.model.ModelWarning;
import info.isaksson.erland.onemodel.model.ModelWarnings;
import info.isaksson.erland.onemodel.model.OmParameter;
import info.isaksson.erland.onemodel.model.OmRule;
import info.isaksson.erland.onemodel.model.OmSpecies;
import info.isaksson.erland.onemodel.model.OneModel;
import info.isaksson.erland.onemodel.model.RuleType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DaeModelBuilderTest {

    private static DaeModel build(OneModel m, ModelWarnings warnings) {
        return new DaeModelBuilder(warnings).build(new Flattener(warnings).flatten(m), null);
    }

    @Test
    void speciesBecomeOdeStatesFromStoichiometry() {
        OneModel m = TestModels.nestedReaction();
        ((OmSpecies) m.root().get("A")).setInitialValue(1);
        ((OmParameter) m.root().get("foo").get("k")).setValue(0.3);

        DaeModel dae = build(m, new ModelWarnings());

        assertEquals("main", dae.getModelName());
        assertEquals("foo__k", dae.getParameters().get(0).id);
        assertEquals(0.3, dae.getParameters().get(0).value);

        DaeState b = dae.getStates().get(0);
        DaeState a = dae.getStates().get(1);
        assertEquals("foo__B", b.id);
        assertEquals(StateType.ODE, b.type);
        assertEquals("(foo__k*A)", b.equation);
        assertEquals("-(foo__k*A)", a.equation);
        assertEquals(1.0, a.initialCondition);
        assertEquals("reactions foo__J1", a.equationComment);
        assertEquals(Map.of("t_init", 0, "t_end", 10), dae.getOptions());
    }

    @Test
    void termsFollowReactionOrder() {
        OneModel m = TestModels.rootReaction();
        m.root().put("k2", new OmParameter(2));
        m.root().put("J2", TestModels.reaction(List.of("B"), List.of("A"), "k2*B"));

        DaeModel dae = build(m, new ModelWarnings());

        assertEquals("-(k*A)+(k2*B)", dae.getStates().get(0).equation);
        assertEquals("(k*A)-(k2*B)", dae.getStates().get(1).equation);
    }

    @Test
    void chainedPowerInKineticLawIsWrittenWithExplicitGrouping() {
        OneModel m = TestModels.rootReaction();
        m.root().put("J1", TestModels.reaction(List.of("A"), List.of("B"), "k^A^2"));

        DaeModel dae = build(m, new ModelWarnings());

        assertEquals("-(k^(A^2))", dae.getStates().get(0).equation);
        assertEquals("(k^(A^2))", dae.getStates().get(1).equation);
    }

    @Test
    void speciesOutsideAnyReactionIsConstant() {
        OneModel m = TestModels.rootReaction();
        m.root().put("E", new OmSpecies(4));

        DaeState e = build(m, new ModelWarnings()).getStates().get(2);

        assertEquals("0", e.equation);
        assertEquals(4.0, e.initialCondition);
    }

    @Test
    void rulesSelectSubstitutionAndAlgebraicStates() {
        OneModel m = TestModels.rootReaction();
        m.root().put("C", new OmSpecies());
        m.root().put("D", new OmSpecies());
        m.root().put("r1", new OmRule(RuleType.ASSIGNMENT, "C", "A+B"));
        m.root().put("r2", new OmRule(RuleType.ALGEBRAIC, "D", "k*C"));

        DaeModel dae = build(m, new ModelWarnings());

        assertEquals(StateType.SUBSTITUTION, dae.getStates().get(2).type);
        assertEquals("A+B", dae.getStates().get(2).equation);
        assertEquals(StateType.ALGEBRAIC, dae.getStates().get(3).type);
        assertEquals("k*C", dae.getStates().get(3).equation);
    }

    @Test
    void ruleOnReactingSpeciesWinsWithWarning() {
        OneModel m = TestModels.rootReaction();
        m.root().put("r", new OmRule(RuleType.ASSIGNMENT, "B", "2*A"));
        ModelWarnings warnings = new ModelWarnings();

        DaeModel dae = build(m, warnings);

        assertEquals(StateType.SUBSTITUTION, dae.getStates().get(1).type);
        ModelWarning w = warnings.toDeterministicList().get(0);
        assertEquals(ModelWarning.RULE_OVERRIDES_REACTIONS, w.code);
        assertEquals("B", w.context.get("species"));
    }
}

package info.isaksson.erland.onemodel.dae;

import info.isaksson.erland.onemodel.error.DependencyResolutionException;
import info.isaksson.erland.onemodel.ir.DaeModel;
import info.isaksson.erland.onemodel.ir.DaeParameter;
import info.isaksson.erland.onemodel.ir.DaeState;
import info.isaksson.erland.onemodel.ir.StateType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EquationDependencyResolverTest {

    private static DaeState sub(String id, String equation) {
        return new DaeState(id, StateType.SUBSTITUTION, equation, 0, "");
    }

    private static List<String> ids(List<DaeState> states) {
        return states.stream().map(s -> s.id).toList();
    }

    @Test
    void dependencyIsEmittedFirst() {
        DaeModel m = new DaeModel("m", List.of(), List.of(sub("x", "y + 1"), sub("y", "2")), null);

        EvaluationOrder order = EquationDependencyResolver.resolve(m);

        assertEquals(List.of("y", "x"), ids(order.substitutions()));
    }

    @Test
    void cycleFails() {
        DaeModel m = new DaeModel("m", List.of(), List.of(sub("x", "y"), sub("y", "x")), null);

        DependencyResolutionException ex = assertThrows(DependencyResolutionException.class,
                () -> EquationDependencyResolver.resolve(m));
        assertEquals("CyclicOrMissingDependencyError", ex.getCode());
        assertEquals(List.of("y"), ex.getUnresolved().get("x"));
        assertEquals(List.of("x"), ex.getUnresolved().get("y"));
    }

    @Test
    void undefinedNameFailsTheSameWay() {
        DaeModel m = new DaeModel("m", List.of(), List.of(sub("x", "ghost*2")), null);

        DependencyResolutionException ex = assertThrows(DependencyResolutionException.class,
                () -> EquationDependencyResolver.resolve(m));
        assertEquals(List.of("ghost"), ex.getUnresolved().get("x"));
    }

    @Test
    void parametersIndexedStatesTimeAndFunctionsAreKnown() {
        DaeModel m = new DaeModel("m",
                List.of(new DaeParameter("k", 1, "")),
                List.of(
                        new DaeState("A", StateType.ODE, "-k*A", 1, ""),
                        sub("z", "exp(-k*t)*A"),
                        new DaeState("C", StateType.ALGEBRAIC, "A", 0, "")),
                null);

        EvaluationOrder order = EquationDependencyResolver.resolve(m);

        assertEquals(List.of("z"), ids(order.substitutions()));
        assertEquals(List.of("A", "C"), ids(order.indexedStates()));
        assertEquals(1, order.indexOf("A"));
        assertEquals(2, order.indexOf("C"));
        assertEquals(-1, order.indexOf("z"));
    }

    @Test
    void simultaneouslyResolvableStatesKeepDeclarationOrder() {
        DaeModel m = new DaeModel("m", List.of(new DaeParameter("k", 1, "")),
                List.of(sub("d", "c+b"), sub("c", "a"), sub("b", "a"), sub("a", "k")), null);

        EvaluationOrder order = EquationDependencyResolver.resolve(m);

        assertEquals(List.of("a", "c", "b", "d"), ids(order.substitutions()));
    }
}

package info.isaksson.erland.onemodel.matlab;

import info.isaksson.erland.onemodel.dae.EquationDependencyResolver;
import info.isaksson.erland.onemodel.error.SerializationException;
import info.isaksson.erland.onemodel.math.MathParser;
import info.isaksson.erland.onemodel.math.MathTextRenderer;

import java.util.Set;

/**
 * Rewrites an equation for vectorised Matlab evaluation.
 *
 * <p>Parameters become fields of the parameter struct ({@code p.k}), states stay bare, and
 * {@code * / ^} become the element-wise {@code .* ./ .^}. Function calls and the time variable
 * pass through. Any other identifier cannot be bound in the generated code and is rejected.</p>
 */
public final class MatlabExpressionRenderer extends MathTextRenderer {

    public static final String PARAMETER_STRUCT = "p";

    private final Set<String> parameters;
    private final Set<String> states;

    private String owner;
    private String expression;

    public MatlabExpressionRenderer(Set<String> parameters, Set<String> states) {
        this.parameters = Set.copyOf(parameters);
        this.states = Set.copyOf(states);
    }

    /**
     * Parse and rewrite {@code text}.
     *
     * @param owner state the equation belongs to; used in error messages
     * @throws SerializationException when the text does not parse or names an unknown identifier
     */
    public String render(String owner, String text) {
        this.owner = owner;
        this.expression = text;
        try {
            return render(MathParser.parse(text));
        } finally {
            this.owner = null;
            this.expression = null;
        }
    }

    @Override
    protected String identifier(String name) {
        if (parameters.contains(name)) {
            return PARAMETER_STRUCT + "." + name;
        }
        if (states.contains(name) || EquationDependencyResolver.TIME.equals(name)) {
            return name;
        }
        throw new SerializationException(owner, expression, "unknown identifier '" + name + "'");
    }

    @Override
    protected String binaryOperator(char operator) {
        switch (operator) {
            case '*':
            case '/':
            case '^':
                return "." + operator;
            default:
                return String.valueOf(operator);
        }
    }
}

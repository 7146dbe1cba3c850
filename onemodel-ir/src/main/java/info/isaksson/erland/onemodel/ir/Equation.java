package info.isaksson.erland.onemodel.ir;

import java.util.Objects;

/** The single equation attached to a state variable. */
public final class Equation {

    public final StateType kind;
    public final String expression;
    public final String comment;

    public Equation(StateType kind, String expression, String comment) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.comment = comment == null ? "" : comment;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Equation)) return false;
        Equation that = (Equation) o;
        return kind == that.kind && expression.equals(that.expression) && comment.equals(that.comment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, expression, comment);
    }

    @Override
    public String toString() {
        return kind + ": " + expression;
    }
}

package info.isaksson.erland.onemodel.math;

import java.util.List;
import java.util.Objects;

/** Function application {@code f(a, b)}. The function name is not a variable reference. */
public final class MathCall extends MathExpr {

    public final String function;
    public final List<MathExpr> arguments;

    public MathCall(String function, List<MathExpr> arguments) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override
    public <R> R accept(MathVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MathCall)) return false;
        MathCall that = (MathCall) o;
        return function.equals(that.function) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, arguments);
    }
}

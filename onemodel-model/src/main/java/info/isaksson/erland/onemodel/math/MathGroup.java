package info.isaksson.erland.onemodel.math;

import java.util.Objects;

/** Parenthesised sub-expression. Kept so text output reproduces the source parentheses. */
public final class MathGroup extends MathExpr {

    public final MathExpr inner;

    public MathGroup(MathExpr inner) {
        this.inner = Objects.requireNonNull(inner, "inner must not be null");
    }

    @Override
    public <R> R accept(MathVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MathGroup && ((MathGroup) o).inner.equals(inner);
    }

    @Override
    public int hashCode() {
        return inner.hashCode() * 31 + 7;
    }
}

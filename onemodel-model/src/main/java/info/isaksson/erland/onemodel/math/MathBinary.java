package info.isaksson.erland.onemodel.math;

import java.util.Objects;

/** One of {@code + - * / ^}. */
public final class MathBinary extends MathExpr {

    public final char operator;
    public final MathExpr left;
    public final MathExpr right;

    public MathBinary(char operator, MathExpr left, MathExpr right) {
        if (MathLexer.OPERATORS.indexOf(operator) < 0) {
            throw new IllegalArgumentException("Unsupported binary operator: " + operator);
        }
        this.operator = operator;
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    @Override
    public <R> R accept(MathVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MathBinary)) return false;
        MathBinary that = (MathBinary) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }
}

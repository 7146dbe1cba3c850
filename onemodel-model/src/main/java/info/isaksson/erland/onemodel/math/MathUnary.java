package info.isaksson.erland.onemodel.math;

import java.util.Objects;

/** Prefix {@code -} or {@code +}. */
public final class MathUnary extends MathExpr {

    public final char operator;
    public final MathExpr operand;

    public MathUnary(char operator, MathExpr operand) {
        if (operator != '-' && operator != '+') {
            throw new IllegalArgumentException("Unsupported unary operator: " + operator);
        }
        this.operator = operator;
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    @Override
    public <R> R accept(MathVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MathUnary)) return false;
        MathUnary that = (MathUnary) o;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }
}

package info.isaksson.erland.onemodel.math;

import java.util.Objects;

/** Numeric literal, kept in its source spelling. */
public final class MathNumber extends MathExpr {

    public final String text;

    public MathNumber(String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    public boolean isInteger() {
        for (int i = 0; i < text.length(); i++) {
            if (!MathLexer.isDigit(text.charAt(i))) return false;
        }
        return !text.isEmpty();
    }

    public boolean hasExponent() {
        return text.indexOf('e') >= 0 || text.indexOf('E') >= 0;
    }

    /** Part before the exponent marker ({@code 1.5} for {@code 1.5e-3}). */
    public String mantissa() {
        int idx = exponentIndex();
        return idx < 0 ? text : text.substring(0, idx);
    }

    /** Exponent without a leading {@code +} ({@code -3} for {@code 1.5e-3}); empty when absent. */
    public String exponent() {
        int idx = exponentIndex();
        if (idx < 0) return "";
        String e = text.substring(idx + 1);
        return e.startsWith("+") ? e.substring(1) : e;
    }

    public double doubleValue() {
        return Double.parseDouble(text);
    }

    private int exponentIndex() {
        int idx = text.indexOf('e');
        return idx >= 0 ? idx : text.indexOf('E');
    }

    @Override
    public <R> R accept(MathVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MathNumber && ((MathNumber) o).text.equals(text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }
}

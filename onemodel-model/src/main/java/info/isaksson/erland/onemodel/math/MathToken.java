package info.isaksson.erland.onemodel.math;

import java.util.Objects;

/** One lexical token of a math expression. */
public final class MathToken {

    public final MathTokenType type;
    public final String value;

    /** Zero-based offset of the first character in the source text. */
    public final int position;

    public MathToken(MathTokenType type, String value, int position) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.position = position;
    }

    public boolean is(MathTokenType t, String v) {
        return type == t && value.equals(v);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MathToken)) return false;
        MathToken that = (MathToken) o;
        return position == that.position && type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, position);
    }

    @Override
    public String toString() {
        return type + "(" + value + ")";
    }
}

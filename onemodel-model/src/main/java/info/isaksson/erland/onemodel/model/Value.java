package info.isaksson.erland.onemodel.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of evaluating a syntax tree node: a literal, a list of values or a namespace object.
 *
 * <p>{@link #NONE} is produced by declarations, which bind into the tree instead of yielding a value.</p>
 */
public final class Value {

    public static final Value NONE = new Value(ValueKind.NONE, 0.0, false, null, null, null);

    public final ValueKind kind;

    private final double number;
    private final boolean integer;
    private final String text;
    private final List<Value> items;
    private final OmObject object;

    private Value(ValueKind kind, double number, boolean integer, String text, List<Value> items, OmObject object) {
        this.kind = kind;
        this.number = number;
        this.integer = integer;
        this.text = text;
        this.items = items;
        this.object = object;
    }

    public static Value number(double v) {
        return new Value(ValueKind.NUMBER, v, false, null, null, null);
    }

    public static Value integer(long v) {
        return new Value(ValueKind.NUMBER, v, true, null, null, null);
    }

    public static Value string(String s) {
        return new Value(ValueKind.STRING, 0.0, false, Objects.requireNonNull(s, "s"), null, null);
    }

    public static Value list(List<Value> items) {
        List<Value> copy = items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
        return new Value(ValueKind.LIST, 0.0, false, null, copy, null);
    }

    public static Value object(OmObject object) {
        return new Value(ValueKind.OBJECT, 0.0, false, null, null, Objects.requireNonNull(object, "object"));
    }

    public boolean isNone() {
        return kind == ValueKind.NONE;
    }

    public boolean isNumber() {
        return kind == ValueKind.NUMBER;
    }

    /** True for numbers that came from an integer literal. */
    public boolean isInteger() {
        return kind == ValueKind.NUMBER && integer;
    }

    public double asNumber() {
        require(ValueKind.NUMBER);
        return number;
    }

    public String asText() {
        require(ValueKind.STRING);
        return text;
    }

    public List<Value> asList() {
        require(ValueKind.LIST);
        return items;
    }

    public OmObject asObject() {
        require(ValueKind.OBJECT);
        return object;
    }

    /** Short description for error messages, e.g. {@code number 3} or {@code Species foo.B}. */
    public String describe() {
        switch (kind) {
            case NONE:
                return "nothing";
            case NUMBER:
                return "number " + (integer ? Long.toString((long) number) : Numbers.format(number));
            case STRING:
                return "string \"" + text + "\"";
            case LIST:
                return "list of " + items.size();
            case OBJECT:
                return object.kind() + " " + object.pathString();
            default:
                throw new IllegalStateException("Unhandled value kind " + kind);
        }
    }

    private void require(ValueKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected " + expected + " value but was " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value that = (Value) o;
        return kind == that.kind
                && Double.compare(number, that.number) == 0
                && integer == that.integer
                && Objects.equals(text, that.text)
                && Objects.equals(items, that.items)
                && object == that.object;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number, integer, text, items, object == null ? 0 : System.identityHashCode(object));
    }

    @Override
    public String toString() {
        return describe();
    }
}

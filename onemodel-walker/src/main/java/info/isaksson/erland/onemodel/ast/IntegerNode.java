package info.isaksson.erland.onemodel.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Integer literal, kept as source text. */
public final class IntegerNode extends SyntaxNode {

    public final String value;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public IntegerNode(@JsonProperty("value") String value) {
        this.value = Objects.requireNonNull(value, "Integer literal without a value");
    }

    @Override
    public <R> R accept(SyntaxNodeVisitor<R> visitor) {
        return visitor.visitInteger(this);
    }

    @Override public boolean equals(Object o) {
        return o instanceof IntegerNode && Objects.equals(value, ((IntegerNode) o).value);
    }

    @Override public int hashCode() {
        return Objects.hash(value);
    }
}

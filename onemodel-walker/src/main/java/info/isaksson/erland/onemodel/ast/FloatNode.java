package info.isaksson.erland.onemodel.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Real literal, kept as source text. */
public final class FloatNode extends SyntaxNode {

    public final String value;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public FloatNode(@JsonProperty("value") String value) {
        this.value = Objects.requireNonNull(value, "Float literal without a value");
    }

    @Override
    public <R> R accept(SyntaxNodeVisitor<R> visitor) {
        return visitor.visitFloat(this);
    }

    @Override public boolean equals(Object o) {
        return o instanceof FloatNode && Objects.equals(value, ((FloatNode) o).value);
    }

    @Override public int hashCode() {
        return Objects.hash(value);
    }
}

package info.isaksson.erland.onemodel.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Quoted string literal, without the quotes. */
public final class StringNode extends SyntaxNode {

    public final String value;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public StringNode(@JsonProperty("value") String value) {
        this.value = Objects.requireNonNull(value, "String literal without a value");
    }

    @Override
    public <R> R accept(SyntaxNodeVisitor<R> visitor) {
        return visitor.visitString(this);
    }

    @Override public boolean equals(Object o) {
        return o instanceof StringNode && Objects.equals(value, ((StringNode) o).value);
    }

    @Override public int hashCode() {
        return Objects.hash(value);
    }
}

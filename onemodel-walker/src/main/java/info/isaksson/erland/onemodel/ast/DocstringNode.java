package info.isaksson.erland.onemodel.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Triple-quoted documentation text; the walker strips each line. */
public final class DocstringNode extends SyntaxNode {

    public final String value;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public DocstringNode(@JsonProperty("value") String value) {
        this.value = Objects.requireNonNull(value, "Docstring literal without a value");
    }

    @Override
    public <R> R accept(SyntaxNodeVisitor<R> visitor) {
        return visitor.visitDocstring(this);
    }

    @Override public boolean equals(Object o) {
        return o instanceof DocstringNode && Objects.equals(value, ((DocstringNode) o).value);
    }

    @Override public int hashCode() {
        return Objects.hash(value);
    }
}

package info.isaksson.erland.onemodel.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Read of a bound name. */
public final class AccessNameNode extends SyntaxNode {

    public final DottedNameNode name;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public AccessNameNode(@JsonProperty("name") DottedNameNode name) {
        this.name = Objects.requireNonNull(name, "access without a name");
    }

    @Override
    public <R> R accept(SyntaxNodeVisitor<R> visitor) {
        return visitor.visitAccessName(this);
    }

    @Override public boolean equals(Object o) {
        return o instanceof AccessNameNode && Objects.equals(name, ((AccessNameNode) o).name);
    }

    @Override public int hashCode() {
        return Objects.hash(name);
    }
}

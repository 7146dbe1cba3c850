package info.isaksson.erland.onemodel.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** {@code name = value}. */
@JsonPropertyOrder({"name", "value"})
public final class AssignNameNode extends SyntaxNode {

    public final DottedNameNode name;
    public final SyntaxNode value;

    @JsonCreator
    public AssignNameNode(
            @JsonProperty("name") DottedNameNode name,
            @JsonProperty("value") SyntaxNode value
    ) {
        this.name = Objects.requireNonNull(name, "assignment without a name");
        this.value = Objects.requireNonNull(value, "assignment to '" + name + "' without a value");
    }

    @Override
    public <R> R accept(SyntaxNodeVisitor<R> visitor) {
        return visitor.visitAssignName(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssignNameNode)) return false;
        AssignNameNode that = (AssignNameNode) o;
        return Objects.equals(name, that.name) && Objects.equals(value, that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(name, value);
    }
}

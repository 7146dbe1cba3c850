package info.isaksson.erland.onemodel.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** {@code parameter name = value "doc"}; value and documentation are optional. */
@JsonPropertyOrder({"name", "value", "documentation"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ParameterNode extends SyntaxNode {

    public final DottedNameNode name;
    public final SyntaxNode value;
    public final SyntaxNode documentation;

    @JsonCreator
    public ParameterNode(
            @JsonProperty("name") DottedNameNode name,
            @JsonProperty("value") SyntaxNode value,
            @JsonProperty("documentation") SyntaxNode documentation
    ) {
        this.name = Objects.requireNonNull(name, "parameter declaration without a name");
        this.value = value;
        this.documentation = documentation;
    }

    @Override
    public <R> R accept(SyntaxNodeVisitor<R> visitor) {
        return visitor.visitParameter(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterNode)) return false;
        ParameterNode that = (ParameterNode) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(value, that.value) &&
                Objects.equals(documentation, that.documentation);
    }

    @Override public int hashCode() {
        return Objects.hash(name, value, documentation);
    }
}

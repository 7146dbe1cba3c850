package info.isaksson.erland.onemodel.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** {@code species name = value "doc"}; value and documentation are optional. */
@JsonPropertyOrder({"name", "value", "documentation"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SpeciesNode extends SyntaxNode {

    public final DottedNameNode name;
    public final SyntaxNode value;
    public final SyntaxNode documentation;

    @JsonCreator
    public SpeciesNode(
            @JsonProperty("name") DottedNameNode name,
            @JsonProperty("value") SyntaxNode value,
            @JsonProperty("documentation") SyntaxNode documentation
    ) {
        this.name = Objects.requireNonNull(name, "species declaration without a name");
        this.value = value;
        this.documentation = documentation;
    }

    @Override
    public <R> R accept(SyntaxNodeVisitor<R> visitor) {
        return visitor.visitSpecies(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SpeciesNode)) return false;
        SpeciesNode that = (SpeciesNode) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(value, that.value) &&
                Objects.equals(documentation, that.documentation);
    }

    @Override public int hashCode() {
        return Objects.hash(name, value, documentation);
    }
}

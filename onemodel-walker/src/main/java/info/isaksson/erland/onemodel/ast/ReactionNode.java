package info.isaksson.erland.onemodel.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * {@code reaction J1}. Participants and rate are assigned afterwards as attributes
 * ({@code J1.reactants = [A]}). Without a name the walker picks one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ReactionNode extends SyntaxNode {

    public final DottedNameNode name;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public ReactionNode(@JsonProperty("name") DottedNameNode name) {
        this.name = name;
    }

    @Override
    public <R> R accept(SyntaxNodeVisitor<R> visitor) {
        return visitor.visitReaction(this);
    }

    @Override public boolean equals(Object o) {
        return o instanceof ReactionNode && Objects.equals(name, ((ReactionNode) o).name);
    }

    @Override public int hashCode() {
        return Objects.hash(name);
    }
}

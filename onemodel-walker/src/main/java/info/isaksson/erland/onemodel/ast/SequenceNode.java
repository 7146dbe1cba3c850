package info.isaksson.erland.onemodel.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** Statement block or list literal. */
public final class SequenceNode extends SyntaxNode {

    public final List<SyntaxNode> items;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public SequenceNode(@JsonProperty("items") List<SyntaxNode> items) {
        this.items = items == null ? List.of() : List.copyOf(items);
    }

    public static SequenceNode of(SyntaxNode... items) {
        return new SequenceNode(List.of(items));
    }

    @Override
    public <R> R accept(SyntaxNodeVisitor<R> visitor) {
        return visitor.visitSequence(this);
    }

    @Override public boolean equals(Object o) {
        return o instanceof SequenceNode && Objects.equals(items, ((SequenceNode) o).items);
    }

    @Override public int hashCode() {
        return Objects.hash(items);
    }
}

package info.isaksson.erland.onemodel.ast;

/** A fresh, empty namespace ({@code foo = Object()}). */
public final class ObjectNode extends SyntaxNode {

    @Override
    public <R> R accept(SyntaxNodeVisitor<R> visitor) {
        return visitor.visitObject(this);
    }

    @Override public boolean equals(Object o) {
        return o instanceof ObjectNode;
    }

    @Override public int hashCode() {
        return ObjectNode.class.hashCode();
    }
}

package info.isaksson.erland.onemodel.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** {@code foo.bar.B}: qualifiers {@code [foo, bar]} and name {@code B}. */
@JsonPropertyOrder({"qualifiers", "name"})
public final class DottedNameNode extends SyntaxNode {

    public final List<String> qualifiers;
    public final String name;

    @JsonCreator
    public DottedNameNode(
            @JsonProperty("qualifiers") List<String> qualifiers,
            @JsonProperty("name") String name
    ) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("dotted name without a name");
        this.qualifiers = qualifiers == null ? List.of() : List.copyOf(qualifiers);
        this.name = name;
    }

    /** Split {@code "foo.bar.B"} on dots. */
    public static DottedNameNode parse(String dotted) {
        if (dotted == null) throw new IllegalArgumentException("dotted is null");
        String[] parts = dotted.split("\\.");
        return new DottedNameNode(Arrays.asList(parts).subList(0, parts.length - 1), parts[parts.length - 1]);
    }

    @Override
    public <R> R accept(SyntaxNodeVisitor<R> visitor) {
        return visitor.visitDottedName(this);
    }

    @Override
    public String toString() {
        return qualifiers.isEmpty() ? name : String.join(".", qualifiers) + "." + name;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DottedNameNode)) return false;
        DottedNameNode that = (DottedNameNode) o;
        return Objects.equals(qualifiers, that.qualifiers) && Objects.equals(name, that.name);
    }

    @Override public int hashCode() {
        return Objects.hash(qualifiers, name);
    }
}

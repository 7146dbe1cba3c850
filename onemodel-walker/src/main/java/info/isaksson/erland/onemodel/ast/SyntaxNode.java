package info.isaksson.erland.onemodel.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Node of the syntax tree produced by the external OneModel parser.
 *
 * <p>The set of node kinds is closed: every subclass is listed in {@link JsonSubTypes} and has a
 * method in {@link SyntaxNodeVisitor}. The JSON encoding names the kind in a {@code "type"}
 * property.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SequenceNode.class, name = "Sequence"),
        @JsonSubTypes.Type(value = ParameterNode.class, name = "Parameter"),
        @JsonSubTypes.Type(value = SpeciesNode.class, name = "Species"),
        @JsonSubTypes.Type(value = ReactionNode.class, name = "Reaction"),
        @JsonSubTypes.Type(value = RuleNode.class, name = "Rule"),
        @JsonSubTypes.Type(value = ObjectNode.class, name = "Object"),
        @JsonSubTypes.Type(value = AssignNameNode.class, name = "AssignName"),
        @JsonSubTypes.Type(value = AccessNameNode.class, name = "AccessName"),
        @JsonSubTypes.Type(value = DottedNameNode.class, name = "DottedName"),
        @JsonSubTypes.Type(value = FloatNode.class, name = "Float"),
        @JsonSubTypes.Type(value = IntegerNode.class, name = "Integer"),
        @JsonSubTypes.Type(value = StringNode.class, name = "String"),
        @JsonSubTypes.Type(value = DocstringNode.class, name = "Docstring")
})
public abstract class SyntaxNode {

    public abstract <R> R accept(SyntaxNodeVisitor<R> visitor);
}

package info.isaksson.erland.onemodel.ast;

/** Exhaustive dispatch over the syntax tree node kinds. */
public interface SyntaxNodeVisitor<R> {

    R visitSequence(SequenceNode node);

    R visitParameter(ParameterNode node);

    R visitSpecies(SpeciesNode node);

    R visitReaction(ReactionNode node);

    R visitRule(RuleNode node);

    R visitObject(ObjectNode node);

    R visitAssignName(AssignNameNode node);

    R visitAccessName(AccessNameNode node);

    R visitDottedName(DottedNameNode node);

    R visitFloat(FloatNode node);

    R visitInteger(IntegerNode node);

    R visitString(StringNode node);

    R visitDocstring(DocstringNode node);
}

package info.isaksson.erland.onemodel.walk;

import info.isaksson.erland.onemodel.ast.AccessNameNode;
import info.isaksson.erland.onemodel.ast.AssignNameNode;
import info.isaksson.erland.onemodel.ast.AstJson;
import info.isaksson.erland.onemodel.ast.DottedNameNode;
import info.isaksson.erland.onemodel.ast.FloatNode;
import info.isaksson.erland.onemodel.ast.IntegerNode;
import info.isaksson.erland.onemodel.ast.ObjectNode;
import info.isaksson.erland.onemodel.ast.ParameterNode;
import info.isaksson.erland.onemodel.ast.ReactionNode;
import info.isaksson.erland.onemodel.ast.SequenceNode;
import info.isaksson.erland.onemodel.ast.SpeciesNode;
import info.isaksson.erland.onemodel.ast.SyntaxNode;
import info.isaksson.erland.onemodel.error.RedeclarationException;
import info.isaksson.erland.onemodel.error.UndefinedNameException;
import info.isaksson.erland.onemodel.error.UndefinedNamespaceException;
import info.isaksson.erland.onemodel.model.ModelWarning;
import info.isaksson.erland.onemodel.model.ModelWarnings;
import info.isaksson.erland.onemodel.model.ObjectKind;
import info.isaksson.erland.onemodel.model.OmObject;
import info.isaksson.erland.onemodel.model.OmParameter;
import info.isaksson.erland.onemodel.model.OmReaction;
import info.isaksson.erland.onemodel.model.OmRule;
import info.isaksson.erland.onemodel.model.OmSpecies;
import info.isaksson.erland.onemodel.model.OneModel;
import info.isaksson.erland.onemodel.model.RuleType;
import info.isaksson.erland.onemodel.model.Value;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OneModelWalkerTest {

    private static SyntaxNode fixture(String name) throws Exception {
        return AstJson.read(Path.of(OneModelWalkerTest.class.getClassLoader().getResource("ast/" + name).toURI()));
    }

    private static DottedNameNode n(String dotted) {
        return DottedNameNode.parse(dotted);
    }

    @Test
    void nestedFixtureBuildsScopedTree() throws Exception {
        OneModel m = OneModelWalker.build(fixture("nested.ast.json"), null);

        assertEquals("main", m.getName());
        assertEquals(List.of("foo", "A"), m.root().childNames());
        assertEquals(List.of("B", "k", "J1"), m.root().get("foo").childNames());
        assertInstanceOf(OmSpecies.class, m.lookup("foo.B"));
        assertInstanceOf(OmParameter.class, m.lookup("foo.k"));

        OmReaction j1 = assertInstanceOf(OmReaction.class, m.lookup("foo.J1"));
        assertEquals(List.of("A"), j1.getReactants());
        assertEquals(List.of("B"), j1.getProducts());
        assertEquals("k*A", j1.getKineticLaw());
        assertEquals(List.of("foo", "J1"), j1.path());
    }

    @Test
    void declarationsCarryValuesDocsAndAutoNames() throws Exception {
        WalkContext ctx = new WalkContext("decl");
        new OneModelWalker(ctx).walk(fixture("declarations.ast.json"));
        OmObject root = ctx.getModel().root();

        OmParameter k1 = (OmParameter) root.get("k1");
        assertEquals(0.5, k1.getValue());
        assertEquals("Forward rate.\nPer second.", k1.getDocumentation());
        assertEquals(10.0, ((OmSpecies) root.get("A")).getInitialValue());

        assertEquals(List.of("k1", "A", "_J1", "_rule1", "_J2"), root.childNames());
        OmRule rule = (OmRule) root.get("_rule1");
        assertEquals(RuleType.ALGEBRAIC, rule.getRuleType());
        assertEquals("C", rule.getVariable());
        assertEquals("A*2", rule.getExpression());
        assertTrue(ctx.getWarnings().isEmpty());
    }

    @Test
    void autoNamingRestartsPerRun() throws Exception {
        SyntaxNode ast = fixture("declarations.ast.json");
        OneModel first = OneModelWalker.build(ast, "a");
        OneModel second = OneModelWalker.build(ast, "b");

        assertEquals(first.root().childNames(), second.root().childNames());
    }

    @Test
    void missingQualifierIsUndefinedNamespace() {
        SyntaxNode ast = new SpeciesNode(n("bar.B"), null, null);

        UndefinedNamespaceException ex = assertThrows(UndefinedNamespaceException.class,
                () -> OneModelWalker.build(ast, null));
        assertEquals("UndefinedNamespaceError", ex.getCode());
    }

    @Test
    void readingUnboundNameIsUndefinedName() {
        SyntaxNode ast = new AssignNameNode(n("x"), new AccessNameNode(n("y")));

        assertThrows(UndefinedNameException.class, () -> OneModelWalker.build(ast, null));
    }

    @Test
    void redeclarationOverwritesAndWarns() {
        SyntaxNode ast = SequenceNode.of(
                new ParameterNode(n("k"), new IntegerNode("1"), null),
                new SpeciesNode(n("k"), null, null));
        WalkContext ctx = new WalkContext("m");
        new OneModelWalker(ctx).walk(ast);

        assertEquals(ObjectKind.SPECIES, ctx.getModel().root().get("k").kind());
        List<ModelWarning> warnings = ctx.getWarnings().toDeterministicList();
        assertEquals(1, warnings.size());
        assertEquals(ModelWarning.REDECLARATION, warnings.get(0).code);
        assertEquals("k", warnings.get(0).context.get("path"));
    }

    @Test
    void redeclarationFailsWhenRequested() {
        SyntaxNode ast = SequenceNode.of(
                new SpeciesNode(n("A"), null, null),
                new SpeciesNode(n("A"), null, null));
        WalkContext ctx = new WalkContext(new OneModel(), new ModelWarnings(), true);

        RedeclarationException ex = assertThrows(RedeclarationException.class, () -> new OneModelWalker(ctx).walk(ast));
        assertEquals("A", ex.getContext().get("path"));
    }

    @Test
    void literalAssignmentReadsBackAsLiteral() {
        SyntaxNode ast = SequenceNode.of(
                new AssignNameNode(n("x"), new FloatNode("2.5")),
                new ParameterNode(n("k"), new AccessNameNode(n("x")), null));
        OneModel m = OneModelWalker.build(ast, null);

        assertEquals(2.5, ((OmParameter) m.lookup("k")).getValue());
        assertEquals(Value.number(2.5), m.root().get("x").getLiteral());
    }

    @Test
    void productGivenAsQualifiedAccessBindsTheNestedSpecies() {
        SyntaxNode ast = SequenceNode.of(
                new AssignNameNode(n("foo"), new ObjectNode()),
                new SpeciesNode(n("foo.B"), null, null),
                new SpeciesNode(n("B"), null, null),
                new ReactionNode(n("J1")),
                new AssignNameNode(n("J1.products"), SequenceNode.of(new AccessNameNode(n("foo.B")))));
        OneModel m = OneModelWalker.build(ast, null);

        OmReaction j1 = (OmReaction) m.lookup("J1");
        assertEquals(List.of("B"), j1.getProducts());
        assertSame(m.lookup("foo.B"), j1.getProductRefs().get(0).getTarget());
    }

    @Test
    void bindingAnOwnedObjectBindsACopy() {
        SyntaxNode ast = SequenceNode.of(
                new AssignNameNode(n("foo"), new ObjectNode()),
                new SpeciesNode(n("foo.B"), null, null),
                new AssignNameNode(n("bar"), new AccessNameNode(n("foo"))));
        OneModel m = OneModelWalker.build(ast, null);

        OmObject foo = m.lookup("foo");
        OmObject bar = m.lookup("bar");
        assertNotSame(foo, bar);
        assertNotSame(foo.get("B"), bar.get("B"));
        assertSame(bar, bar.get("B").getParent());
        assertEquals(List.of("bar", "B"), bar.get("B").path());
    }
}

package info.isaksson.erland.onemodel.sbml;

import info.isaksson.erland.onemodel.TestModels;
import info.isaksson.erland.onemodel.flatten.FlatModel;
import info.isaksson.erland.onemodel.flatten.Flattener;
import info.isaksson.erland.onemodel.model.OmParameter;
import info.isaksson.erland.onemodel.model.OmRule;
import info.isaksson.erland.onemodel.model.OmSpecies;
import info.isaksson.erland.onemodel.model.OneModel;
import info.isaksson.erland.onemodel.model.RuleType;
import org.junit.jupiter.api.Test;
import org.sbml.jsbml.ASTNode;
import org.sbml.jsbml.AssignmentRule;
import org.sbml.jsbml.Model;
import org.sbml.jsbml.SBMLDocument;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SbmlWriterTest {

    private static final String MATHML = "http://www.w3.org/1998/Math/MathML";

    private static String sbml(OneModel m) throws Exception {
        FlatModel flat = new Flattener().flatten(m);
        return SbmlWriter.writeToString(flat);
    }

    private static List<String> childElementNames(Element e) {
        List<String> out = new ArrayList<>();
        NodeList children = e.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node n = children.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE) out.add(n.getLocalName());
        }
        return out;
    }

    @Test
    void rootReactionMatchesFixture() throws Exception {
        assertEquals(XmlCanon.of(TestModels.resource("sbml/root.xml")), XmlCanon.of(sbml(TestModels.rootReaction())));
    }

    @Test
    void nestedReactionMatchesFixture() throws Exception {
        assertEquals(XmlCanon.of(TestModels.resource("sbml/nested.xml")), XmlCanon.of(sbml(TestModels.nestedReaction())));
    }

    @Test
    void documentIsLevelThreeVersionTwo() throws Exception {
        Element root = XmlCanon.parse(sbml(TestModels.rootReaction())).getDocumentElement();

        assertEquals(SbmlWriter.SBML_NAMESPACE, root.getNamespaceURI());
        assertEquals("3", root.getAttribute("level"));
        assertEquals("2", root.getAttribute("version"));
    }

    @Test
    void nestedReactionParsesWithResolvedReferences() throws Exception {
        Document doc = XmlCanon.parse(sbml(TestModels.nestedReaction()));

        Element reaction = (Element) doc.getElementsByTagNameNS("*", "reaction").item(0);
        assertEquals("foo__J1", reaction.getAttribute("id"));
        NodeList refs = reaction.getElementsByTagNameNS("*", "speciesReference");
        assertEquals("A", ((Element) refs.item(0)).getAttribute("species"));
        assertEquals("foo__B", ((Element) refs.item(1)).getAttribute("species"));

        NodeList ci = doc.getElementsByTagNameNS(MATHML, "ci");
        assertEquals("foo__k", ci.item(0).getTextContent().trim());
        assertEquals("A", ci.item(1).getTextContent().trim());
    }

    @Test
    void initialValuesAndParameterValuesAreSet() {
        OneModel m = TestModels.rootReaction();
        ((OmSpecies) m.root().get("A")).setInitialValue(2.5);
        ((OmParameter) m.root().get("k")).setValue(0.3);

        Model model = SbmlWriter.toDocument(new Flattener().flatten(m)).getModel();

        assertEquals(2.5, model.getSpecies("A").getInitialConcentration());
        assertEquals(SbmlWriter.COMPARTMENT, model.getSpecies("A").getCompartment());
        assertEquals(0.3, model.getParameter("k").getValue());
        assertEquals(OmParameter.UNITS, model.getParameter("k").getUnits());
    }

    @Test
    void rulesSitBetweenParametersAndReactions() throws Exception {
        Document plain = XmlCanon.parse(sbml(TestModels.rootReaction()));
        assertEquals(0, plain.getElementsByTagNameNS("*", "listOfRules").getLength());

        OneModel m = TestModels.rootReaction();
        m.root().put("C", new OmSpecies());
        m.root().put("D", new OmSpecies());
        m.root().put("r1", new OmRule(RuleType.ASSIGNMENT, "C", "A+B"));
        m.root().put("r2", new OmRule(RuleType.ALGEBRAIC, "D", "2*k"));
        Document doc = XmlCanon.parse(sbml(m));

        Element model = (Element) doc.getElementsByTagNameNS("*", "model").item(0);
        assertEquals(List.of("listOfUnitDefinitions", "listOfCompartments", "listOfSpecies",
                "listOfParameters", "listOfRules", "listOfReactions"), childElementNames(model));

        Element assignment = (Element) doc.getElementsByTagNameNS("*", "assignmentRule").item(0);
        assertEquals("C", assignment.getAttribute("variable"));
        Element apply = (Element) assignment.getElementsByTagNameNS(MATHML, "apply").item(0);
        assertEquals(List.of("plus", "ci", "ci"), childElementNames(apply));

        Element algebraic = (Element) doc.getElementsByTagNameNS("*", "algebraicRule").item(0);
        Element residual = (Element) algebraic.getElementsByTagNameNS(MATHML, "apply").item(0);
        assertEquals("minus", childElementNames(residual).get(0));
        NodeList ci = algebraic.getElementsByTagNameNS(MATHML, "ci");
        assertEquals("D", ci.item(ci.getLength() - 1).getTextContent().trim());
    }

    @Test
    void assignmentRuleMathIsTheConvertedExpression() {
        OneModel m = TestModels.rootReaction();
        m.root().put("C", new OmSpecies());
        m.root().put("r1", new OmRule(RuleType.ASSIGNMENT, "C", "k*(A-B)"));

        SBMLDocument doc = SbmlWriter.toDocument(new Flattener().flatten(m));
        AssignmentRule rule = (AssignmentRule) doc.getModel().getRule(0);

        assertEquals("C", rule.getVariable());
        assertEquals(ASTNode.Type.TIMES, rule.getMath().getType());
        assertEquals(ASTNode.Type.MINUS, rule.getMath().getChild(1).getType());
    }

    @Test
    void modelNameOutsideIdSyntaxKeepsNameAndGetsSanitisedId() throws Exception {
        OneModel m = new OneModel("decay-chain 2");
        m.root().put("A", new OmSpecies());

        Element model = (Element) XmlCanon.parse(sbml(m)).getElementsByTagNameNS("*", "model").item(0);

        assertEquals("decay_chain_2", model.getAttribute("id"));
        assertEquals("decay-chain 2", model.getAttribute("name"));
        assertEquals("_1st", SbmlWriter.modelId("1st"));
    }

    @Test
    void writingTwiceIsByteIdentical() throws Exception {
        OneModel m = TestModels.nestedReaction();
        FlatModel flat = new Flattener().flatten(m);
        Path out1 = Files.createTempFile("onemodel-sbml-1", ".xml");
        Path out2 = Files.createTempFile("onemodel-sbml-2", ".xml");

        SbmlWriter.write(flat, out1);
        SbmlWriter.write(new Flattener().flatten(m), out2);

        assertArrayEquals(Files.readAllBytes(out1), Files.readAllBytes(out2));
    }
}

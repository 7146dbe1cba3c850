package info.isaksson.erland.onemodel.core;

import info.isaksson.erland.onemodel.ast.AccessNameNode;
import info.isaksson.erland.onemodel.ast.AssignNameNode;
import info.isaksson.erland.onemodel.ast.DocstringNode;
import info.isaksson.erland.onemodel.ast.DottedNameNode;
import info.isaksson.erland.onemodel.ast.FloatNode;
import info.isaksson.erland.onemodel.ast.IntegerNode;
import info.isaksson.erland.onemodel.ast.ParameterNode;
import info.isaksson.erland.onemodel.ast.ReactionNode;
import info.isaksson.erland.onemodel.ast.RuleNode;
import info.isaksson.erland.onemodel.ast.SequenceNode;
import info.isaksson.erland.onemodel.ast.SpeciesNode;
import info.isaksson.erland.onemodel.ast.StringNode;
import info.isaksson.erland.onemodel.ast.SyntaxNode;
import info.isaksson.erland.onemodel.error.RedeclarationException;
import info.isaksson.erland.onemodel.ir.DaeJson;
import info.isaksson.erland.onemodel.ir.DaeModel;
import info.isaksson.erland.onemodel.ir.StateType;
import info.isaksson.erland.onemodel.matlab.MatlabFile;
import info.isaksson.erland.onemodel.matlab.MatlabStyle;
import info.isaksson.erland.onemodel.model.ModelWarning;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end smoke test over the whole pipeline: a small decay network with one assignment rule,
 * compiled to SBML, a DAE model and Matlab code.
 */
public class OneModelServiceSmokeTest {

    private static DottedNameNode n(String dotted) {
        return DottedNameNode.parse(dotted);
    }

    /** A -> B at k*A, plus total = A + B. */
    private static SyntaxNode decay(boolean redeclareK) {
        List<SyntaxNode> items = new java.util.ArrayList<>(List.of(
                new SpeciesNode(n("A"), new IntegerNode("10"), null),
                new SpeciesNode(n("B"), null, null),
                new SpeciesNode(n("total"), null, null),
                new ParameterNode(n("k"), new FloatNode("0.5"), new DocstringNode("  decay rate  ")),
                new ReactionNode(n("J1")),
                new AssignNameNode(n("J1.reactants"), SequenceNode.of(new AccessNameNode(n("A")))),
                new AssignNameNode(n("J1.products"), SequenceNode.of(new StringNode("B"))),
                new AssignNameNode(n("J1.kinetic_law"), new StringNode("k*A")),
                new RuleNode(null, "total", "A+B", null)
        ));
        if (redeclareK) {
            items.add(new ParameterNode(n("k"), new FloatNode("0.25"), null));
        }
        return new SequenceNode(items);
    }

    private static Document parseXml(String xml) throws Exception {
        DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
        f.setNamespaceAware(true);
        return f.newDocumentBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void compilesSyntaxTreeToAllArtifacts() throws Exception {
        OneModelOptions opt = new OneModelOptions();
        opt.modelName = "decay";

        OneModelResult res = new OneModelService().generateFromAst(decay(false), opt);

        assertEquals("decay", res.getName());
        assertNotNull(res.model);
        assertEquals(3, res.flatModel.getSpecies().size());
        assertTrue(res.warnings.isEmpty(), res.warnings.toString());

        assertTrue(res.hasSbml());
        Document sbml = parseXml(res.sbml);
        Element model = (Element) sbml.getElementsByTagNameNS("*", "model").item(0);
        assertEquals("decay", model.getAttribute("id"));
        assertEquals("decay", model.getAttribute("name"));
        assertEquals("total", ((Element) sbml.getElementsByTagNameNS("*", "assignmentRule").item(0)).getAttribute("variable"));
        assertEquals("J1", ((Element) sbml.getElementsByTagNameNS("*", "reaction").item(0)).getAttribute("id"));

        DaeModel dae = res.daeModel;
        assertEquals("decay rate", dae.getParameters().get(0).comment);
        assertEquals(StateType.ODE, dae.getStates().get(0).type);
        assertEquals("-(k*A)", dae.getStates().get(0).equation);
        assertEquals(StateType.SUBSTITUTION, dae.getStates().get(2).type);
        assertEquals("A+B", dae.getStates().get(2).equation);

        assertEquals(List.of("decay_param.m", "decay_ode.m", "decay_states.m", "decay_driver.m"),
                res.matlabFiles.stream().map(MatlabFile::fileName).toList());
        assertTrue(res.matlabFiles.get(1).content().contains("dx(1,1) = -(p.k.*A);\n"),
                res.matlabFiles.get(1).content());
    }

    @Test
    void optionsSwitchOutputsOff() throws Exception {
        OneModelOptions opt = new OneModelOptions();
        opt.emitSbml = false;
        opt.emitMatlab = false;

        OneModelResult res = new OneModelService().generateFromAst(decay(false), opt);

        assertEquals("main", res.getName());
        assertFalse(res.hasSbml());
        assertTrue(res.matlabFiles.isEmpty());
        assertNotNull(res.daeModel);
    }

    @Test
    void redeclarationIsWarningUnlessStrict() throws Exception {
        OneModelResult res = new OneModelService().generateFromAst(decay(true), new OneModelOptions());
        assertEquals(1, res.warnings.size());
        assertEquals(ModelWarning.REDECLARATION, res.warnings.get(0).code);
        assertEquals(0.25, res.daeModel.getParameters().get(0).value);

        OneModelOptions strict = new OneModelOptions();
        strict.failOnRedeclaration = true;
        assertThrows(RedeclarationException.class, () -> new OneModelService().generateFromAst(decay(true), strict));
    }

    @Test
    void writesArtifactsAndDaeSnapshot(@TempDir Path out) throws Exception {
        OneModelOptions opt = new OneModelOptions();
        opt.modelName = "decay";
        opt.matlabStyle = MatlabStyle.CLASS;
        OneModelService service = new OneModelService();
        OneModelResult res = service.generateFromAst(decay(false), opt);

        Path snapshot = out.resolve("dae/decay.json");
        List<Path> written = service.writeAll(res, out, snapshot);

        assertEquals(List.of(out.resolve("decay.xml"), out.resolve("decay.m"), out.resolve("decay_example.m"), snapshot),
                written);
        assertEquals(res.sbml, Files.readString(out.resolve("decay.xml")));
        assertEquals(res.daeModel, DaeJson.read(snapshot));

        // The snapshot compiles to the same Matlab code as the syntax tree did.
        OneModelResult fromDae = service.generateFromDae(snapshot, opt);
        assertNull(fromDae.model);
        assertFalse(fromDae.hasSbml());
        assertEquals(res.matlabFiles, fromDae.matlabFiles);
    }
}

package info.isaksson.erland.onemodel;

import info.isaksson.erland.onemodel.ir.DaeJson;
import info.isaksson.erland.onemodel.ir.DaeModel;
import info.isaksson.erland.onemodel.ir.StateType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MainAstModeSmokeTest {

    private static List<String> ids(Document doc, String element) {
        List<String> out = new ArrayList<>();
        NodeList nodes = doc.getElementsByTagNameNS("*", element);
        for (int i = 0; i < nodes.getLength(); i++) {
            out.add(((Element) nodes.item(i)).getAttribute("id"));
        }
        return out;
    }

    @Test
    void compilesNestedSampleToSbmlMatlabAndReport(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("out");

        int code = Main.run(new String[] {
                TestRepoPaths.resolveSample("nested/model.ast.json").toString(),
                "--output", out.toString(),
                "--name", "nested"
        });

        assertEquals(0, code);
        DocumentBuilderFactory xml = DocumentBuilderFactory.newInstance();
        xml.setNamespaceAware(true);
        Document sbml = xml.newDocumentBuilder().parse(out.resolve("nested.xml").toFile());
        assertTrue(ids(sbml, "species").contains("foo__B"));
        assertEquals(List.of("foo__k"), ids(sbml, "parameter"));
        assertEquals(List.of("foo__J1"), ids(sbml, "reaction"));
        for (String f : new String[] {"nested_param.m", "nested_ode.m", "nested_states.m", "nested_driver.m"}) {
            assertTrue(Files.exists(out.resolve(f)), f);
        }

        String report = Files.readString(out.resolve("report.md"));
        assertTrue(report.startsWith("# OneModel compile report\n"), report);
        assertTrue(report.contains("- Species: **2**"), report);
        assertTrue(report.contains("- `nested.xml`"), report);
    }

    @Test
    void writesDaeSnapshotWithRuleStates(@TempDir Path tmp) throws IOException {
        Path out = tmp.resolve("out");
        Path snapshots = tmp.resolve("snapshots");

        int code = Main.run(new String[] {
                "--ast", TestRepoPaths.resolveSample("decay/model.ast.json").toString(),
                "--output", out.toString(),
                "--name", "decay",
                "--sbml", "false",
                "--matlab", "class",
                "--write-dae", snapshots.toString()
        });

        assertEquals(0, code);
        assertFalse(Files.exists(out.resolve("decay.xml")));
        assertTrue(Files.exists(out.resolve("decay.m")));
        assertTrue(Files.exists(out.resolve("decay_example.m")));

        DaeModel dae = DaeJson.read(snapshots.resolve("decay.dae.json"));
        assertEquals("decay", dae.name);
        assertEquals("-(k1*A)", dae.states.get(0).equation);
        assertEquals("(k1*A)-(k2*B)", dae.states.get(1).equation);
        assertEquals(StateType.SUBSTITUTION, dae.states.get(2).type);
    }

    @Test
    void strictRedeclarationFailsWithExitCodeTwo(@TempDir Path tmp) throws IOException {
        Path ast = tmp.resolve("twice.ast.json");
        Files.writeString(ast, """
                {
                  "type": "Sequence",
                  "items": [
                    { "type": "Species", "name": { "type": "DottedName", "qualifiers": [], "name": "A" } },
                    { "type": "Species", "name": { "type": "DottedName", "qualifiers": [], "name": "A" } }
                  ]
                }
                """);

        assertEquals(0, Main.run(new String[] {ast.toString(), "--output", tmp.resolve("lenient").toString()}));
        String report = Files.readString(tmp.resolve("lenient/report.md"));
        assertTrue(report.contains("**REDECLARATION**"), report);
        assertTrue(report.contains("- REDECLARATION: **1**"), report);

        assertEquals(2, Main.run(new String[] {
                ast.toString(), "--output", tmp.resolve("strict").toString(), "--fail-on-redeclaration", "true"
        }));
    }

    @Test
    void usageErrorsExitWithOne(@TempDir Path tmp) {
        assertEquals(1, Main.run(new String[] {}));
        assertEquals(1, Main.run(new String[] {"--unknown"}));
        assertEquals(1, Main.run(new String[] {"--matlab", "octave", "x.json"}));
        assertEquals(1, Main.run(new String[] {tmp.resolve("missing.json").toString()}));
        assertEquals(0, Main.run(new String[] {"--help"}));
    }
}

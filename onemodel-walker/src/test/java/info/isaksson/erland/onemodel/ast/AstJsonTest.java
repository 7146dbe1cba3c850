package info.isaksson.erland.onemodel.ast;

import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstJsonTest {

    private static Path fixture(String name) throws Exception {
        return Path.of(AstJsonTest.class.getClassLoader().getResource("ast/" + name).toURI());
    }

    @Test
    void readsNestedFixtureIntoTypedNodes() throws Exception {
        SyntaxNode root = AstJson.read(fixture("nested.ast.json"));

        SequenceNode seq = assertInstanceOf(SequenceNode.class, root);
        assertEquals(8, seq.items.size());
        AssignNameNode first = assertInstanceOf(AssignNameNode.class, seq.items.get(0));
        assertEquals("foo", first.name.name);
        assertInstanceOf(ObjectNode.class, first.value);

        SpeciesNode b = assertInstanceOf(SpeciesNode.class, seq.items.get(2));
        assertEquals(List.of("foo"), b.name.qualifiers);
        assertNull(b.value);
        assertEquals("foo.B", b.name.toString());
    }

    @Test
    void writeThenReadGivesEqualTree() throws Exception {
        SyntaxNode root = AstJson.read(fixture("declarations.ast.json"));

        String json = AstJson.toJsonString(root);
        assertEquals(root, AstJson.readFromString(json));
        assertEquals(json, AstJson.toJsonString(AstJson.readFromString(json)));
        assertTrue(json.contains("\"type\" : \"Rule\""), json);
    }

    @Test
    void unknownNodeTypeIsRejected() {
        String json = "{\"type\":\"Lambda\",\"body\":[]}";
        assertThrows(InvalidTypeIdException.class, () -> AstJson.readFromString(json));
    }

    @Test
    void dottedNameParse() {
        DottedNameNode n = DottedNameNode.parse("foo.bar.B");
        assertEquals(List.of("foo", "bar"), n.qualifiers);
        assertEquals("B", n.name);
        assertEquals(List.of(), DottedNameNode.parse("A").qualifiers);
        assertThrows(IllegalArgumentException.class, () -> DottedNameNode.parse(""));
    }
}

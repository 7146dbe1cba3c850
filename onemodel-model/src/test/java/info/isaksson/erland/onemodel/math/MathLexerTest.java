package info.isaksson.erland.onemodel.math;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class MathLexerTest {

    @Test
    void tokenizesIdentifiersOperatorsNumbersAndPunctuation() {
        List<MathToken> tokens = MathLexer.tokenize("k1 * (A + 2.5e-3)");

        assertEquals(7, tokens.size());
        assertEquals(new MathToken(MathTokenType.IDENTIFIER, "k1", 0), tokens.get(0));
        assertEquals(new MathToken(MathTokenType.OPERATOR, "*", 3), tokens.get(1));
        assertEquals(new MathToken(MathTokenType.PUNCT, "(", 5), tokens.get(2));
        assertEquals(new MathToken(MathTokenType.IDENTIFIER, "A", 6), tokens.get(3));
        assertEquals(new MathToken(MathTokenType.OPERATOR, "+", 8), tokens.get(4));
        assertEquals(new MathToken(MathTokenType.NUMBER, "2.5e-3", 10), tokens.get(5));
        assertEquals(new MathToken(MathTokenType.PUNCT, ")", 16), tokens.get(6));
    }

    @Test
    void unknownCharactersPassThroughAsPunct() {
        List<MathToken> tokens = MathLexer.tokenize("a $ b");

        assertEquals(3, tokens.size());
        assertEquals(MathTokenType.PUNCT, tokens.get(1).type);
        assertEquals("$", tokens.get(1).value);
    }

    @Test
    void exponentMarkerWithoutDigitsStartsAnIdentifier() {
        List<MathToken> tokens = MathLexer.tokenize("2e");

        assertEquals(2, tokens.size());
        assertEquals(new MathToken(MathTokenType.NUMBER, "2", 0), tokens.get(0));
        assertEquals(new MathToken(MathTokenType.IDENTIFIER, "e", 1), tokens.get(1));
    }

    @Test
    void leadingDotNumber() {
        List<MathToken> tokens = MathLexer.tokenize(".5*x");

        assertEquals(MathTokenType.NUMBER, tokens.get(0).type);
        assertEquals(".5", tokens.get(0).value);
    }

    @Test
    void identifierNamesSkipNumbersOperatorsAndFunctionNames() {
        Set<String> names = MathLexer.identifierNames("k1/k2*A + exp(-B) - 3*A");

        assertEquals(List.of("k1", "k2", "A", "B"), List.copyOf(names));
    }

    @Test
    void emptyInputProducesNoTokens() {
        assertTrue(MathLexer.tokenize("   ").isEmpty());
        assertTrue(MathLexer.identifierNames("").isEmpty());
    }
}

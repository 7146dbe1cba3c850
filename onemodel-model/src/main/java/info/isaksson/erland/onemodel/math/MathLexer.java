package info.isaksson.erland.onemodel.math;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lexes a math expression into a flat token sequence.
 *
 * <p>The lexer is total: whitespace is skipped and any character that is not part of an
 * identifier, number or operator comes out as a single {@link MathTokenType#PUNCT} token, so a
 * consumer that only rewrites some tokens loses nothing.</p>
 */
public final class MathLexer {

    static final String OPERATORS = "+-*/^";

    private MathLexer() {}

    public static List<MathToken> tokenize(String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        List<MathToken> out = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (isIdentifierStart(c)) {
                int start = i;
                while (i < n && isIdentifierPart(text.charAt(i))) i++;
                out.add(new MathToken(MathTokenType.IDENTIFIER, text.substring(start, i), start));
            } else if (isDigit(c) || (c == '.' && i + 1 < n && isDigit(text.charAt(i + 1)))) {
                int end = scanNumber(text, i);
                out.add(new MathToken(MathTokenType.NUMBER, text.substring(i, end), i));
                i = end;
            } else if (OPERATORS.indexOf(c) >= 0) {
                out.add(new MathToken(MathTokenType.OPERATOR, String.valueOf(c), i));
                i++;
            } else {
                out.add(new MathToken(MathTokenType.PUNCT, String.valueOf(c), i));
                i++;
            }
        }
        return out;
    }

    /**
     * Names of the identifiers referenced by {@code text}, in first-occurrence order.
     *
     * <p>Function names (an identifier directly followed by {@code (}) are not references and are
     * left out, as are numbers and operators.</p>
     */
    public static Set<String> identifierNames(String text) {
        List<MathToken> tokens = tokenize(text);
        Set<String> out = new LinkedHashSet<>();
        for (int i = 0; i < tokens.size(); i++) {
            MathToken t = tokens.get(i);
            if (t.type != MathTokenType.IDENTIFIER) continue;
            boolean call = i + 1 < tokens.size() && tokens.get(i + 1).is(MathTokenType.PUNCT, "(");
            if (!call) out.add(t.value);
        }
        return Collections.unmodifiableSet(out);
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    /** digits [. digits] [(e|E) [+|-] digits]; an exponent marker without digits is not consumed. */
    private static int scanNumber(String text, int start) {
        int n = text.length();
        int i = start;
        while (i < n && isDigit(text.charAt(i))) i++;
        if (i < n && text.charAt(i) == '.') {
            i++;
            while (i < n && isDigit(text.charAt(i))) i++;
        }
        if (i < n && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < n && (text.charAt(j) == '+' || text.charAt(j) == '-')) j++;
            if (j < n && isDigit(text.charAt(j))) {
                while (j < n && isDigit(text.charAt(j))) j++;
                i = j;
            }
        }
        return i;
    }
}

package info.isaksson.erland.onemodel.math;

import info.isaksson.erland.onemodel.error.SerializationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser from {@link MathLexer} tokens to a binary {@link MathExpr} tree.
 *
 * <p>Precedence, lowest first: {@code + -}, {@code * /}, prefix {@code - +}, {@code ^}
 * (right-associative), primaries (number, identifier, call, parenthesised group).
 * Binary operators of equal precedence associate to the left.</p>
 */
public final class MathParser {

    private final String source;
    private final List<MathToken> tokens;
    private int pos;

    private MathParser(String source) {
        this.source = source;
        this.tokens = MathLexer.tokenize(source);
    }

    /**
     * @throws SerializationException when the tokens do not form a single well-formed expression
     */
    public static MathExpr parse(String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        MathParser p = new MathParser(text);
        if (p.tokens.isEmpty()) {
            throw new SerializationException(text, "empty expression");
        }
        MathExpr expr = p.expression();
        if (p.pos < p.tokens.size()) {
            throw p.error("unexpected '" + p.peek().value + "'");
        }
        return expr;
    }

    private MathExpr expression() {
        MathExpr left = term();
        while (peekOperator('+') || peekOperator('-')) {
            char op = next().value.charAt(0);
            left = new MathBinary(op, left, term());
        }
        return left;
    }

    private MathExpr term() {
        MathExpr left = unary();
        while (peekOperator('*') || peekOperator('/')) {
            char op = next().value.charAt(0);
            left = new MathBinary(op, left, unary());
        }
        return left;
    }

    private MathExpr unary() {
        if (peekOperator('-') || peekOperator('+')) {
            char op = next().value.charAt(0);
            return new MathUnary(op, unary());
        }
        return power();
    }

    private MathExpr power() {
        MathExpr base = primary();
        if (peekOperator('^')) {
            next();
            // right-associative; the exponent may carry its own sign (2^-1)
            return new MathBinary('^', base, unary());
        }
        return base;
    }

    private MathExpr primary() {
        if (pos >= tokens.size()) {
            throw error("unexpected end of expression");
        }
        MathToken t = next();
        switch (t.type) {
            case NUMBER:
                return new MathNumber(t.value);
            case IDENTIFIER:
                if (peekPunct('(')) {
                    next();
                    return new MathCall(t.value, arguments());
                }
                return new MathIdentifier(t.value);
            case PUNCT:
                if (t.value.equals("(")) {
                    MathExpr inner = expression();
                    expectPunct(')');
                    return new MathGroup(inner);
                }
                throw error("unexpected '" + t.value + "'", t);
            case OPERATOR:
            default:
                throw error("unexpected operator '" + t.value + "'", t);
        }
    }

    private List<MathExpr> arguments() {
        List<MathExpr> args = new ArrayList<>();
        if (peekPunct(')')) {
            next();
            return args;
        }
        args.add(expression());
        while (peekPunct(',')) {
            next();
            args.add(expression());
        }
        expectPunct(')');
        return args;
    }

    private void expectPunct(char c) {
        if (!peekPunct(c)) {
            throw error(pos < tokens.size() ? "expected '" + c + "' but found '" + peek().value + "'" : "missing '" + c + "'");
        }
        next();
    }

    private boolean peekOperator(char c) {
        return pos < tokens.size() && tokens.get(pos).type == MathTokenType.OPERATOR && tokens.get(pos).value.charAt(0) == c;
    }

    private boolean peekPunct(char c) {
        return pos < tokens.size() && tokens.get(pos).type == MathTokenType.PUNCT && tokens.get(pos).value.charAt(0) == c;
    }

    private MathToken peek() {
        return tokens.get(pos);
    }

    private MathToken next() {
        return tokens.get(pos++);
    }

    private SerializationException error(String reason) {
        return pos < tokens.size() ? error(reason, peek()) : new SerializationException(source, reason);
    }

    private SerializationException error(String reason, MathToken at) {
        return new SerializationException(source, reason + " at offset " + at.position);
    }
}

package info.isaksson.erland.onemodel.math;

public enum MathTokenType {
    IDENTIFIER,
    OPERATOR,
    NUMBER,
    /** Parentheses, commas and any character the lexer does not recognise, verbatim. */
    PUNCT
}

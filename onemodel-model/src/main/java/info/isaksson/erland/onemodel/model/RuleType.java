package info.isaksson.erland.onemodel.model;

public enum RuleType {
    /** {@code variable = expression}, evaluated directly (a substitution state). */
    ASSIGNMENT,
    /** {@code 0 = expression - variable}, solved together with the ODEs. */
    ALGEBRAIC
}

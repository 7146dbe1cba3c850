package info.isaksson.erland.onemodel.math;

/**
 * Node of the expression tree shared by the MathML and Matlab renderers.
 *
 * <p>Built once from the token stream by {@link MathParser}; each backend is a
 * {@link MathVisitor} over the same tree.</p>
 */
public abstract class MathExpr {

    MathExpr() {}

    public abstract <R> R accept(MathVisitor<R> visitor);

    /** Infix source form, parentheses as written. */
    @Override
    public String toString() {
        return accept(new MathTextRenderer());
    }
}

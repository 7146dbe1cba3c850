package info.isaksson.erland.onemodel.math;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/** Tree utilities used by the name resolver and the exporters. */
public final class MathExpressions {

    private MathExpressions() {}

    /** Variable references in left-to-right order, without function names. */
    public static Set<String> identifiers(MathExpr expr) {
        Set<String> out = new LinkedHashSet<>();
        collect(expr, out);
        return Collections.unmodifiableSet(out);
    }

    /** Copy of {@code expr} with every variable reference renamed by {@code renamer}. */
    public static MathExpr rename(MathExpr expr, UnaryOperator<String> renamer) {
        return expr.accept(new MathVisitor<MathExpr>() {
            @Override
            public MathExpr visitNumber(MathNumber node) {
                return node;
            }

            @Override
            public MathExpr visitIdentifier(MathIdentifier node) {
                return new MathIdentifier(renamer.apply(node.name));
            }

            @Override
            public MathExpr visitUnary(MathUnary node) {
                return new MathUnary(node.operator, node.operand.accept(this));
            }

            @Override
            public MathExpr visitBinary(MathBinary node) {
                return new MathBinary(node.operator, node.left.accept(this), node.right.accept(this));
            }

            @Override
            public MathExpr visitGroup(MathGroup node) {
                return new MathGroup(node.inner.accept(this));
            }

            @Override
            public MathExpr visitCall(MathCall node) {
                List<MathExpr> args = new ArrayList<>();
                for (MathExpr a : node.arguments) args.add(a.accept(this));
                return new MathCall(node.function, args);
            }
        });
    }

    private static void collect(MathExpr expr, Set<String> out) {
        if (expr instanceof MathIdentifier id) {
            out.add(id.name);
        } else if (expr instanceof MathUnary u) {
            collect(u.operand, out);
        } else if (expr instanceof MathBinary b) {
            collect(b.left, out);
            collect(b.right, out);
        } else if (expr instanceof MathGroup g) {
            collect(g.inner, out);
        } else if (expr instanceof MathCall c) {
            for (MathExpr a : c.arguments) collect(a, out);
        }
    }
}

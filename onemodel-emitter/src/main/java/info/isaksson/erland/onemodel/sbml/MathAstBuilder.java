package info.isaksson.erland.onemodel.sbml;

import info.isaksson.erland.onemodel.error.SerializationException;
import info.isaksson.erland.onemodel.math.MathBinary;
import info.isaksson.erland.onemodel.math.MathCall;
import info.isaksson.erland.onemodel.math.MathExpr;
import info.isaksson.erland.onemodel.math.MathGroup;
import info.isaksson.erland.onemodel.math.MathIdentifier;
import info.isaksson.erland.onemodel.math.MathNumber;
import info.isaksson.erland.onemodel.math.MathUnary;
import info.isaksson.erland.onemodel.math.MathVisitor;
import org.sbml.jsbml.ASTNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts an expression tree into a JSBML {@link ASTNode} for use as SBML math.
 *
 * <p>Chains of {@code +} and {@code *} become a single n-ary node; parentheses only shape the
 * tree and leave no trace in the result. Calls to known functions map to their MathML
 * operators, any other call becomes a user function reference.</p>
 */
public final class MathAstBuilder implements MathVisitor<ASTNode> {

    private static final Map<String, ASTNode.Type> FUNCTIONS = Map.ofEntries(
            Map.entry("exp", ASTNode.Type.FUNCTION_EXP),
            Map.entry("ln", ASTNode.Type.FUNCTION_LN),
            Map.entry("log", ASTNode.Type.FUNCTION_LOG),
            Map.entry("sin", ASTNode.Type.FUNCTION_SIN),
            Map.entry("cos", ASTNode.Type.FUNCTION_COS),
            Map.entry("tan", ASTNode.Type.FUNCTION_TAN),
            Map.entry("abs", ASTNode.Type.FUNCTION_ABS),
            Map.entry("floor", ASTNode.Type.FUNCTION_FLOOR),
            Map.entry("ceiling", ASTNode.Type.FUNCTION_CEILING),
            Map.entry("sqrt", ASTNode.Type.FUNCTION_ROOT),
            Map.entry("pow", ASTNode.Type.POWER)
    );

    private static final MathAstBuilder INSTANCE = new MathAstBuilder();

    private MathAstBuilder() {}

    public static ASTNode toAst(MathExpr expr) {
        if (expr == null) throw new IllegalArgumentException("expr must not be null");
        return expr.accept(INSTANCE);
    }

    @Override
    public ASTNode visitNumber(MathNumber node) {
        if (node.hasExponent()) {
            return new ASTNode(Double.parseDouble(node.mantissa()), Integer.parseInt(node.exponent()));
        }
        if (node.isInteger()) {
            try {
                return new ASTNode(Integer.parseInt(node.text));
            } catch (NumberFormatException tooLarge) {
                return new ASTNode(node.doubleValue());
            }
        }
        return new ASTNode(node.doubleValue());
    }

    @Override
    public ASTNode visitIdentifier(MathIdentifier node) {
        return new ASTNode(node.name);
    }

    @Override
    public ASTNode visitUnary(MathUnary node) {
        if (node.operator == '+') {
            return node.operand.accept(this);
        }
        return apply(new ASTNode(ASTNode.Type.MINUS), List.of(node.operand));
    }

    @Override
    public ASTNode visitBinary(MathBinary node) {
        List<MathExpr> operands = new ArrayList<>();
        if (node.operator == '+' || node.operator == '*') {
            collectChain(node, node.operator, operands);
        } else {
            operands.add(node.left);
            operands.add(node.right);
        }
        return apply(new ASTNode(operatorType(node.operator)), operands);
    }

    @Override
    public ASTNode visitGroup(MathGroup node) {
        return node.inner.accept(this);
    }

    @Override
    public ASTNode visitCall(MathCall node) {
        ASTNode.Type type = FUNCTIONS.get(node.function);
        ASTNode head;
        if (type != null) {
            head = new ASTNode(type);
        } else {
            head = new ASTNode(ASTNode.Type.FUNCTION);
            head.setName(node.function);
        }
        return apply(head, node.arguments);
    }

    private static void collectChain(MathExpr expr, char operator, List<MathExpr> out) {
        if (expr instanceof MathBinary && ((MathBinary) expr).operator == operator) {
            MathBinary b = (MathBinary) expr;
            collectChain(b.left, operator, out);
            out.add(b.right);
        } else {
            out.add(expr);
        }
    }

    private static ASTNode.Type operatorType(char operator) {
        switch (operator) {
            case '+': return ASTNode.Type.PLUS;
            case '-': return ASTNode.Type.MINUS;
            case '*': return ASTNode.Type.TIMES;
            case '/': return ASTNode.Type.DIVIDE;
            case '^': return ASTNode.Type.POWER;
            default:
                throw new SerializationException(String.valueOf(operator), "no MathML operator for '" + operator + "'");
        }
    }

    private ASTNode apply(ASTNode head, List<MathExpr> operands) {
        for (MathExpr operand : operands) {
            head.addChild(operand.accept(this));
        }
        return head;
    }
}

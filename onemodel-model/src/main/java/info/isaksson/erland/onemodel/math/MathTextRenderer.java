package info.isaksson.erland.onemodel.math;

/**
 * Renders an expression back to compact infix text (no inserted whitespace).
 *
 * <p>Subclasses customise identifiers and operators, e.g. to prefix parameters or switch to
 * element-wise operators. Source parentheses are kept. Where the tree shape differs from what
 * left-to-right reading of the bare text gives, the operand is parenthesised as well: a power
 * whose base or exponent is itself a power, and any operand binding looser than its operator.
 * The text then means the same to {@link MathParser} (right-associative {@code ^}) and to
 * targets that group powers left to right.</p>
 */
public class MathTextRenderer implements MathVisitor<String> {

    public String render(MathExpr expr) {
        return expr.accept(this);
    }

    /** Text for a variable reference. */
    protected String identifier(String name) {
        return name;
    }

    /** Text for a binary operator. */
    protected String binaryOperator(char operator) {
        return String.valueOf(operator);
    }

    /** Text for a called function's name. */
    protected String function(String name) {
        return name;
    }

    @Override
    public String visitNumber(MathNumber node) {
        return node.text;
    }

    @Override
    public String visitIdentifier(MathIdentifier node) {
        return identifier(node.name);
    }

    @Override
    public String visitUnary(MathUnary node) {
        String operand = node.operand.accept(this);
        if (node.operand instanceof MathBinary && precedence(((MathBinary) node.operand).operator) < 3) {
            operand = "(" + operand + ")";
        }
        return node.operator + operand;
    }

    @Override
    public String visitBinary(MathBinary node) {
        int own = precedence(node.operator);
        String left = node.left.accept(this);
        String right = node.right.accept(this);
        if (node.left instanceof MathBinary) {
            int p = precedence(((MathBinary) node.left).operator);
            if (p < own || (node.operator == '^' && p == own)) left = "(" + left + ")";
        }
        if (node.right instanceof MathBinary && precedence(((MathBinary) node.right).operator) <= own) {
            right = "(" + right + ")";
        }
        return left + binaryOperator(node.operator) + right;
    }

    @Override
    public String visitGroup(MathGroup node) {
        return "(" + node.inner.accept(this) + ")";
    }

    static int precedence(char operator) {
        switch (operator) {
            case '+':
            case '-':
                return 1;
            case '*':
            case '/':
                return 2;
            default:
                return 3;
        }
    }

    @Override
    public String visitCall(MathCall node) {
        StringBuilder sb = new StringBuilder(function(node.function)).append('(');
        for (int i = 0; i < node.arguments.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(node.arguments.get(i).accept(this));
        }
        return sb.append(')').toString();
    }
}

package info.isaksson.erland.onemodel.model;

import info.isaksson.erland.onemodel.error.InvalidAssignmentException;

import java.util.Locale;

/**
 * Binds a species to an expression instead of letting reactions drive it.
 *
 * <p>Like reaction participants, {@link #getVariable() variable} is an unqualified name resolved
 * outward from the rule's scope at flatten time.</p>
 */
public class OmRule extends OmObject {

    private RuleType ruleType = RuleType.ASSIGNMENT;
    private String variable;
    private String expression;

    public OmRule() {
    }

    public OmRule(RuleType ruleType, String variable, String expression) {
        this.ruleType = ruleType == null ? RuleType.ASSIGNMENT : ruleType;
        this.variable = variable;
        this.expression = expression;
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.RULE;
    }

    public RuleType getRuleType() {
        return ruleType;
    }

    public void setRuleType(RuleType ruleType) {
        this.ruleType = ruleType == null ? RuleType.ASSIGNMENT : ruleType;
    }

    public String getVariable() {
        return variable;
    }

    public void setVariable(String variable) {
        this.variable = variable;
    }

    public String getExpression() {
        return expression;
    }

    public void setExpression(String expression) {
        this.expression = expression;
    }

    @Override
    protected boolean assignAttribute(String name, Value v) {
        switch (name) {
            case "variable":
                variable = v.kind == ValueKind.OBJECT ? v.asObject().getName() : requireText(name, v);
                return true;
            case "expression":
                expression = v.isNumber() ? Numbers.format(v.asNumber()) : requireText(name, v);
                return true;
            case "rule_type":
                try {
                    ruleType = RuleType.valueOf(requireText(name, v).trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException ex) {
                    throw new InvalidAssignmentException(pathString(), name, "ASSIGNMENT or ALGEBRAIC", v.describe());
                }
                return true;
            default:
                return false;
        }
    }

    @Override
    protected Value readAttribute(String name) {
        switch (name) {
            case "variable":
                return variable == null ? Value.NONE : Value.string(variable);
            case "expression":
                return expression == null ? Value.NONE : Value.string(expression);
            case "rule_type":
                return Value.string(ruleType.name());
            default:
                return null;
        }
    }

    @Override
    protected OmObject newInstance() {
        return new OmRule();
    }

    @Override
    protected void copyInto(OmObject target) {
        super.copyInto(target);
        OmRule r = (OmRule) target;
        r.ruleType = ruleType;
        r.variable = variable;
        r.expression = expression;
    }
}

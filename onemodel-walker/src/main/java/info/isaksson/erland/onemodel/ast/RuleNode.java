package info.isaksson.erland.onemodel.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.onemodel.model.RuleType;

import java.util.Objects;

/** {@code rule C := A + B} (assignment) or {@code rule 0 = C - A} (algebraic). */
@JsonPropertyOrder({"name", "variable", "expression", "ruleType"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RuleNode extends SyntaxNode {

    public final DottedNameNode name;
    public final String variable;
    public final String expression;
    public final RuleType ruleType;

    @JsonCreator
    public RuleNode(
            @JsonProperty("name") DottedNameNode name,
            @JsonProperty("variable") String variable,
            @JsonProperty("expression") String expression,
            @JsonProperty("ruleType") RuleType ruleType
    ) {
        if (variable == null || variable.isBlank()) throw new IllegalArgumentException("rule without a variable");
        if (expression == null || expression.isBlank()) throw new IllegalArgumentException("rule without an expression");
        this.name = name;
        this.variable = variable;
        this.expression = expression;
        this.ruleType = ruleType == null ? RuleType.ASSIGNMENT : ruleType;
    }

    @Override
    public <R> R accept(SyntaxNodeVisitor<R> visitor) {
        return visitor.visitRule(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RuleNode)) return false;
        RuleNode that = (RuleNode) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(variable, that.variable) &&
                Objects.equals(expression, that.expression) &&
                ruleType == that.ruleType;
    }

    @Override public int hashCode() {
        return Objects.hash(name, variable, expression, ruleType);
    }
}

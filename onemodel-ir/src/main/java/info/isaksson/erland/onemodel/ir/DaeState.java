package info.isaksson.erland.onemodel.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A state variable with exactly one equation.
 *
 * <p>{@code initialCondition} is only meaningful for {@link StateType#isIndexed() indexed}
 * states; substitution states are recomputed from their equation.</p>
 */
@JsonPropertyOrder({"id","type","equation","initialCondition","comment","equationComment"})
public final class DaeState {
    public final String id;
    public final StateType type;
    public final String equation;
    public final double initialCondition;
    public final String comment;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final String equationComment;

    @JsonCreator
    public DaeState(
            @JsonProperty("id") String id,
            @JsonProperty("type") StateType type,
            @JsonProperty("equation") String equation,
            @JsonProperty("initialCondition") double initialCondition,
            @JsonProperty("comment") String comment,
            @JsonProperty("equationComment") String equationComment
    ) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("state id must not be blank");
        if (type == null) throw new IllegalArgumentException("state '" + id + "' has no type");
        if (equation == null || equation.isBlank()) throw new IllegalArgumentException("state '" + id + "' has no equation");
        this.id = id;
        this.type = type;
        this.equation = equation;
        this.initialCondition = initialCondition;
        this.comment = comment == null ? "" : comment;
        this.equationComment = equationComment == null ? "" : equationComment;
    }

    /** Convenience constructor without an equation comment. */
    public DaeState(String id, StateType type, String equation, double initialCondition, String comment) {
        this(id, type, equation, initialCondition, comment, null);
    }

    public Equation toEquation() {
        return new Equation(type, equation, equationComment);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DaeState)) return false;
        DaeState that = (DaeState) o;
        return Double.compare(initialCondition, that.initialCondition) == 0 &&
                Objects.equals(id, that.id) &&
                type == that.type &&
                Objects.equals(equation, that.equation) &&
                Objects.equals(comment, that.comment) &&
                Objects.equals(equationComment, that.equationComment);
    }

    @Override public int hashCode() {
        return Objects.hash(id, type, equation, initialCondition, comment, equationComment);
    }
}

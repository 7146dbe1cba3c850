package info.isaksson.erland.onemodel.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"id","value","comment"})
public final class DaeParameter {
    public final String id;
    public final double value;
    public final String comment;

    @JsonCreator
    public DaeParameter(
            @JsonProperty("id") String id,
            @JsonProperty("value") double value,
            @JsonProperty("comment") String comment
    ) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("parameter id must not be blank");
        this.id = id;
        this.value = value;
        this.comment = comment == null ? "" : comment;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DaeParameter)) return false;
        DaeParameter that = (DaeParameter) o;
        return Double.compare(value, that.value) == 0 &&
                Objects.equals(id, that.id) &&
                Objects.equals(comment, that.comment);
    }

    @Override public int hashCode() {
        return Objects.hash(id, value, comment);
    }
}

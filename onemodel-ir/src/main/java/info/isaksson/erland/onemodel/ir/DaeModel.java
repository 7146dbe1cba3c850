package info.isaksson.erland.onemodel.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Serializable DAE model: parameters, states with equations, and simulation options.
 *
 * <p>This is the exchange format between the reaction-network compiler and the numerical
 * backends, and the input of the "already-resolved model" entry point.</p>
 */
@JsonPropertyOrder({"schemaVersion","name","parameters","states","options"})
public final class DaeModel implements ModelAccessor {

    public static final String SCHEMA_VERSION = "1.0";

    public final String schemaVersion;
    public final String name;
    public final List<DaeParameter> parameters;
    public final List<DaeState> states;
    public final Map<String, Object> options;

    @JsonCreator
    public DaeModel(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("name") String name,
            @JsonProperty("parameters") List<DaeParameter> parameters,
            @JsonProperty("states") List<DaeState> states,
            @JsonProperty("options") Map<String, Object> options
    ) {
        this.schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
        this.name = name == null || name.isBlank() ? "main" : name;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.states = states == null ? List.of() : List.copyOf(states);
        this.options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
        checkUniqueIds();
    }

    public DaeModel(String name, List<DaeParameter> parameters, List<DaeState> states, Map<String, Object> options) {
        this(SCHEMA_VERSION, name, parameters, states, options);
    }

    /** Default simulation options: {@code t_init = 0}, {@code t_end = 10}. */
    public static Map<String, Object> defaultOptions() {
        Map<String, Object> o = new LinkedHashMap<>();
        o.put("t_init", 0);
        o.put("t_end", 10);
        return o;
    }

    @JsonIgnore
    @Override
    public String getModelName() {
        return name;
    }

    @Override
    public List<DaeParameter> getParameters() {
        return parameters;
    }

    @Override
    public List<DaeState> getStates() {
        return states;
    }

    @Override
    public Map<String, Object> getOptions() {
        return options;
    }

    private void checkUniqueIds() {
        Set<String> seen = new HashSet<>();
        for (DaeParameter p : parameters) {
            if (!seen.add(p.id)) throw new IllegalArgumentException("duplicate id in DAE model: " + p.id);
        }
        for (DaeState s : states) {
            if (!seen.add(s.id)) throw new IllegalArgumentException("duplicate id in DAE model: " + s.id);
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DaeModel)) return false;
        DaeModel that = (DaeModel) o;
        return Objects.equals(schemaVersion, that.schemaVersion) &&
                Objects.equals(name, that.name) &&
                Objects.equals(parameters, that.parameters) &&
                Objects.equals(states, that.states) &&
                Objects.equals(options, that.options);
    }

    @Override public int hashCode() {
        return Objects.hash(schemaVersion, name, parameters, states, options);
    }
}

package info.isaksson.erland.onemodel.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A non-fatal deterministic finding produced while building or exporting a model. */
public final class ModelWarning {

    /** Re-declaration at an existing namespace path. The old binding was replaced. */
    public static final String REDECLARATION = "REDECLARATION";

    /** A species has a rule and also takes part in reactions; the rule wins. */
    public static final String RULE_OVERRIDES_REACTIONS = "RULE_OVERRIDES_REACTIONS";

    /** A reaction has no kinetic law and contributes nothing to the equations. */
    public static final String MISSING_KINETIC_LAW = "MISSING_KINETIC_LAW";

    /** Warning code stable across versions. */
    public final String code;

    /** Human-readable message. */
    public final String message;

    /** Optional structured context (stable keys recommended). */
    public final Map<String, String> context;

    public ModelWarning(String code, String message, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    /**
     * The model element the warning is about: the value of the first context entry, by
     * convention the path or id of that element. Empty when there is no context.
     */
    public String subject() {
        if (context.isEmpty()) return "";
        return context.values().iterator().next();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelWarning)) return false;
        ModelWarning that = (ModelWarning) o;
        return code.equals(that.code) && message.equals(that.message) && context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, context);
    }

    @Override
    public String toString() {
        String subject = subject();
        return subject.isEmpty() ? code + ": " + message : code + " [" + subject + "]: " + message;
    }
}

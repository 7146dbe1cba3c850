package info.isaksson.erland.onemodel.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class of every fatal compilation error.
 *
 * <p>Each error carries a stable {@code code} (the abstract error kind) and a small context map
 * with the qualified path, variable name or expression text that pinpoints the offending
 * declaration. Any of these aborts the current export; no partial output is valid.</p>
 */
public class OneModelException extends RuntimeException {

    private final String code;
    private final Map<String, String> context;

    public OneModelException(String code, String message, Map<String, String> context) {
        this(code, message, context, null);
    }

    public OneModelException(String code, String message, Map<String, String> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    /** Stable error kind, e.g. {@code UndefinedNamespaceError}. */
    public String getCode() {
        return code;
    }

    public Map<String, String> getContext() {
        return context;
    }

    static Map<String, String> ctx(String k1, String v1) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put(k1, v1);
        return m;
    }

    static Map<String, String> ctx(String k1, String v1, String k2, String v2) {
        Map<String, String> m = ctx(k1, v1);
        m.put(k2, v2);
        return m;
    }

    static Map<String, String> ctx(String k1, String v1, String k2, String v2, String k3, String v3) {
        Map<String, String> m = ctx(k1, v1, k2, v2);
        m.put(k3, v3);
        return m;
    }
}

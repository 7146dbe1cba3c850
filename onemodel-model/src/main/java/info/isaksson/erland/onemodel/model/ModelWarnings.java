package info.isaksson.erland.onemodel.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Collects warnings during a compilation run.
 *
 * <p>The same finding is often reached more than once (a rule is seen once per reaction touching
 * its species, a redeclared name once per assignment), so identical warnings are kept once.
 * Final output is grouped by code and then by the element the warning is about
 * ({@link ModelWarning#subject()}), which keeps all warnings for one species or reaction
 * together in reports.</p>
 */
public final class ModelWarnings {

    private static final Logger log = LoggerFactory.getLogger(ModelWarnings.class);

    private static final Comparator<ModelWarning> ORDER = Comparator
            .comparing((ModelWarning w) -> w.code)
            .thenComparing(ModelWarning::subject)
            .thenComparing(w -> w.message)
            .thenComparing(w -> contextString(w.context));

    private final Set<ModelWarning> warnings = new LinkedHashSet<>();

    /**
     * Record a warning with context given as alternating keys and values, the subject first:
     * {@code warn(code, msg, "species", id, "rule", ruleId)}.
     */
    public void warn(String code, String message, String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("context needs key/value pairs, got " + keyValues.length + " strings");
        }
        Map<String, String> ctx = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            ctx.put(keyValues[i], keyValues[i + 1]);
        }
        warn(code, message, ctx);
    }

    public void warn(String code, String message, Map<String, String> context) {
        ModelWarning w = new ModelWarning(code, message, context == null ? Collections.emptyMap() : context);
        if (warnings.add(w)) {
            log.warn("{}", w);
        } else {
            log.debug("repeated warning {}", w);
        }
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public int size() {
        return warnings.size();
    }

    public List<ModelWarning> toDeterministicList() {
        List<ModelWarning> out = new ArrayList<>(warnings);
        out.sort(ORDER);
        return Collections.unmodifiableList(out);
    }

    public Map<String, Integer> countByCode() {
        return countByCode(warnings);
    }

    /** Number of warnings per code, codes in alphabetical order. */
    public static Map<String, Integer> countByCode(Collection<ModelWarning> warnings) {
        Map<String, Integer> counts = new TreeMap<>();
        for (ModelWarning w : warnings) {
            counts.merge(w.code, 1, Integer::sum);
        }
        return counts;
    }

    private static String contextString(Map<String, String> ctx) {
        if (ctx == null || ctx.isEmpty()) return "";
        // key-sorted so insertion order of the context map does not matter
        List<String> keys = new ArrayList<>(ctx.keySet());
        keys.sort(String::compareTo);
        StringBuilder sb = new StringBuilder();
        for (String k : keys) {
            sb.append(k).append('=').append(ctx.get(k)).append(';');
        }
        return sb.toString();
    }
}

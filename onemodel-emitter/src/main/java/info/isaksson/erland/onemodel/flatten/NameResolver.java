package info.isaksson.erland.onemodel.flatten;

import info.isaksson.erland.onemodel.model.ObjectKind;
import info.isaksson.erland.onemodel.model.OmObject;

import java.util.EnumSet;
import java.util.Set;

/**
 * Outward name lookup: a scope first, then each ancestor up to the root.
 *
 * <p>Only entities of the accepted kinds match. A nearer binding of another kind does not hide
 * an outer match, so a reaction named {@code A} does not shadow species {@code A} of its
 * parent scope.</p>
 */
public final class NameResolver {

    public static final Set<ObjectKind> SPECIES = EnumSet.of(ObjectKind.SPECIES);
    public static final Set<ObjectKind> SYMBOLS = EnumSet.of(ObjectKind.PARAMETER, ObjectKind.SPECIES);

    private NameResolver() {}

    /** @return the nearest match, or {@code null} when no scope in the chain binds {@code name} */
    public static OmObject resolve(OmObject scope, String name, Set<ObjectKind> kinds) {
        for (OmObject ns = scope; ns != null; ns = ns.getParent()) {
            OmObject candidate = ns.get(name);
            if (candidate != null && kinds.contains(candidate.kind())) {
                return candidate;
            }
        }
        return null;
    }
}

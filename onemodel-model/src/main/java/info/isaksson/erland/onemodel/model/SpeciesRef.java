package info.isaksson.erland.onemodel.model;

import java.util.Objects;

/**
 * One reactant or product of a reaction.
 *
 * <p>A reference written as a name is looked up through the enclosing scopes when the model is
 * flattened. A reference assigned an object ({@code J1.products = [foo.B]}) is bound to that
 * object and never looked up by name.</p>
 */
public final class SpeciesRef {

    public final String name;
    private final OmObject target;

    private SpeciesRef(String name, OmObject target) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.target = target;
    }

    public static SpeciesRef named(String name) {
        return new SpeciesRef(name, null);
    }

    public static SpeciesRef bound(OmObject target) {
        Objects.requireNonNull(target, "target must not be null");
        if (target.getName() == null) {
            throw new IllegalArgumentException("bound species reference needs a named object");
        }
        return new SpeciesRef(target.getName(), target);
    }

    public boolean isBound() {
        return target != null;
    }

    /** The assigned object, or {@code null} for a name reference. */
    public OmObject getTarget() {
        return target;
    }

    Value toValue() {
        return target != null ? Value.object(target) : Value.string(name);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SpeciesRef)) return false;
        SpeciesRef that = (SpeciesRef) o;
        return name.equals(that.name) && target == that.target;
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + System.identityHashCode(target);
    }

    @Override
    public String toString() {
        return target != null ? target.pathString() : name;
    }
}

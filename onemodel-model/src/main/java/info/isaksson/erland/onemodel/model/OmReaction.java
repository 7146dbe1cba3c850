package info.isaksson.erland.onemodel.model;

import info.isaksson.erland.onemodel.error.InvalidAssignmentException;

import java.util.ArrayList;
import java.util.List;

/**
 * An irreversible reaction.
 *
 * <p>Reactant and product names are stored unqualified, exactly as written. They are resolved
 * against the enclosing scopes when the model is flattened, never at declaration time, so a
 * reaction may name a species declared later or in an ancestor scope. Species assigned as
 * objects stay bound to that object; see {@link SpeciesRef}.</p>
 */
public class OmReaction extends OmObject {

    private final List<SpeciesRef> reactants = new ArrayList<>();
    private final List<SpeciesRef> products = new ArrayList<>();
    private String kineticLaw;

    @Override
    public ObjectKind kind() {
        return ObjectKind.REACTION;
    }

    /** Reactant names as written. */
    public List<String> getReactants() {
        return names(reactants);
    }

    public List<SpeciesRef> getReactantRefs() {
        return List.copyOf(reactants);
    }

    public void setReactants(List<String> names) {
        replace(reactants, names);
    }

    public void setReactantRefs(List<SpeciesRef> refs) {
        reactants.clear();
        if (refs != null) reactants.addAll(refs);
    }

    /** Product names as written. */
    public List<String> getProducts() {
        return names(products);
    }

    public List<SpeciesRef> getProductRefs() {
        return List.copyOf(products);
    }

    public void setProducts(List<String> names) {
        replace(products, names);
    }

    public void setProductRefs(List<SpeciesRef> refs) {
        products.clear();
        if (refs != null) products.addAll(refs);
    }

    /** Rate expression in local names; {@code null} until assigned. */
    public String getKineticLaw() {
        return kineticLaw;
    }

    public void setKineticLaw(String kineticLaw) {
        this.kineticLaw = kineticLaw;
    }

    @Override
    protected boolean assignAttribute(String name, Value v) {
        switch (name) {
            case "reactants":
                setReactantRefs(toRefs(name, v));
                return true;
            case "products":
                setProductRefs(toRefs(name, v));
                return true;
            case "kinetic_law":
                if (v.isNumber()) {
                    kineticLaw = Numbers.format(v.asNumber());
                } else {
                    kineticLaw = requireText(name, v);
                }
                return true;
            default:
                return false;
        }
    }

    @Override
    protected Value readAttribute(String name) {
        switch (name) {
            case "reactants":
                return refsValue(reactants);
            case "products":
                return refsValue(products);
            case "kinetic_law":
                return kineticLaw == null ? Value.NONE : Value.string(kineticLaw);
            default:
                return null;
        }
    }

    /** A single species or a list of them, each given by name or as the species object. */
    private List<SpeciesRef> toRefs(String attribute, Value v) {
        List<SpeciesRef> out = new ArrayList<>();
        switch (v.kind) {
            case LIST:
                for (Value item : v.asList()) {
                    out.add(toRef(attribute, item));
                }
                break;
            case STRING:
            case OBJECT:
                out.add(toRef(attribute, v));
                break;
            default:
                throw new InvalidAssignmentException(pathString(), attribute, "a list of species names", v.describe());
        }
        return out;
    }

    private SpeciesRef toRef(String attribute, Value v) {
        if (v.kind == ValueKind.STRING) {
            return SpeciesRef.named(v.asText());
        }
        if (v.kind == ValueKind.OBJECT && v.asObject().getName() != null) {
            return SpeciesRef.bound(v.asObject());
        }
        throw new InvalidAssignmentException(pathString(), attribute, "a species name", v.describe());
    }

    private static void replace(List<SpeciesRef> refs, List<String> names) {
        refs.clear();
        if (names == null) return;
        for (String n : names) refs.add(SpeciesRef.named(n));
    }

    private static List<String> names(List<SpeciesRef> refs) {
        List<String> out = new ArrayList<>(refs.size());
        for (SpeciesRef r : refs) out.add(r.name);
        return List.copyOf(out);
    }

    private static Value refsValue(List<SpeciesRef> refs) {
        List<Value> items = new ArrayList<>();
        for (SpeciesRef r : refs) items.add(r.toValue());
        return Value.list(items);
    }

    @Override
    protected OmObject newInstance() {
        return new OmReaction();
    }

    @Override
    protected void copyInto(OmObject target) {
        super.copyInto(target);
        OmReaction r = (OmReaction) target;
        r.setReactantRefs(reactants);
        r.setProductRefs(products);
        r.kineticLaw = kineticLaw;
    }
}

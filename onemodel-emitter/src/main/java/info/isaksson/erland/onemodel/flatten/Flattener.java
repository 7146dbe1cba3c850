package info.isaksson.erland.onemodel.flatten;

import info.isaksson.erland.onemodel.error.DuplicateQualifiedIdException;
import info.isaksson.erland.onemodel.error.UnresolvedReferenceException;
import info.isaksson.erland.onemodel.model.ModelWarning;
import info.isaksson.erland.onemodel.model.ModelWarnings;
import info.isaksson.erland.onemodel.model.ObjectKind;
import info.isaksson.erland.onemodel.model.OmObject;
import info.isaksson.erland.onemodel.model.OmParameter;
import info.isaksson.erland.onemodel.model.OmReaction;
import info.isaksson.erland.onemodel.model.OmRule;
import info.isaksson.erland.onemodel.model.OmSpecies;
import info.isaksson.erland.onemodel.model.OneModel;
import info.isaksson.erland.onemodel.model.SpeciesRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a namespace tree into model-wide unique ids.
 *
 * <p>The id of an entity is the path of scope names from the root down to it, joined with
 * {@value #SEPARATOR}; entities declared in the root keep their own name. The traversal is
 * depth-first in child insertion order and that order is kept in every registry.</p>
 *
 * <p>Reactant, product and rule variable names are resolved after the traversal, so a reference
 * may point at a species declared later in an enclosing scope.</p>
 */
public final class Flattener {

    public static final String SEPARATOR = "__";

    private static final Logger log = LoggerFactory.getLogger(Flattener.class);

    private final ModelWarnings warnings;

    public Flattener() {
        this(new ModelWarnings());
    }

    public Flattener(ModelWarnings warnings) {
        this.warnings = warnings == null ? new ModelWarnings() : warnings;
    }

    public static String qualifiedId(OmObject entity) {
        return String.join(SEPARATOR, entity.path());
    }

    public FlatModel flatten(OneModel model) {
        if (model == null) throw new IllegalArgumentException("model must not be null");

        Collector c = new Collector();
        for (OmObject child : model.root().children()) {
            c.visit(child);
        }

        List<FlatReaction> reactions = new ArrayList<>();
        for (FlatEntry<OmReaction> e : c.reactions) {
            OmReaction r = e.entity;
            List<String> reactants = resolveRefs(c.ids, r, "reactant", r.getReactantRefs());
            List<String> products = resolveRefs(c.ids, r, "product", r.getProductRefs());
            FlatReaction fr = new FlatReaction(e.id, r, reactants, products);
            if (!fr.hasKineticLaw()) {
                warnings.warn(ModelWarning.MISSING_KINETIC_LAW,
                        "Reaction '" + e.id + "' has no kinetic law", "reaction", e.id);
            }
            reactions.add(fr);
        }

        List<FlatRule> rules = new ArrayList<>();
        for (FlatEntry<OmRule> e : c.rules) {
            String variable = e.entity.getVariable();
            String variableId = resolveSpecies(c.ids, e.entity, "variable", List.of(variable)).get(0);
            rules.add(new FlatRule(e.id, e.entity, variableId));
        }

        log.debug("flattened model '{}': {} parameters, {} species, {} reactions, {} rules",
                model.getName(), c.parameters.size(), c.species.size(), reactions.size(), rules.size());
        return new FlatModel(model.getName(), c.parameters, c.species, reactions, rules, c.ids);
    }

    private static List<String> resolveRefs(Map<OmObject, String> ids, OmReaction owner, String role, List<SpeciesRef> refs) {
        List<String> out = new ArrayList<>(refs.size());
        for (SpeciesRef ref : refs) {
            if (!ref.isBound()) {
                out.addAll(resolveSpecies(ids, owner, role, List.of(ref.name)));
                continue;
            }
            // a bound species must be part of this model; a detached copy has no id
            OmObject target = ref.getTarget();
            String id = ids.get(target);
            if (id == null || target.kind() != ObjectKind.SPECIES) {
                throw new UnresolvedReferenceException(owner.pathString(), role, target.pathString());
            }
            out.add(id);
        }
        return out;
    }

    private static List<String> resolveSpecies(Map<OmObject, String> ids, OmObject owner, String role, List<String> names) {
        List<String> out = new ArrayList<>(names.size());
        for (String name : names) {
            OmObject target = name == null ? null : NameResolver.resolve(owner.getParent(), name, NameResolver.SPECIES);
            if (target == null) {
                throw new UnresolvedReferenceException(owner.pathString(), role, String.valueOf(name));
            }
            out.add(ids.get(target));
        }
        return out;
    }

    /** Depth-first collection of typed entities. */
    private static final class Collector {
        final List<FlatEntry<OmParameter>> parameters = new ArrayList<>();
        final List<FlatEntry<OmSpecies>> species = new ArrayList<>();
        final List<FlatEntry<OmReaction>> reactions = new ArrayList<>();
        final List<FlatEntry<OmRule>> rules = new ArrayList<>();
        final IdentityHashMap<OmObject, String> ids = new IdentityHashMap<>();
        final Map<String, OmObject> byId = new HashMap<>();

        void visit(OmObject o) {
            switch (o.kind()) {
                case PARAMETER:
                    parameters.add(new FlatEntry<>(register(o), (OmParameter) o));
                    break;
                case SPECIES:
                    species.add(new FlatEntry<>(register(o), (OmSpecies) o));
                    break;
                case REACTION:
                    reactions.add(new FlatEntry<>(register(o), (OmReaction) o));
                    break;
                case RULE:
                    rules.add(new FlatEntry<>(register(o), (OmRule) o));
                    break;
                case GENERIC:
                default:
                    break;
            }
            for (OmObject child : o.children()) {
                visit(child);
            }
        }

        private String register(OmObject o) {
            String id = qualifiedId(o);
            OmObject previous = byId.putIfAbsent(id, o);
            if (previous != null) {
                throw new DuplicateQualifiedIdException(id, previous.pathString(), o.pathString());
            }
            ids.put(o, id);
            return id;
        }
    }
}

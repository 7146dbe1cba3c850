package info.isaksson.erland.onemodel.flatten;

import info.isaksson.erland.onemodel.math.MathExpr;
import info.isaksson.erland.onemodel.math.MathExpressions;
import info.isaksson.erland.onemodel.math.MathParser;
import info.isaksson.erland.onemodel.model.OmObject;
import info.isaksson.erland.onemodel.model.OmParameter;
import info.isaksson.erland.onemodel.model.OmSpecies;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registries produced by {@link Flattener}, in depth-first declaration order.
 *
 * <p>Expressions (kinetic laws, rule expressions) are stored with their local names. They are
 * translated to flattened ids on demand by {@link #resolveExpression}.</p>
 */
public final class FlatModel {

    private final String name;
    private final List<FlatEntry<OmParameter>> parameters;
    private final List<FlatEntry<OmSpecies>> species;
    private final List<FlatReaction> reactions;
    private final List<FlatRule> rules;
    private final Map<OmObject, String> ids;

    FlatModel(String name,
              List<FlatEntry<OmParameter>> parameters,
              List<FlatEntry<OmSpecies>> species,
              List<FlatReaction> reactions,
              List<FlatRule> rules,
              IdentityHashMap<OmObject, String> ids) {
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.species = List.copyOf(species);
        this.reactions = List.copyOf(reactions);
        this.rules = List.copyOf(rules);
        this.ids = Collections.unmodifiableMap(new IdentityHashMap<>(ids));
    }

    public String getName() {
        return name;
    }

    public List<FlatEntry<OmParameter>> getParameters() {
        return parameters;
    }

    public List<FlatEntry<OmSpecies>> getSpecies() {
        return species;
    }

    public List<FlatReaction> getReactions() {
        return reactions;
    }

    public List<FlatRule> getRules() {
        return rules;
    }

    /** Flattened id of a parameter, species, reaction or rule of this model; {@code null} otherwise. */
    public String idOf(OmObject entity) {
        return ids.get(entity);
    }

    /**
     * Parse {@code text} and replace every identifier that names a parameter or species visible
     * from {@code owner}'s scope by its flattened id. Other identifiers are kept as written.
     */
    public MathExpr resolveExpression(OmObject owner, String text) {
        MathExpr parsed = MathParser.parse(text);
        OmObject scope = owner.getParent();
        return MathExpressions.rename(parsed, local -> {
            OmObject target = NameResolver.resolve(scope, local, NameResolver.SYMBOLS);
            String id = target == null ? null : ids.get(target);
            return id == null ? local : id;
        });
    }

    /** Kinetic law of {@code r} in flattened ids; {@code null} when the reaction has none. */
    public MathExpr kineticLaw(FlatReaction r) {
        return r.hasKineticLaw() ? resolveExpression(r.reaction, r.reaction.getKineticLaw()) : null;
    }

    /** Expression of {@code r} in flattened ids. */
    public MathExpr expression(FlatRule r) {
        return resolveExpression(r.rule, r.rule.getExpression());
    }
}

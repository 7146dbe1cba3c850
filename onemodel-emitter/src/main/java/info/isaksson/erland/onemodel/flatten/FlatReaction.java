package info.isaksson.erland.onemodel.flatten;

import info.isaksson.erland.onemodel.model.OmReaction;

import java.util.List;

/** A reaction with reactant and product names resolved to species ids, in the order written. */
public final class FlatReaction {

    public final String id;
    public final OmReaction reaction;
    public final List<String> reactantIds;
    public final List<String> productIds;

    FlatReaction(String id, OmReaction reaction, List<String> reactantIds, List<String> productIds) {
        this.id = id;
        this.reaction = reaction;
        this.reactantIds = List.copyOf(reactantIds);
        this.productIds = List.copyOf(productIds);
    }

    public boolean hasKineticLaw() {
        String law = reaction.getKineticLaw();
        return law != null && !law.isBlank();
    }

    @Override
    public String toString() {
        return id + ": " + reactantIds + " -> " + productIds;
    }
}

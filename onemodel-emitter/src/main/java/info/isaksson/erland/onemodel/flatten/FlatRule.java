package info.isaksson.erland.onemodel.flatten;

import info.isaksson.erland.onemodel.model.OmRule;

/** A rule with its target species resolved. */
public final class FlatRule {

    public final String id;
    public final OmRule rule;
    public final String variableId;

    FlatRule(String id, OmRule rule, String variableId) {
        this.id = id;
        this.rule = rule;
        this.variableId = variableId;
    }

    @Override
    public String toString() {
        return id + ": " + variableId + " (" + rule.getRuleType() + ")";
    }
}

package info.isaksson.erland.onemodel.walk;

import info.isaksson.erland.onemodel.model.ModelWarnings;
import info.isaksson.erland.onemodel.model.OneModel;

import java.util.Objects;

/**
 * State of one compilation run: the model being built, its warnings and the auto-naming counters.
 *
 * <p>Counters start at 1 for every context, so two runs over the same input name their unnamed
 * entities identically.</p>
 */
public final class WalkContext {

    static final String REACTION_PREFIX = "_J";
    static final String RULE_PREFIX = "_rule";

    private final OneModel model;
    private final ModelWarnings warnings;
    private final boolean failOnRedeclaration;

    private int unnamedReactions;
    private int unnamedRules;

    public WalkContext(OneModel model, ModelWarnings warnings, boolean failOnRedeclaration) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.warnings = warnings == null ? new ModelWarnings() : warnings;
        this.failOnRedeclaration = failOnRedeclaration;
    }

    public WalkContext(String modelName) {
        this(new OneModel(modelName), new ModelWarnings(), false);
    }

    public OneModel getModel() {
        return model;
    }

    public ModelWarnings getWarnings() {
        return warnings;
    }

    public boolean isFailOnRedeclaration() {
        return failOnRedeclaration;
    }

    String nextReactionName() {
        return REACTION_PREFIX + (++unnamedReactions);
    }

    String nextRuleName() {
        return RULE_PREFIX + (++unnamedRules);
    }
}

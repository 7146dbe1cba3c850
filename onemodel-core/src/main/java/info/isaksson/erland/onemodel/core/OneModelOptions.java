package info.isaksson.erland.onemodel.core;

import info.isaksson.erland.onemodel.ir.DaeModel;
import info.isaksson.erland.onemodel.matlab.MatlabStyle;
import info.isaksson.erland.onemodel.model.OneModel;

import java.util.Map;

/**
 * Core (server-friendly) options for OneModel compilation.
 *
 * <p>This mirrors the CLI flags but in a structured form.</p>
 */
public final class OneModelOptions {
    public String modelName = OneModel.DEFAULT_NAME;

    public boolean emitSbml = true;
    public boolean emitMatlab = true;
    public MatlabStyle matlabStyle = MatlabStyle.FUNCTIONS;

    /**
     * If true, re-declaring a name that is already bound aborts compilation with a
     * {@link info.isaksson.erland.onemodel.error.RedeclarationException}.
     * Otherwise the re-declaration is recorded as a warning and the new binding wins.
     */
    public boolean failOnRedeclaration = false;

    /** Copied into the DAE model built from a syntax tree; ignored for DAE input, which carries its own. */
    public Map<String, Object> simulationOptions = DaeModel.defaultOptions();
}

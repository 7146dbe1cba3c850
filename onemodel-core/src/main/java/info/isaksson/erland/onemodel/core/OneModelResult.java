package info.isaksson.erland.onemodel.core;

import info.isaksson.erland.onemodel.flatten.FlatModel;
import info.isaksson.erland.onemodel.ir.DaeModel;
import info.isaksson.erland.onemodel.matlab.MatlabFile;
import info.isaksson.erland.onemodel.model.ModelWarning;
import info.isaksson.erland.onemodel.model.OneModel;

import java.util.List;

/** Compilation result container for programmatic usage. */
public final class OneModelResult {
    /** Present for syntax-tree mode. */
    public final OneModel model;

    /** Present for syntax-tree mode. */
    public final FlatModel flatModel;

    /** Always present: built from the flat model, or read from DAE JSON. */
    public final DaeModel daeModel;

    /** SBML document, or null when SBML output was disabled or the input was a DAE model. */
    public final String sbml;

    /** Empty when Matlab output was disabled. */
    public final List<MatlabFile> matlabFiles;

    public final List<ModelWarning> warnings;

    OneModelResult(
            OneModel model,
            FlatModel flatModel,
            DaeModel daeModel,
            String sbml,
            List<MatlabFile> matlabFiles,
            List<ModelWarning> warnings
    ) {
        this.model = model;
        this.flatModel = flatModel;
        this.daeModel = daeModel;
        this.sbml = sbml;
        this.matlabFiles = matlabFiles == null ? List.of() : List.copyOf(matlabFiles);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public String getName() {
        return daeModel.getModelName();
    }

    public boolean hasSbml() {
        return sbml != null;
    }
}

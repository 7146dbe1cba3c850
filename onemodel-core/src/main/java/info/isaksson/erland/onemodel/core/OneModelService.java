package info.isaksson.erland.onemodel.core;

import info.isaksson.erland.onemodel.ast.AstJson;
import info.isaksson.erland.onemodel.ast.SyntaxNode;
import info.isaksson.erland.onemodel.dae.DaeModelBuilder;
import info.isaksson.erland.onemodel.flatten.FlatModel;
import info.isaksson.erland.onemodel.flatten.Flattener;
import info.isaksson.erland.onemodel.ir.DaeJson;
import info.isaksson.erland.onemodel.ir.DaeModel;
import info.isaksson.erland.onemodel.matlab.MatlabExporter;
import info.isaksson.erland.onemodel.matlab.MatlabFile;
import info.isaksson.erland.onemodel.model.ModelWarnings;
import info.isaksson.erland.onemodel.model.OneModel;
import info.isaksson.erland.onemodel.sbml.SbmlWriter;
import info.isaksson.erland.onemodel.walk.OneModelWalker;
import info.isaksson.erland.onemodel.walk.WalkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Core (server-friendly) API for compiling OneModel sources.
 *
 * <p>CLI and server wrappers should use this class instead of re-implementing the pipeline:
 * syntax tree → namespace tree → flat model → SBML / DAE model → Matlab.</p>
 */
public final class OneModelService {

    private static final Logger log = LoggerFactory.getLogger(OneModelService.class);

    /** Compile a syntax tree read from its JSON encoding. */
    public OneModelResult generateFromAst(Path astJson, OneModelOptions options) throws IOException {
        if (astJson == null) throw new IllegalArgumentException("astJson must not be null");
        SyntaxNode root = AstJson.read(astJson);
        log.info("read syntax tree from {}", astJson);
        return generateFromAst(root, options);
    }

    /**
     * Compile an in-memory syntax tree.
     *
     * @throws IOException when the SBML document cannot be serialized
     */
    public OneModelResult generateFromAst(SyntaxNode root, OneModelOptions options) throws IOException {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        if (options == null) options = new OneModelOptions();

        ModelWarnings warnings = new ModelWarnings();
        WalkContext ctx = new WalkContext(new OneModel(options.modelName), warnings, options.failOnRedeclaration);
        new OneModelWalker(ctx).walk(root);
        OneModel model = ctx.getModel();
        log.info("built namespace tree '{}'", model.getName());

        FlatModel flat = new Flattener(warnings).flatten(model);
        log.info("flattened {} parameters, {} species, {} reactions, {} rules",
                flat.getParameters().size(), flat.getSpecies().size(),
                flat.getReactions().size(), flat.getRules().size());

        String sbml = null;
        if (options.emitSbml) {
            sbml = SbmlWriter.writeToString(flat);
            log.info("rendered SBML document ({} chars)", sbml.length());
        }

        DaeModel dae = new DaeModelBuilder(warnings).build(flat, simulationOptions(options));
        log.info("built DAE model with {} states", dae.states.size());

        List<MatlabFile> matlab = options.emitMatlab ? matlab(dae, options) : List.of();
        return new OneModelResult(model, flat, dae, sbml, matlab, warnings.toDeterministicList());
    }

    /** Generate Matlab code from a DAE model read from JSON. SBML needs a reaction network, so none is produced. */
    public OneModelResult generateFromDae(Path daeJson, OneModelOptions options) throws IOException {
        if (daeJson == null) throw new IllegalArgumentException("daeJson must not be null");
        DaeModel dae = DaeJson.read(daeJson);
        log.info("read DAE model '{}' from {}", dae.name, daeJson);
        return generateFromDae(dae, options);
    }

    public OneModelResult generateFromDae(DaeModel dae, OneModelOptions options) {
        if (dae == null) throw new IllegalArgumentException("dae must not be null");
        if (options == null) options = new OneModelOptions();

        List<MatlabFile> matlab = options.emitMatlab ? matlab(dae, options) : List.of();
        return new OneModelResult(null, null, dae, null, matlab, List.of());
    }

    /**
     * Write every artifact in {@code result} to {@code outDir}: {@code <name>.xml} when SBML is present
     * and the Matlab files. When {@code daeSnapshot} is non-null the DAE model is also written there as JSON.
     *
     * @return written files, in write order
     */
    public List<Path> writeAll(OneModelResult result, Path outDir, Path daeSnapshot) throws IOException {
        if (result == null) throw new IllegalArgumentException("result must not be null");
        if (outDir == null) throw new IllegalArgumentException("outDir must not be null");
        Files.createDirectories(outDir);

        List<Path> written = new ArrayList<>();
        if (result.hasSbml()) {
            Path xml = outDir.resolve(result.getName() + ".xml");
            Files.writeString(xml, result.sbml, StandardCharsets.UTF_8);
            written.add(xml);
        }
        for (MatlabFile f : result.matlabFiles) {
            Path p = outDir.resolve(f.fileName());
            Files.writeString(p, f.content(), StandardCharsets.UTF_8);
            written.add(p);
        }
        if (daeSnapshot != null) {
            DaeJson.write(result.daeModel, daeSnapshot);
            written.add(daeSnapshot);
        }
        log.info("wrote {} files to {}", written.size(), outDir);
        return written;
    }

    private static List<MatlabFile> matlab(DaeModel dae, OneModelOptions options) {
        List<MatlabFile> files = new MatlabExporter(dae).generate(options.matlabStyle);
        log.info("generated {} Matlab files ({})", files.size(), options.matlabStyle);
        return files;
    }

    private static LinkedHashMap<String, Object> simulationOptions(OneModelOptions options) {
        return options.simulationOptions == null
                ? new LinkedHashMap<>(DaeModel.defaultOptions())
                : new LinkedHashMap<>(options.simulationOptions);
    }
}

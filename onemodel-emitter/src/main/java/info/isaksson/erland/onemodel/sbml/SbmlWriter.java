package info.isaksson.erland.onemodel.sbml;

import info.isaksson.erland.onemodel.error.SerializationException;
import info.isaksson.erland.onemodel.flatten.FlatEntry;
import info.isaksson.erland.onemodel.flatten.FlatModel;
import info.isaksson.erland.onemodel.flatten.FlatReaction;
import info.isaksson.erland.onemodel.flatten.FlatRule;
import info.isaksson.erland.onemodel.math.MathBinary;
import info.isaksson.erland.onemodel.math.MathExpr;
import info.isaksson.erland.onemodel.math.MathIdentifier;
import info.isaksson.erland.onemodel.model.OmParameter;
import info.isaksson.erland.onemodel.model.OmSpecies;
import info.isaksson.erland.onemodel.model.RuleType;
import org.sbml.jsbml.AlgebraicRule;
import org.sbml.jsbml.AssignmentRule;
import org.sbml.jsbml.Compartment;
import org.sbml.jsbml.KineticLaw;
import org.sbml.jsbml.Model;
import org.sbml.jsbml.Parameter;
import org.sbml.jsbml.Reaction;
import org.sbml.jsbml.SBMLDocument;
import org.sbml.jsbml.SBMLException;
import org.sbml.jsbml.Species;
import org.sbml.jsbml.SpeciesReference;
import org.sbml.jsbml.Unit;
import org.sbml.jsbml.UnitDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLStreamException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes a {@link FlatModel} as an SBML Level 3 Version 2 document.
 *
 * <p>The document is assembled with JSBML and written by its {@link org.sbml.jsbml.SBMLWriter}.
 * Every document carries one unit definition ({@value OmParameter#UNITS}) and one compartment
 * ({@value #COMPARTMENT}); species, parameters, rules and reactions follow in model order.</p>
 */
public final class SbmlWriter {

    private static final Logger log = LoggerFactory.getLogger(SbmlWriter.class);

    public static final int LEVEL = 3;
    public static final int VERSION = 2;
    public static final String SBML_NAMESPACE = "http://www.sbml.org/sbml/level3/version2/core";
    public static final String COMPARTMENT = "default_compartment";

    private SbmlWriter() {}

    public static void write(FlatModel model, Path outFile) throws IOException {
        if (outFile == null) throw new IllegalArgumentException("outFile must not be null");
        String xml = writeToString(model);
        Path parent = outFile.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(outFile, xml, StandardCharsets.UTF_8);
    }

    public static String writeToString(FlatModel model) throws IOException {
        SBMLDocument doc = toDocument(model);
        try {
            return new org.sbml.jsbml.SBMLWriter().writeSBMLToString(doc);
        } catch (XMLStreamException | SBMLException ex) {
            throw new IOException("could not write SBML for model '" + model.getName() + "': " + ex.getMessage(), ex);
        }
    }

    /** The in-memory document {@link #writeToString} serializes. */
    public static SBMLDocument toDocument(FlatModel model) {
        if (model == null) throw new IllegalArgumentException("model must not be null");

        SBMLDocument doc = new SBMLDocument(LEVEL, VERSION);
        Model m = doc.createModel(modelId(model.getName()));
        m.setName(model.getName());
        m.setSubstanceUnits("mole");
        m.setTimeUnits("second");
        m.setExtentUnits("mole");

        UnitDefinition perSecond = m.createUnitDefinition(OmParameter.UNITS);
        Unit second = perSecond.createUnit(Unit.Kind.SECOND);
        second.setExponent(-1d);
        second.setScale(0);
        second.setMultiplier(1d);

        Compartment compartment = m.createCompartment(COMPARTMENT);
        compartment.setSpatialDimensions(3d);
        compartment.setSize(1d);
        compartment.setUnits("litre");
        compartment.setConstant(true);

        addSpecies(m, compartment, model.getSpecies());
        addParameters(m, model.getParameters());
        addRules(m, model);
        addReactions(m, model);

        log.debug("SBML document for '{}': {} species, {} parameters, {} rules, {} reactions",
                model.getName(), m.getSpeciesCount(), m.getParameterCount(), m.getRuleCount(), m.getReactionCount());
        return doc;
    }

    /** Model names are free text; the model id is the name with anything outside SId syntax replaced. */
    static String modelId(String name) {
        String id = name.replaceAll("[^A-Za-z0-9_]", "_");
        if (id.isEmpty() || Character.isDigit(id.charAt(0))) id = "_" + id;
        return id;
    }

    private static void addSpecies(Model m, Compartment compartment, List<FlatEntry<OmSpecies>> species) {
        for (FlatEntry<OmSpecies> s : species) {
            Species sp = m.createSpecies(s.id, compartment);
            sp.setInitialConcentration(s.entity.getInitialValue());
            sp.setSubstanceUnits("mole");
            sp.setHasOnlySubstanceUnits(false);
            sp.setBoundaryCondition(false);
            sp.setConstant(false);
        }
    }

    private static void addParameters(Model m, List<FlatEntry<OmParameter>> parameters) {
        for (FlatEntry<OmParameter> p : parameters) {
            Parameter par = m.createParameter(p.id);
            par.setValue(p.entity.getValue());
            try {
                par.setUnits(p.entity.getUnits());
            } catch (IllegalArgumentException ex) {
                throw new SerializationException(p.id, p.entity.getUnits(), "not a usable SBML unit: " + ex.getMessage());
            }
            par.setConstant(true);
        }
    }

    private static void addRules(Model m, FlatModel model) {
        for (FlatRule r : model.getRules()) {
            MathExpr expr = model.expression(r);
            if (r.rule.getRuleType() == RuleType.ALGEBRAIC) {
                // 0 = expr - variable
                AlgebraicRule rule = m.createAlgebraicRule();
                rule.setMath(MathAstBuilder.toAst(new MathBinary('-', expr, new MathIdentifier(r.variableId))));
            } else {
                AssignmentRule rule = m.createAssignmentRule();
                rule.setVariable(r.variableId);
                rule.setMath(MathAstBuilder.toAst(expr));
            }
        }
    }

    private static void addReactions(Model m, FlatModel model) {
        for (FlatReaction r : model.getReactions()) {
            Reaction reaction = m.createReaction(r.id);
            reaction.setReversible(false);
            for (String id : r.reactantIds) {
                constant(reaction.createReactant(), id);
            }
            for (String id : r.productIds) {
                constant(reaction.createProduct(), id);
            }
            MathExpr law = model.kineticLaw(r);
            if (law != null) {
                KineticLaw kl = reaction.createKineticLaw();
                kl.setMath(MathAstBuilder.toAst(law));
            }
        }
    }

    private static void constant(SpeciesReference ref, String speciesId) {
        ref.setSpecies(speciesId);
        ref.setConstant(true);
    }
}

package info.isaksson.erland.onemodel.matlab;

import info.isaksson.erland.onemodel.dae.EquationDependencyResolver;
import info.isaksson.erland.onemodel.dae.EvaluationOrder;
import info.isaksson.erland.onemodel.error.SerializationException;
import info.isaksson.erland.onemodel.ir.DaeParameter;
import info.isaksson.erland.onemodel.ir.DaeState;
import info.isaksson.erland.onemodel.ir.ModelAccessor;
import info.isaksson.erland.onemodel.ir.StateType;
import info.isaksson.erland.onemodel.model.Numbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Generates Matlab code that simulates a {@link ModelAccessor} with {@code ode15s}.
 *
 * <p>The four bodies (default parameters, initial conditions, mass matrix and right-hand side)
 * are available separately and are assembled into either the function layout or the class
 * layout. All of them share one state index: the position of a state in
 * {@link EvaluationOrder#indexedStates()}.</p>
 */
public final class MatlabExporter {

    private static final Logger log = LoggerFactory.getLogger(MatlabExporter.class);

    static final String[] WARNING = {
            "% This file was automatically generated by OneModel.",
            "% Any changes you make to it will be overwritten the next time",
            "% the file is generated."
    };

    private static final String INDENT = "    ";

    /** Locals of the generated functions and scripts; a state of the same name would overwrite them. */
    static final Set<String> RESERVED_LOCALS = Set.of(
            "p", "x", "t", "dx", "x0", "M", "out", "ones_t", "opt", "opts", "tspan", "m", "obj");

    static final Set<String> KEYWORDS = Set.of(
            "break", "case", "catch", "classdef", "continue", "else", "elseif", "end", "for",
            "function", "global", "if", "otherwise", "parfor", "persistent", "return", "spmd",
            "switch", "try", "while");

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    private final ModelAccessor model;
    private final EvaluationOrder order;
    private final MatlabExpressionRenderer renderer;

    public MatlabExporter(ModelAccessor model) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        this.model = model;

        Set<String> states = new LinkedHashSet<>();
        for (DaeState s : model.getStates()) {
            checkName(s.id);
            if (RESERVED_LOCALS.contains(s.id)) {
                throw new SerializationException(s.id, s.id, "state name clashes with a generated Matlab variable");
            }
            states.add(s.id);
        }
        Set<String> parameters = new LinkedHashSet<>();
        for (DaeParameter p : model.getParameters()) {
            checkName(p.id);
            // parameters are fields of p, but they share the output struct with the states and out.t
            if (p.id.equals("t") || states.contains(p.id)) {
                throw new SerializationException(p.id, p.id, "parameter name clashes with a field of the output struct");
            }
            parameters.add(p.id);
        }
        this.order = EquationDependencyResolver.resolve(model);
        this.renderer = new MatlabExpressionRenderer(parameters, states);
    }

    private static void checkName(String id) {
        if (id == null || !IDENTIFIER.matcher(id).matches()) {
            throw new SerializationException(String.valueOf(id), String.valueOf(id), "not a valid Matlab identifier");
        }
        if (KEYWORDS.contains(id)) {
            throw new SerializationException(id, id, "Matlab keyword");
        }
    }

    public EvaluationOrder getEvaluationOrder() {
        return order;
    }

    /** Rewrite one equation of {@code owner} for Matlab. */
    public String rewrite(String owner, String equation) {
        return renderer.render(owner, equation);
    }

    // ---------------------------------------------------------------------------------------
    // Bodies
    // ---------------------------------------------------------------------------------------

    /** {@code p.<id> = <value>;} per parameter, in declaration order. */
    public String defaultParameters() {
        StringBuilder sb = new StringBuilder();
        sb.append("p = [];\n");
        for (DaeParameter p : model.getParameters()) {
            sb.append("p.").append(p.id).append(" = ").append(Numbers.format(p.value)).append(';')
                    .append(trailingComment(p.comment)).append('\n');
        }
        return sb.toString();
    }

    /** Column vector {@code x0}, one row per ODE or algebraic state. */
    public String initialConditions() {
        StringBuilder sb = new StringBuilder("x0 = [\n");
        for (DaeState s : order.indexedStates()) {
            sb.append(INDENT).append(Numbers.format(s.initialCondition)).append(" % ").append(s.id);
            if (s.type == StateType.ALGEBRAIC) sb.append(" (algebraic)");
            sb.append('\n');
        }
        return sb.append("];\n").toString();
    }

    /** Diagonal mass matrix: 1 for ODE rows, 0 for algebraic rows. */
    public String massMatrix() {
        List<DaeState> indexed = order.indexedStates();
        int n = indexed.size();
        StringBuilder sb = new StringBuilder("M = [\n");
        for (int i = 0; i < n; i++) {
            sb.append(INDENT);
            for (int j = 0; j < n; j++) {
                if (j > 0) sb.append(' ');
                sb.append(i == j && indexed.get(i).type == StateType.ODE ? '1' : '0');
            }
            sb.append('\n');
        }
        return sb.append("];\n").toString();
    }

    /** Bindings of every state from {@code x} followed by {@code dx(i,1)} rows. */
    public String rightHandSide() {
        StringBuilder sb = new StringBuilder(stateBindings());
        sb.append('\n');
        sb.append("dx = zeros(").append(order.size()).append(",1);\n");
        int i = 1;
        for (DaeState s : order.indexedStates()) {
            sb.append('\n');
            if (s.type == StateType.ODE) {
                sb.append("% der(").append(s.id).append(')').append(equationNote(s)).append('\n');
                sb.append("dx(").append(i).append(",1) = ").append(rewrite(s.id, s.equation)).append(";\n");
            } else {
                sb.append("% ").append(s.id).append(" (algebraic)").append(equationNote(s)).append('\n');
                sb.append("dx(").append(i).append(",1) = -").append(s.id).append(" + ")
                        .append(rewrite(s.id, s.equation)).append(";\n");
            }
            i++;
        }
        return sb.toString();
    }

    /** Indexed states bound from rows of {@code x}, then substitutions in dependency order. */
    public String stateBindings() {
        StringBuilder sb = new StringBuilder("% ODE and algebraic states.\n");
        int i = 1;
        for (DaeState s : order.indexedStates()) {
            sb.append(s.id).append(" = x(").append(i++).append(",:);");
            String note = s.type == StateType.ALGEBRAIC ? "(algebraic) " + oneLine(s.comment) : oneLine(s.comment);
            sb.append(trailingComment(note.strip())).append('\n');
        }
        sb.append("\n% Substitution states.\n");
        for (DaeState s : order.substitutions()) {
            sb.append(s.id).append(" = ").append(rewrite(s.id, s.equation)).append(';')
                    .append(trailingComment(s.comment)).append('\n');
        }
        return sb.toString();
    }

    /** Every state and parameter as a row aligned with {@code t}; {@code x} has one row per time point. */
    public String stateReconstruction() {
        StringBuilder sb = new StringBuilder();
        sb.append("x = x.';\n");
        sb.append("t = t(:).';\n");
        sb.append("ones_t = ones(1,numel(t));\n\n");
        sb.append(stateBindings());
        sb.append("\n% Save simulation time.\n");
        sb.append("out.t = t;\n");
        sb.append("\n% Save states.\n");
        for (DaeState s : model.getStates()) {
            sb.append("out.").append(s.id).append(" = ").append(s.id).append(".*ones_t;")
                    .append(trailingComment(s.comment)).append('\n');
        }
        sb.append("\n% Save parameters.\n");
        for (DaeParameter p : model.getParameters()) {
            sb.append("out.").append(p.id).append(" = p.").append(p.id).append(".*ones_t;")
                    .append(trailingComment(p.comment)).append('\n');
        }
        return sb.toString();
    }

    /** {@code opts.<name> = <value>;} per simulation option. */
    public String simulationOptions() {
        StringBuilder sb = new StringBuilder("opts = [];\n");
        for (Map.Entry<String, Object> e : model.getOptions().entrySet()) {
            sb.append("opts.").append(e.getKey()).append(" = ").append(literal(e.getValue())).append(";\n");
        }
        return sb.toString();
    }

    // ---------------------------------------------------------------------------------------
    // Files
    // ---------------------------------------------------------------------------------------

    public List<MatlabFile> generate(MatlabStyle style) {
        String name = model.getModelName();
        List<MatlabFile> files = new ArrayList<>();
        if (style == MatlabStyle.CLASS) {
            files.add(new MatlabFile(name + ".m", classFile(name)));
            files.add(new MatlabFile(name + "_example.m", exampleScript(name)));
        } else {
            files.add(new MatlabFile(name + "_param.m", paramFunction(name)));
            files.add(new MatlabFile(name + "_ode.m", odeFunction(name)));
            files.add(new MatlabFile(name + "_states.m", statesFunction(name)));
            files.add(new MatlabFile(name + "_driver.m", driverScript(name)));
        }
        return files;
    }

    public List<Path> write(Path outDir, MatlabStyle style) throws IOException {
        if (outDir == null) throw new IllegalArgumentException("outDir must not be null");
        Files.createDirectories(outDir);
        List<Path> written = new ArrayList<>();
        for (MatlabFile f : generate(style)) {
            Path p = outDir.resolve(f.fileName());
            Files.writeString(p, f.content(), StandardCharsets.UTF_8);
            written.add(p);
        }
        log.debug("wrote {} Matlab files to {}", written.size(), outDir);
        return written;
    }

    private String paramFunction(String name) {
        StringBuilder sb = header();
        sb.append("function [p,x0,M] = ").append(name).append("_param()\n");
        sb.append("% Default parameters, initial conditions and mass matrix of \"").append(name).append("\".\n\n");
        sb.append("% Default parameters value.\n").append(defaultParameters());
        sb.append("\n% Default initial conditions.\n").append(initialConditions());
        sb.append("\n% Mass matrix for algebraic simulations.\n").append(massMatrix());
        sb.append("\nend\n");
        return sb.toString();
    }

    private String odeFunction(String name) {
        StringBuilder sb = header();
        sb.append("function [dx] = ").append(name).append("_ode(t,x,p)\n");
        sb.append("% Evaluate the right-hand side of \"").append(name).append("\".\n");
        sb.append("%\n");
        sb.append("% Args:\n");
        sb.append("%    t Current time in the simulation.\n");
        sb.append("%    x Column vector with the state value.\n");
        sb.append("%    p Struct with the parameters.\n");
        sb.append("%\n");
        sb.append("% Return:\n");
        sb.append("%    dx Column vector with derivatives and algebraic residuals.\n\n");
        sb.append(rightHandSide());
        sb.append("\nend\n");
        return sb.toString();
    }

    private String statesFunction(String name) {
        StringBuilder sb = header();
        sb.append("function [out] = ").append(name).append("_states(t,x,p)\n");
        sb.append("% Recover every state and parameter of \"").append(name).append("\" from a simulation.\n");
        sb.append("%\n");
        sb.append("% Args:\n");
        sb.append("%    t Simulation time points.\n");
        sb.append("%    x Solver output, one row per time point.\n");
        sb.append("%    p Struct with the parameters.\n\n");
        sb.append(stateReconstruction());
        sb.append("\nend\n");
        return sb.toString();
    }

    private String driverScript(String name) {
        StringBuilder sb = header();
        sb.append("%% Example driver script for simulating \"").append(name).append("\" model.\n");
        sb.append("clear all;\n");
        sb.append("close all;\n");
        sb.append("\n% Default parameters.\n");
        sb.append("[p,x0,M] = ").append(name).append("_param();\n");
        sb.append("\n% Solver options.\n");
        sb.append("opt = odeset('AbsTol',1e-8,'RelTol',1e-8);\n");
        sb.append("opt = odeset(opt,'Mass',M);\n");
        sb.append("\n% Simulation time span.\n");
        sb.append("tspan = [").append(option("t_init", "0")).append(' ').append(option("t_end", "10")).append("];\n");
        sb.append("\n[t,x] = ode15s(@(t,x) ").append(name).append("_ode(t,x,p),tspan,x0,opt);\n");
        sb.append("out = ").append(name).append("_states(t,x,p);\n");
        sb.append("\n% Plot result.\n");
        sb.append("plot(t,x);\n");
        sb.append("grid on;\n");
        return sb.toString();
    }

    private String classFile(String name) {
        String m = INDENT + INDENT;
        String body = m + INDENT;
        StringBuilder sb = header();
        sb.append("classdef ").append(name).append('\n');
        sb.append(INDENT).append("properties\n");
        sb.append(m).append("p      % Default model parameters.\n");
        sb.append(m).append("x0     % Default initial conditions.\n");
        sb.append(m).append("M      % Mass matrix for DAE systems.\n");
        sb.append(m).append("opts   % Simulation options.\n");
        sb.append(INDENT).append("end\n\n");
        sb.append(INDENT).append("methods\n");

        sb.append(m).append("function obj = ").append(name).append("()\n");
        sb.append(body).append("obj.p    = obj.default_parameters();\n");
        sb.append(body).append("obj.x0   = obj.initial_conditions();\n");
        sb.append(body).append("obj.M    = obj.mass_matrix();\n");
        sb.append(body).append("obj.opts = obj.simulation_options();\n");
        sb.append(m).append("end\n\n");

        method(sb, "p = default_parameters(~)", "Default parameters value.", defaultParameters());
        method(sb, "x0 = initial_conditions(~)", "Default initial conditions.", initialConditions());
        method(sb, "M = mass_matrix(~)", "Mass matrix for DAE systems.", massMatrix());
        method(sb, "opts = simulation_options(~)", "Default simulation options.", simulationOptions());
        method(sb, "dx = ode(~,t,x,p)", "Evaluate the right-hand side.", rightHandSide());
        method(sb, "out = simout2struct(~,t,x,p)", "Convert the simulation output into a struct.", stateReconstruction());

        sb.setLength(sb.length() - 1);
        sb.append(INDENT).append("end\n");
        sb.append("end\n");
        return sb.toString();
    }

    private String exampleScript(String name) {
        StringBuilder sb = header();
        sb.append("%% Example driver script for simulating \"").append(name).append("\" model.\n");
        sb.append("clear all;\n");
        sb.append("close all;\n");
        sb.append("\n% Init model.\n");
        sb.append("m = ").append(name).append("();\n");
        sb.append("\n% Solver options.\n");
        sb.append("opt = odeset('AbsTol',1e-8,'RelTol',1e-8);\n");
        sb.append("opt = odeset(opt,'Mass',m.M);\n");
        sb.append("\n% Simulation time span.\n");
        sb.append("tspan = [m.opts.t_init m.opts.t_end];\n");
        sb.append("\n[t,x] = ode15s(@(t,x) m.ode(t,x,m.p),tspan,m.x0,opt);\n");
        sb.append("out = m.simout2struct(t,x,m.p);\n");
        sb.append("\n% Plot result.\n");
        sb.append("plot(t,x);\n");
        sb.append("grid on;\n");
        return sb.toString();
    }

    private static void method(StringBuilder sb, String signature, String doc, String body) {
        String m = INDENT + INDENT;
        sb.append(m).append("function ").append(signature).append('\n');
        sb.append(m).append(INDENT).append("%% ").append(doc).append('\n');
        for (String line : body.split("\n", -1)) {
            if (!line.isEmpty()) sb.append(m).append(INDENT).append(line);
            sb.append('\n');
        }
        sb.setLength(sb.length() - 1);
        sb.append(m).append("end\n\n");
    }

    private static StringBuilder header() {
        StringBuilder sb = new StringBuilder();
        for (String line : WARNING) sb.append(line).append('\n');
        return sb.append('\n');
    }

    private String option(String key, String fallback) {
        Object v = model.getOptions().get(key);
        return v == null ? fallback : literal(v);
    }

    static String literal(Object value) {
        if (value instanceof Number n) return Numbers.format(n.doubleValue());
        if (value instanceof Boolean b) return b ? "true" : "false";
        return "'" + String.valueOf(value).replace("'", "''") + "'";
    }

    private static String equationNote(DaeState s) {
        return s.equationComment.isEmpty() ? "" : " " + oneLine(s.equationComment);
    }

    private static String trailingComment(String comment) {
        String c = oneLine(comment);
        return c.isEmpty() ? "" : " % " + c;
    }

    private static String oneLine(String text) {
        return text == null ? "" : text.replace('\r', ' ').replace('\n', ' ').strip();
    }
}

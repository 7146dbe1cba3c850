package info.isaksson.erland.onemodel;

import info.isaksson.erland.onemodel.core.OneModelOptions;
import info.isaksson.erland.onemodel.core.OneModelResult;
import info.isaksson.erland.onemodel.core.OneModelService;
import info.isaksson.erland.onemodel.error.OneModelException;
import info.isaksson.erland.onemodel.ir.DaeJson;
import info.isaksson.erland.onemodel.ir.DaeModel;
import info.isaksson.erland.onemodel.matlab.MatlabStyle;
import info.isaksson.erland.onemodel.model.ModelWarning;
import info.isaksson.erland.onemodel.report.CompileReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI entrypoint: compiles a OneModel syntax tree (JSON) to SBML and Matlab, or a DAE model (JSON)
 * to Matlab, and writes a markdown report next to the outputs.
 */
public final class Main {

    private static final OneModelService SERVICE = new OneModelService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     *
     * @return 0 on success, 1 on usage errors, 2 on compile or I/O failures
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.ast == null && parsed.dae == null) {
            System.err.println("Error: --ast or --dae is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }
        if (parsed.ast != null && parsed.dae != null) {
            System.err.println("Error: --ast and --dae are mutually exclusive.");
            return 1;
        }

        final boolean daeMode = parsed.dae != null;
        final Path inputPath = Paths.get(daeMode ? parsed.dae : parsed.ast).toAbsolutePath().normalize();
        if (!Files.exists(inputPath) || Files.isDirectory(inputPath)) {
            System.err.println("Error: " + (daeMode ? "--dae" : "--ast") + " must point to an existing JSON file: " + inputPath);
            return 1;
        }

        final Path outDir = Paths.get(parsed.output).toAbsolutePath().normalize();
        final OneModelOptions opts = toCoreOptions(parsed);

        final OneModelResult res;
        try {
            if (daeMode) {
                DaeModel dae = DaeJson.read(inputPath);
                if (parsed.name != null) {
                    dae = new DaeModel(dae.schemaVersion, parsed.name, dae.parameters, dae.states, dae.options);
                }
                res = SERVICE.generateFromDae(dae, opts);
            } else {
                res = SERVICE.generateFromAst(inputPath, opts);
            }
        } catch (OneModelException ex) {
            System.err.println("Error: compilation failed (" + ex.getCode() + ").");
            System.err.println(ex.getMessage());
            if (!ex.getContext().isEmpty()) {
                System.err.println("Context: " + ex.getContext());
            }
            return 2;
        } catch (RuntimeException | IOException ex) {
            System.err.println("Error: could not read " + inputPath);
            System.err.println(ex.getMessage());
            return 2;
        }

        final Path daeOut = parsed.writeDae == null ? null : resolveDaeOutput(parsed.writeDae, res.getName());
        final List<Path> written;
        try {
            written = new ArrayList<>(SERVICE.writeAll(res, outDir, daeOut));
        } catch (IOException ex) {
            System.err.println("Error: could not write outputs to: " + outDir);
            System.err.println(ex.getMessage());
            return 2;
        }

        final Path reportOut = resolveReportOutput(parsed.report, outDir);
        try {
            Path parent = reportOut.getParent();
            if (parent != null) Files.createDirectories(parent);
            CompileReport.writeMarkdown(reportOut, inputPath, res, written);
        } catch (IOException ex) {
            System.err.println("Error: could not write report to: " + reportOut);
            System.err.println(ex.getMessage());
            return 2;
        }

        for (ModelWarning w : res.warnings) {
            System.err.println("Warning: " + w);
        }

        StringBuilder summary = new StringBuilder();
        summary.append("onemodel").append(daeMode ? " (DAE mode)" : "").append('\n');
        summary.append("- Input: ").append(inputPath).append('\n');
        summary.append("- Model: ").append(res.getName()).append('\n');
        summary.append("- Output: ").append(outDir).append('\n');
        summary.append("- Report: ").append(reportOut).append('\n');
        summary.append("- Files written: ").append(written.size()).append('\n');
        summary.append("- States: ").append(res.daeModel.getStates().size()).append('\n');
        summary.append("- Warnings: ").append(res.warnings.size());
        System.out.println(summary);
        return 0;
    }

    private static OneModelOptions toCoreOptions(CliArgs parsed) {
        OneModelOptions o = new OneModelOptions();
        if (parsed.name != null) o.modelName = parsed.name;
        o.emitSbml = parsed.sbml;
        o.emitMatlab = parsed.matlabStyle != null;
        if (parsed.matlabStyle != null) o.matlabStyle = parsed.matlabStyle;
        o.failOnRedeclaration = parsed.failOnRedeclaration;
        return o;
    }

    private static Path resolveDaeOutput(String daeArg, String modelName) {
        // A path ending with .json is the snapshot file itself; anything else is a directory.
        if (daeArg.toLowerCase().endsWith(".json")) {
            return Paths.get(daeArg).toAbsolutePath().normalize();
        }
        return Paths.get(daeArg).toAbsolutePath().normalize().resolve(modelName + ".dae.json");
    }

    private static Path resolveReportOutput(String reportArg, Path outDir) {
        if (reportArg != null && !reportArg.isBlank()) {
            return Paths.get(reportArg).toAbsolutePath().normalize();
        }
        return outDir.resolve("report.md");
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String ast;
        String dae;
        String output = "./build";
        String name;
        String report;
        String writeDae;

        boolean sbml = true;
        // null means no Matlab output
        MatlabStyle matlabStyle = MatlabStyle.FUNCTIONS;
        boolean failOnRedeclaration = false;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--ast":
                        out.ast = requireValue(args, ++i, "--ast");
                        break;
                    case "--dae":
                        out.dae = requireValue(args, ++i, "--dae");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--name":
                        out.name = requireValue(args, ++i, "--name");
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--write-dae":
                        out.writeDae = requireValue(args, ++i, "--write-dae");
                        break;
                    case "--sbml":
                        out.sbml = parseBoolean(requireValue(args, ++i, "--sbml"), "--sbml");
                        break;
                    case "--matlab":
                        out.matlabStyle = parseMatlab(requireValue(args, ++i, "--matlab"));
                        break;
                    case "--fail-on-redeclaration":
                        out.failOnRedeclaration = parseBoolean(requireValue(args, ++i, "--fail-on-redeclaration"), "--fail-on-redeclaration");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --ast
                        if (out.ast == null) {
                            out.ast = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static MatlabStyle parseMatlab(String v) {
            switch (v.trim().toLowerCase()) {
                case "functions":
                    return MatlabStyle.FUNCTIONS;
                case "class":
                    return MatlabStyle.CLASS;
                case "none":
                    return null;
                default:
                    throw new IllegalArgumentException("Invalid value for --matlab: " + v + " (expected functions | class | none)");
            }
        }

        static void printHelp() {
            System.out.println(
                    "onemodel\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar onemodel-cli.jar --ast <model.ast.json> [--output <dir>] [options]\n" +
                    "  java -jar onemodel-cli.jar --dae <model.json> [--output <dir>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --ast <file>           Syntax tree produced by the OneModel parser (JSON). A bare path\n" +
                    "                         is treated as --ast.\n" +
                    "  --dae <file>           DAE model (JSON); generates Matlab code only\n" +
                    "  --output <dir>         Output folder (default: ./build)\n" +
                    "  --name <name>          Model name (default: main, or the name in the DAE file)\n" +
                    "  --sbml <bool>          Write <name>.xml (default: true; syntax tree input only)\n" +
                    "  --matlab <mode>        functions | class | none (default: functions)\n" +
                    "  --fail-on-redeclaration <bool>\n" +
                    "                         Abort when a name is declared twice instead of warning\n" +
                    "                         (default: false)\n" +
                    "  --write-dae <file|dir> Also write the DAE model as JSON\n" +
                    "  --report <file>        Report path (default: <output>/report.md)\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar onemodel-cli.jar samples/nested/model.ast.json --output out\n" +
                    "  java -jar onemodel-cli.jar --dae samples/dae/decay-chain.json --matlab class\n"
            );
        }
    }
}

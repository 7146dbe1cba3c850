package info.isaksson.erland.onemodel.report;

import info.isaksson.erland.onemodel.core.OneModelResult;
import info.isaksson.erland.onemodel.flatten.FlatModel;
import info.isaksson.erland.onemodel.ir.DaeModel;
import info.isaksson.erland.onemodel.ir.DaeState;
import info.isaksson.erland.onemodel.ir.StateType;
import info.isaksson.erland.onemodel.model.ModelWarning;
import info.isaksson.erland.onemodel.model.ModelWarnings;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Human-readable markdown report of one compiler run.
 *
 * <p>Output paths are listed relative to the report's directory when they live below it.</p>
 */
public final class CompileReport {

    private CompileReport() {}

    public static void writeMarkdown(Path reportPath,
                                     Path inputPath,
                                     OneModelResult result,
                                     List<Path> written) throws IOException {
        Files.writeString(reportPath, toMarkdown(reportPath, inputPath, result, written), StandardCharsets.UTF_8);
    }

    public static String toMarkdown(Path reportPath, Path inputPath, OneModelResult result, List<Path> written) {
        if (result == null) throw new IllegalArgumentException("result must not be null");
        Path base = reportPath == null ? null : reportPath.toAbsolutePath().normalize().getParent();

        StringBuilder report = new StringBuilder();
        report.append("# OneModel compile report\n\n");

        report.append("## Summary\n\n");
        report.append("- Model: `").append(result.getName()).append("`\n");
        report.append("- Input: `").append(inputPath).append("`\n");
        report.append("- Mode: **").append(result.flatModel != null ? "syntax tree" : "DAE model").append("**\n");
        report.append("- Warnings: **").append(result.warnings.size()).append("**\n\n");

        FlatModel flat = result.flatModel;
        if (flat != null) {
            report.append("## Reaction network\n\n");
            report.append("- Parameters: **").append(flat.getParameters().size()).append("**\n");
            report.append("- Species: **").append(flat.getSpecies().size()).append("**\n");
            report.append("- Reactions: **").append(flat.getReactions().size()).append("**\n");
            report.append("- Rules: **").append(flat.getRules().size()).append("**\n\n");
        }

        DaeModel dae = result.daeModel;
        report.append("## DAE model\n\n");
        report.append("- Parameters: **").append(dae.getParameters().size()).append("**\n");
        Map<StateType, Integer> byType = new EnumMap<>(StateType.class);
        for (DaeState s : dae.getStates()) {
            byType.merge(s.type, 1, Integer::sum);
        }
        for (StateType t : StateType.values()) {
            report.append("- ").append(t.name()).append(" states: **").append(byType.getOrDefault(t, 0)).append("**\n");
        }
        report.append('\n');

        report.append("## Outputs\n\n");
        if (written == null || written.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (Path p : written) {
                report.append("- `").append(display(base, p)).append("`\n");
            }
        }

        report.append("\n## Warnings\n\n");
        if (result.warnings.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (Map.Entry<String, Integer> e : ModelWarnings.countByCode(result.warnings).entrySet()) {
                report.append("- ").append(e.getKey()).append(": **").append(e.getValue()).append("**\n");
            }
            report.append('\n');
            for (ModelWarning w : result.warnings) {
                report.append("- **").append(w.code).append("**: ").append(w.message);
                if (!w.context.isEmpty()) {
                    report.append(" (");
                    boolean first = true;
                    for (Map.Entry<String, String> e : w.context.entrySet()) {
                        if (!first) report.append(", ");
                        report.append(e.getKey()).append('=').append('`').append(e.getValue()).append('`');
                        first = false;
                    }
                    report.append(')');
                }
                report.append('\n');
            }
        }
        return report.toString();
    }

    private static String display(Path base, Path p) {
        Path abs = p.toAbsolutePath().normalize();
        if (base != null && abs.startsWith(base)) {
            return base.relativize(abs).toString().replace("\\", "/");
        }
        return abs.toString().replace("\\", "/");
    }
}

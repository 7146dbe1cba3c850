package info.isaksson.erland.onemodel.ir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization of {@link DaeModel}.
 *
 * <p>Writing is deterministic. List and option order is significant (it is the emission order of
 * generated code), so nothing is re-sorted.</p>
 *
 * <p>Files are usually written by hand, so reading is lenient about the case of state types
 * ({@code "ode"}) but strict about the rest: a file without {@code schemaVersion} is taken to be
 * the current version, a different major version is rejected, and a state the model refuses is
 * reported with the file it came from.</p>
 */
public final class DaeJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private DaeJson() {}

    public static DaeModel read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        return parse(Files.readString(path, StandardCharsets.UTF_8), path.toString());
    }

    /** Parse a DAE model from a JSON string. */
    public static DaeModel readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return parse(json, "<string>");
    }

    public static void write(DaeModel model, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        String json = toJsonString(model);
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, json, StandardCharsets.UTF_8);
    }

    /** Pretty-printed JSON with a trailing newline. */
    public static String toJsonString(DaeModel model) throws IOException {
        if (model == null) throw new IllegalArgumentException("model is null");
        return MAPPER.writer(PRETTY).writeValueAsString(model) + "\n";
    }

    static boolean isSupported(String schemaVersion) {
        return majorOf(schemaVersion).equals(majorOf(DaeModel.SCHEMA_VERSION));
    }

    private static String majorOf(String version) {
        int dot = version.indexOf('.');
        return dot < 0 ? version.trim() : version.substring(0, dot).trim();
    }

    private static DaeModel parse(String json, String source) throws IOException {
        JsonNode tree = MAPPER.readTree(json);
        if (!(tree instanceof ObjectNode)) {
            throw new IOException(source + ": a DAE model must be a JSON object");
        }
        JsonNode version = tree.get("schemaVersion");
        if (version != null && !version.isNull() && !isSupported(version.asText())) {
            throw new IOException(source + ": unsupported DAE schema version " + version.asText()
                    + " (expected " + DaeModel.SCHEMA_VERSION + ")");
        }
        try {
            return MAPPER.treeToValue(tree, DaeModel.class);
        } catch (ValueInstantiationException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new IOException(source + ": invalid DAE model: " + cause.getMessage(), ex);
        } catch (JsonProcessingException ex) {
            throw new IOException(source + ": invalid DAE model: " + ex.getOriginalMessage(), ex);
        }
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}

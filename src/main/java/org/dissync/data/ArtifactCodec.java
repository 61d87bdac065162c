package org.dissync.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes artifacts as TOML.
 * <p>
 * Tables written by {@link #dumpMany(Collection, Comparator)} list their entries in a fixed order,
 * so dumping unchanged data twice yields identical bytes and version control sees no change.
 */
public final class ArtifactCodec {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactCodec.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    public static final Comparator<Function> FUNCTION_ORDER = Comparator.comparingLong(Function::getAddr);
    public static final Comparator<Comment> COMMENT_ORDER = Comparator.comparingLong(Comment::getAddr);
    public static final Comparator<StackVariable> STACK_VARIABLE_ORDER =
            Comparator.comparingLong(StackVariable::getStackOffset);
    public static final Comparator<Struct> STRUCT_ORDER = Comparator.comparing(Struct::getName);

    /**
     * Builds an artifact from one parsed TOML table.
     *
     * @param <T> The artifact type.
     */
    @FunctionalInterface
    public interface ArtifactReader<T extends Artifact> {
        T read(JsonNode node);
    }

    private ArtifactCodec() {
        // Utility class
    }

    public static String serialize(Artifact artifact) {
        return write(artifact.toNode());
    }

    public static <T extends Artifact> T deserialize(String text, ArtifactReader<T> reader) {
        return reader.read(parse(text));
    }

    /**
     * Builds one table holding every artifact under its {@link Artifact#key() key}.
     *
     * @param artifacts The artifacts to dump.
     * @param order     The order in which entries are written.
     * @return A table ready for {@link #write(ObjectNode)}.
     */
    public static <T extends Artifact> ObjectNode dumpMany(Collection<T> artifacts, Comparator<? super T> order) {
        List<T> sorted = new ArrayList<>(artifacts);
        sorted.sort(order);
        ObjectNode table = JsonNodeFactory.instance.objectNode();
        for (T artifact : sorted) {
            table.set(artifact.key(), artifact.toNode());
        }
        return table;
    }

    /**
     * Reads every entry of a table written by {@link #dumpMany(Collection, Comparator)}.
     * An entry that cannot be read is logged and skipped; it never hides the other entries.
     *
     * @param table  The parsed table.
     * @param reader Converts one entry.
     * @return The artifacts in table order.
     */
    public static <T extends Artifact> List<T> loadMany(JsonNode table, ArtifactReader<T> reader) {
        List<T> result = new ArrayList<>();
        if (table == null || !table.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> entries = table.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            try {
                result.add(reader.read(entry.getValue()));
            } catch (ArtifactFormatException e) {
                LOG.warn("Skipping unreadable artifact '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        return result;
    }

    /**
     * Writes a table as TOML text. An empty table is written as empty text, which
     * {@link #parse(String)} reads back as an empty table.
     */
    public static String write(ObjectNode table) {
        if (table.isEmpty()) {
            return "";
        }
        try {
            return MAPPER.writeValueAsString(table);
        } catch (JsonProcessingException e) {
            throw new ArtifactFormatException("Failed to write TOML", e);
        }
    }

    /**
     * Parses TOML text into a table. Blank text yields an empty table.
     *
     * @throws ArtifactFormatException if the text is not valid TOML.
     */
    public static ObjectNode parse(String text) {
        if (text == null || text.isBlank()) {
            return JsonNodeFactory.instance.objectNode();
        }
        try {
            JsonNode node = MAPPER.readTree(text);
            if (node == null || !node.isObject()) {
                return JsonNodeFactory.instance.objectNode();
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new ArtifactFormatException("Invalid TOML: " + e.getOriginalMessage(), e);
        }
    }

    static long requireLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber()) {
            throw new ArtifactFormatException("Missing integer field '" + field + "'");
        }
        return value.asLong();
    }

    static long optionalLong(JsonNode node, String field, long fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isIntegralNumber()) {
            throw new ArtifactFormatException("Field '" + field + "' is not an integer");
        }
        return value.asLong();
    }

    static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }
}

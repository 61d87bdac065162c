package org.dissync.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dissync.data.ArtifactCodec;
import org.dissync.data.ArtifactFormatException;
import org.dissync.data.Comment;
import org.dissync.data.Function;
import org.dissync.data.HexKeys;
import org.dissync.data.StackVariable;
import org.dissync.data.Struct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps a {@link State} to the files of one user's directory in the sync repository and back.
 * <p>
 * Layout, relative to the user's directory:
 * <pre>
 * metadata.toml             user and most recent change
 * functions.toml            functions keyed by hex address
 * comments.toml             comments keyed by hex address
 * structs.toml              structs keyed by name
 * stack_vars/&lt;addr&gt;.toml    stack variables of one function keyed by signed hex offset
 * </pre>
 * The whole file set is produced in memory before anything is written, so a serialization error
 * never leaves a partial snapshot behind.
 */
public final class StateSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(StateSerializer.class);

    public static final String METADATA_FILE = "metadata.toml";
    public static final String FUNCTIONS_FILE = "functions.toml";
    public static final String COMMENTS_FILE = "comments.toml";
    public static final String STRUCTS_FILE = "structs.toml";
    public static final String STACK_VARS_DIR = "stack_vars";
    private static final String TOML_SUFFIX = ".toml";

    private StateSerializer() {
        // Utility class
    }

    /**
     * Serializes a complete state.
     *
     * @param state The state to serialize.
     * @return File contents keyed by path relative to the user's directory, in path order.
     */
    public static Map<String, byte[]> toFiles(State state) {
        Map<String, byte[]> files = new TreeMap<>();

        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("user", state.getUser());
        metadata.put("last_change", state.latestChange());
        files.put(METADATA_FILE, bytes(ArtifactCodec.write(metadata)));

        files.put(FUNCTIONS_FILE, bytes(ArtifactCodec.write(
                ArtifactCodec.dumpMany(state.getFunctions().values(), ArtifactCodec.FUNCTION_ORDER))));
        files.put(COMMENTS_FILE, bytes(ArtifactCodec.write(
                ArtifactCodec.dumpMany(state.getAllComments().values(), ArtifactCodec.COMMENT_ORDER))));
        files.put(STRUCTS_FILE, bytes(ArtifactCodec.write(
                ArtifactCodec.dumpMany(state.getStructs(), ArtifactCodec.STRUCT_ORDER))));

        for (Long funcAddr : state.getStackVariableFunctions()) {
            Map<Long, StackVariable> variables = state.getStackVariables(funcAddr);
            if (variables.isEmpty()) {
                continue;
            }
            files.put(stackVariablePath(funcAddr), bytes(ArtifactCodec.write(
                    ArtifactCodec.dumpMany(variables.values(), ArtifactCodec.STACK_VARIABLE_ORDER))));
        }
        return files;
    }

    /**
     * Rebuilds a state from the files of one user's directory. A file that cannot be parsed is
     * logged and skipped; the remaining files still load.
     *
     * @param user    The owner of the files.
     * @param version The repository version the files were read from.
     * @param files   File contents keyed by path relative to the user's directory.
     * @param clock   Clock for the new state.
     * @return A clean state.
     */
    public static State fromFiles(String user, String version, Map<String, byte[]> files, Clock clock) {
        State state = new State(user, version, clock);
        for (Map.Entry<String, byte[]> file : files.entrySet()) {
            String path = file.getKey();
            try {
                JsonNode table = ArtifactCodec.parse(new String(file.getValue(), StandardCharsets.UTF_8));
                switch (path) {
                    case FUNCTIONS_FILE -> ArtifactCodec.loadMany(table, Function::fromNode)
                            .forEach(function -> state.setFunction(function, false));
                    case COMMENTS_FILE -> ArtifactCodec.loadMany(table, Comment::fromNode)
                            .forEach(comment -> state.setComment(comment, false));
                    case STRUCTS_FILE -> ArtifactCodec.loadMany(table, Struct::fromNode)
                            .forEach(struct -> state.setStruct(struct, null, false));
                    case METADATA_FILE -> LOG.trace("Metadata of user '{}': {}", user, table);
                    default -> loadStackVariables(state, path, table);
                }
            } catch (ArtifactFormatException e) {
                LOG.warn("Skipping unreadable file '{}' of user '{}': {}", path, user, e.getMessage());
            }
        }
        state.markClean();
        return state;
    }

    private static void loadStackVariables(State state, String path, JsonNode table) {
        if (!path.startsWith(STACK_VARS_DIR + "/") || !path.endsWith(TOML_SUFFIX)) {
            LOG.debug("Ignoring unknown file '{}' of user '{}'", path, state.getUser());
            return;
        }
        String key = path.substring(STACK_VARS_DIR.length() + 1, path.length() - TOML_SUFFIX.length());
        long funcAddr = HexKeys.parse(key);
        for (StackVariable variable : ArtifactCodec.loadMany(table, StackVariable::fromNode)) {
            if (variable.getFuncAddr() != funcAddr) {
                LOG.warn("Stack variable {} stored in the file of function 0x{}, skipping", variable, key);
                continue;
            }
            state.setStackVariable(variable, false);
        }
    }

    public static String stackVariablePath(long funcAddr) {
        return STACK_VARS_DIR + "/" + HexKeys.format(funcAddr) + TOML_SUFFIX;
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}

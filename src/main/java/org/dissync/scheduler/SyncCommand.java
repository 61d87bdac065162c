package org.dissync.scheduler;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A deferred change to the master state, created by the hook layer and executed by the sync loop.
 * <p>
 * Commands that carry a collapse key replace an older pending command with the same key, so only
 * the latest definition of a struct gets written.
 */
public final class SyncCommand {

    /**
     * The work of a command.
     */
    @FunctionalInterface
    public interface CommandAction {
        /**
         * @param apiSet {@code true} if the change that triggered the command was made by the sync
         *               engine itself rather than by the analyst.
         */
        void execute(boolean apiSet) throws Exception;
    }

    /**
     * Combines a collapsing command with the pending command it replaces.
     */
    @FunctionalInterface
    public interface Merge {
        /**
         * @param pending The command being replaced.
         * @return The command to keep instead of the new one, or empty to keep the new one as is.
         */
        Optional<SyncCommand> merge(SyncCommand pending);
    }

    private final String operation;
    private final List<Object> args;
    private final String collapseKey;
    private final boolean apiSet;
    private final CommandAction action;
    private final Merge merge;

    private SyncCommand(String operation, List<Object> args, String collapseKey, boolean apiSet,
                        CommandAction action, Merge merge) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.args = List.copyOf(args);
        this.collapseKey = collapseKey;
        this.apiSet = apiSet;
        this.action = Objects.requireNonNull(action, "action");
        this.merge = merge;
    }

    public static SyncCommand of(String operation, List<Object> args, CommandAction action) {
        return new SyncCommand(operation, args, null, false, action, null);
    }

    /**
     * Creates a command that replaces any pending command with the same {@code collapseKey}.
     */
    public static SyncCommand collapsing(String collapseKey, String operation, List<Object> args, CommandAction action) {
        return new SyncCommand(operation, args, Objects.requireNonNull(collapseKey, "collapseKey"), false, action, null);
    }

    /**
     * Returns a copy that consults {@code merge} when it replaces a pending command.
     */
    public SyncCommand mergingWith(Merge merge) {
        return new SyncCommand(operation, args, collapseKey, apiSet, action, Objects.requireNonNull(merge, "merge"));
    }

    /**
     * Returns a copy marked as originating from an engine-made change.
     */
    public SyncCommand withApiSet() {
        return apiSet ? this : new SyncCommand(operation, args, collapseKey, true, action, merge);
    }

    /**
     * The command that takes the place of {@code pending} in the queue. A merged command counts as
     * engine-made only if both commands were.
     */
    public SyncCommand replacing(SyncCommand pending) {
        if (merge == null) {
            return this;
        }
        Optional<SyncCommand> merged = merge.merge(pending);
        if (merged.isEmpty()) {
            return this;
        }
        return apiSet && pending.isApiSet() ? merged.get().withApiSet() : merged.get();
    }

    public void execute() throws Exception {
        action.execute(apiSet);
    }

    public String getOperation() {
        return operation;
    }

    public List<Object> getArgs() {
        return args;
    }

    public String getCollapseKey() {
        return collapseKey;
    }

    public boolean isApiSet() {
        return apiSet;
    }

    @Override
    public String toString() {
        return operation + args + (apiSet ? " (api)" : "");
    }
}

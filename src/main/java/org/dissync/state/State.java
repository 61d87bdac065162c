package org.dissync.state;

import org.dissync.data.Artifact;
import org.dissync.data.Comment;
import org.dissync.data.Function;
import org.dissync.data.HexKeys;
import org.dissync.data.StackVariable;
import org.dissync.data.Struct;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One analyst's snapshot of every synchronized artifact at one repository version.
 * <p>
 * A state is a value object. The client hands out copies, so nothing a caller does to a state is
 * visible to anyone else until the state is {@link #save() saved}. Only the local analyst's own
 * latest state can be saved; every other state is read-only.
 * <p>
 * Not thread-safe. Writers are serialized by the client's state lock.
 */
public final class State {

    /**
     * Persists a complete state, typically by serializing and committing it.
     */
    @FunctionalInterface
    public interface Writer {
        void write(State state) throws IOException;
    }

    private final String user;
    private final String version;
    private final Clock clock;

    private final TreeMap<Long, Function> functions = new TreeMap<>();
    private final TreeMap<Long, TreeMap<Long, StackVariable>> stackVariables = new TreeMap<>();
    private final TreeMap<Long, Comment> comments = new TreeMap<>();
    private final TreeMap<String, Struct> structs = new TreeMap<>();

    private Writer writer;
    private boolean dirty;

    public State(String user, Clock clock) {
        this(user, null, clock);
    }

    /**
     * @param user    The analyst owning this state.
     * @param version The repository version it was read from, or {@code null} for a state that was
     *                never committed.
     * @param clock   Source of {@code last_change} stamps.
     */
    public State(String user, String version, Clock clock) {
        this.user = Objects.requireNonNull(user, "user");
        this.version = version;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String getUser() {
        return user;
    }

    public String getVersion() {
        return version;
    }

    public Clock getClock() {
        return clock;
    }

    // ---------------------------------------------------------------------
    // Functions
    // ---------------------------------------------------------------------

    public Function getFunction(long addr) {
        Function function = functions.get(addr);
        if (function == null) {
            throw new ArtifactNotFoundException(String.format("No function at 0x%x for user '%s'", addr, user));
        }
        return function;
    }

    public NavigableMap<Long, Function> getFunctions() {
        return Collections.unmodifiableNavigableMap(functions);
    }

    public void setFunction(Function function, boolean setLastChange) {
        Function stored = functions.get(function.getAddr());
        functions.put(function.getAddr(), setLastChange ? function.withLastChange(now())
                : function.withLastChange(keptStamp(function, stored)));
        dirty = true;
    }

    // ---------------------------------------------------------------------
    // Stack variables
    // ---------------------------------------------------------------------

    public StackVariable getStackVariable(long funcAddr, long offset) {
        StackVariable variable = getStackVariables(funcAddr).get(offset);
        if (variable == null) {
            throw new ArtifactNotFoundException(String.format("No stack variable at offset %s of function 0x%x for user '%s'",
                    HexKeys.format(offset), funcAddr, user));
        }
        return variable;
    }

    /**
     * Returns the stack variables of one function keyed by offset.
     *
     * @throws ArtifactNotFoundException if the state has no stack variables for the function.
     */
    public NavigableMap<Long, StackVariable> getStackVariables(long funcAddr) {
        TreeMap<Long, StackVariable> variables = stackVariables.get(funcAddr);
        if (variables == null) {
            throw new ArtifactNotFoundException(String.format("No stack variables for function 0x%x for user '%s'",
                    funcAddr, user));
        }
        return Collections.unmodifiableNavigableMap(variables);
    }

    /**
     * Returns the addresses of every function that has at least one stack variable.
     */
    public List<Long> getStackVariableFunctions() {
        return new ArrayList<>(stackVariables.keySet());
    }

    public void setStackVariable(StackVariable variable, boolean setLastChange) {
        TreeMap<Long, StackVariable> variables = stackVariables.computeIfAbsent(variable.getFuncAddr(), addr -> new TreeMap<>());
        long stamp = setLastChange ? now() : keptStamp(variable, variables.get(variable.getStackOffset()));
        variables.put(variable.getStackOffset(), variable.withLastChange(stamp));
        dirty = true;
    }

    // ---------------------------------------------------------------------
    // Comments
    // ---------------------------------------------------------------------

    public Comment getComment(long addr) {
        Comment comment = comments.get(addr);
        if (comment == null) {
            throw new ArtifactNotFoundException(String.format("No comment at 0x%x for user '%s'", addr, user));
        }
        return comment;
    }

    /**
     * Returns the comments that belong to one function, keyed by address. Empty when there are none.
     */
    public NavigableMap<Long, Comment> getComments(long funcAddr) {
        TreeMap<Long, Comment> result = new TreeMap<>();
        for (Comment comment : comments.values()) {
            if (comment.getFuncAddr() == funcAddr) {
                result.put(comment.getAddr(), comment);
            }
        }
        return result;
    }

    public NavigableMap<Long, Comment> getAllComments() {
        return Collections.unmodifiableNavigableMap(comments);
    }

    public void setComment(Comment comment, boolean setLastChange) {
        long stamp = setLastChange ? now() : keptStamp(comment, comments.get(comment.getAddr()));
        comments.put(comment.getAddr(), comment.withLastChange(stamp));
        dirty = true;
    }

    /**
     * Removes the comment at an address. Removing a comment that does not exist does nothing.
     */
    public void removeComment(long addr) {
        if (comments.remove(addr) != null) {
            dirty = true;
        }
    }

    // ---------------------------------------------------------------------
    // Structs
    // ---------------------------------------------------------------------

    public List<Struct> getStructs() {
        return new ArrayList<>(structs.values());
    }

    public Struct getStruct(String name) {
        Struct struct = structs.get(name);
        if (struct == null) {
            throw new ArtifactNotFoundException("No struct '" + name + "' for user '" + user + "'");
        }
        return struct;
    }

    /**
     * Stores a struct. When {@code oldName} names a different struct, this is a rename: the old
     * entry is dropped and the new one inserted in one step, without diffing members.
     *
     * @param struct        The complete new definition.
     * @param oldName       The name before the change, or {@code null}.
     * @param setLastChange Whether to stamp the struct with the current time.
     */
    public void setStruct(Struct struct, String oldName, boolean setLastChange) {
        if (oldName != null && !oldName.isEmpty() && !oldName.equals(struct.getName())) {
            structs.remove(oldName);
        }
        long stamp = setLastChange ? now() : keptStamp(struct, structs.get(struct.getName()));
        structs.put(struct.getName(), struct.withLastChange(stamp));
        dirty = true;
    }

    public void removeStruct(String name) {
        if (structs.remove(name) != null) {
            dirty = true;
        }
    }

    // ---------------------------------------------------------------------
    // Comparison and merging
    // ---------------------------------------------------------------------

    /**
     * Checks whether the name, stack variables and comments of one function are content-equal in
     * both states. Timestamps never take part, so two analysts who agree compare equal even though
     * they changed things at different times.
     *
     * @param addr  The function address.
     * @param other The state to compare with.
     * @return {@code true} if nothing about the function differs.
     */
    public boolean compareFunction(long addr, State other) {
        if (!Objects.equals(functions.get(addr), other.functions.get(addr))) {
            return false;
        }
        Map<Long, StackVariable> mine = stackVariables.getOrDefault(addr, new TreeMap<>());
        Map<Long, StackVariable> theirs = other.stackVariables.getOrDefault(addr, new TreeMap<>());
        if (!mine.equals(theirs)) {
            return false;
        }
        return getComments(addr).equals(other.getComments(addr));
    }

    /**
     * Checks whether both states hold content-equal struct definitions.
     */
    public boolean compareStructs(State other) {
        return structs.equals(other.structs);
    }

    /**
     * Merges another analyst's state into this one, last write wins. An artifact of {@code other}
     * is adopted when this state lacks it, or when it is strictly newer and its content differs.
     * Artifacts keep the timestamp they had in {@code other}.
     *
     * @param other The state to merge from.
     * @return The number of adopted artifacts.
     */
    public int mergeFrom(State other) {
        int adopted = 0;
        for (Function theirs : other.functions.values()) {
            if (newer(theirs, functions.get(theirs.getAddr()))) {
                functions.put(theirs.getAddr(), theirs);
                adopted++;
            }
        }
        for (Map.Entry<Long, TreeMap<Long, StackVariable>> entry : other.stackVariables.entrySet()) {
            TreeMap<Long, StackVariable> mine = stackVariables.computeIfAbsent(entry.getKey(), addr -> new TreeMap<>());
            for (StackVariable theirs : entry.getValue().values()) {
                if (newer(theirs, mine.get(theirs.getStackOffset()))) {
                    mine.put(theirs.getStackOffset(), theirs);
                    adopted++;
                }
            }
            if (mine.isEmpty()) {
                stackVariables.remove(entry.getKey());
            }
        }
        for (Comment theirs : other.comments.values()) {
            if (newer(theirs, comments.get(theirs.getAddr()))) {
                comments.put(theirs.getAddr(), theirs);
                adopted++;
            }
        }
        for (Struct theirs : other.structs.values()) {
            if (newer(theirs, structs.get(theirs.getName()))) {
                structs.put(theirs.getName(), theirs);
                adopted++;
            }
        }
        if (adopted > 0) {
            dirty = true;
        }
        return adopted;
    }

    private static boolean newer(Artifact theirs, Artifact mine) {
        if (mine == null) {
            return true;
        }
        return theirs.getLastChange() > mine.getLastChange() && !theirs.equals(mine);
    }

    /**
     * Returns the most recent {@code last_change} of any artifact, or {@link Artifact#NEVER_CHANGED}.
     */
    public long latestChange() {
        long latest = Artifact.NEVER_CHANGED;
        for (Function function : functions.values()) {
            latest = Math.max(latest, function.getLastChange());
        }
        for (TreeMap<Long, StackVariable> variables : stackVariables.values()) {
            for (StackVariable variable : variables.values()) {
                latest = Math.max(latest, variable.getLastChange());
            }
        }
        for (Comment comment : comments.values()) {
            latest = Math.max(latest, comment.getLastChange());
        }
        for (Struct struct : structs.values()) {
            latest = Math.max(latest, struct.getLastChange());
        }
        return latest;
    }

    public boolean isEmpty() {
        return functions.isEmpty() && stackVariables.isEmpty() && comments.isEmpty() && structs.isEmpty();
    }

    // ---------------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------------

    /**
     * Returns a detached deep copy. The copy is not dirty and cannot be saved until a writer is bound.
     */
    public State copy() {
        State copy = new State(user, version, clock);
        copy.functions.putAll(functions);
        for (Map.Entry<Long, TreeMap<Long, StackVariable>> entry : stackVariables.entrySet()) {
            copy.stackVariables.put(entry.getKey(), new TreeMap<>(entry.getValue()));
        }
        copy.comments.putAll(comments);
        copy.structs.putAll(structs);
        return copy;
    }

    public void bindWriter(Writer newWriter) {
        this.writer = newWriter;
    }

    public boolean isWritable() {
        return writer != null;
    }

    public boolean isDirty() {
        return dirty;
    }

    /**
     * Persists the complete snapshot. Does nothing when no setter changed the state since it was
     * loaded or last saved.
     *
     * @throws IllegalStateException if the state is read-only.
     * @throws IOException           if serialization or the commit fails; the state stays dirty.
     */
    public void save() throws IOException {
        if (writer == null) {
            throw new IllegalStateException("State of user '" + user + "' is read-only");
        }
        if (!dirty) {
            return;
        }
        writer.write(this);
        dirty = false;
    }

    void markClean() {
        dirty = false;
    }

    /**
     * An unstamped artifact inherits the stamp of the one it replaces.
     */
    private static long keptStamp(Artifact incoming, Artifact stored) {
        if (incoming.getLastChange() == Artifact.NEVER_CHANGED && stored != null) {
            return stored.getLastChange();
        }
        return incoming.getLastChange();
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    @Override
    public String toString() {
        return String.format("State{user='%s', version=%s, functions=%d, stackVariableFunctions=%d, comments=%d, structs=%d}",
                user, version, functions.size(), stackVariables.size(), comments.size(), structs.size());
    }
}

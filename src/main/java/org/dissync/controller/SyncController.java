package org.dissync.controller;

import org.dissync.client.Client;
import org.dissync.client.ConnectionWarning;
import org.dissync.client.NotConnectedException;
import org.dissync.client.StateAction;
import org.dissync.config.SyncSettings;
import org.dissync.controller.HostTool.FrameMember;
import org.dissync.controller.HostTool.HostFunction;
import org.dissync.controller.HostTool.StackFrame;
import org.dissync.data.Artifact;
import org.dissync.data.Comment;
import org.dissync.data.Function;
import org.dissync.data.HexKeys;
import org.dissync.data.StackVariable;
import org.dissync.data.Struct;
import org.dissync.data.UnsupportedOffsetConversionException;
import org.dissync.scheduler.ApiCallCounter;
import org.dissync.scheduler.CommandQueue;
import org.dissync.scheduler.SyncCommand;
import org.dissync.scheduler.UpdateTask;
import org.dissync.scheduler.UpdateTaskState;
import org.dissync.state.ArtifactNotFoundException;
import org.dissync.state.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Orchestrates synchronization between the host tool and the sync repository.
 * <p>
 * Outbound, the {@code push*} writers record the analyst's own edits in the master state. Inbound,
 * {@link #fillFunction} diffs another user's state against the host and applies every differing
 * artifact. Every host mutation made here is counted by the {@link ApiCallCounter} so the hook
 * layer can tell engine-made changes from analyst edits.
 */
public class SyncController {

    private static final Logger LOG = LoggerFactory.getLogger(SyncController.class);

    static final String FILL_FUNCTION = "fill_function";

    private final HostTool host;
    private final SyncSettings settings;
    private final Clock clock;
    private final ApiCallCounter apiCounter = new ApiCallCounter();
    private final CommandQueue commandQueue = new CommandQueue();
    private final Map<Long, UpdateTaskState> updateStates = new ConcurrentHashMap<>();

    private volatile Client client;
    private volatile InfoSurface infoSurface;
    private SyncLoop loop;

    @FunctionalInterface
    private interface HostCall {
        void run() throws HostToolException;
    }

    public SyncController(HostTool host, SyncSettings settings, Clock clock) {
        this.host = host;
        this.settings = settings;
        this.clock = clock;
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Starts the background sync loop.
     */
    public synchronized void start() {
        if (loop == null) {
            loop = new SyncLoop(this, settings, clock);
        }
        loop.start();
    }

    /**
     * Stops the background sync loop and disconnects.
     */
    public synchronized void shutdown() {
        if (loop != null && (loop.getCurrentState() == SyncLoop.State.RUNNING
                || loop.getCurrentState() == SyncLoop.State.PAUSED)) {
            loop.stop();
        }
        disconnect();
    }

    public synchronized SyncLoop getLoop() {
        return loop;
    }

    /**
     * Connects to a sync repository as {@code user}, replacing any previous connection.
     *
     * @return Non-fatal problems found while connecting.
     * @throws IOException       if the repository cannot be opened.
     * @throws HostToolException if the host cannot report the binary hash.
     */
    public synchronized List<ConnectionWarning> connect(String user, Path repoPath, boolean initRepo, String remoteUrl)
            throws IOException, HostToolException {
        if (client != null) {
            disconnect();
        }
        String binaryHash = host.currentBinaryHash();
        client = Client.connect(user, repoPath, binaryHash, initRepo, remoteUrl, settings.repository(), clock);
        return List.copyOf(client.getConnectionWarnings());
    }

    public synchronized void disconnect() {
        Client current = client;
        if (current == null) {
            return;
        }
        client = null;
        commandQueue.clear();
        updateStates.clear();
        current.close();
        LOG.info("Disconnected from sync repository");
    }

    public boolean isConnected() {
        return client != null;
    }

    /**
     * @return The connected client.
     * @throws NotConnectedException if not connected.
     */
    public Client client() {
        Client current = client;
        if (current == null) {
            throw new NotConnectedException();
        }
        return current;
    }

    Optional<Client> currentClient() {
        return Optional.ofNullable(client);
    }

    public SyncStatus status() {
        return statusOf(client);
    }

    private static SyncStatus statusOf(Client current) {
        if (current == null) {
            return SyncStatus.DISCONNECTED;
        }
        return current.hasRemote() ? SyncStatus.CONNECTED : SyncStatus.CONNECTED_NO_REMOTE;
    }

    public String statusString() {
        Client current = client;
        return switch (statusOf(current)) {
            case CONNECTED -> "Connected to a sync repo: " + current.getMasterUser();
            case CONNECTED_NO_REMOTE -> "Connected to a sync repo (no remote): " + current.getMasterUser();
            case DISCONNECTED -> "Not connected to a sync repo";
        };
    }

    public List<String> users() throws IOException {
        return client().users();
    }

    public ApiCallCounter apiCounter() {
        return apiCounter;
    }

    public CommandQueue commandQueue() {
        return commandQueue;
    }

    /**
     * @return The pending host updates of one function, created on first use.
     */
    public UpdateTaskState updateState(long funcAddr) {
        return updateStates.computeIfAbsent(funcAddr, addr -> new UpdateTaskState());
    }

    public void setInfoSurface(InfoSurface surface) {
        this.infoSurface = surface;
    }

    public void clearInfoSurface() {
        this.infoSurface = null;
    }

    Optional<InfoSurface> infoSurface() {
        return Optional.ofNullable(infoSurface);
    }

    // ---------------------------------------------------------------------
    // Apply engine
    // ---------------------------------------------------------------------

    /**
     * Applies one user's version of a function to the host tool.
     *
     * @param funcAddr The function address.
     * @param user     The source user, or {@code null} for the master user.
     * @return What happened.
     * @throws IOException       if a state cannot be read or the applied artifacts cannot be recorded.
     * @throws HostToolException if the host cannot look up the function.
     */
    public FillResult fillFunction(long funcAddr, String user) throws IOException, HostToolException {
        Client current = client();
        if (host.getFunctionAt(funcAddr).isEmpty()) {
            LOG.debug("No function at 0x{} in the host, nothing to fill", HexKeys.format(funcAddr));
            return FillResult.FUNCTION_MISSING;
        }
        State source = current.getState(user, null, false);
        boolean fromMaster = source.getUser().equals(current.getMasterUser());
        if (!fromMaster && source.compareFunction(funcAddr, current.getState(null, null, false))) {
            LOG.debug("Function 0x{} of '{}' matches the master state, nothing to fill",
                    HexKeys.format(funcAddr), source.getUser());
            return FillResult.NO_CHANGE;
        }

        FillPass pass = new FillPass(source, funcAddr);
        pass.applyFunctionName();
        pass.applyComments();
        pass.applyStackVariables();

        if (!fromMaster && !pass.applied.isEmpty()) {
            recordApplied(pass.applied);
        }
        try {
            host.refreshView(funcAddr);
        } catch (HostToolException e) {
            LOG.warn("Failed to refresh the view of function 0x{}: {}", HexKeys.format(funcAddr), e.getMessage());
        }
        LOG.info("Filled function 0x{} from '{}': {} artifacts applied", HexKeys.format(funcAddr),
                source.getUser(), pass.applied.size());
        return FillResult.APPLIED;
    }

    /**
     * Applies every struct of one user's state to the host tool. Structs the host already holds
     * with equal content are skipped.
     *
     * @param user The source user, or {@code null} for the master user.
     * @return The number of structs applied.
     */
    public int fillStructs(String user) throws IOException {
        Client current = client();
        State source = current.getState(user, null, false);
        List<Consumer<State>> applied = new ArrayList<>();
        int count = fillStructs(source, applied);
        if (!source.getUser().equals(current.getMasterUser()) && !applied.isEmpty()) {
            recordApplied(applied);
        }
        return count;
    }

    private int fillStructs(State source, List<Consumer<State>> applied) {
        List<Struct> created = new ArrayList<>();
        for (Struct struct : source.getStructs()) {
            try {
                Optional<Struct> existing = host.getStruct(struct.getName());
                if (existing.isPresent() && existing.get().equals(struct)) {
                    LOG.debug("Struct '{}' is up to date in the host", struct.getName());
                    continue;
                }
            } catch (HostToolException e) {
                LOG.warn("Failed to read struct '{}' from the host: {}", struct.getName(), e.getMessage());
                continue;
            }
            if (mutate("struct " + struct.getName(), () -> host.createStruct(struct))) {
                created.add(struct);
            }
        }
        // Member types may reference each other, so they are set once every struct exists.
        for (Struct struct : created) {
            if (mutate("member types of struct " + struct.getName(), () -> host.setStructMemberTypes(struct))) {
                applied.add(master -> master.setStruct(struct, null, false));
            }
        }
        return created.size();
    }

    /**
     * One diff-and-apply pass over a function.
     */
    private final class FillPass {
        private final State source;
        private final long funcAddr;
        private final List<Consumer<State>> applied = new ArrayList<>();
        private boolean structsFilled;

        FillPass(State source, long funcAddr) {
            this.source = source;
            this.funcAddr = funcAddr;
        }

        void applyFunctionName() {
            Function function;
            try {
                function = source.getFunction(funcAddr);
            } catch (ArtifactNotFoundException e) {
                LOG.debug("{}", e.getMessage());
                return;
            }
            if (!function.hasName()) {
                return;
            }
            try {
                Optional<HostFunction> hostFunction = host.getFunctionAt(funcAddr);
                if (hostFunction.isPresent() && function.getName().equals(hostFunction.get().name())) {
                    return;
                }
            } catch (HostToolException e) {
                LOG.warn("Failed to read function 0x{} from the host: {}", HexKeys.format(funcAddr), e.getMessage());
                return;
            }
            if (mutate("name of function 0x" + HexKeys.format(funcAddr),
                    () -> host.setFunctionName(funcAddr, function.getName()))) {
                applied.add(master -> master.setFunction(function, false));
            }
        }

        void applyComments() {
            for (Comment comment : source.getComments(funcAddr).values()) {
                try {
                    Optional<String> current = host.getComment(comment.getAddr(), comment.isDecompiled());
                    if (current.orElse("").equals(comment.getComment())) {
                        continue;
                    }
                } catch (HostToolException e) {
                    LOG.warn("Failed to read comment at 0x{}: {}", HexKeys.format(comment.getAddr()), e.getMessage());
                    continue;
                }
                if (mutate("comment at 0x" + HexKeys.format(comment.getAddr()),
                        () -> host.setComment(comment.getAddr(), comment.getComment(), comment.isDecompiled()))) {
                    applied.add(master -> master.setComment(comment, false));
                }
            }
        }

        void applyStackVariables() {
            NavigableMap<Long, StackVariable> variables;
            try {
                variables = source.getStackVariables(funcAddr);
            } catch (ArtifactNotFoundException e) {
                LOG.debug("{}", e.getMessage());
                return;
            }
            Optional<StackFrame> frame;
            try {
                frame = host.getStackFrame(funcAddr);
            } catch (HostToolException e) {
                LOG.warn("Failed to read the stack frame of function 0x{}: {}", HexKeys.format(funcAddr), e.getMessage());
                return;
            }
            if (frame.isEmpty()) {
                LOG.debug("Function 0x{} has no stack frame in the host", HexKeys.format(funcAddr));
                return;
            }
            for (StackVariable variable : variables.values()) {
                applyStackVariable(frame.get(), variable);
            }
        }

        private void applyStackVariable(StackFrame frame, StackVariable variable) {
            long offset;
            try {
                offset = variable.getOffset(host.offsetType());
            } catch (UnsupportedOffsetConversionException e) {
                LOG.warn("Skipping stack variable '{}' of function 0x{}: {}", variable.getName(),
                        HexKeys.format(funcAddr), e.getMessage());
                return;
            }
            FrameMember member = frame.members().get(offset);
            if (member == null) {
                LOG.debug("No stack member at offset {} of function 0x{}", HexKeys.format(offset), HexKeys.format(funcAddr));
                return;
            }
            boolean changed = false;
            if (!variable.getName().isEmpty() && !variable.getName().equals(member.name())) {
                changed = mutate("name of stack variable at offset " + HexKeys.format(offset),
                        () -> host.renameStackMember(funcAddr, offset, variable.getName()));
            }
            if (!variable.getType().isEmpty() && !variable.getType().equals(member.type())) {
                changed |= applyType(offset, variable.getType());
            }
            if (changed) {
                applied.add(master -> master.setStackVariable(variable, false));
            }
        }

        private boolean applyType(long offset, String type) {
            apiCounter.increment();
            try {
                host.setMemberType(funcAddr, offset, type);
                return true;
            } catch (UnknownTypeException e) {
                apiCounter.release();
                if (structsFilled || !referencesStruct(type)) {
                    warnType(offset, type, e);
                    return false;
                }
            } catch (HostToolException e) {
                apiCounter.release();
                warnType(offset, type, e);
                return false;
            }

            LOG.debug("Type '{}' is unknown to the host, filling structs of '{}' first", type, source.getUser());
            structsFilled = true;
            fillStructs(source, applied);
            apiCounter.increment();
            try {
                host.setMemberType(funcAddr, offset, type);
                return true;
            } catch (HostToolException e) {
                apiCounter.release();
                warnType(offset, type, e);
                return false;
            }
        }

        private boolean referencesStruct(String type) {
            return source.getStructs().stream().anyMatch(struct -> type.contains(struct.getName()));
        }

        private void warnType(long offset, String type, HostToolException e) {
            LOG.warn("Cannot apply type '{}' to stack variable at offset {} of function 0x{}: {}",
                    type, HexKeys.format(offset), HexKeys.format(funcAddr), e.getMessage());
        }
    }

    /**
     * Runs one host mutation, counted as engine-made.
     *
     * @return {@code true} if the host accepted it.
     */
    private boolean mutate(String what, HostCall call) {
        apiCounter.increment();
        try {
            call.run();
            return true;
        } catch (HostToolException e) {
            apiCounter.release();
            LOG.warn("Failed to apply {}: {}", what, e.getMessage());
            return false;
        }
    }

    /**
     * Records artifacts that were applied to the host in the master state, keeping their source
     * timestamps, so the next diff sees them as in sync. The commit is published by the sync loop.
     */
    private void recordApplied(List<Consumer<State>> applied) throws IOException {
        client().recordLocally(master -> {
            applied.forEach(update -> update.accept(master));
            return null;
        });
    }

    // ---------------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------------

    /**
     * Merges {@code user}'s state into the master state, then schedules a fill of every function
     * of the master state for when the analyst next views it.
     *
     * @return The number of scheduled functions.
     */
    public int syncAll(String user) throws IOException {
        Client current = client();
        current.syncStates(user);
        State master = current.getState(null, null, false);
        TreeSet<Long> addresses = new TreeSet<>(master.getFunctions().keySet());
        addresses.addAll(master.getStackVariableFunctions());
        master.getAllComments().values().forEach(comment -> addresses.add(comment.getFuncAddr()));
        for (long addr : addresses) {
            scheduleFill(addr, current.getMasterUser());
        }
        LOG.info("Scheduled {} functions for sync with '{}'", addresses.size(), user);
        return addresses.size();
    }

    /**
     * Schedules a one-shot fill of a function from {@code user}.
     */
    public void scheduleFill(long funcAddr, String user) {
        updateState(funcAddr).addUpdateTask(fillTask(funcAddr, user));
    }

    /**
     * Turns the recurring fill of a function from {@code user} on or off.
     *
     * @return {@code true} if it is on afterwards.
     */
    public boolean toggleAutoSync(long funcAddr, String user) {
        return updateState(funcAddr).toggleAutoSyncTask(fillTask(funcAddr, user));
    }

    private UpdateTask fillTask(long funcAddr, String user) {
        return new UpdateTask(FILL_FUNCTION, List.of(funcAddr, user), () -> fillFunction(funcAddr, user));
    }

    // ---------------------------------------------------------------------
    // Readers
    // ---------------------------------------------------------------------

    public Optional<Function> pullFunction(long addr, String user) throws IOException {
        return find(user, state -> state.getFunction(addr));
    }

    public Map<Long, StackVariable> pullStackVariables(long funcAddr, String user) throws IOException {
        return find(user, state -> (Map<Long, StackVariable>) state.getStackVariables(funcAddr)).orElse(Map.of());
    }

    public Optional<StackVariable> pullStackVariable(long funcAddr, long offset, String user) throws IOException {
        return find(user, state -> state.getStackVariable(funcAddr, offset));
    }

    public Map<Long, Comment> pullComments(long funcAddr, String user) throws IOException {
        return client().getState(user, null, false).getComments(funcAddr);
    }

    public Optional<Comment> pullComment(long addr, String user) throws IOException {
        return find(user, state -> state.getComment(addr));
    }

    public List<Struct> pullStructs(String user) throws IOException {
        return client().getState(user, null, false).getStructs();
    }

    private <T> Optional<T> find(String user, java.util.function.Function<State, T> lookup) throws IOException {
        State state = client().getState(user, null, false);
        try {
            return Optional.of(lookup.apply(state));
        } catch (ArtifactNotFoundException e) {
            LOG.debug("{}", e.getMessage());
            return Optional.empty();
        }
    }

    // ---------------------------------------------------------------------
    // Writers
    // ---------------------------------------------------------------------

    /**
     * Records a function name in the master state.
     *
     * @param apiSet {@code true} if the rename was made by the sync engine: the name is stored
     *               without a new timestamp.
     * @return {@code true} if the master state changed.
     */
    public boolean pushFunctionName(long addr, String name, boolean apiSet) throws IOException {
        Function function = new Function(addr, name);
        return mutateMaster(master -> {
            if (function.equals(stored(() -> master.getFunction(addr)))) {
                return false;
            }
            master.setFunction(function, !apiSet);
            return true;
        });
    }

    /**
     * Records a stack variable in the master state. {@code offset} is in the host's convention.
     */
    public boolean pushStackVariable(long funcAddr, long offset, String name, String type, int size, boolean apiSet)
            throws IOException {
        StackVariable variable = new StackVariable(offset, host.offsetType(), name, type, size, funcAddr);
        return mutateMaster(master -> {
            if (variable.equals(stored(() -> master.getStackVariable(funcAddr, offset)))) {
                return false;
            }
            master.setStackVariable(variable, !apiSet);
            return true;
        });
    }

    /**
     * Records a comment in the master state. An empty text is stored as such, so clearing a
     * comment reaches other users.
     */
    public boolean pushComment(long funcAddr, long addr, String text, boolean decompiled, boolean apiSet)
            throws IOException {
        Comment comment = new Comment(funcAddr, addr, text, decompiled);
        return mutateMaster(master -> {
            if (comment.equals(stored(() -> master.getComment(addr)))) {
                return false;
            }
            master.setComment(comment, !apiSet);
            return true;
        });
    }

    /**
     * Records several comments of one function in a single commit.
     *
     * @return The number of comments that changed.
     */
    public int pushComments(long funcAddr, Map<Long, String> comments, boolean decompiled, boolean apiSet)
            throws IOException {
        return mutateMaster(master -> {
            int changed = 0;
            for (Map.Entry<Long, String> entry : new TreeMap<>(comments).entrySet()) {
                Comment comment = new Comment(funcAddr, entry.getKey(), entry.getValue(), decompiled);
                if (!comment.equals(stored(() -> master.getComment(entry.getKey())))) {
                    master.setComment(comment, !apiSet);
                    changed++;
                }
            }
            return changed;
        });
    }

    /**
     * Removes every comment of a function from the master state.
     *
     * @return The number of removed comments.
     */
    public int removeAllComments(long funcAddr) throws IOException {
        return mutateMaster(master -> {
            List<Long> addresses = new ArrayList<>(master.getComments(funcAddr).keySet());
            addresses.forEach(master::removeComment);
            return addresses.size();
        });
    }

    /**
     * Records a struct definition. A differing {@code oldName} makes this a rename.
     */
    public boolean pushStruct(Struct struct, String oldName, boolean apiSet) throws IOException {
        boolean rename = oldName != null && !oldName.isEmpty() && !oldName.equals(struct.getName());
        return mutateMaster(master -> {
            if (!rename && struct.equals(stored(() -> master.getStruct(struct.getName())))) {
                return false;
            }
            master.setStruct(struct, oldName, !apiSet);
            return true;
        });
    }

    public boolean deleteStruct(String name, boolean apiSet) throws IOException {
        return mutateMaster(master -> {
            if (stored(() -> master.getStruct(name)) == null) {
                return false;
            }
            master.removeStruct(name);
            return true;
        });
    }

    private <T> T mutateMaster(StateAction<T> action) throws IOException {
        return client().stateCtx(null, null, true, action);
    }

    private static <T extends Artifact> T stored(java.util.function.Supplier<T> lookup) {
        try {
            return lookup.get();
        } catch (ArtifactNotFoundException e) {
            return null;
        }
    }

    // ---------------------------------------------------------------------
    // Commands for the hook layer
    // ---------------------------------------------------------------------

    public SyncCommand functionNameCommand(long addr, String name) {
        return SyncCommand.of("push_function_name", List.of(addr, name),
                apiSet -> pushFunctionName(addr, name, apiSet));
    }

    public SyncCommand stackVariableCommand(long funcAddr, FrameMember member) {
        return SyncCommand.of("push_stack_variable", List.of(funcAddr, member.offset(), member.name(), member.type()),
                apiSet -> pushStackVariable(funcAddr, member.offset(), member.name(), member.type(), member.size(), apiSet));
    }

    public SyncCommand commentCommand(long funcAddr, long addr, String text, boolean decompiled) {
        return SyncCommand.of("push_comment", List.of(funcAddr, addr, text, decompiled),
                apiSet -> pushComment(funcAddr, addr, text, decompiled, apiSet));
    }

    public SyncCommand commentsCommand(long funcAddr, Map<Long, String> comments, boolean decompiled) {
        Map<Long, String> copy = new TreeMap<>(comments);
        return SyncCommand.of("push_comments", List.of(funcAddr, copy.size(), decompiled),
                apiSet -> pushComments(funcAddr, copy, decompiled, apiSet));
    }

    /**
     * Struct pushes collapse on the struct name, so only the latest pending definition is written.
     * A pending rename survives a later edit of the renamed struct.
     */
    public SyncCommand structCommand(Struct struct, String oldName) {
        List<Object> args = new ArrayList<>();
        args.add(struct.getName());
        if (oldName != null) {
            args.add(oldName);
        }
        return SyncCommand.collapsing(struct.getName(), "push_struct", args,
                        apiSet -> pushStruct(struct, oldName, apiSet))
                .mergingWith(pending -> pendingRenameSource(pending)
                        .filter(source -> oldName == null && !source.equals(struct.getName()))
                        .map(source -> structCommand(struct, source)));
    }

    /**
     * Deleting a struct whose rename is still pending deletes it under its old name too.
     */
    public SyncCommand deleteStructCommand(String name) {
        return SyncCommand.collapsing(name, "delete_struct", List.of(name), apiSet -> deleteStruct(name, apiSet))
                .mergingWith(pending -> pendingRenameSource(pending)
                        .filter(source -> !source.equals(name))
                        .map(source -> SyncCommand.collapsing(name, "delete_struct", List.of(name, source),
                                apiSet -> mutateMaster(master -> {
                                    master.removeStruct(source);
                                    master.removeStruct(name);
                                    return null;
                                }))));
    }

    private static Optional<String> pendingRenameSource(SyncCommand pending) {
        List<Object> args = pending.getArgs();
        if (!"push_struct".equals(pending.getOperation()) || args.size() < 2) {
            return Optional.empty();
        }
        return Optional.of((String) args.get(1));
    }

    // ---------------------------------------------------------------------
    // Activity
    // ---------------------------------------------------------------------

    /**
     * For every function any user changed, the most recent change across all users. Most recent
     * first.
     */
    public List<FunctionActivity> functionActivity() throws IOException {
        Map<Long, FunctionActivity> latest = new HashMap<>();
        for (State state : client().allStates()) {
            Map<Long, Long> changes = new HashMap<>();
            state.getFunctions().values().forEach(f -> changes.merge(f.getAddr(), f.getLastChange(), Math::max));
            for (long funcAddr : state.getStackVariableFunctions()) {
                for (StackVariable variable : state.getStackVariables(funcAddr).values()) {
                    changes.merge(funcAddr, variable.getLastChange(), Math::max);
                }
            }
            state.getAllComments().values().forEach(c -> changes.merge(c.getFuncAddr(), c.getLastChange(), Math::max));

            for (Map.Entry<Long, Long> change : changes.entrySet()) {
                if (change.getValue() == Artifact.NEVER_CHANGED) {
                    continue;
                }
                FunctionActivity known = latest.get(change.getKey());
                if (known == null || change.getValue() > known.lastChange()) {
                    latest.put(change.getKey(), new FunctionActivity(change.getKey(), "", state.getUser(), change.getValue()));
                }
            }
        }
        List<FunctionActivity> result = new ArrayList<>();
        for (FunctionActivity activity : latest.values()) {
            result.add(new FunctionActivity(activity.address(), localName(activity.address()), activity.user(),
                    activity.lastChange()));
        }
        result.sort(Comparator.comparingLong(FunctionActivity::lastChange).reversed()
                .thenComparingLong(FunctionActivity::address));
        return result;
    }

    private String localName(long addr) {
        try {
            return host.getFunctionAt(addr).map(HostFunction::name).orElse("");
        } catch (HostToolException e) {
            LOG.debug("Cannot read the name of function 0x{}: {}", HexKeys.format(addr), e.getMessage());
            return "";
        }
    }
}

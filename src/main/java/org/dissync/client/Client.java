package org.dissync.client;

import org.dissync.state.State;
import org.dissync.state.StateSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Connection of one analyst (the master user) to a sync repository.
 * <p>
 * The client hands out {@link State} copies of any user at any version, and is the only path
 * through which the master user's state gets written. Writes to the master state are serialized
 * by a state lock; reads of other users' states take no lock.
 */
public final class Client implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Client.class);
    private static final Pattern USER_NAME = Pattern.compile("[A-Za-z0-9._-]+");

    private final String masterUser;
    private final SyncRepository repository;
    private final String binaryHash;
    private final Clock clock;
    private final Set<ConnectionWarning> connectionWarnings;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Map<String, State> cache = new ConcurrentHashMap<>();
    private final AtomicBoolean pushPending = new AtomicBoolean();
    private volatile boolean deferPush;
    private volatile Instant lastPullAttemptAt;

    /**
     * Connects to a sync repository, creating or cloning it when needed.
     *
     * @param user       The local analyst.
     * @param repoPath   Working copy location.
     * @param binaryHash Content hash of the binary open in the host tool.
     * @param initRepo   Create a new repository instead of opening or cloning one.
     * @param remoteUrl  Shared remote, or {@code null} for a local-only repository.
     * @param settings   Repository naming conventions.
     * @param clock      Source of timestamps.
     * @return The connected client.
     * @throws IOException if the repository cannot be opened.
     */
    public static Client connect(String user, Path repoPath, String binaryHash, boolean initRepo,
                                 String remoteUrl, RepositorySettings settings, Clock clock) throws IOException {
        validateUser(user);
        SyncRepository repository = GitSyncRepository.open(repoPath, user, initRepo, remoteUrl, binaryHash, settings);
        try {
            return new Client(repository, binaryHash, settings, clock);
        } catch (IOException | RuntimeException e) {
            repository.close();
            throw e;
        }
    }

    /**
     * Wraps an already opened repository.
     *
     * @throws IOException if the stored binary hash cannot be read.
     */
    public Client(SyncRepository repository, String binaryHash, RepositorySettings settings, Clock clock)
            throws IOException {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.masterUser = repository.getUser();
        this.binaryHash = binaryHash;
        this.clock = Objects.requireNonNull(clock, "clock");

        EnumSet<ConnectionWarning> warnings = EnumSet.noneOf(ConnectionWarning.class);
        Optional<String> storedHash = repository.readRootFile(settings.hashFile());
        if (binaryHash != null && storedHash.isPresent() && !storedHash.get().strip().equals(binaryHash)) {
            LOG.warn("Sync repository was created for binary {} but the open binary is {}",
                    storedHash.get().strip(), binaryHash);
            warnings.add(ConnectionWarning.HASH_MISMATCH);
        }
        this.connectionWarnings = Collections.unmodifiableSet(warnings);
        LOG.info("Connected as '{}' to sync repository{}", masterUser, repository.hasRemote() ? "" : " (no remote)");
    }

    static void validateUser(String user) {
        if (user == null || !USER_NAME.matcher(user).matches()) {
            throw new IllegalArgumentException("Invalid user name '" + user + "'");
        }
        if (user.equals(RepositorySettings.ROOT_BRANCH_SUFFIX)) {
            throw new IllegalArgumentException("User name '" + user + "' is reserved");
        }
    }

    public String getMasterUser() {
        return masterUser;
    }

    public String getBinaryHash() {
        return binaryHash;
    }

    public Set<ConnectionWarning> getConnectionWarnings() {
        return connectionWarnings;
    }

    public boolean hasRemote() {
        return repository.hasRemote();
    }

    public Instant getLastPullAttemptAt() {
        return lastPullAttemptAt;
    }

    // ---------------------------------------------------------------------
    // States
    // ---------------------------------------------------------------------

    /**
     * Returns a copy of a user's state. Only the master user's latest state is writable.
     *
     * @param user    The user, or {@code null} for the master user.
     * @param version A repository version, or {@code null} for the latest known one.
     * @param locked  Hold the state lock while loading.
     * @return The state; an empty one if the user has no history yet.
     * @throws IOException if the version does not exist or cannot be read.
     */
    public State getState(String user, String version, boolean locked) throws IOException {
        String owner = user == null ? masterUser : user;
        if (!locked) {
            return loadState(owner, version);
        }
        stateLock.lock();
        try {
            return loadState(owner, version);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Runs an action on the writable master state and commits what it changed. When the action
     * throws, the repository stays untouched.
     *
     * @param user    Must be {@code null} or the master user.
     * @param version Must be {@code null}.
     * @param locked  Hold the state lock for the whole action and commit.
     * @param action  The work to do.
     * @return The action's result.
     * @throws IOException if loading or committing fails, or the action throws it.
     */
    public <T> T stateCtx(String user, String version, boolean locked, StateAction<T> action) throws IOException {
        if ((user != null && !user.equals(masterUser)) || version != null) {
            throw new IllegalArgumentException("Only the latest state of '" + masterUser + "' can be modified");
        }
        if (locked) {
            stateLock.lock();
        }
        try {
            State state = loadState(masterUser, null);
            T result = action.apply(state);
            state.save();
            return result;
        } finally {
            if (locked) {
                stateLock.unlock();
            }
        }
    }

    /**
     * Like {@link #stateCtx}, but the resulting commit stays local until {@link #publishPending()}.
     * Never touches the network, so it is safe to call from the host tool's threads.
     */
    public <T> T recordLocally(StateAction<T> action) throws IOException {
        stateLock.lock();
        deferPush = true;
        try {
            return stateCtx(null, null, false, action);
        } finally {
            deferPush = false;
            stateLock.unlock();
        }
    }

    /**
     * Loads the latest state of every known user, the master user included.
     */
    public List<State> allStates() throws IOException {
        List<State> states = new ArrayList<>();
        for (String user : users()) {
            states.add(getState(user, null, false));
        }
        return states;
    }

    private State loadState(String user, String version) throws IOException {
        boolean writable = user.equals(masterUser) && version == null;
        Optional<StoredSnapshot> snapshot = repository.read(user, version);
        State state;
        if (snapshot.isEmpty()) {
            state = new State(user, null, clock);
        } else {
            String loadedVersion = snapshot.get().version();
            State cached = cache.get(user);
            if (cached == null || !loadedVersion.equals(cached.getVersion())) {
                cached = StateSerializer.fromFiles(user, loadedVersion, snapshot.get().files(), clock);
                cache.put(user, cached);
            }
            state = cached.copy();
        }
        if (writable) {
            state.bindWriter(this::saveState);
        }
        return state;
    }

    private void saveState(State state) throws IOException {
        boolean committed = repository.commit(StateSerializer.toFiles(state), "Update state of " + masterUser);
        if (!committed) {
            return;
        }
        cache.remove(masterUser);
        if (!repository.hasRemote()) {
            return;
        }
        if (deferPush) {
            pushPending.set(true);
            LOG.debug("Committed state of '{}' locally, push deferred", masterUser);
            return;
        }
        publish();
    }

    private boolean publish() {
        pushPending.set(false);
        try {
            repository.push();
            return true;
        } catch (IOException e) {
            pushPending.set(true);
            LOG.warn("Failed to push state of '{}', the commit stays local: {}", masterUser, e.getMessage());
            return false;
        }
    }

    /**
     * @return {@code true} if local commits are waiting for {@link #publishPending()}.
     */
    public boolean isPushPending() {
        return pushPending.get();
    }

    /**
     * Pushes local commits that were not published yet. Never throws.
     *
     * @return {@code true} if something was pushed.
     */
    public boolean publishPending() {
        if (!pushPending.get() || !repository.hasRemote()) {
            return false;
        }
        return publish();
    }

    // ---------------------------------------------------------------------
    // Remote
    // ---------------------------------------------------------------------

    /**
     * Fetches every user's latest history. Never throws: a failed fetch is logged and the local
     * repository stays usable. The attempt time advances either way.
     *
     * @return {@code true} if the fetch succeeded.
     */
    public boolean pull() {
        try {
            if (!repository.hasRemote()) {
                LOG.debug("No remote configured, skipping pull");
                return false;
            }
            repository.fetch();
            LOG.debug("Pulled from remote");
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to pull from remote: {}", e.getMessage());
            return false;
        } finally {
            lastPullAttemptAt = clock.instant();
        }
    }

    /**
     * @return {@code true} if no pull was attempted yet, or at least {@code interval} has passed
     *         since the last attempt.
     */
    public boolean isPullDue(Duration interval) {
        Instant last = lastPullAttemptAt;
        return last == null || Duration.between(last, clock.instant()).compareTo(interval) >= 0;
    }

    /**
     * Pulls, then merges {@code user}'s latest state into the master state (last write wins) and
     * commits the result. The host tool is not touched.
     *
     * @param user The user to merge from.
     * @return The number of adopted artifacts.
     * @throws IOException if the states cannot be read or the merge cannot be committed.
     */
    public int syncStates(String user) throws IOException {
        pull();
        if (user == null || user.equals(masterUser)) {
            return 0;
        }
        State theirs = getState(user, null, false);
        int adopted = stateCtx(null, null, true, master -> master.mergeFrom(theirs));
        LOG.info("Merged {} artifacts from '{}' into '{}'", adopted, user, masterUser);
        return adopted;
    }

    /**
     * @return Users with a history locally or on the remote, sorted by name.
     */
    public List<String> users() throws IOException {
        return repository.users();
    }

    @Override
    public void close() {
        cache.clear();
        repository.close();
    }
}

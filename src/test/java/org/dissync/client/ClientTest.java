package org.dissync.client;

import org.dissync.data.Function;
import org.dissync.junit.extensions.logging.ExpectLog;
import org.dissync.junit.extensions.logging.LogLevel;
import org.dissync.junit.extensions.logging.LogWatchExtension;
import org.dissync.state.State;
import org.dissync.testutils.MutableClock;
import org.eclipse.jgit.api.Git;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class ClientTest {

    private static final String HASH = "5d41402abc4b2a76b9719d911017c592";
    private static final long FUNC = 0x4011a0L;

    @TempDir
    Path tmp;

    private MutableClock clock;
    private Path remote;
    private final List<Client> clients = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.atEpochSecond(1_700_000_000L);
        remote = tmp.resolve("remote.git");
        Git.init().setBare(true).setDirectory(remote.toFile()).call().close();
    }

    @AfterEach
    void tearDown() {
        clients.forEach(Client::close);
    }

    private Client connect(String user, boolean init, String hash) throws IOException {
        Client client = Client.connect(user, tmp.resolve(user), hash, init, remote.toString(),
                RepositorySettings.defaults(), clock);
        clients.add(client);
        return client;
    }

    private static void rename(Client client, long addr, String name) throws IOException {
        client.stateCtx(null, null, true, state -> {
            state.setFunction(new Function(addr, name), true);
            return null;
        });
    }

    @Test
    @DisplayName("A second analyst sees the first analyst's pushed state after cloning")
    void clonedClientReadsOtherUsersState() throws IOException {
        Client alice = connect("alice", true, HASH);
        rename(alice, FUNC, "parse_header");

        Client bob = connect("bob", false, HASH);

        State aliceState = bob.getState("alice", null, false);
        assertThat(aliceState.getFunction(FUNC).getName()).isEqualTo("parse_header");
        assertThat(aliceState.getFunction(FUNC).getLastChange()).isEqualTo(1_700_000_000L);
        assertThat(bob.users()).containsExactly("alice", "bob");
        assertThat(bob.getConnectionWarnings()).isEmpty();
        assertThat(bob.hasRemote()).isTrue();
    }

    @Test
    void pullMakesNewCommitsVisible() throws IOException {
        Client alice = connect("alice", true, HASH);
        Client bob = connect("bob", false, HASH);
        rename(alice, FUNC, "parse_header");

        assertThat(bob.pull()).isTrue();

        assertThat(bob.getState("alice", null, false).getFunction(FUNC).getName()).isEqualTo("parse_header");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*Client", messagePattern = "Sync repository was created for binary .*")
    void hashMismatch_isReportedWithoutFailing() throws IOException {
        connect("alice", true, HASH);

        Client bob = connect("bob", false, "ffffffffffffffffffffffffffffffff");

        assertThat(bob.getConnectionWarnings()).containsExactly(ConnectionWarning.HASH_MISMATCH);
    }

    @Test
    void stateCtx_failingAction_leavesRepositoryUntouched() throws IOException {
        Client alice = connect("alice", true, HASH);
        rename(alice, FUNC, "parse_header");
        String before = alice.getState(null, null, false).getVersion();

        assertThatThrownBy(() -> alice.stateCtx(null, null, true, state -> {
            state.setFunction(new Function(FUNC, "half_done"), true);
            throw new IOException("interrupted");
        })).isInstanceOf(IOException.class);

        State after = alice.getState(null, null, false);
        assertThat(after.getVersion()).isEqualTo(before);
        assertThat(after.getFunction(FUNC).getName()).isEqualTo("parse_header");
    }

    @Test
    void stateCtx_unchangedState_makesNoCommit() throws IOException {
        Client alice = connect("alice", true, HASH);
        rename(alice, FUNC, "parse_header");
        String before = alice.getState(null, null, false).getVersion();

        alice.stateCtx(null, null, true, state -> state.getFunction(FUNC));

        assertThat(alice.getState(null, null, false).getVersion()).isEqualTo(before);
    }

    @Test
    void stateCtx_otherUser_isRejected() throws IOException {
        Client alice = connect("alice", true, HASH);

        assertThatThrownBy(() -> alice.stateCtx("bob", null, true, state -> null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void otherUsersState_isReadOnlyCopy() throws IOException {
        Client alice = connect("alice", true, HASH);
        rename(alice, FUNC, "parse_header");
        Client bob = connect("bob", false, HASH);

        State copy = bob.getState("alice", null, false);
        copy.setFunction(new Function(FUNC, "tampered"), true);

        assertThatThrownBy(copy::save).isInstanceOf(IllegalStateException.class);
        assertThat(bob.getState("alice", null, false).getFunction(FUNC).getName()).isEqualTo("parse_header");
    }

    @Test
    void getState_atOlderVersion_returnsHistoricSnapshot() throws IOException {
        Client alice = connect("alice", true, HASH);
        rename(alice, FUNC, "first_name");
        String firstVersion = alice.getState(null, null, false).getVersion();
        clock.advance(Duration.ofMinutes(1));
        rename(alice, FUNC, "second_name");

        State old = alice.getState("alice", firstVersion, false);

        assertThat(old.getFunction(FUNC).getName()).isEqualTo("first_name");
        assertThat(old.isWritable()).isFalse();
        assertThat(alice.getState(null, null, false).getFunction(FUNC).getName()).isEqualTo("second_name");
    }

    @Test
    void getState_userWithoutHistory_isEmpty() throws IOException {
        Client alice = connect("alice", true, HASH);

        State carol = alice.getState("carol", null, false);

        assertThat(carol.isEmpty()).isTrue();
        assertThat(carol.getVersion()).isNull();
    }

    @Test
    void syncStates_mergesOtherUserIntoMaster() throws IOException {
        Client alice = connect("alice", true, HASH);
        Client bob = connect("bob", false, HASH);
        rename(alice, FUNC, "parse_header");

        int adopted = bob.syncStates("alice");

        assertThat(adopted).isEqualTo(1);
        Function merged = bob.getState(null, null, false).getFunction(FUNC);
        assertThat(merged.getName()).isEqualTo("parse_header");
        assertThat(merged.getLastChange()).isEqualTo(1_700_000_000L);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*Client", messagePattern = "Failed to pull from remote.*")
    void pullFailure_isLoggedAndStillAdvancesAttemptTime() throws IOException {
        Client alice = connect("alice", true, HASH);
        deleteRecursively(remote);

        assertThat(alice.isPullDue(Duration.ofSeconds(10))).isTrue();
        assertThat(alice.pull()).isFalse();

        assertThat(alice.getLastPullAttemptAt()).isEqualTo(clock.instant());
        assertThat(alice.isPullDue(Duration.ofSeconds(10))).isFalse();
        clock.advance(Duration.ofSeconds(10));
        assertThat(alice.isPullDue(Duration.ofSeconds(10))).isTrue();
    }

    @Test
    void localOnlyRepository_skipsPullButCommits() throws IOException {
        Client solo = Client.connect("solo", tmp.resolve("solo"), HASH, true, null, RepositorySettings.defaults(), clock);
        clients.add(solo);

        assertThat(solo.hasRemote()).isFalse();
        assertThat(solo.pull()).isFalse();
        assertThat(solo.getLastPullAttemptAt()).isNotNull();

        rename(solo, FUNC, "main");
        assertThat(solo.getState(null, null, false).getFunction(FUNC).getName()).isEqualTo("main");
        assertThat(solo.users()).containsExactly("solo");
    }

    @Test
    void recordLocally_commitsWithoutPushing() throws IOException {
        Client alice = connect("alice", true, HASH);
        Client bob = connect("bob", false, HASH);

        bob.recordLocally(state -> {
            state.setFunction(new Function(FUNC, "parse_header"), true);
            return null;
        });

        assertThat(bob.getState(null, null, false).getFunction(FUNC).getName()).isEqualTo("parse_header");
        assertThat(bob.isPushPending()).isTrue();
        alice.pull();
        assertThat(alice.users()).doesNotContain("bob");

        assertThat(bob.publishPending()).isTrue();
        assertThat(bob.publishPending()).isFalse();
        alice.pull();
        assertThat(alice.getState("bob", null, false).getFunction(FUNC).getName()).isEqualTo("parse_header");
    }

    @Test
    void stateCtx_publishesEarlierLocalCommits() throws IOException {
        Client alice = connect("alice", true, HASH);
        Client bob = connect("bob", false, HASH);
        bob.recordLocally(state -> {
            state.setFunction(new Function(FUNC, "parse_header"), true);
            return null;
        });

        rename(bob, FUNC + 0x10, "read_chunk");

        assertThat(bob.isPushPending()).isFalse();
        alice.pull();
        assertThat(alice.getState("bob", null, false).getFunction(FUNC).getName()).isEqualTo("parse_header");
    }

    @Test
    void connect_invalidUserNames_areRejected() {
        assertThatThrownBy(() -> connect("__root__", true, HASH)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> connect("a/b", true, HASH)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void connect_initOverExistingRepository_fails() throws IOException {
        connect("alice", true, HASH);

        assertThatThrownBy(() -> Client.connect("alice", tmp.resolve("alice"), HASH, true, null,
                RepositorySettings.defaults(), clock)).isInstanceOf(IOException.class);
    }

    private static void deleteRecursively(Path path) throws IOException {
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }
}

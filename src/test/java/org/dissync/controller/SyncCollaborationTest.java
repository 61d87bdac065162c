package org.dissync.controller;

import org.dissync.config.SyncSettings;
import org.dissync.data.Function;
import org.dissync.data.Struct;
import org.dissync.data.StructMember;
import org.dissync.hooks.HookDispatcher;
import org.dissync.junit.extensions.logging.ExpectLog;
import org.dissync.junit.extensions.logging.LogLevel;
import org.dissync.junit.extensions.logging.LogWatchExtension;
import org.dissync.scheduler.CommandQueue;
import org.dissync.testutils.FakeHostTool;
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
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Two analysts, each with their own host tool and controller, sharing one bare remote.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class SyncCollaborationTest {

    private static final long FUNC = 0x4011a0L;
    private static final long OTHER_FUNC = 0x401300L;
    private static final long T0 = 1_700_000_000L;

    @TempDir
    Path tmp;

    private MutableClock clock;
    private FakeHostTool aliceHost;
    private FakeHostTool bobHost;
    private SyncController alice;
    private SyncController bob;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.atEpochSecond(T0);
        Path remote = tmp.resolve("remote.git");
        Git.init().setBare(true).setDirectory(remote.toFile()).call().close();

        aliceHost = new FakeHostTool();
        bobHost = new FakeHostTool();
        for (FakeHostTool host : List.of(aliceHost, bobHost)) {
            host.addFunction(FUNC, "sub_4011a0");
            host.addFunction(OTHER_FUNC, "sub_401300");
            host.addFrameMember(FUNC, -0x18, "var_18", "", 4);
        }
        alice = controllerFor(aliceHost);
        bob = controllerFor(bobHost);

        alice.connect("alice", tmp.resolve("alice"), true, remote.toString());
        bob.connect("bob", tmp.resolve("bob"), false, remote.toString());
    }

    @AfterEach
    void tearDown() {
        alice.disconnect();
        bob.disconnect();
    }

    private SyncController controllerFor(FakeHostTool host) {
        SyncController controller = new SyncController(host, SyncSettings.defaults(), clock);
        HookDispatcher dispatcher = new HookDispatcher(controller);
        host.setListener(dispatcher::onEvent);
        return controller;
    }

    /**
     * Runs every pending command the way the sync loop would, one per tick.
     */
    private static int drain(SyncController controller) {
        int executed = 0;
        while (controller.commandQueue().drainOne() == CommandQueue.DrainOutcome.EXECUTED) {
            executed++;
        }
        return executed;
    }

    private static String masterVersion(SyncController controller) throws IOException {
        return controller.client().getState(null, null, false).getVersion();
    }

    @Test
    @DisplayName("A rename by one analyst is applied once to the other analyst's host")
    void renameReachesOtherAnalyst() throws Exception {
        aliceHost.setFunctionName(FUNC, "parse_header");
        drain(alice);

        bob.client().pull();
        assertThat(bob.fillFunction(FUNC, "alice")).isEqualTo(FillResult.APPLIED);

        assertThat(bobHost.functionName(FUNC)).isEqualTo("parse_header");
        assertThat(bobHost.refreshedViews()).containsExactly(FUNC);
        Function recorded = bob.pullFunction(FUNC, null).orElseThrow();
        assertThat(recorded.getName()).isEqualTo("parse_header");
        assertThat(recorded.getLastChange()).isEqualTo(T0);
        assertThat(bob.apiCounter().get()).isZero();

        // The host callback for the engine's own rename is queued but changes nothing.
        String version = masterVersion(bob);
        assertThat(bob.commandQueue().pending()).hasSize(1);
        assertThat(bob.commandQueue().pending().get(0).isApiSet()).isTrue();
        drain(bob);
        assertThat(masterVersion(bob)).isEqualTo(version);

        assertThat(bob.fillFunction(FUNC, "alice")).isEqualTo(FillResult.NO_CHANGE);
    }

    @Test
    @DisplayName("Filling a function commits locally and leaves the push to the sync loop")
    void fillDoesNotPushFromTheCallerThread() throws Exception {
        aliceHost.setFunctionName(FUNC, "parse_header");
        drain(alice);
        bob.client().pull();

        assertThat(bob.fillFunction(FUNC, "alice")).isEqualTo(FillResult.APPLIED);

        assertThat(bob.client().isPushPending()).isTrue();
        alice.client().pull();
        assertThat(alice.pullFunction(FUNC, "bob")).isEmpty();

        assertThat(bob.client().publishPending()).isTrue();
        assertThat(bob.client().isPushPending()).isFalse();
        alice.client().pull();
        assertThat(alice.pullFunction(FUNC, "bob")).map(Function::getName).contains("parse_header");
    }

    @Test
    void builtinTypeIsAppliedWithoutFillingStructs() throws Exception {
        alice.pushStruct(new Struct("Header", 8, List.of(new StructMember("magic", 0, "int", 4))), null, false);
        alice.pushStackVariable(FUNC, -0x18, "len", "int", 4, false);

        bob.client().pull();
        assertThat(bob.fillFunction(FUNC, "alice")).isEqualTo(FillResult.APPLIED);

        assertThat(bobHost.frameMember(FUNC, -0x18).name()).isEqualTo("len");
        assertThat(bobHost.frameMember(FUNC, -0x18).type()).isEqualTo("int");
        assertThat(bobHost.hasStruct("Header")).isFalse();
    }

    @Test
    @DisplayName("A type naming one of the source's structs fills the structs and retries")
    void structTypeFillsStructsFirst() throws Exception {
        alice.pushStruct(new Struct("Header", 8, List.of(new StructMember("magic", 0, "int", 4))), null, false);
        alice.pushStackVariable(FUNC, -0x18, "hdr", "Header *", 4, false);

        bob.client().pull();
        bob.fillFunction(FUNC, "alice");

        assertThat(bobHost.hasStruct("Header")).isTrue();
        assertThat(bobHost.frameMember(FUNC, -0x18).type()).isEqualTo("Header *");
        assertThat(bob.pullStructs(null)).extracting(Struct::getName).containsExactly("Header");
        assertThat(bob.apiCounter().get()).isZero();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*SyncController", messagePattern = "Cannot apply type 'Widget' .*")
    void unknownTypeIsSkippedButNameApplied() throws Exception {
        alice.pushStackVariable(FUNC, -0x18, "widget", "Widget", 4, false);

        bob.client().pull();
        assertThat(bob.fillFunction(FUNC, "alice")).isEqualTo(FillResult.APPLIED);

        assertThat(bobHost.frameMember(FUNC, -0x18).name()).isEqualTo("widget");
        assertThat(bobHost.frameMember(FUNC, -0x18).type()).isEmpty();
        assertThat(bob.apiCounter().get()).isZero();
    }

    @Test
    void commentsAreAppliedToTheMatchingView() throws Exception {
        aliceHost.setComment(FUNC + 4, "checks magic", false);
        aliceHost.setComment(FUNC + 8, "length check", true);
        drain(alice);

        bob.client().pull();
        bob.fillFunction(FUNC, "alice");

        assertThat(bobHost.comment(FUNC + 4, false)).isEqualTo("checks magic");
        assertThat(bobHost.comment(FUNC + 8, true)).isEqualTo("length check");
        assertThat(bobHost.comment(FUNC + 8, false)).isNull();
    }

    @Test
    @DisplayName("Sync all merges the other state and fills each function when its view refreshes")
    void syncAllFillsOnViewRefresh() throws Exception {
        aliceHost.setFunctionName(FUNC, "parse_header");
        drain(alice);

        assertThat(bob.syncAll("alice")).isEqualTo(1);
        assertThat(bobHost.functionName(FUNC)).isEqualTo("sub_4011a0");
        assertThat(bob.updateState(FUNC).size()).isEqualTo(1);

        bobHost.refreshView(FUNC);

        assertThat(bobHost.functionName(FUNC)).isEqualTo("parse_header");
        assertThat(bob.updateState(FUNC).size()).isZero();

        String version = masterVersion(bob);
        drain(bob);
        assertThat(masterVersion(bob)).isEqualTo(version);
    }

    @Test
    void autoSyncRefillsOnEveryRefresh() throws Exception {
        assertThat(bob.toggleAutoSync(FUNC, "alice")).isTrue();

        aliceHost.setFunctionName(FUNC, "parse_header");
        drain(alice);
        bob.client().pull();
        bobHost.refreshView(FUNC);
        assertThat(bobHost.functionName(FUNC)).isEqualTo("parse_header");

        clock.advance(Duration.ofMinutes(1));
        aliceHost.setFunctionName(FUNC, "parse_file_header");
        drain(alice);
        bob.client().pull();
        bobHost.refreshView(FUNC);
        assertThat(bobHost.functionName(FUNC)).isEqualTo("parse_file_header");

        assertThat(bob.toggleAutoSync(FUNC, "alice")).isFalse();
        assertThat(bob.updateState(FUNC).size()).isZero();
    }

    @Test
    void functionActivityListsLatestChangePerFunction() throws Exception {
        aliceHost.setFunctionName(FUNC, "parse_header");
        drain(alice);
        clock.advance(Duration.ofMinutes(1));
        bobHost.setFunctionName(OTHER_FUNC, "read_chunk");
        drain(bob);

        bob.client().pull();
        List<FunctionActivity> activity = bob.functionActivity();

        assertThat(activity).containsExactly(
                new FunctionActivity(OTHER_FUNC, "read_chunk", "bob", T0 + 60),
                new FunctionActivity(FUNC, "sub_4011a0", "alice", T0));
    }
}

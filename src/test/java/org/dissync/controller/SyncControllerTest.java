package org.dissync.controller;

import org.dissync.client.NotConnectedException;
import org.dissync.config.SyncSettings;
import org.dissync.data.Comment;
import org.dissync.data.Function;
import org.dissync.data.StackOffsetType;
import org.dissync.data.Struct;
import org.dissync.data.StructMember;
import org.dissync.junit.extensions.logging.LogWatchExtension;
import org.dissync.scheduler.SyncCommand;
import org.dissync.testutils.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
@MockitoSettings(strictness = Strictness.LENIENT)
class SyncControllerTest {

    private static final long FUNC = 0x4011a0L;

    @Mock
    private HostTool host;

    @TempDir
    Path tmp;

    private MutableClock clock;
    private SyncController controller;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.atEpochSecond(1_700_000_000L);
        when(host.currentBinaryHash()).thenReturn("abc");
        when(host.offsetType()).thenReturn(StackOffsetType.IDA);
        controller = new SyncController(host, SyncSettings.defaults(), clock);
    }

    @AfterEach
    void tearDown() {
        controller.disconnect();
    }

    private void connectLocal() throws Exception {
        controller.connect("alice", tmp.resolve("repo"), true, null);
    }

    private String masterVersion() throws IOException {
        return controller.client().getState(null, null, false).getVersion();
    }

    @Test
    void operationsBeforeConnect_throwNotConnected() {
        assertThat(controller.status()).isEqualTo(SyncStatus.DISCONNECTED);
        assertThat(controller.statusString()).isEqualTo("Not connected to a sync repo");

        assertThatThrownBy(() -> controller.pullFunction(FUNC, null)).isInstanceOf(NotConnectedException.class);
        assertThatThrownBy(() -> controller.pushFunctionName(FUNC, "x", false)).isInstanceOf(NotConnectedException.class);
        assertThatThrownBy(() -> controller.fillFunction(FUNC, "bob")).isInstanceOf(NotConnectedException.class);
        assertThatThrownBy(() -> controller.users()).isInstanceOf(NotConnectedException.class);
    }

    @Test
    void connect_localOnly_reportsStatusWithoutRemote() throws Exception {
        connectLocal();

        assertThat(controller.status()).isEqualTo(SyncStatus.CONNECTED_NO_REMOTE);
        assertThat(controller.statusString()).isEqualTo("Connected to a sync repo (no remote): alice");
        assertThat(controller.users()).containsExactly("alice");
    }

    @Test
    void pushFunctionName_userEdit_isStampedAndCommitted() throws Exception {
        connectLocal();

        assertThat(controller.pushFunctionName(FUNC, "parse_header", false)).isTrue();

        Function stored = controller.pullFunction(FUNC, null).orElseThrow();
        assertThat(stored.getName()).isEqualTo("parse_header");
        assertThat(stored.getLastChange()).isEqualTo(1_700_000_000L);
    }

    @Test
    @DisplayName("An engine-made change that is already recorded produces no commit")
    void pushFunctionName_apiSetUnchanged_skipsCommit() throws Exception {
        connectLocal();
        controller.pushFunctionName(FUNC, "parse_header", false);
        String before = masterVersion();
        clock.advance(Duration.ofMinutes(5));

        assertThat(controller.pushFunctionName(FUNC, "parse_header", true)).isFalse();

        assertThat(masterVersion()).isEqualTo(before);
        assertThat(controller.pullFunction(FUNC, null).orElseThrow().getLastChange()).isEqualTo(1_700_000_000L);
    }

    @Test
    void pushFunctionName_apiSetChanged_keepsPreviousStamp() throws Exception {
        connectLocal();
        controller.pushFunctionName(FUNC, "parse_header", false);
        clock.advance(Duration.ofMinutes(5));

        assertThat(controller.pushFunctionName(FUNC, "parse_hdr", true)).isTrue();

        Function stored = controller.pullFunction(FUNC, null).orElseThrow();
        assertThat(stored.getName()).isEqualTo("parse_hdr");
        assertThat(stored.getLastChange()).isEqualTo(1_700_000_000L);
    }

    @Test
    void pushStackVariable_usesHostOffsetConvention() throws Exception {
        connectLocal();

        controller.pushStackVariable(FUNC, -0x18, "len", "int", 4, false);

        assertThat(controller.pullStackVariable(FUNC, -0x18, null).orElseThrow().getOffsetType())
                .isEqualTo(StackOffsetType.IDA);
        assertThat(controller.pullStackVariables(FUNC, null)).containsOnlyKeys(-0x18L);
    }

    @Test
    void pushComments_andRemoveAllComments() throws Exception {
        connectLocal();

        int changed = controller.pushComments(FUNC, Map.of(FUNC + 4, "checks magic", FUNC + 8, "length"), true, false);
        assertThat(changed).isEqualTo(2);
        assertThat(controller.pushComments(FUNC, Map.of(FUNC + 4, "checks magic"), true, false)).isZero();
        assertThat(controller.pullComments(FUNC, null)).hasSize(2);
        assertThat(controller.pullComment(FUNC + 4, null)).map(Comment::isDecompiled).contains(true);

        assertThat(controller.removeAllComments(FUNC)).isEqualTo(2);
        assertThat(controller.pullComments(FUNC, null)).isEmpty();
    }

    @Test
    void pushStruct_renameAndDelete() throws Exception {
        connectLocal();
        Struct header = new Struct("Header", 4, List.of(new StructMember("magic", 0, "int", 4)));
        controller.pushStruct(header, null, false);

        Struct renamed = new Struct("FileHeader", 4, header.getMembers().values());
        assertThat(controller.pushStruct(renamed, "Header", false)).isTrue();
        assertThat(controller.pullStructs(null)).extracting(Struct::getName).containsExactly("FileHeader");

        assertThat(controller.deleteStruct("FileHeader", false)).isTrue();
        assertThat(controller.deleteStruct("FileHeader", false)).isFalse();
        assertThat(controller.pullStructs(null)).isEmpty();
    }

    @Test
    void readers_mapMissingArtifactsToEmpty() throws Exception {
        connectLocal();

        assertThat(controller.pullFunction(FUNC, "nobody")).isEmpty();
        assertThat(controller.pullStackVariables(FUNC, null)).isEmpty();
        assertThat(controller.pullStackVariable(FUNC, -8, null)).isEmpty();
        assertThat(controller.pullComment(FUNC, null)).isEmpty();
        assertThat(controller.pullStructs("nobody")).isEmpty();
    }

    @Test
    void fillFunction_missingInHost_isReportedWithoutMutations() throws Exception {
        connectLocal();
        when(host.getFunctionAt(anyLong())).thenReturn(Optional.empty());

        assertThat(controller.fillFunction(FUNC, "bob")).isEqualTo(FillResult.FUNCTION_MISSING);

        verify(host, never()).setFunctionName(anyLong(), anyString());
        assertThat(controller.apiCounter().get()).isZero();
    }

    @Test
    void structCommands_collapseOnStructName() {
        Struct header = new Struct("Header", 4, List.of());

        SyncCommand create = controller.structCommand(header, null);
        SyncCommand delete = controller.deleteStructCommand("Header");

        assertThat(create.getCollapseKey()).isEqualTo("Header");
        assertThat(delete.getCollapseKey()).isEqualTo("Header");
        assertThat(controller.functionNameCommand(FUNC, "x").getCollapseKey()).isNull();
    }

    @Test
    @DisplayName("Editing a renamed struct before the queue drains still drops the old name")
    void structRenameThenEdit_keepsRename() throws Exception {
        connectLocal();
        Struct header = new Struct("Header", 4, List.of(new StructMember("magic", 0, "int", 4)));
        controller.pushStruct(header, null, false);
        Struct packet = new Struct("Packet", 4, header.getMembers().values());
        Struct grown = new Struct("Packet", 8, List.of(
                new StructMember("magic", 0, "int", 4),
                new StructMember("length", 4, "int", 4)));

        controller.commandQueue().enqueue(controller.structCommand(packet, "Header"));
        controller.commandQueue().enqueue(controller.structCommand(grown, null));

        assertThat(controller.commandQueue().pending()).singleElement()
                .extracting(SyncCommand::getArgs).isEqualTo(List.of("Packet", "Header"));
        controller.commandQueue().drainOne();

        assertThat(controller.pullStructs(null)).containsExactly(grown);
    }

    @Test
    void structRenameThenDelete_removesBothNames() throws Exception {
        connectLocal();
        Struct header = new Struct("Header", 4, List.of(new StructMember("magic", 0, "int", 4)));
        controller.pushStruct(header, null, false);

        controller.commandQueue().enqueue(controller.structCommand(new Struct("Packet", 4, header.getMembers().values()), "Header"));
        controller.commandQueue().enqueue(controller.deleteStructCommand("Packet"));
        controller.commandQueue().drainOne();

        assertThat(controller.pullStructs(null)).isEmpty();
    }

    @Test
    void disconnect_clearsPendingWork() throws Exception {
        connectLocal();
        controller.commandQueue().enqueue(controller.functionNameCommand(FUNC, "x"));
        controller.scheduleFill(FUNC, "bob");

        controller.disconnect();

        assertThat(controller.isConnected()).isFalse();
        assertThat(controller.commandQueue().size()).isZero();
        assertThat(controller.updateState(FUNC).size()).isZero();
    }
}

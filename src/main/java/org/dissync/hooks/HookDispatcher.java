package org.dissync.hooks;

import org.dissync.controller.SyncController;
import org.dissync.hooks.HostEvent.CommentChanged;
import org.dissync.hooks.HostEvent.DecompiledCommentsChanged;
import org.dissync.hooks.HostEvent.FunctionRenamed;
import org.dissync.hooks.HostEvent.StackMemberChanged;
import org.dissync.hooks.HostEvent.StructChanged;
import org.dissync.hooks.HostEvent.StructDeleted;
import org.dissync.hooks.HostEvent.ViewRefreshed;
import org.dissync.scheduler.SyncCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Turns host tool notifications into pending {@link SyncCommand}s.
 * <p>
 * Runs on the host's callback threads, so it never calls back into the host and does nothing but
 * enqueue. Each event kind maps to exactly one command through a routing table. Events caused by
 * the engine's own host mutations are recognized through the API call counter and tagged, so they
 * are recorded without being treated as new edits.
 */
public class HookDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(HookDispatcher.class);

    private final SyncController controller;
    private final Map<HostEventKind, Function<HostEvent, Optional<SyncCommand>>> routes = new EnumMap<>(HostEventKind.class);
    private final Map<Long, Map<Long, String>> lastDecompiledComments = new ConcurrentHashMap<>();
    private final AtomicBoolean refreshing = new AtomicBoolean();

    public HookDispatcher(SyncController controller) {
        this.controller = controller;

        route(HostEventKind.FUNCTION_RENAMED, FunctionRenamed.class,
                e -> Optional.of(controller.functionNameCommand(e.addr(), e.name())));
        route(HostEventKind.STACK_MEMBER_RENAMED, StackMemberChanged.class,
                e -> Optional.of(controller.stackVariableCommand(e.funcAddr(), e.member())));
        route(HostEventKind.STACK_MEMBER_TYPE_CHANGED, StackMemberChanged.class,
                e -> Optional.of(controller.stackVariableCommand(e.funcAddr(), e.member())));
        route(HostEventKind.STRUCT_CREATED, StructChanged.class,
                e -> Optional.of(controller.structCommand(e.struct(), null)));
        route(HostEventKind.STRUCT_RENAMED, StructChanged.class,
                e -> Optional.of(controller.structCommand(e.struct(), e.oldName())));
        route(HostEventKind.STRUCT_MEMBER_CHANGED, StructChanged.class,
                e -> Optional.of(controller.structCommand(e.struct(), null)));
        route(HostEventKind.STRUCT_DELETED, StructDeleted.class,
                e -> Optional.of(controller.deleteStructCommand(e.name())));
        route(HostEventKind.DISASSEMBLY_COMMENT_CHANGED, CommentChanged.class,
                e -> Optional.of(controller.commentCommand(e.funcAddr(), e.addr(), e.comment(), false)));
        route(HostEventKind.DECOMPILED_COMMENT_CHANGED, DecompiledCommentsChanged.class, this::decompiledComments);
    }

    private <E extends HostEvent> void route(HostEventKind kind, Class<E> type, Function<E, Optional<SyncCommand>> extractor) {
        routes.put(kind, event -> extractor.apply(type.cast(event)));
    }

    /**
     * Handles one host notification. Ignored while not connected.
     */
    public void onEvent(HostEvent event) {
        if (!controller.isConnected()) {
            LOG.trace("Not connected, ignoring {}", event);
            return;
        }
        if (event instanceof ViewRefreshed refreshed) {
            onViewRefreshed(refreshed.funcAddr());
            return;
        }

        boolean apiSet = controller.apiCounter().tryConsume();
        Function<HostEvent, Optional<SyncCommand>> route = routes.get(event.kind());
        if (route == null) {
            LOG.debug("No route for {}", event.kind());
            return;
        }
        Optional<SyncCommand> command = route.apply(event);
        if (command.isEmpty()) {
            return;
        }
        SyncCommand pending = apiSet ? command.get().withApiSet() : command.get();
        LOG.debug("Enqueueing {}", pending);
        controller.commandQueue().enqueue(pending);
    }

    private Optional<SyncCommand> decompiledComments(DecompiledCommentsChanged event) {
        Map<Long, String> comments = new TreeMap<>(event.comments());
        if (comments.isEmpty()) {
            return Optional.empty();
        }
        Map<Long, String> previous = lastDecompiledComments.put(event.funcAddr(), comments);
        if (comments.equals(previous)) {
            LOG.trace("Decompiled comments of 0x{} unchanged", Long.toHexString(event.funcAddr()));
            return Optional.empty();
        }
        return Optional.of(controller.commentsCommand(event.funcAddr(), comments, true));
    }

    private void onViewRefreshed(long funcAddr) {
        if (!refreshing.compareAndSet(false, true)) {
            LOG.trace("Already refreshing, ignoring nested refresh of 0x{}", Long.toHexString(funcAddr));
            return;
        }
        try {
            controller.updateState(funcAddr).doNeededUpdates();
        } finally {
            refreshing.set(false);
        }
    }
}

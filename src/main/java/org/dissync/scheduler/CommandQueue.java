package org.dissync.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered queue of pending {@link SyncCommand}s.
 * <p>
 * Commands with a collapse key share one slot per key: enqueueing again replaces the pending
 * command but keeps its position, merging with it where the new command asks for that. Every
 * other command gets a slot of its own.
 * <p>
 * Thread-safe. The lock is held only to add or pop an entry; commands run outside of it.
 */
public class CommandQueue {

    private static final Logger LOG = LoggerFactory.getLogger(CommandQueue.class);

    /**
     * Result of one {@link #drainOne()} call.
     */
    public enum DrainOutcome {
        EMPTY,
        EXECUTED,
        FAILED
    }

    private record QueueKey(String collapseKey, long sequence) {
    }

    private final Map<QueueKey, SyncCommand> pending = new LinkedHashMap<>();
    private long nextSequence;

    public void enqueue(SyncCommand command) {
        synchronized (pending) {
            QueueKey key = command.getCollapseKey() != null
                    ? new QueueKey(command.getCollapseKey(), -1)
                    : new QueueKey(null, nextSequence++);
            SyncCommand previous = pending.get(key);
            if (previous == null) {
                pending.put(key, command);
                return;
            }
            SyncCommand replacement = command.replacing(previous);
            pending.put(key, replacement);
            LOG.debug("Replaced pending command for '{}' with {}", command.getCollapseKey(), replacement);
        }
    }

    /**
     * Pops the oldest command and runs it.
     *
     * @return What happened; a failing command is logged and reported as {@link DrainOutcome#FAILED}.
     */
    public DrainOutcome drainOne() {
        SyncCommand command;
        synchronized (pending) {
            Iterator<SyncCommand> iterator = pending.values().iterator();
            if (!iterator.hasNext()) {
                return DrainOutcome.EMPTY;
            }
            command = iterator.next();
            iterator.remove();
        }
        try {
            command.execute();
            return DrainOutcome.EXECUTED;
        } catch (Exception e) {
            LOG.warn("Command {} with arguments {} failed: {}", command.getOperation(), command.getArgs(), e.getMessage());
            return DrainOutcome.FAILED;
        }
    }

    public int size() {
        synchronized (pending) {
            return pending.size();
        }
    }

    /**
     * @return The pending commands in execution order.
     */
    public List<SyncCommand> pending() {
        synchronized (pending) {
            return new ArrayList<>(pending.values());
        }
    }

    public void clear() {
        synchronized (pending) {
            pending.clear();
        }
    }
}

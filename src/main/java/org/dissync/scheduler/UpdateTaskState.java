package org.dissync.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pending host updates of one function, each either one-shot or auto-sync.
 * <p>
 * One-shot tasks run once on the next {@link #doNeededUpdates()}; auto-sync tasks run on every
 * call until toggled off. Thread-safe: the monitor is held only to change the task map, tasks run
 * outside of it.
 */
public class UpdateTaskState {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateTaskState.class);

    private final Map<UpdateTask, Boolean> tasks = new LinkedHashMap<>();

    /**
     * Adds a one-shot task. An equal auto-sync task stays auto-sync.
     */
    public synchronized void addUpdateTask(UpdateTask task) {
        tasks.putIfAbsent(task, false);
    }

    /**
     * Switches a task between auto-sync and absent. A one-shot task becomes auto-sync.
     *
     * @return {@code true} if the task is auto-sync afterwards.
     */
    public synchronized boolean toggleAutoSyncTask(UpdateTask task) {
        if (Boolean.TRUE.equals(tasks.get(task))) {
            tasks.remove(task);
            return false;
        }
        tasks.put(task, true);
        return true;
    }

    /**
     * Runs every task in insertion order and forgets the one-shot ones. A failing task is logged
     * and does not stop the others.
     *
     * @return The number of tasks that ran successfully.
     */
    public int doNeededUpdates() {
        List<UpdateTask> due;
        synchronized (this) {
            due = new ArrayList<>(tasks.keySet());
            Iterator<Map.Entry<UpdateTask, Boolean>> iterator = tasks.entrySet().iterator();
            while (iterator.hasNext()) {
                if (!iterator.next().getValue()) {
                    iterator.remove();
                }
            }
        }
        int executed = 0;
        for (UpdateTask task : due) {
            try {
                task.run();
                executed++;
            } catch (Exception e) {
                LOG.warn("Update task {} failed: {}", task, e.getMessage());
            }
        }
        return executed;
    }

    public synchronized boolean isAutoSync(UpdateTask task) {
        return Boolean.TRUE.equals(tasks.get(task));
    }

    public synchronized boolean contains(UpdateTask task) {
        return tasks.containsKey(task);
    }

    public synchronized int size() {
        return tasks.size();
    }
}

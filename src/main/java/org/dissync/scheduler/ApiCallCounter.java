package org.dissync.scheduler;

/**
 * Counts host mutations made by the sync engine whose change events have not been seen yet.
 * <p>
 * The apply engine increments before every mutation; the hook layer consumes one count per event
 * and marks the event as engine-made, so applying a remote change never re-triggers a push of
 * the same change as a user edit.
 */
public class ApiCallCounter {

    private final Object lock = new Object();
    private int count;

    public void increment() {
        synchronized (lock) {
            count++;
        }
    }

    /**
     * Consumes one count if any is outstanding.
     *
     * @return {@code true} if the current event was caused by the sync engine.
     */
    public boolean tryConsume() {
        synchronized (lock) {
            if (count > 0) {
                count--;
                return true;
            }
            count = 0;
            return false;
        }
    }

    /**
     * Undoes an {@link #increment()} whose mutation failed and will produce no event.
     */
    public void release() {
        synchronized (lock) {
            count = Math.max(0, count - 1);
        }
    }

    public int get() {
        synchronized (lock) {
            return count;
        }
    }
}

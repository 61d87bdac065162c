package org.dissync.service;

import java.util.List;

/**
 * A background component with a start/stop/pause/resume lifecycle running on its own thread.
 */
public interface IService {

    /**
     * The operational state of a service.
     */
    enum State {
        /**
         * Not running; must be started to become active.
         */
        STOPPED,
        /**
         * Actively working.
         */
        RUNNING,
        /**
         * Suspended; resumes where it left off.
         */
        PAUSED,
        /**
         * Stopped by a fatal error.
         */
        ERROR
    }

    void start();

    void stop();

    void pause();

    void resume();

    State getCurrentState();

    /**
     * @return Transient errors recorded since the last {@link #clearErrors()}, oldest first.
     */
    List<OperationalError> getErrors();

    void clearErrors();

    /**
     * @return {@code true} if the service is not in {@link State#ERROR} and recorded no errors.
     */
    boolean isHealthy();
}

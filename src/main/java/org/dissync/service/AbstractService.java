package org.dissync.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for background services: lifecycle management on a dedicated thread and a bounded
 * record of transient errors. Subclasses implement {@link #run()}.
 * <p>
 * Error handling in {@link #run()}:
 * <ul>
 *   <li>Transient errors: {@code log.warn} without the exception, {@link #recordError}, keep running.</li>
 *   <li>Fatal errors: {@code log.error} with context, then throw; the service moves to {@link State#ERROR}.</li>
 *   <li>Shutdown: let {@link InterruptedException} propagate.</li>
 * </ul>
 * Stack traces of fatal errors are logged at DEBUG by this class.
 */
public abstract class AbstractService implements IService {

    private static final long STOP_TIMEOUT_MS = 5000;

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Clock clock;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final Object pauseLock = new Object();
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private Thread serviceThread;

    protected AbstractService(String name, Clock clock) {
        this.serviceName = name;
        this.clock = clock;
    }

    /**
     * Maximum number of recorded errors; the oldest are dropped beyond it.
     */
    protected int getMaxErrors() {
        return 1000;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is already in state %s", serviceName, getCurrentState()));
        }
        serviceThread = new Thread(this::runService);
        serviceThread.setName(serviceName);
        serviceThread.setDaemon(true);
        serviceThread.start();
        log.info("{} started", serviceName);
    }

    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state != State.RUNNING && state != State.PAUSED) {
            throw new IllegalStateException(String.format("Cannot stop service '%s' as it is in state %s", serviceName, state));
        }
        if (state == State.PAUSED) {
            synchronized (pauseLock) {
                pauseLock.notifyAll();
            }
        }
        if (serviceThread != null) {
            serviceThread.interrupt();
            try {
                serviceThread.join(STOP_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting for service thread to stop", serviceName);
            }
            if (serviceThread.isAlive()) {
                log.error("{} thread did not stop within {} ms, forcing ERROR state", serviceName, STOP_TIMEOUT_MS);
                currentState.set(State.ERROR);
                return;
            }
        }
        if (getCurrentState() != State.STOPPED && getCurrentState() != State.ERROR) {
            currentState.set(State.STOPPED);
        }
        log.debug("{} stopped", serviceName);
    }

    @Override
    public final void pause() {
        if (!currentState.compareAndSet(State.RUNNING, State.PAUSED)) {
            throw new IllegalStateException(String.format("Cannot pause service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} paused", serviceName);
    }

    @Override
    public final void resume() {
        if (!currentState.compareAndSet(State.PAUSED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot resume service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} resumed", serviceName);
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("{} thread interrupted, shutting down", serviceName);
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}: {}", serviceName, e.getClass().getSimpleName(), e.getMessage());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for {} has terminated", serviceName);
        }
    }

    /**
     * The service loop, run on the service thread. Call {@link #checkPause()} once per iteration.
     *
     * @throws InterruptedException on shutdown.
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Blocks while the service is paused.
     *
     * @throws InterruptedException if the thread is interrupted while waiting.
     */
    protected void checkPause() throws InterruptedException {
        synchronized (pauseLock) {
            while (getCurrentState() == State.PAUSED) {
                pauseLock.wait();
            }
        }
    }

    /**
     * Records a transient error. Only for failures the service continues after.
     *
     * @param code    Category, e.g. {@code "PULL_FAILED"}.
     * @param message Human-readable description.
     * @param details Additional context.
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(clock.instant(), code, message, details));
        while (errors.size() > getMaxErrors()) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        if (getCurrentState() == State.ERROR) return false;
        return errors.isEmpty();
    }
}

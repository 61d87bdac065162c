package org.dissync.controller;

import org.dissync.client.Client;
import org.dissync.config.SyncSettings;
import org.dissync.scheduler.CommandQueue;
import org.dissync.service.AbstractService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * The single background thread of the sync engine. Each tick it pulls when due and then publishes
 * local commits still waiting for a push, drains one pending command and reloads the info surface
 * when due.
 */
public class SyncLoop extends AbstractService {

    private final SyncController controller;
    private final SyncSettings settings;
    private Instant lastInfoReloadAt;

    public SyncLoop(SyncController controller, SyncSettings settings, Clock clock) {
        super("SyncLoop", clock);
        this.controller = controller;
        this.settings = settings;
    }

    @Override
    protected void run() throws InterruptedException {
        while (!Thread.currentThread().isInterrupted()) {
            checkPause();
            tick();
            Thread.sleep(settings.tickInterval().toMillis());
        }
    }

    /**
     * One iteration of the loop.
     */
    void tick() {
        Optional<Client> client = controller.currentClient();
        if (client.isPresent() && client.get().hasRemote() && client.get().isPullDue(settings.pullInterval())) {
            if (!client.get().pull()) {
                recordError("PULL_FAILED", "Failed to pull from remote", client.get().getMasterUser());
            } else if (client.get().isPushPending() && !client.get().publishPending()) {
                recordError("PUSH_FAILED", "Failed to publish local commits", client.get().getMasterUser());
            }
        }

        CommandQueue queue = controller.commandQueue();
        if (queue.drainOne() == CommandQueue.DrainOutcome.FAILED) {
            recordError("DRAIN_FAILED", "Pending command failed", "remaining=" + queue.size());
        }

        Optional<InfoSurface> surface = controller.infoSurface();
        if (surface.isPresent() && infoReloadDue()) {
            lastInfoReloadAt = clock.instant();
            try {
                surface.get().reload();
            } catch (SurfaceClosedException e) {
                log.debug("Info surface closed, no longer reloading it: {}", e.getMessage());
                controller.clearInfoSurface();
            } catch (RuntimeException e) {
                log.warn("Failed to reload info surface: {}", e.getMessage());
                recordError("INFO_RELOAD_FAILED", "Failed to reload info surface", String.valueOf(e.getMessage()));
            }
        }
    }

    private boolean infoReloadDue() {
        return lastInfoReloadAt == null
                || Duration.between(lastInfoReloadAt, clock.instant()).compareTo(settings.infoReloadInterval()) >= 0;
    }
}

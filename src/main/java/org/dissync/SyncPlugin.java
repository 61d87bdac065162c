package org.dissync;

import com.typesafe.config.Config;
import org.dissync.config.ConfigLoader;
import org.dissync.config.LoggingConfigurator;
import org.dissync.config.SyncSettings;
import org.dissync.controller.HostTool;
import org.dissync.controller.SyncController;
import org.dissync.hooks.HookDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Entry point for host tool adapters: wires configuration, logging, the controller and its
 * background loop, and the hook dispatcher the adapter feeds events into.
 */
public final class SyncPlugin implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SyncPlugin.class);

    private final SyncController controller;
    private final HookDispatcher dispatcher;

    private SyncPlugin(SyncController controller, HookDispatcher dispatcher) {
        this.controller = controller;
        this.dispatcher = dispatcher;
    }

    public static SyncPlugin start(HostTool host) {
        return start(host, ConfigLoader.load(), Clock.systemUTC());
    }

    /**
     * Starts the sync engine for a host tool. The engine stays disconnected until
     * {@link SyncController#connect} is called.
     */
    public static SyncPlugin start(HostTool host, Config config, Clock clock) {
        LoggingConfigurator.configure(config);
        SyncSettings settings = SyncSettings.fromConfig(config);
        SyncController controller = new SyncController(host, settings, clock);
        HookDispatcher dispatcher = new HookDispatcher(controller);
        controller.start();
        LOG.info("Sync engine started (tick {}, pull every {})", settings.tickInterval(), settings.pullInterval());
        return new SyncPlugin(controller, dispatcher);
    }

    public SyncController controller() {
        return controller;
    }

    public HookDispatcher dispatcher() {
        return dispatcher;
    }

    @Override
    public void close() {
        controller.shutdown();
        LOG.info("Sync engine stopped");
    }
}

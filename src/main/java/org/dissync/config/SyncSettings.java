package org.dissync.config;

import com.typesafe.config.Config;
import org.dissync.client.RepositorySettings;

import java.time.Duration;

/**
 * Typed view of the {@code dissync} configuration block.
 *
 * @param tickInterval       Pause between two iterations of the sync loop.
 * @param pullInterval       Minimum time between two fetches from the remote.
 * @param infoReloadInterval Minimum time between two reloads of the info surface.
 * @param repository         Repository naming conventions.
 */
public record SyncSettings(Duration tickInterval, Duration pullInterval, Duration infoReloadInterval,
                           RepositorySettings repository) {

    public static SyncSettings defaults() {
        return new SyncSettings(Duration.ofSeconds(1), Duration.ofSeconds(10), Duration.ofSeconds(10),
                RepositorySettings.defaults());
    }

    /**
     * Reads the settings from the root configuration.
     */
    public static SyncSettings fromConfig(Config config) {
        Config sync = config.getConfig("dissync.sync");
        return new SyncSettings(
                sync.getDuration("tick-interval"),
                sync.getDuration("pull-interval"),
                sync.getDuration("info-reload-interval"),
                RepositorySettings.fromConfig(config.getConfig("dissync.repository")));
    }
}

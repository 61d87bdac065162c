package org.dissync;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.dissync.config.ConfigLoader;
import org.dissync.config.LoggingConfigurator;
import org.dissync.controller.SyncStatus;
import org.dissync.data.Function;
import org.dissync.junit.extensions.logging.LogWatchExtension;
import org.dissync.service.IService;
import org.dissync.testutils.FakeHostTool;
import org.dissync.testutils.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class SyncPluginTest {

    private static final long FUNC = 0x4011a0L;

    @TempDir
    Path tmp;

    private Level originalRootLevel;
    private SyncPlugin plugin;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = rootLogger().getLevel();
    }

    @AfterEach
    void tearDown() {
        if (plugin != null) {
            plugin.close();
        }
        rootLogger().setLevel(originalRootLevel);
        LoggingConfigurator.reset();
    }

    private static ch.qos.logback.classic.Logger rootLogger() {
        return ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
    }

    @Test
    void analystEditsAreRecordedByTheBackgroundLoop() throws Exception {
        Config config = ConfigFactory.parseString("dissync.sync.tick-interval = 20ms")
                .withFallback(ConfigLoader.load(tmp.resolve("absent.conf").toString()));
        FakeHostTool host = new FakeHostTool();
        host.addFunction(FUNC, "sub_4011a0");

        plugin = SyncPlugin.start(host, config, MutableClock.atEpochSecond(1_700_000_000L));
        host.setListener(plugin.dispatcher()::onEvent);

        assertThat(plugin.controller().getLoop().getCurrentState()).isEqualTo(IService.State.RUNNING);
        assertThat(plugin.controller().status()).isEqualTo(SyncStatus.DISCONNECTED);

        host.setFunctionName(FUNC, "ignored_while_disconnected");
        plugin.controller().connect("alice", tmp.resolve("repo"), true, null);
        host.setFunctionName(FUNC, "parse_header");

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(plugin.controller().pullFunction(FUNC, null)).map(Function::getName).contains("parse_header"));
        assertThat(plugin.controller().commandQueue().size()).isZero();
    }

    @Test
    void closeStopsTheLoopAndDisconnects() throws Exception {
        plugin = SyncPlugin.start(new FakeHostTool(), ConfigLoader.load(tmp.resolve("absent.conf").toString()),
                MutableClock.atEpochSecond(1_700_000_000L));
        plugin.controller().connect("alice", tmp.resolve("repo"), true, null);

        plugin.close();

        assertThat(plugin.controller().getLoop().getCurrentState()).isEqualTo(IService.State.STOPPED);
        assertThat(plugin.controller().isConnected()).isFalse();
        plugin = null;
    }
}

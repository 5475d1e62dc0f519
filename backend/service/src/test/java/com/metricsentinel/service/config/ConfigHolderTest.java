package com.metricsentinel.service.config;

import com.metricsentinel.core.bus.EventBus;
import com.metricsentinel.core.events.ConfigReloaded;
import com.metricsentinel.service.support.ConfigFiles;
import com.metricsentinel.service.support.EventCapture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigHolderTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    @Test
    void reloadSwapsWholeConfigAndPublishesEvent() throws Exception {
        Path file = ConfigFiles.write(dir, ConfigFiles.agentYaml(30, 1, 1, true));
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        ConfigHolder holder = ConfigHolder.load(file, bus, CLOCK);
        AgentConfig before = holder.current();

        ConfigFiles.write(dir, ConfigFiles.agentYaml(15, 0, 0, false));
        AgentConfig after = holder.reload();

        assertSame(after, holder.current());
        assertEquals(30, before.intervalSeconds());
        assertTrue(before.alerts().enabled());
        assertEquals(15, after.intervalSeconds());
        assertFalse(after.alerts().enabled());

        List<ConfigReloaded> reloads = capture.byType(ConfigReloaded.class);
        assertEquals(1, reloads.size());
        assertEquals(15, reloads.get(0).intervalSeconds());
        assertEquals(file.toString(), reloads.get(0).source());
    }

    @Test
    void invalidReloadKeepsPreviousConfig() throws Exception {
        Path file = ConfigFiles.write(dir, ConfigFiles.agentYaml(30, 1, 1, true));
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        ConfigHolder holder = ConfigHolder.load(file, bus, CLOCK);
        AgentConfig original = holder.current();

        Files.writeString(file, "interval_seconds: -5\n");

        assertThrows(ConfigException.class, holder::reload);
        assertFalse(holder.reloadQuietly());
        assertSame(original, holder.current());
        assertTrue(capture.byType(ConfigReloaded.class).isEmpty());
    }

    @Test
    void startupWithInvalidFileFails() throws Exception {
        Path file = ConfigFiles.write(dir, "endpoint:\n  url: not a url\ninterval_seconds: 10\n");

        ConfigException error = assertThrows(ConfigException.class, () -> ConfigHolder.load(file, new EventBus(), CLOCK));
        assertTrue(error.getMessage().contains("endpoint.url"));
    }
}

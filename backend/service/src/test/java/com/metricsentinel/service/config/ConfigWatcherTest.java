package com.metricsentinel.service.config;

import com.metricsentinel.core.bus.EventBus;
import com.metricsentinel.service.support.ConfigFiles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigWatcherTest {
    @TempDir
    Path dir;

    @Test
    void rewritingTheFileReloadsIt() throws Exception {
        Path file = ConfigFiles.write(dir, ConfigFiles.agentYaml(30, 1, 1, true));
        ConfigHolder holder = ConfigHolder.load(file, new EventBus(), Clock.systemUTC());

        try (ConfigWatcher ignored = ConfigWatcher.start(holder)) {
            Files.writeString(dir.resolve("unrelated.txt"), "noise");
            ConfigFiles.write(dir, ConfigFiles.agentYaml(45, 1, 1, true));

            long deadline = System.currentTimeMillis() + 15_000;
            while (holder.current().intervalSeconds() != 45 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
        }

        assertEquals(45, holder.current().intervalSeconds());
    }
}

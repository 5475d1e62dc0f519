package com.metricsentinel.service.config;

import com.metricsentinel.core.bus.EventBus;
import com.metricsentinel.core.events.ConfigReloaded;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds the active configuration behind a single reference. Readers take one snapshot per cycle; a reload swaps
 * the whole object or nothing.
 */
public final class ConfigHolder {
    private static final Logger LOGGER = Logger.getLogger(ConfigHolder.class.getName());

    private final Path path;
    private final EventBus eventBus;
    private final Clock clock;
    private final AtomicReference<AgentConfig> current;

    private ConfigHolder(Path path, AgentConfig initial, EventBus eventBus, Clock clock) {
        this.path = path;
        this.eventBus = eventBus;
        this.clock = clock;
        this.current = new AtomicReference<>(initial);
    }

    /**
     * @throws ConfigException when the file is missing or invalid
     */
    public static ConfigHolder load(Path path, EventBus eventBus, Clock clock) {
        AgentConfig initial = ConfigLoader.load(path);
        logWarnings(path, initial);
        LOGGER.info("Loaded config from " + path + " (endpoint " + initial.endpoint().url()
                + ", interval " + initial.intervalSeconds() + "s)");
        return new ConfigHolder(path, initial, eventBus, clock);
    }

    public AgentConfig current() {
        return current.get();
    }

    public Path path() {
        return path;
    }

    /**
     * @throws ConfigException when the new file is invalid; the previous configuration stays active
     */
    public synchronized AgentConfig reload() {
        AgentConfig next = ConfigLoader.load(path);
        logWarnings(path, next);
        current.set(next);
        LOGGER.info("Reloaded config from " + path);
        eventBus.publish(new ConfigReloaded(clock.instant(), path.toString(), next.intervalSeconds()));
        return next;
    }

    public boolean reloadQuietly() {
        try {
            reload();
            return true;
        } catch (ConfigException e) {
            LOGGER.log(Level.SEVERE, "Rejected config reload from " + path + "; keeping previous configuration", e);
            return false;
        }
    }

    private static void logWarnings(Path path, AgentConfig config) {
        for (String warning : ConfigLoader.warnings(config)) {
            LOGGER.warning(path + ": " + warning);
        }
    }
}

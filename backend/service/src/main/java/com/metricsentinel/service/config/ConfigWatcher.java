package com.metricsentinel.service.config;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reloads the configuration whenever its file is written. This is the agent's reload trigger: editing or
 * replacing the file plays the role a reload signal would.
 */
public final class ConfigWatcher implements Closeable {
    private static final Logger LOGGER = Logger.getLogger(ConfigWatcher.class.getName());

    private final ConfigHolder holder;
    private final Path fileName;
    private final WatchService watchService;
    private final Thread thread;

    private ConfigWatcher(ConfigHolder holder, WatchService watchService) {
        this.holder = holder;
        this.fileName = holder.path().getFileName();
        this.watchService = watchService;
        this.thread = new Thread(this::run, "metric-sentinel-config-watcher");
        this.thread.setDaemon(true);
    }

    public static ConfigWatcher start(ConfigHolder holder) throws IOException {
        Path directory = holder.path().toAbsolutePath().getParent();
        WatchService watchService = FileSystems.getDefault().newWatchService();
        directory.register(
                watchService,
                StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_MODIFY
        );
        ConfigWatcher watcher = new ConfigWatcher(holder, watchService);
        watcher.thread.start();
        LOGGER.info("Watching " + holder.path() + " for changes");
        return watcher;
    }

    private void run() {
        while (!Thread.currentThread().isInterrupted()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            boolean touched = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.context() instanceof Path && fileName.equals(event.context())) {
                    touched = true;
                }
            }
            key.reset();
            if (touched) {
                try {
                    holder.reloadQuietly();
                } catch (RuntimeException e) {
                    LOGGER.log(Level.SEVERE, "Config reload failed unexpectedly", e);
                }
            }
        }
    }

    @Override
    public void close() throws IOException {
        thread.interrupt();
        watchService.close();
    }
}

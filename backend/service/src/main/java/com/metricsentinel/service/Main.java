package com.metricsentinel.service;

import com.metricsentinel.collectors.alerts.AlertDeduplicator;
import com.metricsentinel.collectors.alerts.AlertState;
import com.metricsentinel.collectors.alerts.ThresholdEvaluator;
import com.metricsentinel.collectors.delivery.DeliveryClient;
import com.metricsentinel.collectors.delivery.HttpIngestTransport;
import com.metricsentinel.collectors.delivery.Sleeper;
import com.metricsentinel.collectors.host.JvmHostSnapshotSource;
import com.metricsentinel.collectors.notify.Notifier;
import com.metricsentinel.collectors.notify.Notifiers;
import com.metricsentinel.core.bus.EventBus;
import com.metricsentinel.core.events.ConfigReloaded;
import com.metricsentinel.service.config.AgentConfig;
import com.metricsentinel.service.config.ConfigException;
import com.metricsentinel.service.config.ConfigHolder;
import com.metricsentinel.service.config.ConfigWatcher;
import com.metricsentinel.service.config.LoggingSetup;
import com.metricsentinel.service.http.HttpClientFactory;
import com.metricsentinel.service.runtime.CollectionLoop;
import com.metricsentinel.service.runtime.CycleContext;
import com.metricsentinel.service.runtime.CycleResult;
import com.metricsentinel.service.runtime.PipelineDiagnostics;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    static final String CONFIG_ENV = "METRIC_SENTINEL_CONFIG";
    static final Path DEFAULT_CONFIG = Path.of("config/config.yaml");
    static final String ONCE_FLAG = "--once";

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        LoggingSetup.initialize();
        LaunchOptions options = resolveLaunchOptions(args, System.getenv());

        EventBus eventBus = new EventBus();
        Clock clock = Clock.systemUTC();
        ConfigHolder config;
        try {
            config = ConfigHolder.load(options.configPath(), eventBus, clock);
        } catch (ConfigException e) {
            LOGGER.log(Level.SEVERE, "Refusing to start: " + e.getMessage(), e);
            System.exit(2);
            return;
        }
        LoggingSetup.apply(config.current().logLevel());
        eventBus.subscribe(ConfigReloaded.class, event -> LoggingSetup.apply(config.current().logLevel()));

        HttpClient sharedHttpClient = HttpClientFactory.create(Duration.ofSeconds(5));
        String hostname = resolveHostname(config.current(), System.getenv());

        CycleContext context = new CycleContext(
                new JvmHostSnapshotSource(hostname),
                new ThresholdEvaluator(),
                new AlertDeduplicator(),
                new AlertState(),
                new DeliveryClient(new HttpIngestTransport(sharedHttpClient), Sleeper.SYSTEM, clock),
                cfg -> notifiersFor(cfg, sharedHttpClient),
                eventBus,
                clock
        );
        PipelineDiagnostics diagnostics = new PipelineDiagnostics(eventBus, clock);
        CollectionLoop loop = new CollectionLoop(config, context);

        if (options.once()) {
            CycleResult result = loop.runOnce();
            loop.shutdown();
            LOGGER.info(result.message());
            System.exit(result.success() ? 0 : 1);
            return;
        }

        ConfigWatcher watcher = startWatcher(config);
        loop.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            loop.shutdown();
            closeQuietly(watcher);
            LOGGER.info(diagnostics.summary());
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static LaunchOptions resolveLaunchOptions(String[] args, Map<String, String> env) {
        List<String> arguments = Arrays.asList(args);
        boolean once = arguments.contains(ONCE_FLAG);
        Path configPath = arguments.stream()
                .filter(arg -> !arg.startsWith("--"))
                .findFirst()
                .map(Path::of)
                .orElseGet(() -> {
                    String fromEnv = env.get(CONFIG_ENV);
                    return fromEnv == null || fromEnv.isBlank() ? DEFAULT_CONFIG : Path.of(fromEnv);
                });
        return new LaunchOptions(configPath, once);
    }

    static String resolveHostname(AgentConfig config, Map<String, String> env) {
        if (config.hostname() != null && !config.hostname().isBlank()) {
            return config.hostname().trim();
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String fromEnv = env.getOrDefault("HOSTNAME", "");
            String fallback = fromEnv.isBlank() ? "unknown-host" : fromEnv;
            LOGGER.warning("Could not resolve local host name (" + e.getMessage() + "); using " + fallback);
            return fallback;
        }
    }

    static List<Notifier> notifiersFor(AgentConfig config, HttpClient httpClient) {
        return Notifiers.create(
                config.alerts().channelSet(),
                config.alerts().slackWebhookUri(),
                httpClient,
                Duration.ofSeconds(config.endpoint().timeout())
        );
    }

    private static ConfigWatcher startWatcher(ConfigHolder config) {
        try {
            return ConfigWatcher.start(config);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Config hot reload unavailable for " + config.path(), e);
            return null;
        }
    }

    private static void closeQuietly(ConfigWatcher watcher) {
        if (watcher == null) {
            return;
        }
        try {
            watcher.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Failed closing config watcher", e);
        }
    }

    record LaunchOptions(Path configPath, boolean once) {
    }
}

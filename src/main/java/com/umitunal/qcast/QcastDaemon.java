package com.umitunal.qcast;

import com.umitunal.qcast.config.BroadcastConfig;
import com.umitunal.qcast.config.PropertyReader;
import com.umitunal.qcast.config.StorageConfig;
import com.umitunal.qcast.core.MessageTransport;
import com.umitunal.qcast.directory.InMemoryRecipientDirectory;
import com.umitunal.qcast.dispatch.DispatchManager;
import com.umitunal.qcast.schedule.BroadcastJobService;
import com.umitunal.qcast.schedule.SchedulerLoop;
import com.umitunal.qcast.storage.RocksJobStore;
import com.umitunal.qcast.transport.BotApiTransport;
import com.umitunal.qcast.transport.LoggingTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the store, directory, transport, dispatch pipeline and scheduler
 * together and runs them until the JVM shuts down.
 *
 * Configuration is layered: {@code qcast.properties} on the classpath, then
 * the file named by {@code -Dqcast.config}, then {@code qcast.*} system
 * properties.
 */
public class QcastDaemon implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QcastDaemon.class);

    static final String DEFAULTS_RESOURCE = "qcast.properties";
    static final String CONFIG_FILE_PROPERTY = "qcast.config";

    private final RocksJobStore jobStore;
    private final InMemoryRecipientDirectory directory;
    private final DispatchManager dispatchManager;
    private final SchedulerLoop schedulerLoop;
    private final BroadcastJobService jobService;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public QcastDaemon(Properties properties) throws Exception {
        StorageConfig storageConfig = StorageConfig.fromProperties(properties);
        BroadcastConfig broadcastConfig = BroadcastConfig.fromProperties(properties);
        PropertyReader reader = new PropertyReader(properties);

        this.directory = createDirectory(reader);
        this.jobStore = new RocksJobStore(storageConfig);
        this.dispatchManager = new DispatchManager(broadcastConfig, createTransport(reader));
        this.schedulerLoop = SchedulerLoop.builder(jobStore, directory, dispatchManager)
                .withConfig(broadcastConfig)
                .build();
        this.jobService = new BroadcastJobService(jobStore);
    }

    public void start() {
        dispatchManager.start();
        schedulerLoop.start();
        log.info("qcast daemon started");
    }

    /**
     * Stop the scheduler first so no new work is queued, then the workers,
     * then close the store. Safe to call more than once.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("qcast daemon stopping");
        schedulerLoop.stop();
        dispatchManager.stop();
        jobStore.close();
        log.info("qcast daemon stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public BroadcastJobService getJobService() { return jobService; }
    public InMemoryRecipientDirectory getDirectory() { return directory; }
    public DispatchManager getDispatchManager() { return dispatchManager; }
    public SchedulerLoop getSchedulerLoop() { return schedulerLoop; }

    /**
     * Build the effective configuration from all layers.
     */
    public static Properties loadConfiguration(Properties systemProperties) throws IOException {
        Properties properties = new Properties();

        try (InputStream defaults = QcastDaemon.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (defaults != null) {
                properties.load(defaults);
            }
        }

        String configFile = systemProperties.getProperty(CONFIG_FILE_PROPERTY);
        if (configFile != null && !configFile.isBlank()) {
            Path path = Paths.get(configFile);
            try (InputStream in = Files.newInputStream(path)) {
                properties.load(in);
            }
            log.info("Loaded configuration from {}", path.toAbsolutePath());
        }

        for (String name : systemProperties.stringPropertyNames()) {
            if (name.startsWith("qcast.") && !name.equals(CONFIG_FILE_PROPERTY)) {
                properties.setProperty(name, systemProperties.getProperty(name));
            }
        }
        return properties;
    }

    static MessageTransport createTransport(PropertyReader reader) {
        String kind = reader.getString("qcast.transport", "log").toLowerCase(Locale.ROOT);
        switch (kind) {
            case "log" -> {
                log.warn("Using dry-run transport, messages are logged and not sent");
                return new LoggingTransport();
            }
            case "bot" -> {
                String token = reader.getString("qcast.bot.token", null);
                if (token == null) {
                    throw new IllegalArgumentException("qcast.bot.token is required when qcast.transport=bot");
                }
                return BotApiTransport.builder(token)
                        .withBaseUrl(reader.getString("qcast.bot.base-url", BotApiTransport.DEFAULT_BASE_URL))
                        .withRequestTimeout(reader.getMillis("qcast.bot.request-timeout-ms", Duration.ofSeconds(10)))
                        .build();
            }
            default -> throw new IllegalArgumentException(
                    "Invalid value for qcast.transport: " + kind + " (expected bot or log)");
        }
    }

    private static InMemoryRecipientDirectory createDirectory(PropertyReader reader) throws IOException {
        String seedFile = reader.getString("qcast.directory.seed-file", null);
        if (seedFile == null) {
            return new InMemoryRecipientDirectory();
        }
        return InMemoryRecipientDirectory.fromJsonFile(Paths.get(seedFile));
    }

    public static void main(String[] args) throws Exception {
        Properties properties = loadConfiguration(System.getProperties());
        QcastDaemon daemon = new QcastDaemon(properties);
        CountDownLatch shutdown = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            daemon.stop();
            shutdown.countDown();
        }, "qcast-shutdown"));

        daemon.start();
        shutdown.await();
    }
}

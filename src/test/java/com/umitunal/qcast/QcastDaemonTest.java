package com.umitunal.qcast;

import com.umitunal.qcast.config.PropertyReader;
import com.umitunal.qcast.schedule.JobDefinition;
import com.umitunal.qcast.transport.BotApiTransport;
import com.umitunal.qcast.transport.LoggingTransport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class QcastDaemonTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should layer classpath defaults, the external file and system properties")
    void testConfigurationLayers() throws Exception {
        // Given
        Path file = tempDir.resolve("qcast.properties");
        Files.writeString(file, "qcast.dispatch.workers=7\nqcast.dispatch.max-retries=5\n");
        Properties system = new Properties();
        system.setProperty("qcast.config", file.toString());
        system.setProperty("qcast.dispatch.max-retries", "9");
        system.setProperty("user.home", "/home/someone");

        // When
        Properties effective = QcastDaemon.loadConfiguration(system);

        // Then
        assertThat(effective.getProperty("qcast.transport")).isEqualTo("log");
        assertThat(effective.getProperty("qcast.dispatch.workers")).isEqualTo("7");
        assertThat(effective.getProperty("qcast.dispatch.max-retries")).isEqualTo("9");
        assertThat(effective).doesNotContainKey("user.home");
    }

    @Test
    @DisplayName("Should choose the transport from configuration")
    void testTransportSelection() {
        Properties properties = new Properties();
        assertThat(QcastDaemon.createTransport(new PropertyReader(properties))).isInstanceOf(LoggingTransport.class);

        properties.setProperty("qcast.transport", "bot");
        assertThatThrownBy(() -> QcastDaemon.createTransport(new PropertyReader(properties)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("qcast.bot.token");

        properties.setProperty("qcast.bot.token", "123:ABC");
        assertThat(QcastDaemon.createTransport(new PropertyReader(properties))).isInstanceOf(BotApiTransport.class);

        properties.setProperty("qcast.transport", "carrier-pigeon");
        assertThatThrownBy(() -> QcastDaemon.createTransport(new PropertyReader(properties)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Daemon should send a due job end to end and shut down cleanly")
    void testEndToEnd() throws Exception {
        // Given
        Path seed = tempDir.resolve("groups.json");
        Files.writeString(seed, "{\"year-1\": [\"1001\", \"1002\"]}");
        Properties properties = new Properties();
        properties.setProperty("qcast.storage.data-dir", tempDir.resolve("data").toString());
        properties.setProperty("qcast.storage.durable-writes", "false");
        properties.setProperty("qcast.directory.seed-file", seed.toString());
        properties.setProperty("qcast.scheduler.tick-interval-ms", "100");
        properties.setProperty("qcast.dispatch.workers", "2");

        // When
        try (QcastDaemon daemon = new QcastDaemon(properties)) {
            daemon.start();
            daemon.getJobService().createJob(JobDefinition.newBuilder()
                    .messageText("Welcome")
                    .weekly(Instant.now().minus(Duration.ofMinutes(1)))
                    .addRecipientGroup("year-1")
                    .build());

            // Then
            await().atMost(10, TimeUnit.SECONDS)
                    .until(() -> daemon.getDispatchManager().getTotalSent() == 2);
            assertThat(daemon.getJobService().listJobs())
                    .allSatisfy(job -> assertThat(job.getNextRunAt()).isAfter(Instant.now()));
        }
    }
}

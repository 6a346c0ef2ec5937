package com.umitunal.qcast.serialization;

import com.umitunal.qcast.config.StorageConfig;
import com.umitunal.qcast.core.BroadcastJob;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class JobCodecsTest {

    @ParameterizedTest
    @EnumSource(StorageConfig.Codec.class)
    @DisplayName("Should keep absent optional fields absent")
    void testNullFields(StorageConfig.Codec codec) {
        // Given - deactivated job without schedule, creation time or owner
        PayloadCodec<BroadcastJob> jobs = JobCodecs.forCodec(codec);
        BroadcastJob job = BroadcastJob.newBuilder("job-1")
                .messageText("Hi")
                .monthly()
                .active(false)
                .build();

        // When
        BroadcastJob decoded = jobs.decode(jobs.encode(job));

        // Then
        assertThat(decoded).isEqualTo(job);
        assertThat(decoded.getNextRunAt()).isNull();
        assertThat(decoded.getOwnerId()).isNull();
        assertThat(decoded.getRecipientGroupIds()).isEmpty();
    }

    @Test
    @DisplayName("JSON records should be readable text with ISO timestamps")
    void testJsonFormat() {
        // Given
        PayloadCodec<BroadcastJob> jobs = JobCodecs.forCodec(StorageConfig.Codec.JSON);
        BroadcastJob job = BroadcastJob.newBuilder("job-1")
                .messageText("Hi")
                .weekly()
                .nextRunAt(Instant.parse("2025-01-06T09:00:00Z"))
                .build();

        // When
        String json = new String(jobs.encode(job), StandardCharsets.UTF_8);

        // Then
        assertThat(json).contains("\"nextRunAt\":\"2025-01-06T09:00:00Z\"")
                .contains("\"recurrenceType\":\"WEEKLY\"");
    }

    @Test
    @DisplayName("Kryo records should be smaller than JSON records")
    void testKryoIsCompact() {
        // Given
        BroadcastJob job = BroadcastJob.newBuilder("3f1c2a7e-5b9d-4e1a-9c0f-2d8b7a6e5f41")
                .messageText("Reminder: submit your lab report")
                .custom("0 9 * * 1")
                .nextRunAt(Instant.parse("2025-01-06T09:00:00Z"))
                .addRecipientGroup("year-1")
                .createdAt(Instant.parse("2024-12-01T00:00:00Z"))
                .build();

        // When
        int kryo = JobCodecs.forCodec(StorageConfig.Codec.KRYO).encode(job).length;
        int json = JobCodecs.forCodec(StorageConfig.Codec.JSON).encode(job).length;

        // Then
        assertThat(kryo).isLessThan(json);
    }

    @ParameterizedTest
    @EnumSource(StorageConfig.Codec.class)
    @DisplayName("Should report corrupt records as codec errors")
    void testCorruptRecord(StorageConfig.Codec codec) {
        PayloadCodec<BroadcastJob> jobs = JobCodecs.forCodec(codec);

        assertThatThrownBy(() -> jobs.decode(new byte[]{1, 2}))
                .isInstanceOf(RuntimeException.class);
    }
}

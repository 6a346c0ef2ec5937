package com.umitunal.qcast.schedule;

import com.umitunal.qcast.core.BroadcastJob;
import com.umitunal.qcast.core.RecurrenceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class BroadcastJobServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-06T08:30:20Z");
    private static final Instant FIRST_RUN = Instant.parse("2025-01-06T09:00:00Z");

    private InMemoryJobStore store;
    private BroadcastJobService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        service = new BroadcastJobService(store, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private JobDefinition.Builder weeklyDefinition() {
        return JobDefinition.newBuilder()
                .messageText("<b>Exam</b> on Friday")
                .weekly(FIRST_RUN)
                .addRecipientGroup("year-1")
                .addRecipientGroup("year-2")
                .ownerId("admin-1");
    }

    @Test
    @DisplayName("Should create an active job with a generated id and creation time")
    void testCreateWeekly() throws Exception {
        // When
        BroadcastJob job = service.createJob(weeklyDefinition().build());

        // Then
        assertThat(job.getId()).isNotBlank();
        assertThat(job.isActive()).isTrue();
        assertThat(job.getNextRunAt()).isEqualTo(FIRST_RUN);
        assertThat(job.getCreatedAt()).isEqualTo(NOW);
        assertThat(job.getRecipientGroupIds()).containsExactly("year-1", "year-2");
        assertThat(store.getJob(job.getId())).isEqualTo(job);
    }

    @Test
    @DisplayName("Should assign distinct ids to identical definitions")
    void testDistinctIds() throws Exception {
        // When
        BroadcastJob first = service.createJob(weeklyDefinition().build());
        BroadcastJob second = service.createJob(weeklyDefinition().build());

        // Then
        assertThat(first.getId()).isNotEqualTo(second.getId());
        assertThat(service.listJobs()).hasSize(2);
    }

    @Test
    @DisplayName("Custom job without a first run should start at the next cron match")
    void testCreateCustomWithoutFirstRun() throws Exception {
        // When
        BroadcastJob job = service.createJob(JobDefinition.newBuilder()
                .messageText("Standup")
                .custom("0 9 * * MON-FRI")
                .addRecipientGroup("staff")
                .build());

        // Then
        assertThat(job.getRecurrenceType()).isEqualTo(RecurrenceType.CUSTOM);
        assertThat(job.getCronExpression()).isEqualTo("0 9 * * MON-FRI");
        assertThat(job.getNextRunAt()).isEqualTo(FIRST_RUN);
    }

    @Test
    @DisplayName("Should reject incomplete definitions")
    void testValidation() {
        assertThatThrownBy(() -> service.createJob(weeklyDefinition().messageText("  ").build()))
                .isInstanceOf(InvalidJobException.class)
                .hasMessageContaining("Message");

        assertThatThrownBy(() -> service.createJob(JobDefinition.newBuilder()
                .messageText("Hi").weekly(FIRST_RUN).build()))
                .isInstanceOf(InvalidJobException.class)
                .hasMessageContaining("group");

        assertThatThrownBy(() -> service.createJob(JobDefinition.newBuilder()
                .messageText("Hi").monthly(null).addRecipientGroup("g").build()))
                .isInstanceOf(InvalidJobException.class)
                .hasMessageContaining("first run");

        assertThat(store.listJobs()).isEmpty();
    }

    @Test
    @DisplayName("Should reject malformed or impossible cron expressions")
    void testInvalidCron() {
        assertThatThrownBy(() -> service.createJob(JobDefinition.newBuilder()
                .messageText("Hi").custom("0 25 * * *").addRecipientGroup("g").build()))
                .isInstanceOf(InvalidJobException.class);

        assertThatThrownBy(() -> service.createJob(JobDefinition.newBuilder()
                .messageText("Hi").custom("0 0 30 2 *").addRecipientGroup("g").build()))
                .isInstanceOf(InvalidJobException.class)
                .hasMessageContaining("never fires");
    }

    @Test
    @DisplayName("Edits should change only the edited fields")
    void testEdits() throws Exception {
        // Given
        BroadcastJob job = service.createJob(weeklyDefinition().build());

        // When
        service.updateMessage(job.getId(), "Exam moved to Monday");
        BroadcastJob edited = service.updateRecipients(job.getId(), Set.of("year-3"));

        // Then
        assertThat(edited.getMessageText()).isEqualTo("Exam moved to Monday");
        assertThat(edited.getRecipientGroupIds()).containsExactly("year-3");
        assertThat(edited.getNextRunAt()).isEqualTo(FIRST_RUN);
        assertThat(edited.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Rescheduling should re-activate a deactivated job")
    void testDeactivateAndReschedule() throws Exception {
        // Given
        BroadcastJob job = service.createJob(weeklyDefinition().build());
        service.deactivate(job.getId());
        assertThat(store.listDueActiveJobs(FIRST_RUN)).isEmpty();

        // When
        BroadcastJob rescheduled = service.reschedule(job.getId(), RecurrenceType.CUSTOM, "30 18 * * FRI", null);

        // Then - Friday 2025-01-10
        assertThat(rescheduled.isActive()).isTrue();
        assertThat(rescheduled.getRecurrenceType()).isEqualTo(RecurrenceType.CUSTOM);
        assertThat(rescheduled.getNextRunAt()).isEqualTo(Instant.parse("2025-01-10T18:30:00Z"));
    }

    @Test
    @DisplayName("Editing a missing job should fail")
    void testMissingJob() throws Exception {
        assertThatThrownBy(() -> service.updateMessage("nope", "Hi"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Job not found");
        assertThat(service.deleteJob("nope")).isFalse();
    }

    @Test
    @DisplayName("Should list jobs per owner")
    void testListByOwner() throws Exception {
        // Given
        service.createJob(weeklyDefinition().build());
        service.createJob(weeklyDefinition().ownerId("admin-2").build());

        // When/Then
        assertThat(service.listJobsOwnedBy("admin-2")).hasSize(1)
                .allSatisfy(job -> assertThat(job.getOwnerId()).isEqualTo("admin-2"));
    }
}

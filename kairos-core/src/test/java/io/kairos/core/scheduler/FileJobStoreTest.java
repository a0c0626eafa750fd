package io.kairos.core.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileJobStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReturnEmptyListWhenFileMissing() throws Exception {
        FileJobStore store = FileJobStore.inWorkspace(tempDir.resolve("workspace"));

        assertThat(store.load()).isEmpty();
        assertThat(store.path().getFileName().toString()).isEqualTo("scheduler.json");
    }

    @Test
    void shouldRoundTripJobsWithPayloadAndCalendarState() throws Exception {
        FileJobStore store = new FileJobStore(tempDir.resolve("nested/scheduler.json"));
        ScheduledJob job = new ScheduledJob(
            "job_1_abcdef",
            "Morning post",
            "Daily announcement",
            "0 9 * * *",
            null,
            false,
            null,
            JobType.POST,
            true,
            new JobPayload("telegram", "Hello", "prod-1", "camp-1", "publish", Map.of("priority", 2)),
            1_000L,
            2_000L,
            3,
            500L,
            1_000L,
            CalendarSync.enabledByDefault().synced("evt-1", "primary", 1_000L),
            "Europe/Berlin"
        );

        store.save(List.of(job));

        assertThat(new FileJobStore(store.path()).load()).containsExactly(job);
        assertThat(Files.readString(store.path())).contains("\"type\" : \"post\"");
    }

    @Test
    void shouldFailOnMalformedFile() throws Exception {
        Path path = tempDir.resolve("scheduler.json");
        Files.writeString(path, "{ not json");

        assertThatThrownBy(() -> new FileJobStore(path).load())
            .isInstanceOf(JobStoreException.class)
            .hasMessageContaining("Malformed");
    }
}

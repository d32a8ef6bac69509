package net.schedra.app;

import net.schedra.core.service.AdminResult;
import net.schedra.core.service.ScheduleAdminService;
import net.schedra.core.service.Scheduler;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class SchedulingFlowTest {

    @TempDir
    static Path dir;

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry r) {
        r.add("schedra.scheduler.loop-interval-ms", () -> "200");
        r.add("schedra.persistence.type", () -> "file");
        r.add("schedra.persistence.state-file", () -> dir.resolve("state.json").toString());
        r.add("schedra.persistence.schedule-file", () -> dir.resolve("schedule.yml").toString());
        r.add("schedra.catalog.jobs.heartbeat.function", () -> "test.ping");
        r.add("schedra.catalog.jobs.heartbeat.seconds", () -> "1");
    }

    @Autowired Scheduler scheduler;
    @Autowired ScheduleAdminService admin;

    @Test
    void catalog_job_fires_and_state_is_persisted() {
        Awaitility.await().atMost(Duration.ofSeconds(15)).untilAsserted(() -> {
            assertThat(scheduler.jobStatus("heartbeat"))
                    .get()
                    .satisfies(s -> assertThat(s.runCount()).isGreaterThanOrEqualTo(1L));
            assertThat(dir.resolve("state.json")).exists();
            assertThat(Files.readString(dir.resolve("state.json"))).contains("\"heartbeat\"");
        });
    }

    @Test
    void admin_added_job_is_saved_to_schedule_file_and_runs() {
        Map<String, Object> job = new LinkedHashMap<>();
        job.put("function", "test.echo");
        job.put("seconds", 1);
        job.put("args", List.of("hello"));

        AdminResult added = admin.add("echo", job);

        assertThat(added.result()).isTrue();
        assertThat(added.comment()).isEqualTo("Added job: echo to schedule.");
        assertThat(dir.resolve("schedule.yml")).exists();

        Awaitility.await().atMost(Duration.ofSeconds(15)).untilAsserted(() ->
                assertThat(scheduler.jobStatus("echo")).get()
                        .satisfies(s -> {
                            assertThat(s.runCount()).isGreaterThanOrEqualTo(1L);
                            assertThat(s.hasError()).isFalse();
                        }));

        assertThat(admin.delete("echo").comment()).isEqualTo("Deleted job: echo from schedule.");
    }
}

package net.schedra.integration.spring.sched;

import net.schedra.core.launch.DirectJobLauncher;
import net.schedra.core.model.JobStatus;
import net.schedra.core.model.OnceMissedPolicy;
import net.schedra.core.service.Scheduler;
import net.schedra.core.service.SchedulerConfig;
import net.schedra.core.spi.FunctionRegistry;
import net.schedra.core.spi.GrainsLookup;
import net.schedra.core.spi.JobFunction;
import net.schedra.core.spi.ReturnerRegistry;
import net.schedra.core.spi.StatePersistence;
import net.schedra.core.store.JobStateStore;
import net.schedra.core.validation.JobSpecValidator;
import net.schedra.integration.spring.cron.CronUtilsCalculator;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class SchedraSchedulersTest {

    @Test
    void ticks_are_ignored_until_started() {
        AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2017-11-29T15:00:00Z"));
        AtomicInteger calls = new AtomicInteger();
        JobFunction ping = (args, kwargs) -> calls.incrementAndGet();
        FunctionRegistry functions = FunctionRegistry.of(Map.of("test.ping", ping));
        CronUtilsCalculator cron = new CronUtilsCalculator();
        Scheduler scheduler = new Scheduler(new SchedulerConfig(ZoneId.of("UTC"), Duration.ofSeconds(1), OnceMissedPolicy.SKIP), new JobStateStore(),
                new JobSpecValidator(functions, GrainsLookup.empty(), cron), functions, ReturnerRegistry.none(),
                new DirectJobLauncher(), StatePersistence.none(), cron, now::get, new Random(0));
        scheduler.load(Map.of("job1", Map.of("function", "test.ping", "cron", "0 * * * *")));
        SchedraSchedulers ticks = new SchedraSchedulers(scheduler, now::get);
        ticks.tick();
        assertThat(scheduler.jobStatus("job1")).get().extracting(JobStatus::nextFireTime).isNull();
        ticks.start();

        ticks.tick();
        now.set(Instant.parse("2017-11-29T16:00:00Z"));
        ticks.tick();

        assertThat(calls.get()).isEqualTo(1);
        assertThat(scheduler.jobStatus("job1")).get()
                .extracting(JobStatus::runCount)
                .isEqualTo(1L);
    }
}

package net.schedra.bootstrap.autoconfigure;

import net.schedra.adapter.file.JsonFileStatePersistence;
import net.schedra.adapter.file.YamlScheduleStore;
import net.schedra.core.launch.DirectJobLauncher;
import net.schedra.core.launch.ExecutorJobLauncher;
import net.schedra.core.service.ScheduleAdminService;
import net.schedra.core.service.Scheduler;
import net.schedra.core.spi.CronCalculator;
import net.schedra.core.spi.FunctionRegistry;
import net.schedra.core.spi.JobFunction;
import net.schedra.core.spi.JobLauncher;
import net.schedra.core.spi.ScheduleStore;
import net.schedra.core.spi.StatePersistence;
import net.schedra.integration.spring.cron.CronUtilsCalculator;
import net.schedra.integration.spring.sched.SchedraSchedulers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class SchedraAutoConfigurationTest {

    final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SchedraAutoConfiguration.class))
            .withUserConfiguration(Functions.class);

    @TempDir
    Path dir;

    @Test
    void defaults_wire_core_with_executor_launcher_and_no_persistence() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(Scheduler.class);
            assertThat(ctx).hasSingleBean(ScheduleAdminService.class);
            assertThat(ctx).hasSingleBean(SchedraSchedulers.class);
            assertThat(ctx.getBean(CronCalculator.class)).isInstanceOf(CronUtilsCalculator.class);
            assertThat(ctx.getBean(JobLauncher.class)).isInstanceOf(ExecutorJobLauncher.class);
            assertThat(ctx).doesNotHaveBean(StatePersistence.class);
            assertThat(ctx).doesNotHaveBean(ScheduleStore.class);
            assertThat(ctx.getBean(FunctionRegistry.class).contains("test.ping")).isTrue();
            assertThat(ctx.getBean(Scheduler.class).config().zone()).isEqualTo(ZoneId.of("UTC"));
        });
    }

    @Test
    void file_persistence_and_direct_launcher_from_properties() {
        runner.withPropertyValues(
                "schedra.zone=America/Denver",
                "schedra.scheduler.launcher=direct",
                "schedra.persistence.type=file",
                "schedra.persistence.state-file=" + dir.resolve("state.json"),
                "schedra.persistence.schedule-file=" + dir.resolve("schedule.yml")
        ).run(ctx -> {
            assertThat(ctx.getBean(JobLauncher.class)).isInstanceOf(DirectJobLauncher.class);
            assertThat(ctx.getBean(StatePersistence.class)).isInstanceOf(JsonFileStatePersistence.class);
            assertThat(ctx.getBean(ScheduleStore.class)).isInstanceOf(YamlScheduleStore.class);
            assertThat(ctx.getBean(Scheduler.class).config().zone()).isEqualTo(ZoneId.of("America/Denver"));
        });
    }

    @Test
    void tick_loop_can_be_disabled() {
        runner.withPropertyValues("schedra.scheduler.enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(SchedraSchedulers.class));
    }

    @Test
    void jdbc_persistence_needs_a_data_source() {
        runner.withPropertyValues("schedra.persistence.type=jdbc")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(StatePersistence.class));
    }

    @Configuration(proxyBeanMethods = false)
    static class Functions {
        @Bean("test.ping")
        JobFunction ping() {
            return (args, kwargs) -> true;
        }
    }
}

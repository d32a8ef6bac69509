package net.schedra.bootstrap.autoconfigure;

import net.schedra.adapter.file.JsonFileStatePersistence;
import net.schedra.adapter.file.YamlScheduleStore;
import net.schedra.adapter.jdbc.JdbcStatePersistence;
import net.schedra.adapter.jdbc.JdbcTxRunner;
import net.schedra.bootstrap.catalog.CatalogRegistrar;
import net.schedra.bootstrap.props.SchedraProperties;
import net.schedra.core.launch.DirectJobLauncher;
import net.schedra.core.launch.ExecutorJobLauncher;
import net.schedra.core.service.ScheduleAdminService;
import net.schedra.core.service.Scheduler;
import net.schedra.core.service.SchedulerConfig;
import net.schedra.core.spi.Clock;
import net.schedra.core.spi.CronCalculator;
import net.schedra.core.spi.FunctionRegistry;
import net.schedra.core.spi.GrainsLookup;
import net.schedra.core.spi.JobLauncher;
import net.schedra.core.spi.ReturnerRegistry;
import net.schedra.core.spi.ScheduleStore;
import net.schedra.core.spi.StatePersistence;
import net.schedra.core.spi.TxRunner;
import net.schedra.core.store.JobStateStore;
import net.schedra.core.validation.JobSpecValidator;
import net.schedra.integration.spring.SchedraSpringConfig;
import net.schedra.integration.spring.cron.CronUtilsCalculator;
import net.schedra.integration.spring.sched.SchedraSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Map;
import java.util.Random;

@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration")
@EnableConfigurationProperties(SchedraProperties.class)
@Import(SchedraSpringConfig.class) // integration-spring: clock/store/registry wiring
public class SchedraAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(SchedraAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(CronCalculator.class)
    public CronCalculator cronCalculator() {
        return new CronUtilsCalculator();
    }

    @Bean
    @ConditionalOnMissingBean(GrainsLookup.class)
    public GrainsLookup grainsLookup(SchedraProperties props) {
        return GrainsLookup.of(Map.of("whens", props.getGrains().getWhens()));
    }

    @Bean
    @ConditionalOnMissingBean(JobLauncher.class)
    public JobLauncher jobLauncher(SchedraProperties props) {
        SchedraProperties.Scheduler s = props.getScheduler();
        if (s.getLauncher() == SchedraProperties.LauncherType.DIRECT) return new DirectJobLauncher();
        return new ExecutorJobLauncher(s.getLauncherThreads(), s.getShutdownTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(StatePersistence.class)
    @ConditionalOnProperty(prefix = "schedra.persistence", name = "type", havingValue = "file")
    public StatePersistence fileStatePersistence(SchedraProperties props) {
        return new JsonFileStatePersistence(Path.of(props.getPersistence().getStateFile()));
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "schedra.persistence", name = "type", havingValue = "jdbc")
    @ConditionalOnBean(DataSource.class)
    static class JdbcPersistenceConfiguration {

        @Bean
        @ConditionalOnMissingBean(TxRunner.class)
        public TxRunner txRunner(DataSource ds) {
            return new JdbcTxRunner(ds);
        }

        @Bean
        @ConditionalOnMissingBean(StatePersistence.class)
        public StatePersistence jdbcStatePersistence(TxRunner tx) {
            return new JdbcStatePersistence(tx);
        }
    }

    @Bean
    @ConditionalOnMissingBean(ScheduleStore.class)
    @ConditionalOnProperty(prefix = "schedra.persistence", name = "schedule-file")
    public ScheduleStore scheduleStore(SchedraProperties props) {
        return new YamlScheduleStore(Path.of(props.getPersistence().getScheduleFile()));
    }

    // --- 코어 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(SchedraProperties props,
                               JobStateStore store,
                               FunctionRegistry functions,
                               ReturnerRegistry returners,
                               GrainsLookup grains,
                               JobLauncher launcher,
                               ObjectProvider<StatePersistence> persistence,
                               CronCalculator cron,
                               Clock clock) {
        SchedraProperties.Scheduler s = props.getScheduler();
        SchedulerConfig config = new SchedulerConfig(ZoneId.of(props.getZone()), s.getLoopInterval(), s.getOnceMissedPolicy());
        Random random = s.getRandomSeed() == null ? new Random() : new Random(s.getRandomSeed());
        StatePersistence state = persistence.getIfAvailable(StatePersistence::none);
        log.info("Scheduler zone={} loopInterval={} persistence={}",
                config.zone(), config.loopInterval(), props.getPersistence().getType());
        return new Scheduler(config, store, new JobSpecValidator(functions, grains, cron),
                functions, returners, launcher, state, cron, clock, random);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleAdminService scheduleAdminService(Scheduler scheduler,
                                                     ObjectProvider<ScheduleStore> scheduleStore,
                                                     SchedraProperties props) {
        return new ScheduleAdminService(scheduler, scheduleStore.getIfAvailable(),
                props.getPersistence().isPersistChanges());
    }

    // --- 틱 루프 (주기는 schedra.scheduler.loop-interval-ms) ---

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "schedra.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class TickConfiguration {

        @Bean
        public SchedraSchedulers schedraSchedulers(Scheduler scheduler, Clock clock) {
            return new SchedraSchedulers(scheduler, clock);
        }
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(Scheduler scheduler, ObjectProvider<ScheduleStore> scheduleStore) {
        return new CatalogRegistrar(scheduler, scheduleStore.getIfAvailable());
    }

    @Bean
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar,
                                           SchedraProperties props,
                                           ObjectProvider<SchedraSchedulers> ticks) {
        log.info("Catalog enabled={} jobs={}", props.getCatalog().isEnabled(), props.getCatalog().getJobs().keySet());
        return args -> {
            registrar.register(props);
            ticks.ifAvailable(SchedraSchedulers::start);
        };
    }
}

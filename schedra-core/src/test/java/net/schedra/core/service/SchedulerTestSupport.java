package net.schedra.core.service;

import net.schedra.core.launch.DirectJobLauncher;
import net.schedra.core.model.JobStatus;
import net.schedra.core.model.OnceMissedPolicy;
import net.schedra.core.model.PersistedJobState;
import net.schedra.core.spi.Clock;
import net.schedra.core.spi.CronCalculator;
import net.schedra.core.spi.FunctionRegistry;
import net.schedra.core.spi.GrainsLookup;
import net.schedra.core.spi.JobFunction;
import net.schedra.core.spi.JobLauncher;
import net.schedra.core.spi.ReturnerRegistry;
import net.schedra.core.spi.StatePersistence;
import net.schedra.core.store.JobStateStore;
import net.schedra.core.validation.JobSpecValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 스케줄러 테스트 공통: 고정 시계, 호출 횟수를 세는 함수들, 메모리 영속 계층.
 */
public abstract class SchedulerTestSupport {
    protected static final ZoneId ZONE = ZoneOffset.UTC;

    /** 분 단위로만 도는 cron 대역. 5필드가 아니거나 월이 1~12 밖이면 거부한다. */
    protected static final CronCalculator EVERY_MINUTE_CRON = (from, expr, zone) -> {
        String[] f = expr.trim().split("\\s+");
        if (f.length != 5) throw new IllegalArgumentException("expected 5 fields: " + expr);
        if (f[3].matches("\\d+") && (Integer.parseInt(f[3]) < 1 || Integer.parseInt(f[3]) > 12)) {
            throw new IllegalArgumentException("month out of range: " + expr);
        }
        return from.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
    };

    protected final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    protected final MemoryPersistence persistence = new MemoryPersistence();
    protected Instant now;
    protected Clock clock;
    protected JobStateStore store;
    protected Scheduler scheduler;

    @BeforeEach
    void setUpScheduler() {
        now = at("2017-11-29T15:00:00");
        clock = () -> now;
        scheduler = newScheduler(GrainsLookup.empty(), new DirectJobLauncher(), persistence, OnceMissedPolicy.SKIP, new Random(42));
    }

    @AfterEach
    void closeScheduler() {
        scheduler.close();
    }

    protected Scheduler newScheduler(GrainsLookup grains, JobLauncher launcher, StatePersistence persistence,
                                     OnceMissedPolicy policy, Random random) {
        return newScheduler(grains, launcher, persistence, policy, random, ReturnerRegistry.none());
    }

    protected Scheduler newScheduler(GrainsLookup grains, JobLauncher launcher, StatePersistence persistence,
                                     OnceMissedPolicy policy, Random random, ReturnerRegistry returners) {
        SchedulerConfig config = new SchedulerConfig(ZONE, Duration.ofSeconds(1), policy);
        FunctionRegistry functions = FunctionRegistry.of(Map.of(
                "test.ping", counting("test.ping", true),
                "test.echo", (JobFunction) (args, kwargs) -> {
                    calls.computeIfAbsent("test.echo", k -> new AtomicInteger()).incrementAndGet();
                    return args;
                },
                "test.skipped", counting("test.skipped", "skipped"),
                "test.fail", (JobFunction) (args, kwargs) -> {
                    calls.computeIfAbsent("test.fail", k -> new AtomicInteger()).incrementAndGet();
                    throw new IllegalStateException("boom");
                }));
        store = new JobStateStore();
        JobSpecValidator validator = new JobSpecValidator(functions, grains, EVERY_MINUTE_CRON);
        return new Scheduler(config, store, validator, functions, returners, launcher, persistence,
                EVERY_MINUTE_CRON, clock, random);
    }

    private JobFunction counting(String name, Object result) {
        return (args, kwargs) -> {
            calls.computeIfAbsent(name, k -> new AtomicInteger()).incrementAndGet();
            return result;
        };
    }

    protected int callCount(String function) {
        AtomicInteger c = calls.get(function);
        return c == null ? 0 : c.get();
    }

    protected void evalAt(String isoLocal) {
        now = at(isoLocal);
        scheduler.eval(now);
    }

    protected JobStatus status(String name) {
        return scheduler.jobStatus(name).orElseThrow();
    }

    protected static Instant at(String isoLocal) {
        return LocalDateTime.parse(isoLocal).atZone(ZONE).toInstant();
    }

    /** 순서를 지키는 가변 맵 (YAML 로더가 주는 형태) */
    protected static Map<String, Object> job(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
        return m;
    }

    protected static Map<String, Object> schedule(String name, Map<String, Object> job) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(name, job);
        return m;
    }

    protected static final class MemoryPersistence implements StatePersistence {
        final Map<String, PersistedJobState> saved = new TreeMap<>();
        int saves;
        boolean failOnSave;
        boolean failOnLoad;

        @Override
        public Map<String, PersistedJobState> load() throws Exception {
            if (failOnLoad) throw new java.io.IOException("state file unreadable");
            return new TreeMap<>(saved);
        }

        @Override
        public void save(Map<String, PersistedJobState> states) throws Exception {
            if (failOnSave) throw new java.io.IOException("disk full");
            saved.clear();
            saved.putAll(states);
            saves++;
        }
    }

    /** 본문을 실행하지 않고 붙잡아 두는 런처 (실행 중 상태 재현) */
    protected static final class HoldingLauncher implements JobLauncher {
        final List<Runnable> held = new ArrayList<>();

        @Override
        public void launch(String jobName, Runnable body) { held.add(body); }

        @Override
        public boolean isRunning(String jobName) { return !held.isEmpty(); }

        void completeAll() {
            List<Runnable> copy = new ArrayList<>(held);
            held.clear();
            copy.forEach(Runnable::run);
        }

        @Override
        public void close() { held.clear(); }
    }
}

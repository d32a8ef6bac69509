package net.schedra.core.service;

import net.schedra.core.model.FireDecision;
import net.schedra.core.model.JobResult;
import net.schedra.core.model.JobSpec;
import net.schedra.core.model.JobState;
import net.schedra.core.model.JobState.ErrorSource;
import net.schedra.core.model.JobStatus;
import net.schedra.core.model.PersistedJobState;
import net.schedra.core.model.Splay;
import net.schedra.core.model.TimingDirective;
import net.schedra.core.spi.Clock;
import net.schedra.core.spi.CronCalculator;
import net.schedra.core.spi.FunctionNotFoundException;
import net.schedra.core.spi.FunctionRegistry;
import net.schedra.core.spi.JobFunction;
import net.schedra.core.spi.JobLauncher;
import net.schedra.core.spi.Returner;
import net.schedra.core.spi.ReturnerRegistry;
import net.schedra.core.spi.StatePersistence;
import net.schedra.core.store.JobStateStore;
import net.schedra.core.store.RunPermit;
import net.schedra.core.trigger.TriggerEvaluators;
import net.schedra.core.trigger.WindowGate;
import net.schedra.core.validation.JobSpecValidator;
import net.schedra.core.validation.JobSpecValidator.Validation;
import net.schedra.core.validation.RawValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * 틱 구동 스케줄러. {@link #eval(Instant)} 한 번이 모든 잡을 이름순으로 평가하고
 * 발화할 잡을 런처로 넘긴다. 잡 하나의 오류는 그 잡의 상태에만 기록된다.
 */
public class Scheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    /** 바뀌면 예약 상태를 처음부터 다시 계산해야 하는 키 */
    private static final List<String> TIMING_KEYS = List.of(
            "seconds", "minutes", "hours", "days", "cron", "when", "whens", "once", "once_fmt", "splay");

    private final SchedulerConfig config;
    private final JobStateStore store;
    private final JobSpecValidator validator;
    private final FunctionRegistry functions;
    private final ReturnerRegistry returners;
    private final JobLauncher launcher;
    private final StatePersistence persistence;
    private final Clock clock;
    private final Random random;

    private final TriggerEvaluators triggers;
    private final WindowGate gate;
    private final JidGenerator jids;

    /** 잡별 마지막으로 로그에 남긴 오류 (같은 오류를 틱마다 찍지 않기 위해) */
    private final Map<String, String> loggedErrors = new HashMap<>();
    private Map<String, PersistedJobState> lastPersisted;
    private boolean persistenceDegraded;

    public Scheduler(SchedulerConfig config,
                     JobStateStore store,
                     JobSpecValidator validator,
                     FunctionRegistry functions,
                     ReturnerRegistry returners,
                     JobLauncher launcher,
                     StatePersistence persistence,
                     CronCalculator cron,
                     Clock clock,
                     Random random) {
        this.config = Objects.requireNonNull(config);
        this.store = Objects.requireNonNull(store);
        this.validator = Objects.requireNonNull(validator);
        this.functions = Objects.requireNonNull(functions);
        this.returners = Objects.requireNonNull(returners);
        this.launcher = Objects.requireNonNull(launcher);
        this.persistence = Objects.requireNonNull(persistence);
        this.clock = Objects.requireNonNull(clock);
        this.random = Objects.requireNonNull(random);
        this.triggers = new TriggerEvaluators(cron, config.zone(), config.loopInterval(), config.onceMissedPolicy());
        this.gate = new WindowGate(config.loopInterval());
        this.jids = new JidGenerator(clock);
    }

    public SchedulerConfig config() { return config; }

    // ---------------------------------------------------------------- 설정

    /**
     * 잡 매핑 전체를 교체한다. 없어진 잡의 상태는 지우고, 트리거 설정이 바뀐 잡은 예약을 다시 계산한다.
     * 최상위의 enabled / skip_function / skip_during_range 는 잡이 아니라 스케줄 설정이다.
     */
    public synchronized void load(Map<String, ?> mapping) {
        Map<String, Object> m = new LinkedHashMap<>();
        if (mapping != null) mapping.forEach(m::put);
        if (m.size() == 1 && m.get("schedule") instanceof Map<?, ?> inner) {
            m.clear();
            inner.forEach((k, v) -> m.put(String.valueOf(k), v));
        }

        config.setEnabled(RawValues.asBool(m.remove(SchedulerConfig.KEY_ENABLED), true));
        Object skipFn = m.remove(SchedulerConfig.KEY_SKIP_FUNCTION);
        config.setSkipFunction(skipFn == null ? null : skipFn.toString());
        config.setSkipDuringRange(RawCopies.deepCopy(m.remove(SchedulerConfig.KEY_SKIP_DURING_RANGE)));

        for (String name : config.jobNames()) {
            if (!m.containsKey(name)) removeJob(name);
        }
        // 복원되었지만 설정에 없는 잡
        for (String name : store.names()) {
            if (!m.containsKey(name)) store.remove(name);
        }
        m.forEach(this::upsertJob);
        log.info("Loaded schedule with {} job(s): {}", m.size(), m.keySet());
    }

    /** @return 새로 추가되었으면 true */
    public synchronized boolean upsertJob(String name, Object raw) {
        Object copy = RawCopies.deepCopy(raw);
        Object old = config.job(name);
        config.putJob(name, copy);
        if (old == null) {
            store.getOrCreate(name);
            return true;
        }
        if (timingChanged(old, copy)) {
            store.update(name, JobState::resetSchedule);
            log.debug("Timing of job {} changed, schedule recalculated", name);
        }
        return false;
    }

    public synchronized boolean removeJob(String name) {
        Object removed = config.removeJob(name);
        store.remove(name);
        loggedErrors.remove(name);
        return removed != null;
    }

    /** 잡 설정의 enabled 값을 바꾼다. 없는 잡이면 false */
    @SuppressWarnings("unchecked")
    public synchronized boolean setEnabled(String name, boolean enabled) {
        if (!(config.job(name) instanceof Map<?, ?> raw)) return false;
        ((Map<String, Object>) raw).put("enabled", enabled);
        return true;
    }

    /** 모든 잡 결과를 받는 스케줄 단위 returner */
    public synchronized void setScheduleReturners(List<String> names) {
        config.setScheduleReturners(names);
    }

    public synchronized boolean scheduleEnabled() {
        return config.enabled();
    }

    public synchronized List<String> jobNames() {
        return config.jobNames();
    }

    public synchronized void setScheduleEnabled(boolean enabled) {
        config.setEnabled(enabled);
        log.info("Schedule {}", enabled ? "enabled" : "disabled");
    }

    /** 원본 잡 값의 사본 */
    public synchronized Optional<Object> rawJob(String name) {
        return Optional.ofNullable(RawCopies.deepCopy(config.job(name)));
    }

    /** 저장 가능한 전체 스케줄 사본 */
    public synchronized Map<String, Object> schedule() {
        return config.toMapping();
    }

    /** 모든 잡과 상태를 비운다. */
    public synchronized void reset() {
        config.clearJobs();
        store.clear();
        loggedErrors.clear();
    }

    // ---------------------------------------------------------------- 조회

    public Optional<JobStatus> jobStatus(String name) {
        return store.status(name);
    }

    public Optional<Instant> nextFireTime(String name) {
        return store.get(name).map(JobState::nextFireTime);
    }

    // ---------------------------------------------------------------- 영속

    /** 시작 시 한 번. 실패하면 기동을 중단한다. */
    public synchronized void restoreState() {
        Map<String, PersistedJobState> persisted;
        try {
            persisted = persistence.load();
        } catch (Exception e) {
            throw new SchedulerException("Failed to restore job state", e);
        }
        store.restore(persisted);
        lastPersisted = store.export();
        log.info("Restored state of {} job(s)", persisted.size());
    }

    /** @return 저장에 성공했으면 true. 실패하면 메모리 상태로 계속 동작한다. */
    public synchronized boolean persistState() {
        Map<String, PersistedJobState> snapshot = store.export();
        try {
            persistence.save(snapshot);
        } catch (Exception e) {
            if (!persistenceDegraded) {
                log.error("Failed to persist job state, continuing in memory only", e);
            } else {
                log.debug("Job state still not persisted: {}", e.toString());
            }
            persistenceDegraded = true;
            return false;
        }
        if (persistenceDegraded) log.info("Job state persisted again");
        persistenceDegraded = false;
        lastPersisted = snapshot;
        return true;
    }

    // ---------------------------------------------------------------- 틱

    public synchronized void eval(Instant now) {
        if (!config.enabled()) {
            log.trace("Schedule disabled, skipping tick {}", now);
            return;
        }
        for (String name : config.jobNames()) {
            try {
                evalJob(name, now);
            } catch (RuntimeException e) {
                String msg = "Unhandled error evaluating job " + name + ": " + e;
                store.update(name, s -> s.recordError(ErrorSource.CONFIGURATION, msg));
                log.error(msg, e);
            }
        }
        if (!store.export().equals(lastPersisted)) persistState();
    }

    private void evalJob(String name, Instant now) {
        // 1) 검증
        Validation v = validator.validate(name, config.job(name), config, now);
        if (!v.ok()) {
            recordJobError(name, v.source(), v.error());
            return;
        }
        JobSpec spec = v.spec();
        clearJobErrors(name);
        if (!spec.enabled()) return;

        // 2) 활성 기간
        if (spec.until() != null && !now.isBefore(spec.until())) {
            log.trace("Until time passed for job {}", name);
            return;
        }
        if (spec.after() != null && !now.isAfter(spec.after())) {
            log.trace("After time not reached for job {}", name);
            return;
        }

        JobState state = store.getOrCreate(name);

        // 3) 대기 중인 splay
        if (state.splayDeadline() != null) {
            if (now.isBefore(state.splayDeadline())) return;
            gateAndDispatch(name, spec, now, state.splaySlot(), state.nextFireTime(), state.splayRetryWhenGated(), false);
            return;
        }

        // 4) 주 트리거
        FireDecision d = triggers.evaluate(spec, state, now);
        if (d.kind() == FireDecision.Kind.ERROR) {
            recordJobError(name, ErrorSource.CONFIGURATION, d.message());
            return;
        }

        // 5) run_on_start 는 게이트를 무시한다
        if (spec.runOnStart() && !state.primed()) {
            dispatch(name, spec, spec.function(), now, d.fires() ? d.slot() : null, d.nextFireTime());
            return;
        }

        // 6) run_explicit
        Instant explicit = null;
        if (!d.fires()) {
            explicit = gate.dueExplicit(spec, now);
            if (explicit != null && state.lastFireTime() != null && !state.lastFireTime().isBefore(explicit)) {
                explicit = null;
            }
        }
        if (!d.fires() && explicit == null) {
            store.update(name, s -> {
                if (d.slot() != null) consume(spec, s, d.slot(), d.nextFireTime());
                else s.setNextFireTime(d.nextFireTime());
                s.setPrimed(true);
            });
            return;
        }

        if (explicit != null) {
            // 명시 실행은 트리거 슬롯을 소비하지 않는다(lastFireTime 으로 중복을 막는다)
            gateAndDispatch(name, spec, now, null, d.nextFireTime(), false, true);
            return;
        }

        // 7) splay
        Splay splay = spec.splay();
        if (splay != null) {
            int delay = splay.pick(random);
            if (delay > 0) {
                Instant deadline = now.plusSeconds(delay);
                store.update(name, s -> {
                    s.startSplay(d.slot(), deadline, d.retryWhenGated());
                    s.setNextFireTime(d.nextFireTime());
                    s.setPrimed(true);
                });
                log.debug("Job {} splayed by {} seconds until {}", name, delay, deadline);
                return;
            }
        }
        gateAndDispatch(name, spec, now, d.slot(), d.nextFireTime(), d.retryWhenGated(), false);
    }

    /** 8) 게이트 → 9) 발화 */
    private void gateAndDispatch(String name, JobSpec spec, Instant now, Instant slot, Instant next,
                                 boolean retryWhenGated, boolean explicit) {
        WindowGate.Verdict verdict = gate.check(spec, now);
        if (verdict == WindowGate.Verdict.RUN) {
            dispatch(name, spec, spec.function(), now, slot, next);
            return;
        }
        String skipFunction = config.skipFunction();
        if (skipFunction != null) {
            log.debug("Job {} blocked ({}), running skip function {}", name, verdict, skipFunction);
            dispatch(name, spec, skipFunction, now, slot, next);
            return;
        }
        log.debug("Job {} blocked ({}) at {}", name, verdict, now);
        if (retryWhenGated && !explicit && verdict != WindowGate.Verdict.SKIP_EXPLICIT) {
            // 슬롯을 유지한다: 게이트가 열리는 첫 틱에 발화
            store.update(name, s -> {
                if (slot != null) s.setNextFireTime(slot);
                s.clearSplay();
                s.setPrimed(true);
            });
            return;
        }
        store.update(name, s -> {
            consume(spec, s, slot, next);
            s.setPrimed(true);
        });
    }

    /** @return 런처로 넘겼으면 true */
    private boolean dispatch(String name, JobSpec spec, String function, Instant now, Instant slot, Instant next) {
        // 동시 실행 제한
        Optional<RunPermit> acquired = spec.jidInclude()
                ? store.tryAcquire(name, spec.maxRunning())
                : Optional.of(store.acquireUnbounded(name));
        if (acquired.isEmpty()) {
            log.debug("Job {} already running maxrunning={} times, skipping slot {}", name, spec.maxRunning(), slot);
            store.update(name, s -> {
                consume(spec, s, slot, next);
                s.setPrimed(true);
            });
            return false;
        }
        RunPermit permit = acquired.get();

        JobFunction fn;
        try {
            fn = functions.resolve(function);
        } catch (FunctionNotFoundException e) {
            permit.close();
            recordJobError(name, ErrorSource.RESOLUTION, "Invalid function: " + function + " in scheduled job " + name + ".");
            return false;
        }

        store.update(name, s -> {
            s.markFired(now, slot, next);
            if (slot != null && spec.directive() instanceof TimingDirective.Once) s.setOnceTarget(slot);
            s.setPrimed(true);
        });

        long missedBy = slot == null ? 0 : Duration.between(slot, now).getSeconds();
        if (missedBy > 0) {
            log.info("Running scheduled job: {} (runtime missed by {} seconds)", name, missedBy);
        } else {
            log.info("Running scheduled job: {}", name);
        }

        String jid = jids.next();
        try {
            launcher.launch(name, () -> execute(permit, jid, name, spec, function, fn));
            return true;
        } catch (RuntimeException e) {
            permit.close();
            String msg = "Failed to launch job " + name + ": " + e.getMessage();
            store.update(name, s -> s.recordError(ErrorSource.EXECUTION, msg));
            log.error(msg, e);
            return false;
        }
    }

    /** 런처 스레드에서 실행된다. permit 은 모든 경로에서 반납된다. */
    private void execute(RunPermit permit, String jid, String name, JobSpec spec, String function, JobFunction fn) {
        try (permit) {
            Instant started = clock.now();
            JobResult result;
            try {
                Object ret = fn.invoke(spec.args(), spec.kwargs());
                result = new JobResult(jid, spec.name(), function, spec.args(), spec.kwargs(), ret, true,
                        JobResult.RETCODE_OK, started, clock.now(), null,
                        spec.returnConfig(), spec.returnKwargs(), spec.metadata());
                store.updateIfPresent(name, s -> s.clearError(ErrorSource.EXECUTION));
            } catch (Exception e) {
                log.error("Unhandled exception running {}", function, e);
                String msg = "Unhandled exception running " + function + ": " + e;
                result = new JobResult(jid, spec.name(), function, spec.args(), spec.kwargs(), null, false,
                        JobResult.RETCODE_UNHANDLED, started, clock.now(), msg,
                        spec.returnConfig(), spec.returnKwargs(), spec.metadata());
                store.updateIfPresent(name, s -> s.recordError(ErrorSource.EXECUTION, msg));
            }
            report(name, spec, result);
        }
    }

    private void report(String name, JobSpec spec, JobResult result) {
        Set<String> targets = new LinkedHashSet<>(spec.returners());
        targets.addAll(config.scheduleReturners());
        for (String target : targets) {
            Optional<Returner> returner = returners.find(target);
            if (returner.isEmpty()) {
                log.warn("Job {} using invalid returner: {}. Ignoring.", name, target);
                continue;
            }
            try {
                returner.get().report(name, result);
            } catch (Exception e) {
                log.warn("Returner {} failed for job {} (jid {})", target, name, result.jid(), e);
            }
        }
    }

    // ---------------------------------------------------------------- 수동 실행

    /**
     * 예약과 무관하게 지금 한 번 실행한다. 다음 예약 시각은 바꾸지 않는다.
     *
     * @param force 비활성 잡도 실행
     * @return 런처로 넘겼으면 true, maxrunning 에 걸렸으면 false
     * @throws IllegalArgumentException 없는 잡
     * @throws IllegalStateException    설정 오류이거나 비활성 잡
     */
    public synchronized boolean runNow(String name, boolean force) {
        if (!config.hasJob(name)) throw new IllegalArgumentException("Job " + name + " does not exist.");
        Instant now = clock.now();
        Object raw = config.job(name);
        if (force && raw instanceof Map<?, ?> m) {
            Map<String, Object> enabled = new LinkedHashMap<>();
            m.forEach((k, val) -> enabled.put(String.valueOf(k), val));
            enabled.put("enabled", true);
            raw = enabled;
        }
        Validation v = validator.validate(name, raw, config, now);
        if (!v.ok()) throw new IllegalStateException(v.error());
        if (!v.spec().enabled()) throw new IllegalStateException("Job " + name + " is disabled.");

        JobSpec spec = v.spec();
        Instant next = store.getOrCreate(name).nextFireTime();
        log.info("Running Job: {}", name);
        return dispatch(name, spec, spec.function(), now, null, next);
    }

    // ---------------------------------------------------------------- 내부

    private void consume(JobSpec spec, JobState s, Instant slot, Instant next) {
        s.consume(slot, next);
        if (slot != null && spec.directive() instanceof TimingDirective.Once) s.setOnceTarget(slot);
    }

    private void recordJobError(String name, ErrorSource source, String message) {
        store.update(name, s -> s.recordError(source, message));
        if (!message.equals(loggedErrors.put(name, message))) log.error(message);
    }

    private void clearJobErrors(String name) {
        store.update(name, s -> {
            s.clearError(ErrorSource.CONFIGURATION);
            s.clearError(ErrorSource.RESOLUTION);
        });
        loggedErrors.remove(name);
    }

    private static boolean timingChanged(Object old, Object raw) {
        if (!(old instanceof Map<?, ?> o) || !(raw instanceof Map<?, ?> n)) return !Objects.equals(old, raw);
        for (String key : TIMING_KEYS) {
            if (!Objects.equals(o.get(key), n.get(key))) return true;
        }
        return false;
    }

    @Override
    public void close() {
        launcher.close();
    }
}

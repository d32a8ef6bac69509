package net.schedra.core.service;

import net.schedra.core.model.OnceMissedPolicy;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 스케줄러 인스턴스 하나의 설정. 변경은 {@link Scheduler} 의 동기화된 메서드를 통해서만 일어난다.
 * 잡 매핑은 이름순으로 유지된다(평가 순서).
 */
public final class SchedulerConfig {
    /** 스케줄 매핑에서 잡이 아닌 최상위 키 */
    public static final String KEY_ENABLED = "enabled";
    public static final String KEY_SKIP_FUNCTION = "skip_function";
    public static final String KEY_SKIP_DURING_RANGE = "skip_during_range";

    private final ZoneId zone;
    private final Duration loopInterval;
    private final OnceMissedPolicy onceMissedPolicy;

    private boolean enabled = true;
    private String skipFunction;
    private Object skipDuringRange;
    private volatile List<String> scheduleReturners = List.of();
    private final TreeMap<String, Object> jobs = new TreeMap<>();

    public SchedulerConfig(ZoneId zone, Duration loopInterval, OnceMissedPolicy onceMissedPolicy) {
        this.zone = Objects.requireNonNull(zone, "zone");
        this.loopInterval = Objects.requireNonNull(loopInterval, "loopInterval");
        if (loopInterval.isZero() || loopInterval.isNegative()) {
            throw new IllegalArgumentException("loopInterval must be positive: " + loopInterval);
        }
        this.onceMissedPolicy = onceMissedPolicy == null ? OnceMissedPolicy.SKIP : onceMissedPolicy;
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(ZoneId.systemDefault(), Duration.ofSeconds(1), OnceMissedPolicy.SKIP);
    }

    public ZoneId zone() { return zone; }
    public Duration loopInterval() { return loopInterval; }
    public OnceMissedPolicy onceMissedPolicy() { return onceMissedPolicy; }

    public boolean enabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String skipFunction() { return skipFunction; }
    public void setSkipFunction(String skipFunction) { this.skipFunction = skipFunction; }

    /** 원본 형태 그대로(검증은 잡마다) */
    public Object skipDuringRange() { return skipDuringRange; }
    public void setSkipDuringRange(Object skipDuringRange) { this.skipDuringRange = skipDuringRange; }

    public List<String> scheduleReturners() { return scheduleReturners; }
    public void setScheduleReturners(List<String> returners) {
        this.scheduleReturners = returners == null ? List.of() : List.copyOf(returners);
    }

    /** 원본 잡 값. 매핑이 아닐 수도 있다(검증 오류로 보고됨). */
    public Object job(String name) { return jobs.get(name); }
    public boolean hasJob(String name) { return jobs.containsKey(name); }
    public void putJob(String name, Object raw) { jobs.put(name, raw); }
    public Object removeJob(String name) { return jobs.remove(name); }
    public List<String> jobNames() { return new ArrayList<>(jobs.keySet()); }
    public void clearJobs() { jobs.clear(); }

    /** 저장/목록용 사본. 숨은 최상위 키도 함께 담는다. */
    public Map<String, Object> toMapping() {
        Map<String, Object> m = new LinkedHashMap<>();
        jobs.forEach((k, v) -> m.put(k, RawCopies.deepCopy(v)));
        if (!enabled) m.put(KEY_ENABLED, false);
        if (skipFunction != null) m.put(KEY_SKIP_FUNCTION, skipFunction);
        if (skipDuringRange != null) m.put(KEY_SKIP_DURING_RANGE, skipDuringRange);
        return m;
    }
}

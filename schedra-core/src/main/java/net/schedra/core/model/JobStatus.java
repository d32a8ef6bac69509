package net.schedra.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** job_status 조회용 읽기 전용 스냅샷 */
public record JobStatus(
        String name,
        Instant nextFireTime,
        Instant lastFireTime,
        long runCount,
        int runningCount,
        String error,
        JobState.ErrorSource errorSource
) {
    public static JobStatus of(String name, JobState s) {
        return new JobStatus(name, s.nextFireTime(), s.lastFireTime(), s.runCount(),
                s.runningCount(), s.lastError(), s.errorSource());
    }

    public boolean hasError() { return error != null; }

    /** 진단 도구가 읽는 키 형태 ({@code _error} 등). 값이 없는 키는 빠진다. */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", name);
        if (nextFireTime != null) m.put("_next_fire_time", nextFireTime);
        if (lastFireTime != null) m.put("_last_run", lastFireTime);
        m.put("_run_count", runCount);
        m.put("_running", runningCount);
        if (error != null) m.put("_error", error);
        return m;
    }
}

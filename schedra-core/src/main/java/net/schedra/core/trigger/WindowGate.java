package net.schedra.core.trigger;

import net.schedra.core.model.JobSpec;
import net.schedra.core.model.TimeWindow;

import java.time.Duration;
import java.time.Instant;

/**
 * 주 트리거가 발화를 결정한 뒤 적용되는 게이트:
 * range(안쪽만, invert 면 바깥만), skip_during_range, skip_explicit.
 */
public final class WindowGate {

    public enum Verdict { RUN, OUTSIDE_RANGE, IN_SKIP_RANGE, SKIP_EXPLICIT }

    private final Duration loopInterval;

    public WindowGate(Duration loopInterval) {
        this.loopInterval = loopInterval;
    }

    public Verdict check(JobSpec spec, Instant now) {
        TimeWindow range = spec.range();
        if (range != null && range.contains(now) == range.invert()) return Verdict.OUTSIDE_RANGE;

        TimeWindow skip = spec.skipDuringRange();
        if (skip != null && skip.contains(now)) return Verdict.IN_SKIP_RANGE;

        for (Instant s : spec.skipExplicit()) {
            if (!now.isBefore(s) && now.isBefore(s.plus(loopInterval))) return Verdict.SKIP_EXPLICIT;
        }
        return Verdict.RUN;
    }

    /** run_explicit 중 now 가 [t, t + loopInterval) 안에 드는 시각 */
    public Instant dueExplicit(JobSpec spec, Instant now) {
        for (Instant t : spec.runExplicit()) {
            if (!now.isBefore(t) && now.isBefore(t.plus(loopInterval))) return t;
        }
        return null;
    }
}

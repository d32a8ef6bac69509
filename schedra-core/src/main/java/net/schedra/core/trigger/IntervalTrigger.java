package net.schedra.core.trigger;

import net.schedra.core.model.FireDecision;
import net.schedra.core.model.JobSpec;
import net.schedra.core.model.JobState;
import net.schedra.core.model.TimingDirective;

import java.time.Duration;
import java.time.Instant;

/**
 * 첫 평가는 발화 없이 next = now + interval 로 준비만 한다.
 * 게이트에 막힌 슬롯은 유지되어 게이트가 열리면 발화한다.
 */
public final class IntervalTrigger implements TriggerEvaluator {

    @Override
    public FireDecision evaluate(JobSpec spec, JobState state, Instant now) {
        Duration every = ((TimingDirective.Interval) spec.directive()).every();
        Instant next = state.nextFireTime();
        if (next == null) return FireDecision.waiting(now.plus(every));
        if (now.isBefore(next)) return FireDecision.waiting(next);
        return FireDecision.fire(next, now.plus(every)).retryingWhenGated();
    }
}

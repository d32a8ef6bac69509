package net.schedra.core.trigger;

import net.schedra.core.model.FireDecision;
import net.schedra.core.model.JobSpec;
import net.schedra.core.model.JobState;
import net.schedra.core.model.TimingDirective;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 각 시각은 한 번만 발화한다. lastSlot 이전(포함) 시각은 이미 소비된 것으로 본다.
 * 루프 간격보다 오래 지난 미발화 시각은 건너뛴다.
 */
public final class WhenTrigger implements TriggerEvaluator {
    private final Duration loopInterval;

    public WhenTrigger(Duration loopInterval) {
        this.loopInterval = loopInterval;
    }

    @Override
    public FireDecision evaluate(JobSpec spec, JobState state, Instant now) {
        List<Instant> times = ((TimingDirective.When) spec.directive()).times();
        Instant consumed = state.lastSlot();
        Instant graceStart = now.minus(loopInterval);
        Instant lastMissed = null;

        for (int i = 0; i < times.size(); i++) {
            Instant t = times.get(i);
            if (consumed != null && !t.isAfter(consumed)) continue;
            if (t.isBefore(graceStart)) {
                lastMissed = t;
                continue;
            }
            if (t.isAfter(now)) {
                return lastMissed == null ? FireDecision.waiting(t) : FireDecision.missed(lastMissed, t);
            }
            Instant following = i + 1 < times.size() ? times.get(i + 1) : null;
            return FireDecision.fire(t, following);
        }
        // 모두 소비됨
        return lastMissed == null ? FireDecision.waiting(null) : FireDecision.missed(lastMissed, null);
    }
}

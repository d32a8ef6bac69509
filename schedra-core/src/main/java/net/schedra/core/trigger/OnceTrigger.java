package net.schedra.core.trigger;

import net.schedra.core.model.FireDecision;
import net.schedra.core.model.JobSpec;
import net.schedra.core.model.JobState;
import net.schedra.core.model.TimingDirective;
import net.schedra.core.model.OnceMissedPolicy;

import java.time.Duration;
import java.time.Instant;

/**
 * at <= now <= at + loopInterval 에서 한 번 발화한다.
 * 처리된 시각은 onceTarget 으로 영속되어 재시작 후에도 다시 발화하지 않는다.
 */
public final class OnceTrigger implements TriggerEvaluator {
    private final Duration loopInterval;
    private final OnceMissedPolicy missedPolicy;

    public OnceTrigger(Duration loopInterval, OnceMissedPolicy missedPolicy) {
        this.loopInterval = loopInterval;
        this.missedPolicy = missedPolicy;
    }

    @Override
    public FireDecision evaluate(JobSpec spec, JobState state, Instant now) {
        Instant at = ((TimingDirective.Once) spec.directive()).at();
        if (at.equals(state.onceTarget())) return FireDecision.waiting(null);
        if (now.isBefore(at)) return FireDecision.waiting(at);
        if (!now.isAfter(at.plus(loopInterval)) || missedPolicy == OnceMissedPolicy.RUN_LATE) {
            return FireDecision.fire(at, null);
        }
        return FireDecision.missed(at, null);
    }
}

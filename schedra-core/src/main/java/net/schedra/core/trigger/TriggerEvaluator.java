package net.schedra.core.trigger;

import net.schedra.core.model.FireDecision;
import net.schedra.core.model.JobSpec;
import net.schedra.core.model.JobState;

import java.time.Instant;

/**
 * 주 트리거 하나에 대한 순수 평가. {@code state} 는 스냅샷이며 변경하지 않는다.
 */
public interface TriggerEvaluator {
    FireDecision evaluate(JobSpec spec, JobState state, Instant now);
}

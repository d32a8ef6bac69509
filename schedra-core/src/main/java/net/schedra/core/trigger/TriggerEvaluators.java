package net.schedra.core.trigger;

import net.schedra.core.model.FireDecision;
import net.schedra.core.model.JobSpec;
import net.schedra.core.model.JobState;
import net.schedra.core.model.OnceMissedPolicy;
import net.schedra.core.model.TimingDirective;
import net.schedra.core.spi.CronCalculator;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/** 잡의 주 트리거 종류에 맞는 평가기로 위임한다. */
public final class TriggerEvaluators implements TriggerEvaluator {
    private final IntervalTrigger interval = new IntervalTrigger();
    private final CronTrigger cron;
    private final WhenTrigger when;
    private final OnceTrigger once;

    public TriggerEvaluators(CronCalculator cronCalculator, ZoneId zone, Duration loopInterval, OnceMissedPolicy missedPolicy) {
        this.cron = new CronTrigger(cronCalculator, zone);
        this.when = new WhenTrigger(loopInterval);
        this.once = new OnceTrigger(loopInterval, missedPolicy);
    }

    @Override
    public FireDecision evaluate(JobSpec spec, JobState state, Instant now) {
        TimingDirective d = spec.directive();
        if (d == null) return FireDecision.waiting(null);
        if (d instanceof TimingDirective.Interval) return interval.evaluate(spec, state, now);
        if (d instanceof TimingDirective.Cron) return cron.evaluate(spec, state, now);
        if (d instanceof TimingDirective.When) return when.evaluate(spec, state, now);
        if (d instanceof TimingDirective.Once) return once.evaluate(spec, state, now);
        throw new IllegalStateException("unknown directive: " + d.key());
    }
}

package net.schedra.core.trigger;

import net.schedra.core.model.FireDecision;
import net.schedra.core.model.JobSpec;
import net.schedra.core.model.JobState;
import net.schedra.core.model.TimingDirective;
import net.schedra.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;

public final class CronTrigger implements TriggerEvaluator {
    private final CronCalculator cron;
    private final ZoneId zone;

    public CronTrigger(CronCalculator cron, ZoneId zone) {
        this.cron = cron;
        this.zone = zone;
    }

    @Override
    public FireDecision evaluate(JobSpec spec, JobState state, Instant now) {
        String expr = ((TimingDirective.Cron) spec.directive()).expression();
        try {
            Instant next = state.nextFireTime();
            if (next == null) {
                Instant from = state.lastFireTime() != null ? state.lastFireTime() : now;
                next = cron.next(from, expr, zone);
            }
            if (now.isBefore(next)) return FireDecision.waiting(next);
            // 놓친 슬롯이 여럿이어도 한 번만 발화하고 now 이후로 건너뛴다
            return FireDecision.fire(next, cron.next(now, expr, zone));
        } catch (RuntimeException e) {
            return FireDecision.error("Invalid cron string. Ignoring job " + spec.name() + ".");
        }
    }
}

package net.schedra.core.trigger;

import net.schedra.core.model.FireDecision;
import net.schedra.core.model.JobSpec;
import net.schedra.core.model.JobState;
import net.schedra.core.model.OnceMissedPolicy;
import net.schedra.core.model.TimingDirective;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static net.schedra.core.trigger.Specs.at;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OnceTriggerTest {

    final JobSpec spec = Specs.of(new TimingDirective.Once(at("15:00"), "%Y-%m-%dT%H:%M:%S"));

    @Test
    void waits_until_target() {
        FireDecision d = new OnceTrigger(Duration.ofSeconds(60), OnceMissedPolicy.SKIP)
                .evaluate(spec, new JobState(), at("14:59"));

        assertFalse(d.fires());
        assertEquals(at("15:00"), d.nextFireTime());
    }

    @Test
    void fires_within_loop_interval_then_never_again() {
        OnceTrigger trigger = new OnceTrigger(Duration.ofSeconds(60), OnceMissedPolicy.SKIP);

        FireDecision d = trigger.evaluate(spec, new JobState(), at("15:01"));
        assertTrue(d.fires());
        assertNull(d.nextFireTime());

        JobState done = new JobState();
        done.setOnceTarget(at("15:00"));
        assertFalse(trigger.evaluate(spec, done, at("15:01")).fires());
    }

    @Test
    void missed_target_depends_on_policy() {
        FireDecision skipped = new OnceTrigger(Duration.ofSeconds(60), OnceMissedPolicy.SKIP)
                .evaluate(spec, new JobState(), at("16:00"));
        FireDecision late = new OnceTrigger(Duration.ofSeconds(60), OnceMissedPolicy.RUN_LATE)
                .evaluate(spec, new JobState(), at("16:00"));

        assertFalse(skipped.fires());
        assertEquals(at("15:00"), skipped.slot());
        assertTrue(late.fires());
    }
}

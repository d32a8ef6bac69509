package net.schedra.core.trigger;

import net.schedra.core.model.FireDecision;
import net.schedra.core.model.JobSpec;
import net.schedra.core.model.JobState;
import net.schedra.core.model.TimingDirective;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static net.schedra.core.trigger.Specs.at;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntervalTriggerTest {

    final IntervalTrigger trigger = new IntervalTrigger();
    final JobSpec spec = Specs.of(new TimingDirective.Interval(Duration.ofMinutes(5)));

    @Test
    void first_evaluation_primes_without_firing() {
        FireDecision d = trigger.evaluate(spec, new JobState(), at("15:00"));

        assertFalse(d.fires());
        assertEquals(at("15:05"), d.nextFireTime());
    }

    @Test
    void fires_when_due_and_reschedules_from_now() {
        JobState state = new JobState();
        state.setNextFireTime(at("15:05"));

        assertFalse(trigger.evaluate(spec, state, at("15:04")).fires());

        FireDecision d = trigger.evaluate(spec, state, at("15:07"));
        assertTrue(d.fires());
        assertTrue(d.retryWhenGated());
        assertEquals(at("15:05"), d.slot());
        assertEquals(at("15:12"), d.nextFireTime());
    }
}

package net.schedra.core.trigger;

import net.schedra.core.model.TimeWindow;
import net.schedra.core.model.TimingDirective;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static net.schedra.core.trigger.Specs.at;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class WindowGateTest {

    final WindowGate gate = new WindowGate(Duration.ofSeconds(60));
    final TimingDirective every = new TimingDirective.Interval(Duration.ofMinutes(1));

    @Test
    void range_admits_only_inside_unless_inverted() {
        TimeWindow window = new TimeWindow(at("14:00"), at("16:00"), false);
        TimeWindow inverted = new TimeWindow(at("14:00"), at("16:00"), true);

        assertEquals(WindowGate.Verdict.RUN, gate.check(Specs.gated(every, window, null, List.of(), List.of()), at("15:00")));
        assertEquals(WindowGate.Verdict.RUN, gate.check(Specs.gated(every, window, null, List.of(), List.of()), at("16:00")));
        assertEquals(WindowGate.Verdict.OUTSIDE_RANGE, gate.check(Specs.gated(every, window, null, List.of(), List.of()), at("17:00")));
        assertEquals(WindowGate.Verdict.OUTSIDE_RANGE, gate.check(Specs.gated(every, inverted, null, List.of(), List.of()), at("15:00")));
        assertEquals(WindowGate.Verdict.RUN, gate.check(Specs.gated(every, inverted, null, List.of(), List.of()), at("17:00")));
    }

    @Test
    void skip_range_and_explicit_skip() {
        TimeWindow skip = new TimeWindow(at("14:00"), at("16:00"), false);

        assertEquals(WindowGate.Verdict.IN_SKIP_RANGE, gate.check(Specs.gated(every, null, skip, List.of(), List.of()), at("15:00")));
        assertEquals(WindowGate.Verdict.SKIP_EXPLICIT,
                gate.check(Specs.gated(every, null, null, List.of(), List.of(at("15:00"))), at("15:00").plusSeconds(30)));
        assertEquals(WindowGate.Verdict.RUN,
                gate.check(Specs.gated(every, null, null, List.of(), List.of(at("15:00"))), at("15:01")));
    }

    @Test
    void explicit_run_is_due_for_one_loop_interval() {
        var spec = Specs.gated(every, null, null, List.of(at("15:00")), List.of());

        assertNull(gate.dueExplicit(spec, at("14:59")));
        assertEquals(at("15:00"), gate.dueExplicit(spec, at("15:00").plusSeconds(59)));
        assertNull(gate.dueExplicit(spec, at("15:01")));
    }
}

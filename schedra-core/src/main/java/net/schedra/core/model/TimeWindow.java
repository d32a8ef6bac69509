package net.schedra.core.model;

import java.time.Instant;

/** range / skip_during_range 구간. end 는 start 보다 뒤여야 한다. */
public record TimeWindow(Instant start, Instant end, boolean invert) {
    public TimeWindow {
        if (!end.isAfter(start)) throw new IllegalArgumentException("end must be after start");
    }

    public boolean contains(Instant t) {
        return !t.isBefore(start) && !t.isAfter(end);
    }
}

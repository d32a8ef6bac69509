package net.schedra.core.model;

import java.time.Instant;

/** 재시작 후에도 남겨야 하는 잡 상태 */
public record PersistedJobState(
        Instant nextFireTime,
        Instant lastFireTime,
        long runCount,
        Instant onceTarget,  // 이미 처리된 once 시각
        Instant lastSlot     // 마지막으로 소비된 when 시각
) {
    public PersistedJobState(Instant nextFireTime, Instant lastFireTime, long runCount, Instant onceTarget) {
        this(nextFireTime, lastFireTime, runCount, onceTarget, null);
    }
}

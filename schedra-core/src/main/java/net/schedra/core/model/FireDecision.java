package net.schedra.core.model;

import java.time.Instant;

/**
 * 트리거 평가 결과. 평가기는 상태를 직접 바꾸지 않고 이 값만 돌려주며,
 * 스케줄러가 적용한다.
 *
 * @param slot          FIRE: 이번에 발화하는 슬롯 / WAIT: 발화 없이 소비된(놓친) 슬롯, 없으면 null
 * @param nextFireTime  적용 후의 다음 발화 예정 시각 (없으면 null)
 * @param retryWhenGated 게이트에 막혔을 때 슬롯을 유지해 게이트가 열리면 바로 발화할지 여부
 */
public record FireDecision(Kind kind, Instant slot, Instant nextFireTime, boolean retryWhenGated, String message) {

    public enum Kind { FIRE, WAIT, ERROR }

    public static FireDecision fire(Instant slot, Instant nextFireTime) {
        return new FireDecision(Kind.FIRE, slot, nextFireTime, false, null);
    }

    public static FireDecision waiting(Instant nextFireTime) {
        return new FireDecision(Kind.WAIT, null, nextFireTime, false, null);
    }

    public static FireDecision missed(Instant slot, Instant nextFireTime) {
        return new FireDecision(Kind.WAIT, slot, nextFireTime, false, null);
    }

    public static FireDecision error(String message) {
        return new FireDecision(Kind.ERROR, null, null, false, message);
    }

    public FireDecision retryingWhenGated() {
        return new FireDecision(kind, slot, nextFireTime, true, message);
    }

    public boolean fires() { return kind == Kind.FIRE; }
}

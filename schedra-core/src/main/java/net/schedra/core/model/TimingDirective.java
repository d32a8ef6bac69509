package net.schedra.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 잡의 주 트리거. 검증 단계에서 하나로 확정된다.
 * 여러 개가 함께 있으면 once > cron > when/whens > interval 순으로 하나만 쓴다.
 */
public interface TimingDirective {

    String key();

    record Interval(Duration every) implements TimingDirective {
        @Override public String key() { return "interval"; }
    }

    record Cron(String expression) implements TimingDirective {
        @Override public String key() { return "cron"; }
    }

    /** when/whens 모두 해석된 시각 목록(오름차순)으로 들어온다. */
    record When(List<Instant> times) implements TimingDirective {
        public When {
            times = List.copyOf(times);
        }
        @Override public String key() { return "when"; }
    }

    record Once(Instant at, String format) implements TimingDirective {
        @Override public String key() { return "once"; }
    }
}

package net.schedra.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 검증을 통과한 잡 설정. 틱마다 원본 매핑에서 다시 만들어진다
 * (시각만 있는 값은 평가 시점의 날짜 기준으로 해석되기 때문).
 */
public record JobSpec(
        String name,
        String function,
        List<Object> args,
        Map<String, Object> kwargs,
        TimingDirective directive,      // null 이면 주 트리거 없음
        Splay splay,
        TimeWindow range,
        TimeWindow skipDuringRange,
        Instant until,
        Instant after,
        boolean runOnStart,
        List<Instant> runExplicit,
        List<Instant> skipExplicit,
        int maxRunning,
        boolean jidInclude,
        boolean enabled,
        List<String> returners,
        Object returnConfig,
        Map<String, Object> returnKwargs,
        Map<String, Object> metadata
) {
    public static final int DEFAULT_MAX_RUNNING = 1;

    public static JobSpec disabled(String name) {
        return new JobSpec(name, null, List.of(), Map.of(), null, null, null, null, null, null,
                false, List.of(), List.of(), DEFAULT_MAX_RUNNING, true, false, List.of(), null, Map.of(), null);
    }

}

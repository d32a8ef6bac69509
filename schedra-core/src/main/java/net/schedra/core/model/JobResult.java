package net.schedra.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** 잡 1회 실행 결과 (returner 로 전달) */
public record JobResult(
        String jid,
        String jobName,
        String function,
        List<Object> args,
        Map<String, Object> kwargs,
        Object returnValue,
        boolean success,
        int retcode,
        Instant startedAt,
        Instant finishedAt,
        String error,
        Object returnConfig,
        Map<String, Object> returnKwargs,
        Map<String, Object> metadata
) {
    public static final int RETCODE_OK = 0;
    public static final int RETCODE_UNHANDLED = 254;
}

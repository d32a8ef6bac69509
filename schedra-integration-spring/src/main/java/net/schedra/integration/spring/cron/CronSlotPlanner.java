package net.schedra.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** cron-utils 기반 슬롯 계산기. 5필드 UNIX 문법, 파싱 결과는 LRU 로 캐시한다. */
public final class CronSlotPlanner {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    // 최대 256개
    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(256);

    private CronSlotPlanner() {}

    /**
     * @throws IllegalArgumentException 식이 잘못되었거나 다음 실행 시각이 없을 때
     */
    public static SlotInfo compute(String cronExpr, ZoneId zone, Instant now) {
        Objects.requireNonNull(cronExpr); Objects.requireNonNull(zone); Objects.requireNonNull(now);

        final ExecutionTime et = executionTime(cronExpr);

        ZonedDateTime base = now.atZone(zone);
        ZonedDateTime next = et.nextExecution(base).orElseThrow(
                () -> new IllegalArgumentException("No next execution for [" + cronExpr + "] at " + base));
        ZonedDateTime slotStart = et.lastExecution(next).orElse(null);

        return new SlotInfo(slotStart == null ? null : slotStart.toInstant(), next.toInstant());
    }

    private static ExecutionTime executionTime(String cronExpr) {
        synchronized (CACHE) {
            ExecutionTime cached = CACHE.get(cronExpr);
            if (cached != null) return cached;
        }
        ExecutionTime parsed;
        try {
            parsed = ExecutionTime.forCron(PARSER.parse(cronExpr.trim()));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid cron expression [" + cronExpr + "]: " + e.getMessage(), e);
        }
        synchronized (CACHE) {
            CACHE.put(cronExpr, parsed);
        }
        return parsed;
    }

    /** @param slotStartUtc next 직전 슬롯 (없으면 null) */
    public record SlotInfo(Instant slotStartUtc, Instant nextUtc) { }

    // --- 내부 LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}

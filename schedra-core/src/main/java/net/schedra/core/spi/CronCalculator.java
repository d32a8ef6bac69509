package net.schedra.core.spi;

import java.time.Instant;
import java.time.ZoneId;

/**
 * cron 식 계산 SPI. 구현체는 integration 모듈에서 주입한다.
 * 잘못된 식이면 {@link IllegalArgumentException} 을 던진다.
 */
public interface CronCalculator {
    /** {@code from} 이후(초과)의 첫 실행 시각 */
    Instant next(Instant from, String cronExpr, ZoneId zone);
}

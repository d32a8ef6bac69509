package net.schedra.core.service;

import net.schedra.core.spi.Clock;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** 실행 1회 식별자. UTC 마이크로초 타임스탬프(yyyyMMddHHmmssSSSSSS), 단조 증가. */
public final class JidGenerator {
    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSSSSS").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private long lastMicros;

    public JidGenerator(Clock clock) {
        this.clock = clock;
    }

    public synchronized String next() {
        Instant now = clock.now();
        long micros = Math.multiplyExact(now.getEpochSecond(), 1_000_000L) + now.getNano() / 1_000;
        if (micros <= lastMicros) micros = lastMicros + 1;
        lastMicros = micros;
        return FORMAT.format(Instant.ofEpochSecond(micros / 1_000_000L, (micros % 1_000_000L) * 1_000L));
    }
}

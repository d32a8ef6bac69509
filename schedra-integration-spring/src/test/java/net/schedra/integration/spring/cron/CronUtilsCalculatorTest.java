package net.schedra.integration.spring.cron;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronUtilsCalculatorTest {

    final CronUtilsCalculator cron = new CronUtilsCalculator();
    final ZoneId utc = ZoneId.of("UTC");

    @Test
    void next_is_strictly_after_from() {
        Instant from = Instant.parse("2017-11-29T15:00:00Z");

        assertThat(cron.next(from, "*/5 * * * *", utc)).isEqualTo(Instant.parse("2017-11-29T15:05:00Z"));
        assertThat(cron.next(from, "0 16 * * *", utc)).isEqualTo(Instant.parse("2017-11-29T16:00:00Z"));
    }

    @Test
    void honours_zone() {
        Instant from = Instant.parse("2017-11-29T15:00:00Z");

        // 덴버 09:00 (UTC-7) 이후의 첫 10:00
        assertThat(cron.next(from, "0 10 * * *", ZoneId.of("America/Denver")))
                .isEqualTo(Instant.parse("2017-11-29T17:00:00Z"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0 16 29 13 *", "not a cron", "* * *", "61 * * * *"})
    void rejects_invalid_expressions(String expr) {
        assertThatThrownBy(() -> cron.next(Instant.parse("2017-11-29T15:00:00Z"), expr, utc))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void slot_info_reports_previous_slot() {
        CronSlotPlanner.SlotInfo slot = CronSlotPlanner.compute("0 * * * *", utc, Instant.parse("2017-11-29T15:30:00Z"));

        assertThat(slot.nextUtc()).isEqualTo(Instant.parse("2017-11-29T16:00:00Z"));
        assertThat(slot.slotStartUtc()).isEqualTo(Instant.parse("2017-11-29T15:00:00Z"));
    }
}

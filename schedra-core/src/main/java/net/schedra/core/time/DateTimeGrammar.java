package net.schedra.core.time;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * when / range / skip_during_range / until / after 에 쓰이는 느슨한 날짜-시각 문법.
 *
 * <ul>
 *   <li>ISO: {@code 2017-11-29T15:00:00}, 오프셋 포함 가능</li>
 *   <li>{@code 2017-11-29}, {@code 2017-11-29 15:00[:00]}</li>
 *   <li>{@code 11/29/2017}, {@code 11/29/2017 3:00pm}, {@code 11/29/2017 4pm}</li>
 *   <li>시각만: {@code 3:00pm}, {@code 3 pm}, {@code 15:00} → 기준 시각의 날짜로 해석</li>
 * </ul>
 * am/pm 이 붙은 시는 1~12, 없으면 0~23 만 허용한다.
 */
public final class DateTimeGrammar {
    private static final Pattern ISO_DATE_TIME = Pattern.compile("\\d{4}-\\d{2}-\\d{2}T");
    private static final Pattern ISO_DATE = Pattern.compile("(\\d{4})-(\\d{1,2})-(\\d{1,2})");
    private static final Pattern US_DATE = Pattern.compile("(\\d{1,2})/(\\d{1,2})/(\\d{4})");
    private static final Pattern TIME = Pattern.compile("(\\d{1,2})(?::(\\d{2}))?(?::(\\d{2}))?(am|pm)?");
    private static final Pattern MERIDIEM = Pattern.compile("\\s*([ap])\\.?m\\.?$");

    private final ZoneId zone;

    public DateTimeGrammar(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone);
    }

    public ZoneId zone() { return zone; }

    /**
     * @param reference 날짜가 없는 입력을 해석할 기준 시각
     * @throws DateTimeException 해석할 수 없는 입력
     */
    public Instant parse(String text, Instant reference) {
        if (text == null || text.isBlank()) throw new DateTimeException("empty date string");
        String s = text.trim();

        if (ISO_DATE_TIME.matcher(s).lookingAt()) {
            TemporalAccessor t = DateTimeFormatter.ISO_DATE_TIME.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
            return t instanceof OffsetDateTime odt ? odt.toInstant() : ((LocalDateTime) t).atZone(zone).toInstant();
        }

        s = MERIDIEM.matcher(s.toLowerCase(Locale.ROOT)).replaceFirst("$1m");
        String[] parts = s.split("\\s+");
        if (parts.length > 2) throw new DateTimeException("Unrecognized date string: " + text);

        LocalDate date = null;
        LocalTime time = null;
        if (parts.length == 2) {
            date = date(parts[0], text);
            time = time(parts[1], text);
        } else if (parts[0].indexOf('-') > 0 || parts[0].indexOf('/') > 0) {
            date = date(parts[0], text);
        } else {
            time = time(parts[0], text);
        }
        if (date == null) date = LocalDate.ofInstant(reference, zone);
        if (time == null) time = LocalTime.MIDNIGHT;
        return LocalDateTime.of(date, time).atZone(zone).toInstant();
    }

    private static LocalDate date(String token, String text) {
        Matcher iso = ISO_DATE.matcher(token);
        if (iso.matches()) {
            return LocalDate.of(Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)), Integer.parseInt(iso.group(3)));
        }
        Matcher us = US_DATE.matcher(token);
        if (us.matches()) {
            return LocalDate.of(Integer.parseInt(us.group(3)), Integer.parseInt(us.group(1)), Integer.parseInt(us.group(2)));
        }
        throw new DateTimeException("Unrecognized date: " + text);
    }

    private static LocalTime time(String token, String text) {
        Matcher m = TIME.matcher(token);
        // 숫자만 있는 토큰("15")은 시각으로 보지 않는다
        if (!m.matches() || (m.group(2) == null && m.group(4) == null)) {
            throw new DateTimeException("Unrecognized time: " + text);
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
        int second = m.group(3) == null ? 0 : Integer.parseInt(m.group(3));
        String meridiem = m.group(4);
        if (meridiem != null) {
            if (hour < 1 || hour > 12) throw new DateTimeException("Hour out of range for " + meridiem + ": " + text);
            hour = hour % 12 + ("pm".equals(meridiem) ? 12 : 0);
        }
        return LocalTime.of(hour, minute, second);   // 범위 밖이면 DateTimeException
    }
}

package net.schedra.core.time;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * strftime 형식({@code %Y-%m-%dT%H:%M:%S})을 엄격한 {@link DateTimeFormatter} 로 바꾼다.
 * once / once_fmt 와 관리 명령의 time_fmt 에 쓰인다.
 */
public final class StrftimeFormat {
    public static final String DEFAULT = "%Y-%m-%dT%H:%M:%S";

    private static final Map<Character, String> DIRECTIVES = Map.ofEntries(
            Map.entry('Y', "uuuu"),
            Map.entry('y', "uu"),
            Map.entry('m', "MM"),
            Map.entry('d', "dd"),
            Map.entry('H', "HH"),
            Map.entry('I', "hh"),
            Map.entry('M', "mm"),
            Map.entry('S', "ss"),
            Map.entry('f', "SSSSSS"),
            Map.entry('p', "a"),
            Map.entry('b', "MMM"),
            Map.entry('B', "MMMM"),
            Map.entry('a', "EEE"),
            Map.entry('A', "EEEE"),
            Map.entry('j', "DDD"),
            Map.entry('z', "xx")
    );
    private static final Map<String, DateTimeFormatter> CACHE = new ConcurrentHashMap<>();

    private StrftimeFormat() {}

    public static DateTimeFormatter formatter(String strftime) {
        return CACHE.computeIfAbsent(strftime, StrftimeFormat::compile);
    }

    public static Instant parse(String text, String strftime, ZoneId zone) {
        if (text == null) throw new DateTimeException("null date string");
        TemporalAccessor t = formatter(strftime).parseBest(text, LocalDateTime::from, LocalDate::from);
        LocalDateTime ldt = t instanceof LocalDateTime l ? l : ((LocalDate) t).atStartOfDay();
        return ldt.atZone(zone).toInstant();
    }

    public static String format(Instant instant, String strftime, ZoneId zone) {
        return formatter(strftime).format(instant.atZone(zone));
    }

    private static DateTimeFormatter compile(String strftime) {
        StringBuilder pattern = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < strftime.length(); i++) {
            char c = strftime.charAt(i);
            if (c != '%') {
                literal.append(c);
                continue;
            }
            if (++i >= strftime.length()) throw new IllegalArgumentException("Dangling % in format: " + strftime);
            char d = strftime.charAt(i);
            if (d == '%') {
                literal.append('%');
                continue;
            }
            String p = DIRECTIVES.get(d);
            if (p == null) throw new IllegalArgumentException("Unsupported directive %" + d + " in " + strftime);
            flush(literal, pattern);
            pattern.append(p);
        }
        flush(literal, pattern);
        return DateTimeFormatter.ofPattern(pattern.toString(), Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    private static void flush(StringBuilder literal, StringBuilder pattern) {
        if (literal.length() == 0) return;
        pattern.append('\'').append(literal.toString().replace("'", "''")).append('\'');
        literal.setLength(0);
    }
}

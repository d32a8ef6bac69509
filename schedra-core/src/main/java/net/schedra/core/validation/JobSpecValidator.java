package net.schedra.core.validation;

import net.schedra.core.model.JobSpec;
import net.schedra.core.model.JobState.ErrorSource;
import net.schedra.core.model.Splay;
import net.schedra.core.model.TimeWindow;
import net.schedra.core.model.TimingDirective;
import net.schedra.core.service.SchedulerConfig;
import net.schedra.core.spi.CronCalculator;
import net.schedra.core.spi.FunctionRegistry;
import net.schedra.core.spi.GrainsLookup;
import net.schedra.core.time.DateTimeGrammar;
import net.schedra.core.time.StrftimeFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 원본 잡 매핑 → {@link JobSpec}. 실패는 던지지 않고 잡 단위 오류 문자열 하나로 돌려준다.
 * 시각만 있는 값이 평가 날짜로 해석되므로 틱마다 다시 호출된다.
 */
public class JobSpecValidator {
    private static final Logger log = LoggerFactory.getLogger(JobSpecValidator.class);

    private static final List<String> INTERVAL_KEYS = List.of("seconds", "minutes", "hours", "days");
    private static final String WHENS_GRAIN = "whens";

    private final FunctionRegistry functions;
    private final GrainsLookup grains;
    private final CronCalculator cron;
    private final Set<String> warned = ConcurrentHashMap.newKeySet();

    public JobSpecValidator(FunctionRegistry functions, GrainsLookup grains, CronCalculator cron) {
        this.functions = Objects.requireNonNull(functions);
        this.grains = Objects.requireNonNull(grains);
        this.cron = Objects.requireNonNull(cron);
    }

    public record Validation(JobSpec spec, String error, ErrorSource source) {
        static Validation ok(JobSpec spec) { return new Validation(spec, null, null); }
        static Validation config(String error) { return new Validation(null, error, ErrorSource.CONFIGURATION); }
        static Validation resolution(String error) { return new Validation(null, error, ErrorSource.RESOLUTION); }

        public boolean ok() { return error == null; }
    }

    /** 검증 중단용. 메시지가 그대로 잡 오류가 된다. */
    private static final class Invalid extends Exception {
        Invalid(String message) { super(message, null, false, false); }
    }

    public Validation validate(String name, Object raw, SchedulerConfig config, Instant now) {
        Map<String, Object> data = RawValues.asMap(raw);
        if (data == null) {
            return Validation.config("Scheduled job \"" + name + "\" should have a dict value, not " + typeName(raw) + ". Ignoring job " + name + ".");
        }
        try {
            if (!RawValues.asBool(data.get("enabled"), true)) {
                return Validation.ok(JobSpec.disabled(name));
            }
            return build(name, data, config, now);
        } catch (Invalid e) {
            return Validation.config(e.getMessage());
        } catch (IllegalArgumentException e) {
            return Validation.config("Invalid value in scheduled job " + name + ": " + e.getMessage() + ". Ignoring job " + name + ".");
        }
    }

    private Validation build(String name, Map<String, Object> data, SchedulerConfig config, Instant now) throws Invalid {
        DateTimeGrammar grammar = new DateTimeGrammar(config.zone());
        Duration loop = config.loopInterval();

        TimingDirective directive = directive(name, data, grammar, config, now);
        Splay splay = splay(name, data.get("splay"));
        TimeWindow range = range(name, data.get("range"), grammar, now);

        List<Instant> runExplicit = new ArrayList<>(explicit(name, "run_explicit", data.get("run_explicit"), grammar, config, now));
        Object sdr = data.containsKey("skip_during_range") ? data.get("skip_during_range") : config.skipDuringRange();
        TimeWindow skipDuringRange = skipDuringRange(name, sdr, grammar, now);
        if (skipDuringRange != null && RawValues.asBool(data.get("run_after_skip_range"), false)) {
            runExplicit.add(skipDuringRange.end().plus(loop));
        }
        runExplicit.sort(null);
        List<Instant> skipExplicit = explicit(name, "skip_explicit", data.get("skip_explicit"), grammar, config, now);

        Instant until = bound(name, "until", data.get("until"), grammar, now);
        Instant after = bound(name, "after", data.get("after"), grammar, now);

        int maxRunning = JobSpec.DEFAULT_MAX_RUNNING;
        if (data.get("maxrunning") != null) {
            maxRunning = RawValues.asInt(data.get("maxrunning"));
            if (maxRunning <= 0) throw new Invalid("Invalid maxrunning, must be larger than zero. Ignoring job " + name + ".");
        }

        List<String> returners = new ArrayList<>();
        for (Object r : RawValues.asList(data.get("returner"))) returners.add(String.valueOf(r));

        Map<String, Object> metadata = null;
        if (data.get("metadata") != null) {
            metadata = RawValues.asMap(data.get("metadata"));
            if (metadata == null) warnOnce("Metadata must be specified as a dictionary. Ignoring metadata in job " + name + ".");
        }
        Map<String, Object> returnKwargs = Optional.ofNullable(RawValues.asMap(data.get("return_kwargs"))).orElse(Map.of());

        Object fn = data.containsKey("function") ? data.get("function")
                : data.containsKey("func") ? data.get("func") : data.get("fun");
        String function = fn == null ? null : fn.toString();
        if (!functions.contains(function)) {
            return Validation.resolution("Invalid function: " + function + " in scheduled job " + name + ".");
        }

        Map<String, Object> kwargs = Optional.ofNullable(RawValues.asMap(data.get("kwargs"))).orElse(new LinkedHashMap<>());
        String displayName = data.get("name") == null ? name : data.get("name").toString();

        return Validation.ok(new JobSpec(
                displayName,
                function,
                RawValues.asList(data.get("args")),
                kwargs,
                directive,
                splay,
                range,
                skipDuringRange,
                until,
                after,
                RawValues.asBool(data.get("run_on_start"), false),
                List.copyOf(runExplicit),
                skipExplicit,
                maxRunning,
                RawValues.asBool(data.get("jid_include"), true),
                true,
                List.copyOf(returners),
                data.get("return_config"),
                returnKwargs,
                metadata));
    }

    // ---- timing directive ----

    private TimingDirective directive(String name, Map<String, Object> data, DateTimeGrammar grammar,
                                      SchedulerConfig config, Instant now) throws Invalid {
        List<String> present = new ArrayList<>();
        if (data.get("once") != null) present.add("once");
        if (data.get("cron") != null) present.add("cron");
        if (data.get("when") != null) present.add("when");
        if (data.get("whens") != null) present.add("whens");
        if (INTERVAL_KEYS.stream().anyMatch(k -> data.get(k) != null)) present.add("interval");
        if (present.isEmpty()) return null;

        String chosen = present.get(0);
        if (present.size() > 1) {
            warnOnce("Job " + name + " has multiple timing directives " + present + ", using " + chosen + " and ignoring the rest.");
        }
        switch (chosen) {
            case "once":
                return once(name, data, config);
            case "cron":
                String expr = data.get("cron").toString();
                try {
                    cron.next(now, expr, config.zone());
                } catch (RuntimeException e) {
                    throw new Invalid("Invalid cron string. Ignoring job " + name + ".");
                }
                return new TimingDirective.Cron(expr);
            case "when":
                return new TimingDirective.When(whenTimes(name, data.get("when"), false, grammar, now));
            case "whens":
                return new TimingDirective.When(whenTimes(name, data.get("whens"), true, grammar, now));
            default:
                return interval(name, data);
        }
    }

    private TimingDirective once(String name, Map<String, Object> data, SchedulerConfig config) throws Invalid {
        Object value = data.get("once");
        String fmt = data.get("once_fmt") == null ? StrftimeFormat.DEFAULT : data.get("once_fmt").toString();
        try {
            return new TimingDirective.Once(StrftimeFormat.parse(value.toString(), fmt, config.zone()), fmt);
        } catch (DateTimeException | IllegalArgumentException e) {
            throw new Invalid("Date string could not be parsed: " + value + ", " + fmt + ". Ignoring job " + name + ".");
        }
    }

    private TimingDirective interval(String name, Map<String, Object> data) throws Invalid {
        long seconds = 0;
        try {
            seconds += intOrZero(data.get("seconds"));
            seconds += 60L * intOrZero(data.get("minutes"));
            seconds += 3600L * intOrZero(data.get("hours"));
            seconds += 86400L * intOrZero(data.get("days"));
        } catch (IllegalArgumentException e) {
            throw new Invalid("Invalid interval, must be larger than zero. Ignoring job " + name + ".");
        }
        if (seconds <= 0) throw new Invalid("Invalid interval, must be larger than zero. Ignoring job " + name + ".");
        return new TimingDirective.Interval(Duration.ofSeconds(seconds));
    }

    /**
     * @param symbolic true 면 모든 항목이 grains "whens" 표에 있어야 한다(whens 키)
     */
    private List<Instant> whenTimes(String name, Object raw, boolean symbolic, DateTimeGrammar grammar, Instant now) throws Invalid {
        Optional<Object> table = grains.lookup(WHENS_GRAIN);
        if (table.isPresent() && !(table.get() instanceof Map)) {
            throw new Invalid("Grain \"whens\" must be a dict. Ignoring job " + name + ".");
        }
        Map<?, ?> whens = table.map(t -> (Map<?, ?>) t).orElse(Map.of());

        TreeSet<Instant> times = new TreeSet<>();
        for (Object entry : RawValues.asList(raw)) {
            String text = entry == null ? null : entry.toString();
            Object mapped = text == null ? null : whens.get(text);
            if (mapped != null) {
                text = mapped.toString();
            } else if (symbolic) {
                throw new Invalid("Invalid date string. Ignoring job " + name + ".");
            }
            try {
                times.add(grammar.parse(text, now));
            } catch (DateTimeException e) {
                throw new Invalid("Invalid date string. Ignoring job " + name + ".");
            }
        }
        if (times.isEmpty()) throw new Invalid("Invalid date string. Ignoring job " + name + ".");
        return new ArrayList<>(times);
    }

    // ---- modifiers / gates ----

    private Splay splay(String name, Object raw) {
        if (raw == null) return null;
        try {
            Map<String, Object> m = RawValues.asMap(raw);
            if (m != null) {
                int start = RawValues.asInt(m.getOrDefault("start", 0));
                int end = RawValues.asInt(m.get("end"));
                if (end < start) {
                    warnOnce("schedule.handle_func: Invalid Splay, end must be larger than start. Ignoring splay in job " + name + ".");
                    return null;
                }
                return new Splay(start, end);
            }
            return Splay.upTo(RawValues.asInt(raw));
        } catch (IllegalArgumentException e) {
            warnOnce("Invalid splay " + raw + " in job " + name + ". Ignoring splay.");
            return null;
        }
    }

    private TimeWindow range(String name, Object raw, DateTimeGrammar grammar, Instant now) throws Invalid {
        if (raw == null) return null;
        Map<String, Object> m = RawValues.asMap(raw);
        if (m == null) {
            throw new Invalid("schedule.handle_func: Invalid, range must be specified as a dictionary. Ignoring job " + name + ".");
        }
        Instant start = parse(m.get("start"), grammar, now, "Invalid date string for start. Ignoring job " + name + ".");
        Instant end = parse(m.get("end"), grammar, now, "Invalid date string for end. Ignoring job " + name + ".");
        if (!end.isAfter(start)) {
            throw new Invalid("schedule.handle_func: Invalid range, end must be larger than start. Ignoring job " + name + ".");
        }
        return new TimeWindow(start, end, RawValues.asBool(m.get("invert"), false));
    }

    private TimeWindow skipDuringRange(String name, Object raw, DateTimeGrammar grammar, Instant now) throws Invalid {
        if (raw == null) return null;
        Map<String, Object> m = RawValues.asMap(raw);
        if (m == null) {
            throw new Invalid("schedule.handle_func: Invalid, range must be specified as a dictionary. Ignoring job " + name + ".");
        }
        Instant start = parse(m.get("start"), grammar, now,
                "Invalid date string for start in skip_during_range. Ignoring job " + name + ".");
        Instant end = parse(m.get("end"), grammar, now,
                "Invalid date string for end in skip_during_range. Ignoring job " + name + ".");
        if (!end.isAfter(start)) {
            throw new Invalid("schedule.handle_func: Invalid range, end must be larger than start. Ignoring job " + name + ".");
        }
        return new TimeWindow(start, end, false);
    }

    private Instant bound(String name, String key, Object raw, DateTimeGrammar grammar, Instant now) throws Invalid {
        if (raw == null) return null;
        return parse(raw, grammar, now, "Invalid date string for " + key + ". Ignoring job " + name + ".");
    }

    /** 문자열 또는 {time, time_fmt} 매핑 목록 */
    private List<Instant> explicit(String name, String key, Object raw, DateTimeGrammar grammar,
                                   SchedulerConfig config, Instant now) throws Invalid {
        if (raw == null) return List.of();
        String error = "Invalid date string for " + key + ". Ignoring job " + name + ".";
        TreeSet<Instant> out = new TreeSet<>();
        for (Object item : RawValues.asList(raw)) {
            Map<String, Object> m = RawValues.asMap(item);
            if (m == null) {
                out.add(parse(item, grammar, now, error));
                continue;
            }
            Object time = m.get("time");
            Object fmt = m.get("time_fmt");
            if (fmt == null) {
                out.add(parse(time, grammar, now, error));
                continue;
            }
            try {
                out.add(StrftimeFormat.parse(String.valueOf(time), fmt.toString(), config.zone()));
            } catch (DateTimeException | IllegalArgumentException e) {
                throw new Invalid(error);
            }
        }
        return List.copyOf(out);
    }

    private static Instant parse(Object raw, DateTimeGrammar grammar, Instant now, String error) throws Invalid {
        if (raw == null) throw new Invalid(error);
        try {
            return grammar.parse(raw.toString(), now);
        } catch (DateTimeException e) {
            throw new Invalid(error);
        }
    }

    private static int intOrZero(Object raw) {
        return raw == null ? 0 : RawValues.asInt(raw);
    }

    private void warnOnce(String message) {
        if (warned.add(message)) log.warn(message);
    }

    private static String typeName(Object raw) {
        return raw == null ? "null" : raw.getClass().getSimpleName();
    }
}

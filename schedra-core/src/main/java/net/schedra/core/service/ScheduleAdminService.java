package net.schedra.core.service;

import net.schedra.core.spi.ScheduleStore;
import net.schedra.core.time.StrftimeFormat;
import net.schedra.core.validation.RawValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 스케줄 관리 명령(add/modify/delete/enable/run/postpone/skip/save/reload ...).
 * 변경 명령은 {@code persistChanges} 가 켜져 있으면 스케줄 파일에도 저장한다.
 */
public final class ScheduleAdminService {
    private static final Logger log = LoggerFactory.getLogger(ScheduleAdminService.class);

    private final Scheduler scheduler;
    private final ScheduleStore scheduleStore;   // null 이면 save/reload 불가
    private final boolean persistChanges;

    public ScheduleAdminService(Scheduler scheduler, ScheduleStore scheduleStore, boolean persistChanges) {
        this.scheduler = scheduler;
        this.scheduleStore = scheduleStore;
        this.persistChanges = persistChanges && scheduleStore != null;
    }

    public AdminResult add(String name, Map<String, Object> job) {
        if (name == null || name.isBlank()) return AdminResult.fail("Job name is required.");
        if (scheduler.rawJob(name).isPresent()) {
            return AdminResult.fail("Job " + name + " already exists in schedule.");
        }
        scheduler.upsertJob(name, job);
        return changed(AdminResult.ok("Added job: " + name + " to schedule."));
    }

    public AdminResult modify(String name, Map<String, Object> job) {
        if (scheduler.rawJob(name).isEmpty()) return missing(name);
        scheduler.upsertJob(name, job);
        return changed(AdminResult.ok("Modified job: " + name + " in schedule."));
    }

    public AdminResult delete(String name) {
        if (!scheduler.removeJob(name)) return missing(name);
        return changed(AdminResult.ok("Deleted job: " + name + " from schedule."));
    }

    public AdminResult deletePrefix(String prefix) {
        List<String> deleted = new ArrayList<>();
        for (String name : scheduler.jobNames()) {
            if (name.startsWith(prefix) && scheduler.removeJob(name)) deleted.add(name);
        }
        if (deleted.isEmpty()) return AdminResult.fail("No jobs matching prefix " + prefix + ".");
        return changed(AdminResult.ok("Deleted jobs: " + deleted + " from schedule.", deleted));
    }

    public AdminResult purge() {
        List<String> names = scheduler.jobNames();
        names.forEach(scheduler::removeJob);
        return changed(AdminResult.ok("Deleted all jobs from schedule.", names));
    }

    public AdminResult enableJob(String name) {
        if (!scheduler.setEnabled(name, true)) return missing(name);
        return changed(AdminResult.ok("Enabled job: " + name + " in schedule."));
    }

    public AdminResult disableJob(String name) {
        if (!scheduler.setEnabled(name, false)) return missing(name);
        return changed(AdminResult.ok("Disabled job: " + name + " in schedule."));
    }

    public AdminResult enableSchedule() {
        scheduler.setScheduleEnabled(true);
        return changed(AdminResult.ok("Enabled schedule."));
    }

    public AdminResult disableSchedule() {
        scheduler.setScheduleEnabled(false);
        return changed(AdminResult.ok("Disabled schedule."));
    }

    public AdminResult isEnabled() {
        boolean enabled = scheduler.scheduleEnabled();
        return AdminResult.ok(enabled ? "Schedule is enabled." : "Schedule is disabled.", enabled);
    }

    public AdminResult runJob(String name, boolean force) {
        try {
            boolean launched = scheduler.runNow(name, force);
            return launched
                    ? AdminResult.ok("Scheduling job " + name + " for execution.")
                    : AdminResult.fail("Job " + name + " is already running or could not be launched.");
        } catch (IllegalArgumentException e) {
            return missing(name);
        } catch (IllegalStateException e) {
            return AdminResult.fail(e.getMessage());
        }
    }

    /** {@code time} 실행을 건너뛰고 {@code newTime} 에 대신 실행한다. */
    public AdminResult postponeJob(String name, String time, String newTime, String timeFmt) {
        if (scheduler.rawJob(name).isEmpty()) return missing(name);
        String fmt = timeFmt == null ? StrftimeFormat.DEFAULT : timeFmt;
        Optional<AdminResult> invalid = checkTime(time, fmt).or(() -> checkTime(newTime, fmt));
        if (invalid.isPresent()) return invalid.get();

        Map<String, Object> job = mutableJob(name);
        appendTime(job, "skip_explicit", time, fmt);
        appendTime(job, "run_explicit", newTime, fmt);
        scheduler.upsertJob(name, job);
        return changed(AdminResult.ok("Postponed job: " + name + " in schedule."));
    }

    public AdminResult skipJob(String name, String time, String timeFmt) {
        if (scheduler.rawJob(name).isEmpty()) return missing(name);
        String fmt = timeFmt == null ? StrftimeFormat.DEFAULT : timeFmt;
        Optional<AdminResult> invalid = checkTime(time, fmt);
        if (invalid.isPresent()) return invalid.get();

        Map<String, Object> job = mutableJob(name);
        appendTime(job, "skip_explicit", time, fmt);
        scheduler.upsertJob(name, job);
        return changed(AdminResult.ok("Added skip for job: " + name + " in schedule."));
    }

    public AdminResult showNextFireTime(String name, String timeFmt) {
        if (scheduler.rawJob(name).isEmpty()) return missing(name);
        Optional<Instant> next = scheduler.nextFireTime(name);
        if (next.isEmpty()) return AdminResult.ok("Job " + name + " has no next fire time.");
        String fmt = timeFmt == null ? StrftimeFormat.DEFAULT : timeFmt;
        return AdminResult.ok(StrftimeFormat.format(next.get(), fmt, scheduler.config().zone()), next.get());
    }

    public AdminResult list() {
        Map<String, Object> schedule = scheduler.schedule();
        return AdminResult.ok("Listed " + scheduler.jobNames().size() + " job(s).", schedule);
    }

    public AdminResult save() {
        if (scheduleStore == null) return AdminResult.fail("No schedule file configured.");
        try {
            scheduleStore.save(scheduler.schedule());
            return AdminResult.ok("Schedule saved.");
        } catch (Exception e) {
            log.error("Failed to save schedule", e);
            return AdminResult.fail("Failed to save schedule: " + e.getMessage());
        }
    }

    /** 스케줄 파일의 잡을 현재 스케줄 위에 덮어쓴다. */
    public AdminResult reload() {
        if (scheduleStore == null) return AdminResult.fail("No schedule file configured.");
        Map<String, Object> loaded;
        try {
            loaded = scheduleStore.load();
        } catch (Exception e) {
            log.error("Failed to read schedule file", e);
            return AdminResult.fail("Failed to reload schedule: " + e.getMessage());
        }
        Map<String, Object> merged = new LinkedHashMap<>(scheduler.schedule());
        Object inner = loaded.get("schedule");
        if (loaded.size() == 1 && inner instanceof Map<?, ?> m) {
            m.forEach((k, v) -> merged.put(String.valueOf(k), v));
        } else {
            merged.putAll(loaded);
        }
        scheduler.load(merged);
        return AdminResult.ok("Reloaded schedule from file.");
    }

    // ----

    private AdminResult changed(AdminResult result) {
        if (persistChanges) {
            AdminResult saved = save();
            if (!saved.result()) {
                return new AdminResult(result.result(), result.comment() + " " + saved.comment(), result.data());
            }
        }
        return result;
    }

    private static AdminResult missing(String name) {
        return AdminResult.fail("Job " + name + " does not exist.");
    }

    private Optional<AdminResult> checkTime(String time, String fmt) {
        try {
            StrftimeFormat.parse(time, fmt, scheduler.config().zone());
            return Optional.empty();
        } catch (DateTimeException | IllegalArgumentException e) {
            return Optional.of(AdminResult.fail("Date string could not be parsed: " + time + ", " + fmt + "."));
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> mutableJob(String name) {
        Object raw = scheduler.rawJob(name).orElseThrow();
        if (raw instanceof Map<?, ?>) return (Map<String, Object>) raw;
        throw new IllegalStateException("Job " + name + " is not a mapping");
    }

    private static void appendTime(Map<String, Object> job, String key, String time, String fmt) {
        List<Object> list = RawValues.asList(job.get(key));
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("time", time);
        entry.put("time_fmt", fmt);
        list.add(entry);
        job.put(key, list);
    }
}

package net.schedra.bootstrap.props;

import net.schedra.core.model.OnceMissedPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("schedra")
public class SchedraProperties {
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
    private Persistence persistence = new Persistence();
    private Catalog catalog = new Catalog();
    private Grains grains = new Grains();
    /** 전역 skip_during_range ({@code start}, {@code end}) */
    private Map<String, Object> skipDuringRange = new LinkedHashMap<>();
    /** 전역 skip_function */
    private String skipFunction;
    /** 모든 잡 결과를 받는 스케줄 수준 returner */
    private List<String> returners = new ArrayList<>();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public Grains getGrains() {
        return grains;
    }

    public void setGrains(Grains grains) {
        this.grains = grains;
    }

    public Map<String, Object> getSkipDuringRange() {
        return skipDuringRange;
    }

    public void setSkipDuringRange(Map<String, Object> skipDuringRange) {
        this.skipDuringRange = skipDuringRange;
    }

    public String getSkipFunction() {
        return skipFunction;
    }

    public void setSkipFunction(String skipFunction) {
        this.skipFunction = skipFunction;
    }

    public List<String> getReturners() {
        return returners;
    }

    public void setReturners(List<String> returners) {
        this.returners = returners;
    }

    public enum LauncherType { EXECUTOR, DIRECT }

    public enum PersistenceType { FILE, JDBC, NONE }

    public static class Scheduler {
        private boolean enabled = true;
        private long loopIntervalMs = 1000;
        private long initialDelayMs = 0;
        private LauncherType launcher = LauncherType.EXECUTOR;
        private int launcherThreads = 4;
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private OnceMissedPolicy onceMissedPolicy = OnceMissedPolicy.SKIP;
        private Long randomSeed;   // splay 재현용

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getLoopIntervalMs() {
            return loopIntervalMs;
        }

        public void setLoopIntervalMs(long loopIntervalMs) {
            this.loopIntervalMs = loopIntervalMs;
        }

        public Duration getLoopInterval() {
            return Duration.ofMillis(loopIntervalMs);
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public LauncherType getLauncher() {
            return launcher;
        }

        public void setLauncher(LauncherType launcher) {
            this.launcher = launcher;
        }

        public int getLauncherThreads() {
            return launcherThreads;
        }

        public void setLauncherThreads(int launcherThreads) {
            this.launcherThreads = launcherThreads;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public OnceMissedPolicy getOnceMissedPolicy() {
            return onceMissedPolicy;
        }

        public void setOnceMissedPolicy(OnceMissedPolicy onceMissedPolicy) {
            this.onceMissedPolicy = onceMissedPolicy;
        }

        public Long getRandomSeed() {
            return randomSeed;
        }

        public void setRandomSeed(Long randomSeed) {
            this.randomSeed = randomSeed;
        }
    }

    public static class Persistence {
        private PersistenceType type = PersistenceType.NONE;
        private String stateFile = "schedra/state.json";
        private String scheduleFile;
        /** 관리 명령으로 바뀐 스케줄을 바로 파일에 저장할지 */
        private boolean persistChanges = true;

        public PersistenceType getType() {
            return type;
        }

        public void setType(PersistenceType type) {
            this.type = type;
        }

        public String getStateFile() {
            return stateFile;
        }

        public void setStateFile(String stateFile) {
            this.stateFile = stateFile;
        }

        public String getScheduleFile() {
            return scheduleFile;
        }

        public void setScheduleFile(String scheduleFile) {
            this.scheduleFile = scheduleFile;
        }

        public boolean isPersistChanges() {
            return persistChanges;
        }

        public void setPersistChanges(boolean persistChanges) {
            this.persistChanges = persistChanges;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private Map<String, Map<String, Object>> jobs = new LinkedHashMap<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Map<String, Map<String, Object>> getJobs() {
            return jobs;
        }

        public void setJobs(Map<String, Map<String, Object>> jobs) {
            this.jobs = jobs;
        }
    }

    public static class Grains {
        /** whens 심볼 → 날짜/시각 문자열 */
        private Map<String, String> whens = new LinkedHashMap<>();

        public Map<String, String> getWhens() {
            return whens;
        }

        public void setWhens(Map<String, String> whens) {
            this.whens = whens;
        }
    }
}

package net.schedra.core.store;

import net.schedra.core.model.JobState;
import net.schedra.core.model.JobStatus;
import net.schedra.core.model.PersistedJobState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 잡 이름 → {@link JobState}. 틱 스레드와 런처 완료 콜백이 함께 쓰므로
 * 저장소 전체를 락 하나로 보호한다. 밖으로는 사본만 내보낸다.
 */
public final class JobStateStore {
    private final ReentrantLock lock = new ReentrantLock();
    private final TreeMap<String, JobState> states = new TreeMap<>();

    /** 사본. 없으면 empty */
    public Optional<JobState> get(String name) {
        lock.lock();
        try {
            JobState s = states.get(name);
            return s == null ? Optional.empty() : Optional.of(s.copy());
        } finally {
            lock.unlock();
        }
    }

    /** 사본. 없으면 새로 만든다. */
    public JobState getOrCreate(String name) {
        lock.lock();
        try {
            return states.computeIfAbsent(name, k -> new JobState()).copy();
        } finally {
            lock.unlock();
        }
    }

    /** 실행 중 카운트는 저장소 값이 우선한다(완료 콜백과의 경합). */
    public void set(String name, JobState state) {
        lock.lock();
        try {
            JobState copy = state.copy();
            JobState current = states.get(name);
            copy.setRunningCount(current == null ? 0 : current.runningCount());
            states.put(name, copy);
        } finally {
            lock.unlock();
        }
    }

    public void update(String name, Consumer<JobState> change) {
        lock.lock();
        try {
            change.accept(states.computeIfAbsent(name, k -> new JobState()));
        } finally {
            lock.unlock();
        }
    }

    /** 잡이 삭제되었으면 아무것도 하지 않는다(실행 완료 콜백용). */
    public boolean updateIfPresent(String name, Consumer<JobState> change) {
        lock.lock();
        try {
            JobState s = states.get(name);
            if (s == null) return false;
            change.accept(s);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(String name) {
        lock.lock();
        try {
            return states.remove(name) != null;
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobStatus> status(String name) {
        lock.lock();
        try {
            JobState s = states.get(name);
            return s == null ? Optional.empty() : Optional.of(JobStatus.of(name, s));
        } finally {
            lock.unlock();
        }
    }

    /** running < max 일 때만 슬롯을 잡는다. */
    public Optional<RunPermit> tryAcquire(String name, int maxRunning) {
        lock.lock();
        try {
            JobState s = states.computeIfAbsent(name, k -> new JobState());
            if (s.runningCount() >= maxRunning) return Optional.empty();
            s.setRunningCount(s.runningCount() + 1);
            return Optional.of(new RunPermit(this, name));
        } finally {
            lock.unlock();
        }
    }

    /** jid_include=false: 동시 실행 제한 없이 카운트만 올린다. */
    public RunPermit acquireUnbounded(String name) {
        lock.lock();
        try {
            JobState s = states.computeIfAbsent(name, k -> new JobState());
            s.setRunningCount(s.runningCount() + 1);
            return new RunPermit(this, name);
        } finally {
            lock.unlock();
        }
    }

    void release(String name) {
        lock.lock();
        try {
            JobState s = states.get(name);
            // 실행 중에 잡이 삭제되었을 수 있다
            if (s != null && s.runningCount() > 0) s.setRunningCount(s.runningCount() - 1);
        } finally {
            lock.unlock();
        }
    }

    /** 이름순 영속 스냅샷 */
    public Map<String, PersistedJobState> export() {
        lock.lock();
        try {
            Map<String, PersistedJobState> out = new TreeMap<>();
            states.forEach((k, v) -> out.put(k, v.toPersisted()));
            return out;
        } finally {
            lock.unlock();
        }
    }

    public void restore(Map<String, PersistedJobState> persisted) {
        lock.lock();
        try {
            persisted.forEach((name, p) -> states.computeIfAbsent(name, k -> new JobState()).restore(p));
        } finally {
            lock.unlock();
        }
    }

    public List<String> names() {
        lock.lock();
        try {
            return new ArrayList<>(states.keySet());
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            states.clear();
        } finally {
            lock.unlock();
        }
    }
}

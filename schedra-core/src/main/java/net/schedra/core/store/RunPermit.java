package net.schedra.core.store;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 실행 슬롯 하나. 어떤 경로로 끝나든 close 하면 반납되며, 두 번 닫아도 한 번만 반납된다.
 */
public final class RunPermit implements AutoCloseable {
    private final JobStateStore store;
    private final String jobName;
    private final AtomicBoolean released = new AtomicBoolean();

    RunPermit(JobStateStore store, String jobName) {
        this.store = store;
        this.jobName = jobName;
    }

    public String jobName() { return jobName; }

    public boolean released() { return released.get(); }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) store.release(jobName);
    }
}

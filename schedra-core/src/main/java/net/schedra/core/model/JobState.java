package net.schedra.core.model;

import java.time.Instant;

/**
 * 잡 하나의 실시간 상태. JobStateStore 만 소유/변경한다.
 */
public final class JobState {

    public enum ErrorSource { CONFIGURATION, RESOLUTION, EXECUTION }

    private Instant nextFireTime;
    private Instant lastFireTime;
    private Instant lastSlot;
    private long runCount;
    private int runningCount;
    private String lastError;
    private ErrorSource errorSource;
    private Instant splayDeadline;
    private Instant splaySlot;
    private boolean splayRetryWhenGated;
    private boolean primed;
    private Instant onceTarget;

    public JobState copy() {
        JobState c = new JobState();
        c.nextFireTime = nextFireTime;
        c.lastFireTime = lastFireTime;
        c.lastSlot = lastSlot;
        c.runCount = runCount;
        c.runningCount = runningCount;
        c.lastError = lastError;
        c.errorSource = errorSource;
        c.splayDeadline = splayDeadline;
        c.splaySlot = splaySlot;
        c.splayRetryWhenGated = splayRetryWhenGated;
        c.primed = primed;
        c.onceTarget = onceTarget;
        return c;
    }

    /** 설정이 바뀌었을 때: 누적 값(runCount, onceTarget, lastFireTime)만 남긴다. */
    public void resetSchedule() {
        nextFireTime = null;
        lastSlot = null;
        splayDeadline = null;
        splaySlot = null;
        splayRetryWhenGated = false;
        primed = false;
    }

    public void markFired(Instant firedAt, Instant slot, Instant next) {
        lastFireTime = firedAt;
        if (slot != null) lastSlot = slot;
        nextFireTime = next;
        runCount++;
        clearSplay();
    }

    public void consume(Instant slot, Instant next) {
        if (slot != null) lastSlot = slot;
        nextFireTime = next;
        clearSplay();
    }

    public void recordError(ErrorSource source, String message) {
        this.errorSource = source;
        this.lastError = message;
    }

    public void clearError(ErrorSource source) {
        if (errorSource == source) {
            errorSource = null;
            lastError = null;
        }
    }

    public void clearSplay() {
        splayDeadline = null;
        splaySlot = null;
        splayRetryWhenGated = false;
    }

    public PersistedJobState toPersisted() {
        return new PersistedJobState(nextFireTime, lastFireTime, runCount, onceTarget, lastSlot);
    }

    public void restore(PersistedJobState p) {
        nextFireTime = p.nextFireTime();
        lastFireTime = p.lastFireTime();
        runCount = p.runCount();
        onceTarget = p.onceTarget();
        lastSlot = p.lastSlot();
    }

    public Instant nextFireTime() { return nextFireTime; }
    public void setNextFireTime(Instant nextFireTime) { this.nextFireTime = nextFireTime; }
    public Instant lastFireTime() { return lastFireTime; }
    public void setLastFireTime(Instant lastFireTime) { this.lastFireTime = lastFireTime; }
    public Instant lastSlot() { return lastSlot; }
    public long runCount() { return runCount; }
    public void setRunCount(long runCount) { this.runCount = runCount; }
    public int runningCount() { return runningCount; }
    public void setRunningCount(int runningCount) { this.runningCount = runningCount; }
    public String lastError() { return lastError; }
    public ErrorSource errorSource() { return errorSource; }
    public Instant splayDeadline() { return splayDeadline; }
    public Instant splaySlot() { return splaySlot; }
    public boolean splayRetryWhenGated() { return splayRetryWhenGated; }
    public void startSplay(Instant slot, Instant deadline, boolean retryWhenGated) {
        this.splaySlot = slot;
        this.splayDeadline = deadline;
        this.splayRetryWhenGated = retryWhenGated;
    }
    public boolean primed() { return primed; }
    public void setPrimed(boolean primed) { this.primed = primed; }
    public Instant onceTarget() { return onceTarget; }
    public void setOnceTarget(Instant onceTarget) { this.onceTarget = onceTarget; }

    @Override
    public String toString() {
        return "JobState{" +
                "nextFireTime=" + nextFireTime +
                ", lastFireTime=" + lastFireTime +
                ", runCount=" + runCount +
                ", runningCount=" + runningCount +
                ", lastError='" + lastError + '\'' +
                '}';
    }
}

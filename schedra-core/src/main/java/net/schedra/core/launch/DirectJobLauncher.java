package net.schedra.core.launch;

import net.schedra.core.spi.JobLauncher;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** 틱 스레드에서 바로 실행한다. 테스트와 단일 스레드 임베딩용. */
public final class DirectJobLauncher implements JobLauncher {
    private final Map<String, AtomicInteger> running = new ConcurrentHashMap<>();

    @Override
    public void launch(String jobName, Runnable body) {
        AtomicInteger counter = running.computeIfAbsent(jobName, k -> new AtomicInteger());
        counter.incrementAndGet();
        try {
            body.run();
        } finally {
            counter.decrementAndGet();
        }
    }

    @Override
    public boolean isRunning(String jobName) {
        AtomicInteger c = running.get(jobName);
        return c != null && c.get() > 0;
    }

    @Override
    public void close() {
        running.clear();
    }
}

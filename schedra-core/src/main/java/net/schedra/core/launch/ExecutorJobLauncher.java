package net.schedra.core.launch;

import net.schedra.core.spi.JobLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** 고정 크기 스레드 풀에서 잡 본문을 실행한다(기본 런처). */
public final class ExecutorJobLauncher implements JobLauncher {
    private static final Logger log = LoggerFactory.getLogger(ExecutorJobLauncher.class);

    private final ExecutorService pool;
    private final Duration shutdownTimeout;
    private final Map<String, AtomicInteger> running = new ConcurrentHashMap<>();

    public ExecutorJobLauncher(int threads, Duration shutdownTimeout) {
        if (threads <= 0) throw new IllegalArgumentException("threads must be positive: " + threads);
        AtomicInteger seq = new AtomicInteger();
        this.pool = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), r -> {
                    Thread t = new Thread(r, "schedra-job-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        this.shutdownTimeout = shutdownTimeout;
    }

    @Override
    public void launch(String jobName, Runnable body) {
        AtomicInteger counter = running.computeIfAbsent(jobName, k -> new AtomicInteger());
        counter.incrementAndGet();
        try {
            pool.execute(() -> {
                try {
                    body.run();
                } finally {
                    counter.decrementAndGet();
                }
            });
        } catch (RuntimeException e) {
            counter.decrementAndGet();
            throw e;
        }
    }

    @Override
    public boolean isRunning(String jobName) {
        AtomicInteger c = running.get(jobName);
        return c != null && c.get() > 0;
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Job threads still running after {}, interrupting", shutdownTimeout);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

package net.schedra.integration.spring.sched;

import net.schedra.core.service.Scheduler;
import net.schedra.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * 루프 간격마다 스케줄러를 한 번 평가한다.
 * {@link #start()} 전의 틱은 건너뛴다(상태 복원과 잡 적재가 끝나기 전).
 */
public class SchedraSchedulers {
    private static final Logger log = LoggerFactory.getLogger(SchedraSchedulers.class);

    private final Scheduler scheduler;
    private final Clock clock;
    private volatile boolean started;

    public SchedraSchedulers(Scheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public void start() {
        started = true;
        log.info("Scheduler tick loop started");
    }

    public boolean isStarted() { return started; }

    @Scheduled(fixedDelayString = "${schedra.scheduler.loop-interval-ms:1000}",
               initialDelayString = "${schedra.scheduler.initial-delay-ms:0}")
    public void tick() {
        if (!started) return;
        try {
            scheduler.eval(clock.now());
        } catch (RuntimeException e) {
            // 잡 단위 오류는 eval 안에서 처리된다. 여기로 오는 건 틱 자체의 실패.
            log.error("Scheduler tick failed", e);
        }
    }
}

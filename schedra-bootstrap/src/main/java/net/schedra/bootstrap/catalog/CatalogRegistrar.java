package net.schedra.bootstrap.catalog;

import net.schedra.bootstrap.props.SchedraProperties;
import net.schedra.core.service.Scheduler;
import net.schedra.core.service.SchedulerConfig;
import net.schedra.core.spi.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 기동 시 한 번: 영속 상태를 복원하고, 프로퍼티 카탈로그와 스케줄 파일의 잡을 적재한다.
 * 같은 이름이면 스케줄 파일 쪽이 이긴다(관리 명령으로 바뀐 값).
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final Scheduler scheduler;
    private final ScheduleStore scheduleStore;   // 없으면 null

    public CatalogRegistrar(Scheduler scheduler, ScheduleStore scheduleStore) {
        this.scheduler = scheduler;
        this.scheduleStore = scheduleStore;
    }

    public void register(SchedraProperties props) throws Exception {
        // 1) 상태 복원 (실패하면 기동 중단)
        scheduler.restoreState();

        // 2) 카탈로그 + 전역 설정
        Map<String, Object> mapping = new LinkedHashMap<>();
        if (props.getCatalog().isEnabled()) mapping.putAll(props.getCatalog().getJobs());
        if (props.getSkipFunction() != null) mapping.put(SchedulerConfig.KEY_SKIP_FUNCTION, props.getSkipFunction());
        if (!props.getSkipDuringRange().isEmpty()) {
            mapping.put(SchedulerConfig.KEY_SKIP_DURING_RANGE, props.getSkipDuringRange());
        }

        // 3) 스케줄 파일
        if (scheduleStore != null) {
            Map<String, Object> saved = scheduleStore.load();
            mapping.putAll(saved);
            log.info("Schedule file contributed {} entr(ies)", saved.size());
        }

        scheduler.setScheduleReturners(props.getReturners());
        scheduler.load(mapping);
        log.info("Catalog registered: jobs={}", scheduler.jobNames());
    }
}

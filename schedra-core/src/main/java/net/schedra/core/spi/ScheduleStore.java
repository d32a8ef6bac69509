package net.schedra.core.spi;

import java.util.Map;

/** 관리 명령으로 바뀐 스케줄(원본 job 매핑)을 저장/복원한다. */
public interface ScheduleStore {
    Map<String, Object> load() throws Exception;
    void save(Map<String, Object> schedule) throws Exception;
}

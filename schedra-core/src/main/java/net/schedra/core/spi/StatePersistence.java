package net.schedra.core.spi;

import net.schedra.core.model.PersistedJobState;

import java.util.Map;

/** 잡 상태의 내구 저장소 (once 잡 재발화 방지) */
public interface StatePersistence {
    Map<String, PersistedJobState> load() throws Exception;   // 없으면 빈 맵
    void save(Map<String, PersistedJobState> states) throws Exception;

    static StatePersistence none() {
        return new StatePersistence() {
            @Override public Map<String, PersistedJobState> load() { return Map.of(); }
            @Override public void save(Map<String, PersistedJobState> states) { }
        };
    }
}

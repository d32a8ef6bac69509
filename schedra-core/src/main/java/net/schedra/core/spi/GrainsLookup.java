package net.schedra.core.spi;

import java.util.Map;
import java.util.Optional;

/**
 * 노드 속성(grains) 조회. {@code whens} 심볼 해석에 쓰인다.
 */
@FunctionalInterface
public interface GrainsLookup {
    Optional<Object> lookup(String key);

    default boolean isMapping(String key) {
        return lookup(key).map(v -> v instanceof Map).orElse(false);
    }

    static GrainsLookup empty() { return key -> Optional.empty(); }

    static GrainsLookup of(Map<String, ?> grains) {
        return key -> Optional.ofNullable(grains.get(key));
    }
}

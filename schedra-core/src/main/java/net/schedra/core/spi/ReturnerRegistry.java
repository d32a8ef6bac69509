package net.schedra.core.spi;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public interface ReturnerRegistry {
    Optional<Returner> find(String name);

    static ReturnerRegistry none() { return name -> Optional.empty(); }

    static ReturnerRegistry of(Map<String, ? extends Returner> returners) {
        var copy = new TreeMap<String, Returner>(returners);
        return name -> Optional.ofNullable(copy.get(name));
    }
}

package net.schedra.adapter.file;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import net.schedra.core.model.PersistedJobState;
import net.schedra.core.spi.PersistenceException;
import net.schedra.core.spi.StatePersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * 잡 상태를 JSON 파일 하나에 저장한다. 키는 이름순, 시각은 ISO-8601 문자열.
 * 같은 상태는 항상 같은 바이트로 직렬화된다.
 */
public final class JsonFileStatePersistence implements StatePersistence {
    private static final Logger log = LoggerFactory.getLogger(JsonFileStatePersistence.class);
    private static final TypeReference<TreeMap<String, StateEntry>> TYPE = new TypeReference<>() { };

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileStatePersistence(Path file) {
        this.file = file;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path file() { return file; }

    @Override
    public Map<String, PersistedJobState> load() throws PersistenceException {
        if (!Files.exists(file)) return Map.of();
        try {
            TreeMap<String, StateEntry> raw = mapper.readValue(file.toFile(), TYPE);
            Map<String, PersistedJobState> out = new TreeMap<>();
            if (raw != null) raw.forEach((name, e) -> out.put(name, e.toState()));
            log.debug("Loaded {} job states from {}", out.size(), file);
            return out;
        } catch (IOException e) {
            throw new PersistenceException("Failed to read job state file " + file, e);
        }
    }

    @Override
    public void save(Map<String, PersistedJobState> states) throws PersistenceException {
        try {
            byte[] bytes = serialize(states);
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            // 임시 파일에 쓰고 교체
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.write(tmp, bytes);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PersistenceException("Failed to write job state file " + file, e);
        }
    }

    /** 파일에 쓰일 바이트 그대로 */
    byte[] serialize(Map<String, PersistedJobState> states) throws IOException {
        Map<String, StateEntry> raw = new TreeMap<>();
        states.forEach((name, s) -> raw.put(name, StateEntry.of(s)));
        return mapper.writeValueAsBytes(raw);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record StateEntry(
            @JsonProperty("next_fire_time") Instant nextFireTime,
            @JsonProperty("last_fire_time") Instant lastFireTime,
            @JsonProperty("run_count") long runCount,
            @JsonProperty("once_target") Instant onceTarget,
            @JsonProperty("last_slot") Instant lastSlot
    ) {
        static StateEntry of(PersistedJobState s) {
            return new StateEntry(s.nextFireTime(), s.lastFireTime(), s.runCount(), s.onceTarget(), s.lastSlot());
        }

        PersistedJobState toState() {
            return new PersistedJobState(nextFireTime, lastFireTime, runCount, onceTarget, lastSlot);
        }
    }
}

package net.schedra.adapter.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import net.schedra.core.spi.PersistenceException;
import net.schedra.core.spi.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 스케줄 파일(YAML). 최상위는 {@code schedule:} 키 아래에 잡 매핑을 둔다.
 * 읽을 때는 감싸지 않은 매핑도 받는다.
 */
public final class YamlScheduleStore implements ScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(YamlScheduleStore.class);
    private static final TypeReference<LinkedHashMap<String, Object>> TYPE = new TypeReference<>() { };
    static final String ROOT_KEY = "schedule";

    private final Path file;
    private final ObjectMapper mapper;

    public YamlScheduleStore(Path file) {
        this.file = file;
        this.mapper = new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES))
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public Path file() { return file; }

    @Override
    public Map<String, Object> load() throws PersistenceException {
        if (!Files.exists(file)) return new LinkedHashMap<>();
        try {
            LinkedHashMap<String, Object> doc = mapper.readValue(file.toFile(), TYPE);
            if (doc == null) return new LinkedHashMap<>();
            Object inner = doc.get(ROOT_KEY);
            if (doc.size() == 1 && inner instanceof Map<?, ?> m) {
                Map<String, Object> jobs = new LinkedHashMap<>();
                m.forEach((k, v) -> jobs.put(String.valueOf(k), v));
                return jobs;
            }
            return doc;
        } catch (IOException e) {
            throw new PersistenceException("Failed to read schedule file " + file, e);
        }
    }

    @Override
    public void save(Map<String, Object> schedule) throws PersistenceException {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put(ROOT_KEY, schedule);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), doc);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved {} scheduled jobs to {}", schedule.size(), file);
        } catch (IOException e) {
            throw new PersistenceException("Failed to write schedule file " + file, e);
        }
    }
}

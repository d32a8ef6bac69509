package net.schedra.adapter.file;

import net.schedra.core.model.PersistedJobState;
import net.schedra.core.spi.PersistenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileStatePersistenceTest {

    @TempDir
    Path dir;

    @Test
    void missing_file_loads_as_empty() throws Exception {
        JsonFileStatePersistence persistence = new JsonFileStatePersistence(dir.resolve("state.json"));

        assertThat(persistence.load()).isEmpty();
    }

    @Test
    void round_trip_is_byte_identical() throws Exception {
        Path file = dir.resolve("nested/state.json");
        JsonFileStatePersistence persistence = new JsonFileStatePersistence(file);
        Map<String, PersistedJobState> states = new LinkedHashMap<>();
        states.put("zeta", new PersistedJobState(Instant.parse("2017-11-29T16:00:00Z"), null, 0, null));
        states.put("alpha", new PersistedJobState(
                Instant.parse("2017-11-29T15:05:00Z"),
                Instant.parse("2017-11-29T15:00:00Z"),
                3,
                Instant.parse("2017-11-29T15:00:00Z"),
                Instant.parse("2017-11-29T14:30:00Z")));

        persistence.save(states);
        byte[] first = Files.readAllBytes(file);

        Map<String, PersistedJobState> loaded = persistence.load();
        assertThat(loaded).isEqualTo(states);
        assertThat(loaded.keySet()).containsExactly("alpha", "zeta");

        persistence.save(loaded);
        assertThat(Files.readAllBytes(file)).isEqualTo(first);
    }

    @Test
    void timestamps_are_written_as_iso_strings() throws Exception {
        Path file = dir.resolve("state.json");
        new JsonFileStatePersistence(file).save(Map.of("job1",
                new PersistedJobState(Instant.parse("2017-11-29T15:05:00Z"), null, 1, null)));

        String json = Files.readString(file);
        assertThat(json).contains("\"next_fire_time\" : \"2017-11-29T15:05:00Z\"");
        assertThat(json).contains("\"run_count\" : 1");
        assertThat(json).doesNotContain("once_target");
        assertThat(json).doesNotContain("last_slot");
    }

    @Test
    void corrupt_file_raises_persistence_exception() throws Exception {
        Path file = dir.resolve("state.json");
        Files.writeString(file, "{ not json");

        assertThatThrownBy(() -> new JsonFileStatePersistence(file).load())
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("state.json");
    }
}

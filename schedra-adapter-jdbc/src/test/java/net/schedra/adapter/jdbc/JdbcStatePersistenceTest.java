package net.schedra.adapter.jdbc;

import net.schedra.core.model.PersistedJobState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcStatePersistenceTest extends TestSupport {

    JdbcTxRunner tx;
    JdbcStatePersistence persistence;

    @BeforeEach
    void setUp() throws Exception {
        tx = new JdbcTxRunner(ds);
        persistence = new JdbcStatePersistence(tx);
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            st.executeUpdate("DELETE FROM TB_JOB_STATE");
        }
    }

    @Test
    void empty_table_loads_as_empty_map() throws Exception {
        assertTrue(persistence.load().isEmpty());
    }

    @Test
    void save_and_load_round_trip() throws Exception {
        Map<String, PersistedJobState> states = new TreeMap<>();
        states.put("job1", new PersistedJobState(
                Instant.parse("2017-11-29T15:05:00Z"), Instant.parse("2017-11-29T15:00:00Z"), 4, null,
                Instant.parse("2017-11-29T15:00:00Z")));
        states.put("once", new PersistedJobState(null, Instant.parse("2017-11-29T15:00:00Z"), 1,
                Instant.parse("2017-11-29T15:00:00Z")));

        persistence.save(states);

        assertEquals(states, persistence.load());
    }

    @Test
    void save_updates_existing_rows_and_removes_stale_ones() throws Exception {
        persistence.save(Map.of(
                "keep", new PersistedJobState(null, null, 1, null),
                "gone", new PersistedJobState(null, null, 2, null)));

        persistence.save(Map.of("keep", new PersistedJobState(Instant.parse("2017-11-29T16:00:00Z"), null, 5, null)));

        Map<String, PersistedJobState> loaded = persistence.load();
        assertEquals(1, loaded.size());
        assertEquals(5, loaded.get("keep").runCount());
        assertEquals(Instant.parse("2017-11-29T16:00:00Z"), loaded.get("keep").nextFireTime());
        assertNull(loaded.get("keep").onceTarget());
    }

    @Test
    void failed_body_rolls_back() throws Exception {
        persistence.save(Map.of("job1", new PersistedJobState(null, null, 1, null)));

        assertThrows(IllegalStateException.class, () -> tx.required(() -> {
            try (Statement st = TxContext.get().createStatement()) {
                st.executeUpdate("DELETE FROM TB_JOB_STATE");
            }
            throw new IllegalStateException("boom");
        }));

        assertEquals(1, persistence.load().size());
        assertNull(TxContext.get());
    }

    @Test
    void requires_new_restores_outer_connection() throws Exception {
        tx.required(() -> {
            Connection outer = TxContext.get();
            tx.requiresNew(() -> {
                assertTrue(TxContext.get() != outer);
                return null;
            });
            assertEquals(outer, TxContext.get());
            return null;
        });
    }
}

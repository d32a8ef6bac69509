package net.schedra.adapter.jdbc;

import net.schedra.adapter.jdbc.mapper.RowMappers;
import net.schedra.core.model.PersistedJobState;
import net.schedra.core.spi.PersistenceException;
import net.schedra.core.spi.StatePersistence;
import net.schedra.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * TB_JOB_STATE 에 잡 상태를 저장한다. save 는 한 트랜잭션에서
 * 전달된 잡을 MERGE 하고 목록에 없는 행을 지운다.
 */
public final class JdbcStatePersistence implements StatePersistence {
    private static final Logger log = LoggerFactory.getLogger(JdbcStatePersistence.class);

    private final TxRunner tx;

    public JdbcStatePersistence(TxRunner tx) { this.tx = tx; }

    @Override
    public Map<String, PersistedJobState> load() throws PersistenceException {
        try {
            return tx.required(() -> {
                Connection c = TxContext.require();
                Map<String, PersistedJobState> out = new TreeMap<>();
                try (PreparedStatement ps = c.prepareStatement("""
                        SELECT JOB_NAME, NEXT_FIRE_AT, LAST_FIRE_AT, RUN_COUNT, ONCE_TARGET, LAST_SLOT_AT
                          FROM TB_JOB_STATE
                         ORDER BY JOB_NAME
                        """);
                     ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.put(rs.getString("JOB_NAME"), RowMappers.toJobState(rs));
                }
                return out;
            });
        } catch (Exception e) {
            throw new PersistenceException("Failed to load job state from TB_JOB_STATE", e);
        }
    }

    @Override
    public void save(Map<String, PersistedJobState> states) throws PersistenceException {
        try {
            tx.required(() -> {
                Connection c = TxContext.require();
                // 1) upsert
                try (PreparedStatement ps = c.prepareStatement("""
                        MERGE INTO TB_JOB_STATE t
                        USING (SELECT ? AS JOB_NAME FROM DUAL) s
                           ON (t.JOB_NAME = s.JOB_NAME)
                        WHEN MATCHED THEN UPDATE
                             SET t.NEXT_FIRE_AT = ?, t.LAST_FIRE_AT = ?, t.RUN_COUNT = ?,
                                 t.ONCE_TARGET = ?, t.LAST_SLOT_AT = ?, t.UPDATED_AT = SYSTIMESTAMP
                        WHEN NOT MATCHED THEN INSERT
                             (JOB_NAME, NEXT_FIRE_AT, LAST_FIRE_AT, RUN_COUNT, ONCE_TARGET, LAST_SLOT_AT, UPDATED_AT)
                             VALUES (?, ?, ?, ?, ?, ?, SYSTIMESTAMP)
                        """)) {
                    for (Map.Entry<String, PersistedJobState> e : states.entrySet()) {
                        PersistedJobState s = e.getValue();
                        ps.setString(1, e.getKey());
                        JdbcUtil.setInstant(ps, 2, s.nextFireTime());
                        JdbcUtil.setInstant(ps, 3, s.lastFireTime());
                        ps.setLong(4, s.runCount());
                        JdbcUtil.setInstant(ps, 5, s.onceTarget());
                        JdbcUtil.setInstant(ps, 6, s.lastSlot());
                        ps.setString(7, e.getKey());
                        JdbcUtil.setInstant(ps, 8, s.nextFireTime());
                        JdbcUtil.setInstant(ps, 9, s.lastFireTime());
                        ps.setLong(10, s.runCount());
                        JdbcUtil.setInstant(ps, 11, s.onceTarget());
                        JdbcUtil.setInstant(ps, 12, s.lastSlot());
                        ps.addBatch();
                    }
                    if (!states.isEmpty()) ps.executeBatch();
                }

                // 2) 스케줄에서 빠진 잡 정리
                List<String> stale = new ArrayList<>();
                try (PreparedStatement ps = c.prepareStatement("SELECT JOB_NAME FROM TB_JOB_STATE");
                     ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String name = rs.getString(1);
                        if (!states.containsKey(name)) stale.add(name);
                    }
                }
                if (!stale.isEmpty()) {
                    try (PreparedStatement ps = c.prepareStatement("DELETE FROM TB_JOB_STATE WHERE JOB_NAME = ?")) {
                        for (String name : stale) {
                            ps.setString(1, name);
                            ps.addBatch();
                        }
                        ps.executeBatch();
                    }
                    log.debug("Removed {} stale job state rows", stale.size());
                }
                return null;
            });
        } catch (Exception e) {
            throw new PersistenceException("Failed to save job state to TB_JOB_STATE", e);
        }
    }
}

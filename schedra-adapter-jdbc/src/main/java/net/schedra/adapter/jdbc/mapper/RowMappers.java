package net.schedra.adapter.jdbc.mapper;

import net.schedra.adapter.jdbc.JdbcUtil;
import net.schedra.core.model.PersistedJobState;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- TB_JOB_STATE ---
    public static PersistedJobState toJobState(ResultSet rs) throws SQLException {
        return new PersistedJobState(
                JdbcUtil.toInstant(rs.getTimestamp("NEXT_FIRE_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_FIRE_AT")),
                rs.getLong("RUN_COUNT"),
                JdbcUtil.toInstant(rs.getTimestamp("ONCE_TARGET")),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_SLOT_AT"))
        );
    }
}

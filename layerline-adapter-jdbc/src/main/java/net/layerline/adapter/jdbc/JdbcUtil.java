package net.layerline.adapter.jdbc;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

public final class JdbcUtil {
    private JdbcUtil() {}

    /** PostgreSQL/H2 공통 unique 위반 */
    static final String UNIQUE_VIOLATION = "23505";

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static Integer getInteger(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    public static void setInteger(PreparedStatement ps, int index, Integer v) throws SQLException {
        if (v == null) ps.setNull(index, Types.INTEGER);
        else ps.setInt(index, v);
    }

    public static boolean isUniqueViolation(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (UNIQUE_VIOLATION.equals(cur.getSQLState())) return true;
        }
        return false;
    }
}

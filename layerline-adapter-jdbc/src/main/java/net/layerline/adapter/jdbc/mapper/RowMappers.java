package net.layerline.adapter.jdbc.mapper;

import net.layerline.adapter.jdbc.JdbcUtil;
import net.layerline.core.model.ArtifactRef;
import net.layerline.core.model.CacheEntry;
import net.layerline.core.model.Job;
import net.layerline.core.model.JobStatus;
import net.layerline.core.model.JobType;
import net.layerline.core.model.ResourceKey;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- Job ---
    public static Job toJob(ResultSet rs) throws SQLException {
        return new Job(
                rs.getString("ID"),
                JobType.from(rs.getString("JOB_TYPE")),
                ResourceKey.of(rs.getString("SOURCE_ID"), rs.getString("PROFILE_ID")),
                JobStatus.from(rs.getString("STATUS")),
                JsonColumns.read(rs.getString("INPUT_PARAMS")),
                rs.getString("OUTPUT_URL"),
                JsonColumns.read(rs.getString("OUTPUT_METADATA")),
                rs.getString("ERROR_MESSAGE"),
                rs.getInt("RETRY_COUNT"),
                rs.getInt("MAX_RETRIES"),
                JdbcUtil.getInteger(rs, "PROGRESS_PERCENT"),
                rs.getString("PROGRESS_TEXT"),
                rs.getLong("VERSION"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("STARTED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("COMPLETED_AT")),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- CacheEntry ---
    public static CacheEntry toCacheEntry(ResultSet rs) throws SQLException {
        return new CacheEntry(
                rs.getString("CACHE_KEY"),
                ResourceKey.of(rs.getString("SOURCE_ID"), rs.getString("PROFILE_ID")),
                new ArtifactRef(rs.getString("ARTIFACT_URL"), JsonColumns.read(rs.getString("METADATA"))),
                rs.getTimestamp("CREATED_AT").toInstant()
        );
    }
}

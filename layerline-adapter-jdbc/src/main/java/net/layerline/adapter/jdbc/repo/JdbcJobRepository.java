package net.layerline.adapter.jdbc.repo;

import net.layerline.adapter.jdbc.JdbcUtil;
import net.layerline.adapter.jdbc.TxContext;
import net.layerline.adapter.jdbc.mapper.JsonColumns;
import net.layerline.adapter.jdbc.mapper.RowMappers;
import net.layerline.core.model.Job;
import net.layerline.core.model.JobStatus;
import net.layerline.core.model.ResourceKey;
import net.layerline.core.spi.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcJobRepository implements JobRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    static final int MAX_CREATE_ATTEMPTS = 3;

    /**
     * ACTIVE_KEY unique 제약으로 "활성 Job 이 없을 때만 INSERT" 를 원자적으로 만든다.
     * 충돌하면 savepoint 로 되돌리고 기존 활성 Job 을 돌려준다.
     */
    @Override
    public CreateOutcome createIfNoActive(Job candidate) throws Exception {
        Connection c = TxContext.required();
        for (int attempt = 1; attempt <= MAX_CREATE_ATTEMPTS; attempt++) {
            Savepoint sp = c.setSavepoint();
            try {
                insert(c, candidate);
                c.releaseSavepoint(sp);
                return new CreateOutcome(candidate, true);
            } catch (SQLException e) {
                if (!JdbcUtil.isUniqueViolation(e)) throw e;
                c.rollback(sp);
            }
            Optional<Job> active = findActiveByResourceKey(candidate.resourceKey());
            if (active.isPresent()) return new CreateOutcome(active.get(), false);
            // 그 사이 활성 Job 이 종결됨. 다시 시도
            log.debug("active job for {} vanished; retrying insert (attempt {})", candidate.resourceKey(), attempt);
        }
        throw new IllegalStateException("could not create job for " + candidate.resourceKey());
    }

    private void insert(Connection c, Job j) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_JOB (ID, JOB_TYPE, RESOURCE_KEY, SOURCE_ID, PROFILE_ID, ACTIVE_KEY, STATUS,
                                    INPUT_PARAMS, OUTPUT_URL, OUTPUT_METADATA, ERROR_MESSAGE,
                                    RETRY_COUNT, MAX_RETRIES, PROGRESS_PERCENT, PROGRESS_TEXT, VERSION,
                                    CREATED_AT, STARTED_AT, COMPLETED_AT, UPDATED_AT)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """)) {
            int i = 1;
            ps.setString(i++, j.id());
            ps.setString(i++, j.type().code());
            ps.setString(i++, j.resourceKey().value());
            ps.setString(i++, j.resourceKey().sourceId());
            ps.setString(i++, j.resourceKey().profileId());
            ps.setString(i++, activeKey(j));
            ps.setString(i++, j.status().code());
            ps.setString(i++, JsonColumns.write(j.inputParams()));
            ps.setString(i++, j.outputUrl());
            ps.setString(i++, JsonColumns.write(j.outputMetadata()));
            ps.setString(i++, j.errorMessage());
            ps.setInt(i++, j.retryCount());
            ps.setInt(i++, j.maxRetries());
            JdbcUtil.setInteger(ps, i++, j.progressPercent());
            ps.setString(i++, j.progressText());
            ps.setLong(i++, j.version());
            ps.setTimestamp(i++, JdbcUtil.ts(j.createdAt()));
            ps.setTimestamp(i++, JdbcUtil.ts(j.startedAt()));
            ps.setTimestamp(i++, JdbcUtil.ts(j.completedAt()));
            ps.setTimestamp(i++, JdbcUtil.ts(j.updatedAt()));
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<Job> findById(String id) throws Exception {
        try (PreparedStatement ps = TxContext.required().prepareStatement("""
                SELECT *
                FROM TB_JOB
                WHERE ID = ?
            """)) {
            ps.setString(1, id);
            return one(ps);
        }
    }

    @Override
    public Optional<Job> findActiveByResourceKey(ResourceKey key) throws Exception {
        try (PreparedStatement ps = TxContext.required().prepareStatement("""
                SELECT *
                FROM TB_JOB
                WHERE ACTIVE_KEY = ?
            """)) {
            ps.setString(1, key.value());
            return one(ps);
        }
    }

    @Override
    public boolean update(Job next, long expectedVersion) throws Exception {
        try (PreparedStatement ps = TxContext.required().prepareStatement("""
                UPDATE TB_JOB
                   SET STATUS           = ?,
                       ACTIVE_KEY       = ?,
                       OUTPUT_URL       = ?,
                       OUTPUT_METADATA  = ?,
                       ERROR_MESSAGE    = ?,
                       RETRY_COUNT      = ?,
                       PROGRESS_PERCENT = ?,
                       PROGRESS_TEXT    = ?,
                       VERSION          = ?,
                       STARTED_AT       = ?,
                       COMPLETED_AT     = ?,
                       UPDATED_AT       = ?
                 WHERE ID = ?
                   AND VERSION = ?
                   AND STATUS IN ('pending', 'processing')
            """)) {
            int i = 1;
            ps.setString(i++, next.status().code());
            ps.setString(i++, activeKey(next));
            ps.setString(i++, next.outputUrl());
            ps.setString(i++, JsonColumns.write(next.outputMetadata()));
            ps.setString(i++, next.errorMessage());
            ps.setInt(i++, next.retryCount());
            JdbcUtil.setInteger(ps, i++, next.progressPercent());
            ps.setString(i++, next.progressText());
            ps.setLong(i++, next.version());
            ps.setTimestamp(i++, JdbcUtil.ts(next.startedAt()));
            ps.setTimestamp(i++, JdbcUtil.ts(next.completedAt()));
            ps.setTimestamp(i++, JdbcUtil.ts(next.updatedAt()));
            ps.setString(i++, next.id());
            ps.setLong(i++, expectedVersion);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public List<Job> findUpdatedAfter(Instant since, String afterId, int limit) throws Exception {
        try (PreparedStatement ps = TxContext.required().prepareStatement("""
                SELECT *
                FROM TB_JOB
                WHERE UPDATED_AT > ?
                   OR (UPDATED_AT = ? AND ID > ?)
                ORDER BY UPDATED_AT ASC, ID ASC
                FETCH FIRST ? ROWS ONLY
            """)) {
            ps.setTimestamp(1, JdbcUtil.ts(since));
            ps.setTimestamp(2, JdbcUtil.ts(since));
            ps.setString(3, afterId);
            ps.setInt(4, limit);
            return list(ps);
        }
    }

    @Override
    public List<Job> findByStatusOlderThan(JobStatus status, Instant threshold, int limit) throws Exception {
        try (PreparedStatement ps = TxContext.required().prepareStatement("""
                SELECT *
                FROM TB_JOB
                WHERE STATUS = ?
                  AND UPDATED_AT < ?
                ORDER BY UPDATED_AT ASC
                FETCH FIRST ? ROWS ONLY
            """)) {
            ps.setString(1, status.code());
            ps.setTimestamp(2, JdbcUtil.ts(threshold));
            ps.setInt(3, limit);
            return list(ps);
        }
    }

    private static String activeKey(Job j) {
        return j.isTerminal() ? null : j.resourceKey().value();
    }

    private static Optional<Job> one(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) return Optional.empty();
            return Optional.of(RowMappers.toJob(rs));
        }
    }

    private static List<Job> list(PreparedStatement ps) throws SQLException {
        List<Job> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toJob(rs));
        }
        return out;
    }
}

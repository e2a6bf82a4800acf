package net.layerline.adapter.jdbc.repo;

import net.layerline.adapter.jdbc.JdbcUtil;
import net.layerline.adapter.jdbc.TxContext;
import net.layerline.adapter.jdbc.mapper.JsonColumns;
import net.layerline.adapter.jdbc.mapper.RowMappers;
import net.layerline.core.model.CacheEntry;
import net.layerline.core.spi.CacheIndexRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.Optional;

public final class JdbcCacheIndexRepository implements CacheIndexRepository {

    @Override
    public Optional<CacheEntry> find(String cacheKey) throws Exception {
        try (PreparedStatement ps = TxContext.required().prepareStatement("""
                SELECT *
                FROM TB_ARTIFACT_CACHE
                WHERE CACHE_KEY = ?
            """)) {
            ps.setString(1, cacheKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toCacheEntry(rs));
            }
        }
    }

    /** UPDATE 후 없으면 INSERT. 동시 INSERT 충돌이면 UPDATE 로 덮어쓴다 */
    @Override
    public void upsert(CacheEntry e) throws Exception {
        Connection c = TxContext.required();
        if (updateRow(c, e) > 0) return;
        Savepoint sp = c.setSavepoint();
        try {
            insertRow(c, e);
            c.releaseSavepoint(sp);
        } catch (SQLException ex) {
            if (!JdbcUtil.isUniqueViolation(ex)) throw ex;
            c.rollback(sp);
            updateRow(c, e);
        }
    }

    private int updateRow(Connection c, CacheEntry e) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE TB_ARTIFACT_CACHE
                   SET SOURCE_ID    = ?,
                       PROFILE_ID   = ?,
                       ARTIFACT_URL = ?,
                       METADATA     = ?,
                       CREATED_AT   = ?
                 WHERE CACHE_KEY = ?
            """)) {
            ps.setString(1, e.resourceKey().sourceId());
            ps.setString(2, e.resourceKey().profileId());
            ps.setString(3, e.artifact().url());
            ps.setString(4, JsonColumns.write(e.artifact().metadata()));
            ps.setTimestamp(5, JdbcUtil.ts(e.createdAt()));
            ps.setString(6, e.cacheKey());
            return ps.executeUpdate();
        }
    }

    private void insertRow(Connection c, CacheEntry e) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_ARTIFACT_CACHE (CACHE_KEY, SOURCE_ID, PROFILE_ID, ARTIFACT_URL, METADATA, CREATED_AT)
                VALUES (?, ?, ?, ?, ?, ?)
            """)) {
            ps.setString(1, e.cacheKey());
            ps.setString(2, e.resourceKey().sourceId());
            ps.setString(3, e.resourceKey().profileId());
            ps.setString(4, e.artifact().url());
            ps.setString(5, JsonColumns.write(e.artifact().metadata()));
            ps.setTimestamp(6, JdbcUtil.ts(e.createdAt()));
            ps.executeUpdate();
        }
    }

    @Override
    public int deleteBySourceId(String sourceId) throws Exception {
        try (PreparedStatement ps = TxContext.required().prepareStatement("""
                DELETE FROM TB_ARTIFACT_CACHE
                WHERE SOURCE_ID = ?
            """)) {
            ps.setString(1, sourceId);
            return ps.executeUpdate();
        }
    }

    @Override
    public int delete(String cacheKey) throws Exception {
        try (PreparedStatement ps = TxContext.required().prepareStatement("""
                DELETE FROM TB_ARTIFACT_CACHE
                WHERE CACHE_KEY = ?
            """)) {
            ps.setString(1, cacheKey);
            return ps.executeUpdate();
        }
    }
}

package com.anodi.db;

import com.anodi.util.SparseCountsCodec;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;

public class HistogramLevelDao {

    /**
     * One stored resolution level.
     */
    public static class StoredLevel {
        public final int factor;
        public final int height;
        public final int width;
        public final int[] counts;

        public StoredLevel(int factor, int height, int width, int[] counts) {
            this.factor = factor;
            this.height = height;
            this.width = width;
            this.counts = counts;
        }
    }

    private final String dbPath;

    public HistogramLevelDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public List<StoredLevel> loadLevels(long imageId, String signature) throws SQLException {
        String sql = "SELECT factor, level_height, level_width, counts_blob FROM histogram_level " +
                "WHERE image_id = ? AND signature = ? ORDER BY id";
        List<StoredLevel> levels = new ArrayList<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, imageId);
            ps.setString(2, signature);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    levels.add(new StoredLevel(
                            rs.getInt("factor"),
                            rs.getInt("level_height"),
                            rs.getInt("level_width"),
                            SparseCountsCodec.fromBytes(rs.getBytes("counts_blob"))));
                }
            }
        }
        return levels;
    }

    public void upsertLevels(long imageId, String signature, List<StoredLevel> levels) throws SQLException {
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO histogram_level " +
                "(image_id, signature, factor, level_height, level_width, counts_blob, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(image_id, signature, factor) DO UPDATE SET " +
                "level_height = excluded.level_height, level_width = excluded.level_width, " +
                "counts_blob = excluded.counts_blob, created_ts = excluded.created_ts";

        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (StoredLevel level : levels) {
                    ps.setLong(1, imageId);
                    ps.setString(2, signature);
                    ps.setInt(3, level.factor);
                    ps.setInt(4, level.height);
                    ps.setInt(5, level.width);
                    ps.setBytes(6, SparseCountsCodec.toBytes(level.counts));
                    ps.setLong(7, now);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    public int deleteBySignature(String signature) throws SQLException {
        String sql = "DELETE FROM histogram_level WHERE signature = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, signature);
            return ps.executeUpdate();
        }
    }

    public int deleteByImage(long imageId) throws SQLException {
        String sql = "DELETE FROM histogram_level WHERE image_id = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, imageId);
            return ps.executeUpdate();
        }
    }
}

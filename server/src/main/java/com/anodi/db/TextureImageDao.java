package com.anodi.db;

import java.sql.*;
import java.util.Optional;

public class TextureImageDao {

    private final String dbPath;

    public TextureImageDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public TextureImage getOrCreateByHash(String contentHash, int height, int width) throws SQLException {
        try (Connection conn = connect()) {
            Optional<TextureImage> existing = findByHashInternal(conn, contentHash);
            if (existing.isPresent()) {
                return existing.get();
            }

            long now = System.currentTimeMillis();
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO texture_image (content_hash, height, width, created_ts) VALUES (?, ?, ?, ?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, contentHash);
                ps.setInt(2, height);
                ps.setInt(3, width);
                ps.setLong(4, now);
                ps.executeUpdate();

                try (ResultSet rs = ps.getGeneratedKeys()) {
                    if (rs.next()) {
                        return new TextureImage(rs.getLong(1), contentHash, height, width, now);
                    } else {
                        throw new SQLException("Creating texture_image failed, no ID obtained.");
                    }
                }
            } catch (SQLException e) {
                // Another writer inserted the same content in between
                if (e.getMessage() != null && e.getMessage().contains("UNIQUE constraint failed")) {
                    return findByHashInternal(conn, contentHash)
                            .orElseThrow(() -> new SQLException(
                                    "Failed to find image after UNIQUE constraint violation", e));
                }
                throw e;
            }
        }
    }

    public Optional<TextureImage> findByHash(String contentHash) throws SQLException {
        try (Connection conn = connect()) {
            return findByHashInternal(conn, contentHash);
        }
    }

    private Optional<TextureImage> findByHashInternal(Connection conn, String contentHash) throws SQLException {
        String sql = "SELECT id, content_hash, height, width, created_ts FROM texture_image WHERE content_hash = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, contentHash);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new TextureImage(
                            rs.getLong("id"),
                            rs.getString("content_hash"),
                            rs.getInt("height"),
                            rs.getInt("width"),
                            rs.getLong("created_ts")));
                }
            }
        }
        return Optional.empty();
    }
}

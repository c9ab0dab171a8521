package com.anodi.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                // One row per distinct image content
                stmt.execute("CREATE TABLE IF NOT EXISTS texture_image (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "content_hash TEXT NOT NULL UNIQUE, " +
                        "height INTEGER NOT NULL, " +
                        "width INTEGER NOT NULL, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                // Raw pattern counts of one resolution level
                stmt.execute("CREATE TABLE IF NOT EXISTS histogram_level (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "image_id INTEGER NOT NULL, " +
                        "signature TEXT NOT NULL, " +
                        "factor INTEGER NOT NULL, " +
                        "level_height INTEGER NOT NULL, " +
                        "level_width INTEGER NOT NULL, " +
                        "counts_blob BLOB NOT NULL, " +
                        "created_ts INTEGER NOT NULL, " +
                        "UNIQUE (image_id, signature, factor), " +
                        "FOREIGN KEY (image_id) REFERENCES texture_image(id) ON DELETE CASCADE" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_histogram_lookup " +
                        "ON histogram_level (signature, image_id);");
            }
        }
    }
}

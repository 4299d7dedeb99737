package com.edgehistogram.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the descriptor cache schema. Vectors are addressed by the SHA-256
 * of the image samples plus the descriptor part and every configuration
 * field, so identical images share rows regardless of where they came from.
 */
public class SqliteInitializer {

    static final int SCHEMA_VERSION = 2;

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                // Version 1 keyed rows by file path and a packed type string
                if (schemaVersion(stmt) < SCHEMA_VERSION) {
                    stmt.execute("DROP TABLE IF EXISTS descriptor_result;");
                    stmt.execute("DROP TABLE IF EXISTS image_entry;");
                }

                stmt.execute("CREATE TABLE IF NOT EXISTS descriptor_result (" +
                        "image_hash TEXT NOT NULL, " +
                        "part TEXT NOT NULL, " +
                        "threshold REAL NOT NULL, " +
                        "normalize INTEGER NOT NULL, " +
                        "horizontal_blocks INTEGER NOT NULL, " +
                        "vertical_blocks INTEGER NOT NULL, " +
                        "version TEXT NOT NULL, " +
                        "vector_length INTEGER NOT NULL, " +
                        "vector_blob BLOB NOT NULL, " +
                        "created_ts INTEGER NOT NULL, " +
                        "PRIMARY KEY (image_hash, part, threshold, normalize, " +
                        "horizontal_blocks, vertical_blocks, version)" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_descriptor_config " +
                        "ON descriptor_result (part, threshold, normalize, horizontal_blocks, " +
                        "vertical_blocks, version);");

                stmt.execute("PRAGMA user_version = " + SCHEMA_VERSION + ";");
            }
        }
    }

    private static int schemaVersion(Statement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery("PRAGMA user_version;")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }
}

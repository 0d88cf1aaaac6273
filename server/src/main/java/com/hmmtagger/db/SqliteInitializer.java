package com.hmmtagger.db;

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

                // one row per distinct observation sequence
                stmt.execute("CREATE TABLE IF NOT EXISTS observation_sequence (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "sequence_text TEXT NOT NULL UNIQUE, " +
                        "sequence_hash TEXT, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                // forward scaling coefficients per sequence and model
                stmt.execute("CREATE TABLE IF NOT EXISTS forward_result (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "sequence_id INTEGER NOT NULL, " +
                        "model_name TEXT NOT NULL, " +
                        "model_version TEXT NOT NULL, " +
                        "scores_blob BLOB NOT NULL, " +
                        "created_ts INTEGER NOT NULL, " +
                        "UNIQUE (sequence_id, model_name, model_version), " +
                        "FOREIGN KEY (sequence_id) REFERENCES observation_sequence(id) ON DELETE CASCADE" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_forward_lookup " +
                        "ON forward_result (model_name, model_version, sequence_id);");
            }
        }
    }
}

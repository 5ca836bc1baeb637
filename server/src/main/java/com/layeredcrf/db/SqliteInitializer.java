package com.layeredcrf.db;

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

                // Label-pair counts of trained co-occurrence models
                stmt.execute("CREATE TABLE IF NOT EXISTS edge_model (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "model_name TEXT NOT NULL, " +
                        "model_kind TEXT NOT NULL, " +
                        "rows_count INTEGER NOT NULL, " +
                        "cols_count INTEGER NOT NULL, " +
                        "counts_blob BLOB NOT NULL, " +
                        "created_ts INTEGER NOT NULL, " +
                        "UNIQUE (model_name, model_kind)" +
                        ");");
            }
        }
    }
}

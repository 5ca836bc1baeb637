package com.layeredcrf.db;

import com.layeredcrf.util.DoubleArrayCodec;

import java.sql.*;
import java.util.Optional;

public class EdgeModelDao {

    private final String dbPath;

    public EdgeModelDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public Optional<StoredCounts> loadCounts(String modelName, ModelKind kind) throws SQLException {
        String sql = "SELECT rows_count, cols_count, counts_blob, created_ts FROM edge_model " +
                "WHERE model_name = ? AND model_kind = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, modelName);
            ps.setString(2, kind.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    double[] counts = DoubleArrayCodec.fromBytes(rs.getBytes("counts_blob"));
                    return Optional.of(new StoredCounts(modelName, kind, rs.getInt("rows_count"),
                            rs.getInt("cols_count"), counts, rs.getLong("created_ts")));
                }
            }
        }
        return Optional.empty();
    }

    public void upsertCounts(String modelName, ModelKind kind, int rows, int cols, double[] counts)
            throws SQLException {
        if (counts == null || counts.length != rows * cols) {
            throw new IllegalArgumentException("Expected " + (rows * cols) + " counts for a " + rows + "x" + cols
                    + " table");
        }
        byte[] blob = DoubleArrayCodec.toBytes(counts);
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO edge_model (model_name, model_kind, rows_count, cols_count, counts_blob, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(model_name, model_kind) DO UPDATE SET " +
                "rows_count = excluded.rows_count, cols_count = excluded.cols_count, " +
                "counts_blob = excluded.counts_blob, created_ts = excluded.created_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, modelName);
            ps.setString(2, kind.name());
            ps.setInt(3, rows);
            ps.setInt(4, cols);
            ps.setBytes(5, blob);
            ps.setLong(6, now);
            ps.executeUpdate();
        }
    }

    public void deleteModel(String modelName) throws SQLException {
        String sql = "DELETE FROM edge_model WHERE model_name = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, modelName);
            ps.executeUpdate();
        }
    }
}

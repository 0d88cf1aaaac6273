package com.hmmtagger.db;

import com.hmmtagger.util.DoubleArrayCodec;

import java.sql.*;
import java.util.Optional;

public class ForwardResultDao {

    private final String dbPath;

    public ForwardResultDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public Optional<double[]> loadScalingFactors(long sequenceId, String modelName, String modelVersion)
            throws SQLException {
        String sql = "SELECT scores_blob FROM forward_result " +
                "WHERE sequence_id = ? AND model_name = ? AND model_version = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, sequenceId);
            ps.setString(2, modelName);
            ps.setString(3, modelVersion);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(DoubleArrayCodec.fromBytes(rs.getBytes("scores_blob")));
                }
            }
        }
        return Optional.empty();
    }

    public void upsertScalingFactors(long sequenceId, String modelName, String modelVersion, double[] factors)
            throws SQLException {
        byte[] blob = DoubleArrayCodec.toBytes(factors);
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO forward_result (sequence_id, model_name, model_version, scores_blob, created_ts) " +
                "VALUES (?, ?, ?, ?, ?) " +
                "ON CONFLICT(sequence_id, model_name, model_version) DO UPDATE SET " +
                "scores_blob = excluded.scores_blob, created_ts = excluded.created_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, sequenceId);
            ps.setString(2, modelName);
            ps.setString(3, modelVersion);
            ps.setBytes(4, blob);
            ps.setLong(5, now);
            ps.executeUpdate();
        }
    }

    public int deleteByModel(String modelName, String modelVersion) throws SQLException {
        String sql = "DELETE FROM forward_result WHERE model_name = ? AND model_version = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, modelName);
            ps.setString(2, modelVersion);
            return ps.executeUpdate();
        }
    }
}

package com.hmmtagger.db;

import java.sql.*;
import java.util.Optional;

public class ObservationSequenceDao {

    private final String dbPath;

    public ObservationSequenceDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public ObservationSequence getOrCreate(String sequenceText, String sequenceHashOrNull) throws SQLException {
        try (Connection conn = connect()) {
            Optional<ObservationSequence> existing = findInternal(conn, sequenceText);
            if (existing.isPresent()) {
                return existing.get();
            }

            long now = System.currentTimeMillis();
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO observation_sequence (sequence_text, sequence_hash, created_ts) VALUES (?, ?, ?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, sequenceText);
                ps.setString(2, sequenceHashOrNull);
                ps.setLong(3, now);
                ps.executeUpdate();

                try (ResultSet rs = ps.getGeneratedKeys()) {
                    if (rs.next()) {
                        return new ObservationSequence(rs.getLong(1), sequenceText, sequenceHashOrNull, now);
                    }
                    throw new SQLException("Creating observation_sequence failed, no ID obtained.");
                }
            } catch (SQLException e) {
                // another writer inserted the same sequence in between
                if (e.getMessage() != null && e.getMessage().contains("UNIQUE constraint failed")) {
                    return findInternal(conn, sequenceText)
                            .orElseThrow(() -> new SQLException(
                                    "Failed to find sequence after UNIQUE constraint violation", e));
                }
                throw e;
            }
        }
    }

    public Optional<ObservationSequence> find(String sequenceText) throws SQLException {
        try (Connection conn = connect()) {
            return findInternal(conn, sequenceText);
        }
    }

    private Optional<ObservationSequence> findInternal(Connection conn, String sequenceText) throws SQLException {
        String sql = "SELECT id, sequence_text, sequence_hash, created_ts FROM observation_sequence "
                + "WHERE sequence_text = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, sequenceText);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new ObservationSequence(
                            rs.getLong("id"),
                            rs.getString("sequence_text"),
                            rs.getString("sequence_hash"),
                            rs.getLong("created_ts")));
                }
            }
        }
        return Optional.empty();
    }
}

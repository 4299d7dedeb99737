package com.edgehistogram.db;

import com.edgehistogram.server.descriptor.DescriptorPart;
import com.edgehistogram.server.descriptor.EhdConfig;
import com.edgehistogram.util.DoubleArrayCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.Optional;

/**
 * Cached descriptor vectors keyed by image content hash, part, configuration
 * and version.
 */
public class DescriptorResultDao {

    private static final Logger logger = LoggerFactory.getLogger(DescriptorResultDao.class);

    private static final String CONFIG_MATCH = "part = ? AND threshold = ? AND normalize = ? " +
            "AND horizontal_blocks = ? AND vertical_blocks = ? AND version = ?";

    private final String dbPath;

    public DescriptorResultDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    /**
     * Returns the stored vector, or empty when there is none or its length no
     * longer matches what the part and block counts produce.
     */
    public Optional<double[]> loadVector(String imageHash, DescriptorPart part, EhdConfig config, String version)
            throws SQLException {
        String sql = "SELECT vector_length, vector_blob FROM descriptor_result " +
                "WHERE image_hash = ? AND " + CONFIG_MATCH;
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, imageHash);
            bindConfig(ps, 2, part, config, version);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                int expected = part.vectorLength(config.getHorizontalBlockCount(), config.getVerticalBlockCount());
                double[] vector;
                try {
                    vector = DoubleArrayCodec.fromBytes(rs.getBytes("vector_blob"));
                } catch (IllegalArgumentException e) {
                    logger.warn("Ignoring corrupt cached {} vector for {}: {}", part.getId(), imageHash,
                            e.getMessage());
                    return Optional.empty();
                }
                if (rs.getInt("vector_length") != expected || vector == null || vector.length != expected) {
                    logger.warn("Ignoring cached {} vector for {} with length {}, expected {}",
                            part.getId(), imageHash, rs.getInt("vector_length"), expected);
                    return Optional.empty();
                }
                return Optional.of(vector);
            }
        }
    }

    public void upsertVector(String imageHash, DescriptorPart part, EhdConfig config, String version,
            double[] vector) throws SQLException {
        byte[] blob = DoubleArrayCodec.toBytes(vector);
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO descriptor_result " +
                "(image_hash, part, threshold, normalize, horizontal_blocks, vertical_blocks, version, " +
                "vector_length, vector_blob, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(image_hash, part, threshold, normalize, horizontal_blocks, vertical_blocks, version) " +
                "DO UPDATE SET vector_length = excluded.vector_length, " +
                "vector_blob = excluded.vector_blob, created_ts = excluded.created_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, imageHash);
            bindConfig(ps, 2, part, config, version);
            ps.setInt(8, vector.length);
            ps.setBytes(9, blob);
            ps.setLong(10, now);
            ps.executeUpdate();
        }
    }

    /**
     * Deletes the vectors of one part and configuration, for every image.
     */
    public int deleteByConfiguration(DescriptorPart part, EhdConfig config, String version) throws SQLException {
        String sql = "DELETE FROM descriptor_result WHERE " + CONFIG_MATCH;
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            bindConfig(ps, 1, part, config, version);
            return ps.executeUpdate();
        }
    }

    public int deleteByImage(String imageHash) throws SQLException {
        String sql = "DELETE FROM descriptor_result WHERE image_hash = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, imageHash);
            return ps.executeUpdate();
        }
    }

    public int deleteAll() throws SQLException {
        try (Connection conn = connect();
                Statement stmt = conn.createStatement()) {
            return stmt.executeUpdate("DELETE FROM descriptor_result");
        }
    }

    /**
     * Number of cached vectors for one part and configuration.
     */
    public int countByConfiguration(DescriptorPart part, EhdConfig config, String version) throws SQLException {
        String sql = "SELECT COUNT(*) FROM descriptor_result WHERE " + CONFIG_MATCH;
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            bindConfig(ps, 1, part, config, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private static void bindConfig(PreparedStatement ps, int first, DescriptorPart part, EhdConfig config,
            String version) throws SQLException {
        ps.setString(first, part.getId());
        ps.setDouble(first + 1, config.getThreshold());
        ps.setInt(first + 2, config.isNormalize() ? 1 : 0);
        ps.setInt(first + 3, config.getHorizontalBlockCount());
        ps.setInt(first + 4, config.getVerticalBlockCount());
        ps.setString(first + 5, version);
    }
}

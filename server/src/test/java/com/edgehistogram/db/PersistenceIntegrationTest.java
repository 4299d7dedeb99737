package com.edgehistogram.db;

import com.edgehistogram.server.descriptor.DescriptorPart;
import com.edgehistogram.server.descriptor.EhdConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

public class PersistenceIntegrationTest {

    private static final EhdConfig NORMALIZED = new EhdConfig(50.0, true, 4, 4);

    @TempDir
    Path tempDir;

    private String db;
    private DescriptorResultDao resultDao;

    @BeforeEach
    public void setup() throws SQLException {
        db = tempDir.resolve("test_cache.db").toString();
        SqliteInitializer.initialize(db);
        // initializing twice must be harmless
        SqliteInitializer.initialize(db);
        resultDao = new DescriptorResultDao(db);
    }

    @Test
    public void testDescriptorResultCrud() throws SQLException {
        double[] vector = { 0.1, 0.2, 0.3, 0.4, 0.5 };

        resultDao.upsertVector("h1", DescriptorPart.GLOBAL, NORMALIZED, "v1", vector);

        Optional<double[]> loaded = resultDao.loadVector("h1", DescriptorPart.GLOBAL, NORMALIZED, "v1");
        Assertions.assertTrue(loaded.isPresent());
        Assertions.assertArrayEquals(vector, loaded.get(), 0.0001);

        // Update
        double[] vector2 = { 0.9, 0.8, 0.7, 0.6, 0.5 };
        resultDao.upsertVector("h1", DescriptorPart.GLOBAL, NORMALIZED, "v1", vector2);
        loaded = resultDao.loadVector("h1", DescriptorPart.GLOBAL, NORMALIZED, "v1");
        Assertions.assertArrayEquals(vector2, loaded.get(), 0.0001);
        Assertions.assertEquals(1, resultDao.countByConfiguration(DescriptorPart.GLOBAL, NORMALIZED, "v1"));

        // every key column separates rows
        Assertions.assertFalse(resultDao.loadVector("h2", DescriptorPart.GLOBAL, NORMALIZED, "v1").isPresent());
        Assertions.assertFalse(resultDao.loadVector("h1", DescriptorPart.GLOBAL, NORMALIZED, "v2").isPresent());
        Assertions.assertFalse(resultDao.loadVector("h1", DescriptorPart.GLOBAL,
                NORMALIZED.withNormalize(false), "v1").isPresent());
        Assertions.assertFalse(resultDao.loadVector("h1", DescriptorPart.GLOBAL,
                NORMALIZED.withThreshold(50.5), "v1").isPresent());

        // Delete
        Assertions.assertEquals(1, resultDao.deleteByConfiguration(DescriptorPart.GLOBAL, NORMALIZED, "v1"));
        Assertions.assertFalse(resultDao.loadVector("h1", DescriptorPart.GLOBAL, NORMALIZED, "v1").isPresent());
    }

    @Test
    public void testBlockCountsAreSeparateRows() throws SQLException {
        EhdConfig wide = NORMALIZED.withBlockCounts(8, 4);
        EhdConfig tall = NORMALIZED.withBlockCounts(4, 8);
        resultDao.upsertVector("h1", DescriptorPart.BLOCKS, wide, "v1", new double[160]);
        resultDao.upsertVector("h1", DescriptorPart.BLOCKS, tall, "v1", new double[160]);

        Assertions.assertEquals(1, resultDao.countByConfiguration(DescriptorPart.BLOCKS, wide, "v1"));
        Assertions.assertEquals(1, resultDao.deleteByConfiguration(DescriptorPart.BLOCKS, tall, "v1"));
        Assertions.assertTrue(resultDao.loadVector("h1", DescriptorPart.BLOCKS, wide, "v1").isPresent());
    }

    @Test
    public void testVectorOfUnexpectedLengthIsIgnored() throws SQLException {
        // semi-local with 4x4 blocks is 65 values
        resultDao.upsertVector("h1", DescriptorPart.SEMI_LOCAL, NORMALIZED, "v1", new double[64]);
        Assertions.assertFalse(resultDao.loadVector("h1", DescriptorPart.SEMI_LOCAL, NORMALIZED, "v1").isPresent());

        resultDao.upsertVector("h1", DescriptorPart.SEMI_LOCAL, NORMALIZED, "v1", new double[65]);
        Assertions.assertTrue(resultDao.loadVector("h1", DescriptorPart.SEMI_LOCAL, NORMALIZED, "v1").isPresent());
    }

    @Test
    public void testDeleteByImageAndAll() throws SQLException {
        resultDao.upsertVector("a", DescriptorPart.GLOBAL, NORMALIZED, "v1", new double[5]);
        resultDao.upsertVector("a", DescriptorPart.GLOBAL, NORMALIZED, "v2", new double[5]);
        resultDao.upsertVector("b", DescriptorPart.GLOBAL, NORMALIZED, "v1", new double[5]);
        resultDao.upsertVector("b", DescriptorPart.FULL, NORMALIZED, "v1", new double[150]);

        Assertions.assertEquals(2, resultDao.deleteByImage("a"));
        Assertions.assertTrue(resultDao.loadVector("b", DescriptorPart.GLOBAL, NORMALIZED, "v1").isPresent());
        Assertions.assertEquals(2, resultDao.deleteAll());
        Assertions.assertEquals(0, resultDao.countByConfiguration(DescriptorPart.GLOBAL, NORMALIZED, "v1"));
    }

    @Test
    public void testOlderSchemaIsReplaced() throws SQLException {
        String old = tempDir.resolve("old_cache.db").toString();
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + old);
                Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE image_entry (id INTEGER PRIMARY KEY, image_key TEXT)");
            stmt.execute("CREATE TABLE descriptor_result (id INTEGER PRIMARY KEY, image_id INTEGER, " +
                    "descriptor_type TEXT, descriptor_version TEXT, vector_blob BLOB)");
        }

        SqliteInitializer.initialize(old);

        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + old);
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(
                        "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = 'image_entry'")) {
            Assertions.assertTrue(rs.next());
            Assertions.assertEquals(0, rs.getInt(1));
        }
        DescriptorResultDao dao = new DescriptorResultDao(old);
        dao.upsertVector("h", DescriptorPart.GLOBAL, NORMALIZED, "v1", new double[5]);
        Assertions.assertTrue(dao.loadVector("h", DescriptorPart.GLOBAL, NORMALIZED, "v1").isPresent());
    }
}

package com.layeredcrf.db;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Optional;

public class EdgeModelDaoTest {

    @TempDir
    Path tempDir;

    private EdgeModelDao dao;

    @BeforeEach
    public void setup() throws SQLException {
        String dbPath = tempDir.resolve("edge_models.db").toString();
        SqliteInitializer.initialize(dbPath);
        // second run must be harmless
        SqliteInitializer.initialize(dbPath);
        dao = new EdgeModelDao(dbPath);
    }

    @Test
    public void testCountsCrud() throws SQLException {
        double[] counts = { 10, 2, 2, 30 };
        dao.upsertCounts("street", ModelKind.EDGE, 2, 2, counts);

        Optional<StoredCounts> loaded = dao.loadCounts("street", ModelKind.EDGE);
        Assertions.assertTrue(loaded.isPresent());
        Assertions.assertEquals(2, loaded.get().getRows());
        Assertions.assertEquals(2, loaded.get().getCols());
        Assertions.assertArrayEquals(counts, loaded.get().getCounts(), 0.0001);

        // Same name, other kind
        Assertions.assertFalse(dao.loadCounts("street", ModelKind.LINK).isPresent());

        // Update
        double[] counts2 = { 1, 2, 3, 4, 5, 6 };
        dao.upsertCounts("street", ModelKind.EDGE, 2, 3, counts2);
        loaded = dao.loadCounts("street", ModelKind.EDGE);
        Assertions.assertEquals(3, loaded.get().getCols());
        Assertions.assertArrayEquals(counts2, loaded.get().getCounts(), 0.0001);

        // Delete removes every kind
        dao.upsertCounts("street", ModelKind.LINK, 1, 1, new double[] { 9 });
        dao.deleteModel("street");
        Assertions.assertFalse(dao.loadCounts("street", ModelKind.EDGE).isPresent());
        Assertions.assertFalse(dao.loadCounts("street", ModelKind.LINK).isPresent());
    }

    @Test
    public void testShapeMismatchRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> dao.upsertCounts("bad", ModelKind.EDGE, 2, 2, new double[] { 1, 2, 3 }));
    }
}

package com.hmmtagger.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.sql.SQLException;
import java.util.Optional;

public class PersistenceIntegrationTest {

    private static final String TEST_DB = "test_hmm_cache.db";
    private ObservationSequenceDao sequenceDao;
    private ForwardResultDao resultDao;

    @BeforeEach
    public void setup() throws SQLException {
        deleteDbFiles();
        SqliteInitializer.initialize(TEST_DB);
        sequenceDao = new ObservationSequenceDao(TEST_DB);
        resultDao = new ForwardResultDao(TEST_DB);
    }

    @AfterEach
    public void teardown() {
        deleteDbFiles();
    }

    private static void deleteDbFiles() {
        for (String suffix : new String[] { "", "-wal", "-shm" }) {
            File f = new File(TEST_DB + suffix);
            if (f.exists()) {
                f.delete();
            }
        }
    }

    @Test
    public void testObservationSequenceGetOrCreate() throws SQLException {
        ObservationSequence first = sequenceDao.getOrCreate("killer crazy clown", "h1");
        Assertions.assertEquals("killer crazy clown", first.getSequenceText());
        Assertions.assertEquals("h1", first.getSequenceHash());

        ObservationSequence again = sequenceDao.getOrCreate("killer crazy clown", "h1");
        Assertions.assertEquals(first.getId(), again.getId());

        Optional<ObservationSequence> found = sequenceDao.find("killer crazy clown");
        Assertions.assertTrue(found.isPresent());
        Assertions.assertEquals(first.getId(), found.get().getId());
        Assertions.assertFalse(sequenceDao.find("clown").isPresent());
    }

    @Test
    public void testForwardResultUpsertAndDelete() throws SQLException {
        ObservationSequence seq = sequenceDao.getOrCreate("o2 o3 o3", null);
        double[] factors = { 0.5, 0.5, 0.828 };

        resultDao.upsertScalingFactors(seq.getId(), "three-state", "v1", factors);
        Optional<double[]> loaded = resultDao.loadScalingFactors(seq.getId(), "three-state", "v1");
        Assertions.assertTrue(loaded.isPresent());
        Assertions.assertArrayEquals(factors, loaded.get(), 0.0);

        // other versions are separate entries
        Assertions.assertFalse(resultDao.loadScalingFactors(seq.getId(), "three-state", "v2").isPresent());

        double[] updated = { 0.25, 0.0 };
        resultDao.upsertScalingFactors(seq.getId(), "three-state", "v1", updated);
        Assertions.assertArrayEquals(updated, resultDao.loadScalingFactors(seq.getId(), "three-state", "v1").get(),
                0.0);

        Assertions.assertEquals(1, resultDao.deleteByModel("three-state", "v1"));
        Assertions.assertFalse(resultDao.loadScalingFactors(seq.getId(), "three-state", "v1").isPresent());
    }
}

package com.hmmtagger.server.service;

import com.hmmtagger.db.ForwardResultDao;
import com.hmmtagger.db.SqliteInitializer;
import com.hmmtagger.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.function.Supplier;

@Service
public class CacheControlService {

    private static final Logger logger = LoggerFactory.getLogger(CacheControlService.class);

    // resolved per call: the data directory comes from config loaded after startup
    private final Supplier<String> dbPath;

    @Autowired
    public CacheControlService(TaggerService taggerService) {
        this(() -> DataPathResolver.resolveDbPath(taggerService.getConfig().hmm_data_directory));
    }

    public CacheControlService(String dbPath) {
        this(() -> dbPath);
    }

    private CacheControlService(Supplier<String> dbPath) {
        this.dbPath = dbPath;
    }

    /**
     * Clears all cached forward results for a model name and version.
     * Use this when the training corpus changes without a version bump. A
     * missing database file is left missing.
     *
     * @return number of removed entries
     */
    public int clearModel(String modelName, String modelVersion) {
        String path = dbPath.get();
        if (!Files.exists(Paths.get(path))) {
            logger.info("No cache database at {}, nothing to clear for model {}/{}", path, modelName, modelVersion);
            return 0;
        }
        try {
            SqliteInitializer.initialize(path);
            int removed = new ForwardResultDao(path).deleteByModel(modelName, modelVersion);
            logger.info("Cleared {} cached results for model {}/{} in {}", removed, modelName, modelVersion, path);
            return removed;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear cache for " + modelName + "/" + modelVersion, e);
        }
    }
}

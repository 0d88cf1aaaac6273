package com.hmmtagger.server.ai;

import com.hmmtagger.db.ForwardResultDao;
import com.hmmtagger.db.ObservationSequence;
import com.hmmtagger.db.ObservationSequenceDao;
import com.hmmtagger.server.ai.inference.ForwardEvaluator;
import com.hmmtagger.server.ai.inference.ForwardResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Forward evaluation backed by the SQLite result cache. Entries are keyed by
 * the observation sequence and the model name/version, so retraining under a
 * new version never serves stale scores.
 */
public class CachedSequenceEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(CachedSequenceEvaluator.class);

    private final ForwardEvaluator delegate;
    private final String modelName;
    private final String modelVersion;
    private final ObservationSequenceDao sequenceDao;
    private final ForwardResultDao resultDao;

    public CachedSequenceEvaluator(ForwardEvaluator delegate, String modelName, String modelVersion,
            ObservationSequenceDao sequenceDao, ForwardResultDao resultDao) {
        this.delegate = delegate;
        this.modelName = modelName;
        this.modelVersion = modelVersion;
        this.sequenceDao = sequenceDao;
        this.resultDao = resultDao;
    }

    public ForwardResult forward(List<Observation> observations) {
        // stored entries are only ever served for sequences the model accepts
        delegate.resolve(observations);
        String key = sequenceKey(observations);
        try {
            ObservationSequence sequence = sequenceDao.getOrCreate(key, sha256(key));

            Optional<double[]> cached = resultDao.loadScalingFactors(sequence.getId(), modelName, modelVersion);
            if (cached.isPresent()) {
                logger.debug("Cache HIT for sequence {} model {}/{}", sequence.getId(), modelName, modelVersion);
                return new ForwardResult(cached.get());
            }

            logger.debug("Cache MISS for sequence {} model {}/{}", sequence.getId(), modelName, modelVersion);
            ForwardResult result = delegate.forward(observations);
            resultDao.upsertScalingFactors(sequence.getId(), modelName, modelVersion, result.getScalingFactors());
            return result;

        } catch (SQLException e) {
            logger.error("Database error in CachedSequenceEvaluator, falling back to direct computation", e);
            return delegate.forward(observations);
        }
    }

    public double evaluate(List<Observation> observations, boolean logarithmic) {
        return forward(observations).get(logarithmic);
    }

    public String getModelName() {
        return modelName;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    /**
     * Space-separated observation names with backslash and space escaped, so
     * distinct sequences never share a key.
     */
    static String sequenceKey(List<Observation> observations) {
        StringBuilder sb = new StringBuilder();
        for (Observation o : observations) {
            if (sb.length() > 0)
                sb.append(' ');
            sb.append(o.getName().replace("\\", "\\\\").replace(" ", "\\ "));
        }
        return sb.toString();
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1)
                    hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.edgehistogram.server.descriptor;

import com.edgehistogram.db.DescriptorResultDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Serves vectors from the SQLite cache, keyed by image content, and fills it
 * on a miss.
 */
public class CachedDescriptorEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(CachedDescriptorEvaluator.class);

    private final DescriptorEvaluator delegate;
    private final DescriptorResultDao resultDao;

    public CachedDescriptorEvaluator(DescriptorEvaluator delegate, DescriptorResultDao resultDao) {
        this.delegate = delegate;
        this.resultDao = resultDao;
    }

    public static class Evaluation {
        private final String imageHash;
        private final double[] vector;
        private final boolean cacheHit;

        Evaluation(String imageHash, double[] vector, boolean cacheHit) {
            this.imageHash = imageHash;
            this.vector = vector;
            this.cacheHit = cacheHit;
        }

        public String getImageHash() {
            return imageHash;
        }

        public double[] getVector() {
            return vector;
        }

        public boolean isCacheHit() {
            return cacheHit;
        }
    }

    public Evaluation evaluate(GrayImage image) {
        String hash = image.contentHash();
        DescriptorPart part = delegate.getPart();
        EhdConfig config = delegate.getConfig();
        String version = delegate.getVersion();

        // 1. Try to load from cache
        Optional<double[]> cached;
        try {
            cached = resultDao.loadVector(hash, part, config, version);
        } catch (SQLException e) {
            logger.error("Database error in CachedDescriptorEvaluator, falling back to direct computation", e);
            return new Evaluation(hash, delegate.computeVector(image), false);
        }

        if (cached.isPresent()) {
            logger.debug("Cache HIT for image {} {} {} {}", hash, part.getId(), config, version);
            return new Evaluation(hash, cached.get(), true);
        }

        // 2. Compute; validation failures propagate and are never stored
        logger.debug("Cache MISS for image {} {} {} {}", hash, part.getId(), config, version);
        double[] vector = delegate.computeVector(image);

        // 3. Store
        try {
            resultDao.upsertVector(hash, part, config, version, vector);
        } catch (SQLException e) {
            logger.error("Failed to store descriptor for image {}", hash, e);
        }
        return new Evaluation(hash, vector, false);
    }
}

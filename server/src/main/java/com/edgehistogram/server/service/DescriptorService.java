package com.edgehistogram.server.service;

import com.edgehistogram.db.DescriptorResultDao;
import com.edgehistogram.db.SqliteInitializer;
import com.edgehistogram.server.descriptor.CachedDescriptorEvaluator;
import com.edgehistogram.server.descriptor.DescriptorPart;
import com.edgehistogram.server.descriptor.EdgeHistogramEvaluator;
import com.edgehistogram.server.descriptor.EhdConfig;
import com.edgehistogram.server.descriptor.GrayImage;
import com.edgehistogram.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.sql.SQLException;

@Service
public class DescriptorService {

    private static final Logger logger = LoggerFactory.getLogger(DescriptorService.class);

    private final ServerConfig serverConfig;
    private final EhdConfig defaults;
    private final String version;
    private final String dbPath;

    private DescriptorResultDao resultDao;
    private boolean cacheReady = false;

    public DescriptorService() {
        this(ServerConfig.loadDefault());
    }

    public DescriptorService(ServerConfig serverConfig) {
        this.serverConfig = serverConfig;
        this.defaults = serverConfig.descriptorDefaults();
        this.version = serverConfig.cacheVersion();
        this.dbPath = DataPathResolver.resolveDbPath(serverConfig);
    }

    @PostConstruct
    public void init() {
        logger.info("Descriptor defaults: {}, cacheEnabled={}", defaults, serverConfig.isCacheEnabled());
        if (!serverConfig.isCacheEnabled()) {
            return;
        }
        try {
            SqliteInitializer.initialize(dbPath);
            resultDao = new DescriptorResultDao(dbPath);
            cacheReady = true;
            logger.info("Initialized SQLite descriptor cache at {}", dbPath);
        } catch (SQLException e) {
            logger.error("Failed to initialize SQLite cache at {}, descriptors will not be cached", dbPath, e);
        }
    }

    public EhdConfig getDefaults() {
        return defaults;
    }

    public String getVersion() {
        return version;
    }

    public boolean isCacheReady() {
        return cacheReady;
    }

    DescriptorResultDao getResultDao() {
        return resultDao;
    }

    /**
     * Applies the non-null overrides on top of the configured defaults.
     */
    public EhdConfig resolveConfig(Double threshold, Boolean normalize, Integer horizontalBlockCount,
            Integer verticalBlockCount) {
        return defaults
                .withThreshold(threshold != null ? threshold : defaults.getThreshold())
                .withNormalize(normalize != null ? normalize : defaults.isNormalize())
                .withBlockCounts(
                        horizontalBlockCount != null ? horizontalBlockCount : defaults.getHorizontalBlockCount(),
                        verticalBlockCount != null ? verticalBlockCount : defaults.getVerticalBlockCount());
    }

    /**
     * Computes one view of the descriptor, through the cache when it is
     * available.
     */
    public DescriptorResult describe(GrayImage image, EhdConfig config, DescriptorPart part) {
        EdgeHistogramEvaluator evaluator = new EdgeHistogramEvaluator(part, config, version);

        if (cacheReady) {
            CachedDescriptorEvaluator.Evaluation evaluation =
                    new CachedDescriptorEvaluator(evaluator, resultDao).evaluate(image);
            return new DescriptorResult(part, evaluation.getVector(), config, evaluation.getImageHash(),
                    evaluation.isCacheHit());
        }

        return new DescriptorResult(part, evaluator.computeVector(image), config, null, false);
    }
}

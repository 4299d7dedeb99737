package com.edgehistogram.server.tools;

import com.edgehistogram.db.DescriptorResultDao;
import com.edgehistogram.db.SqliteInitializer;
import com.edgehistogram.server.descriptor.CachedDescriptorEvaluator;
import com.edgehistogram.server.descriptor.DescriptorPart;
import com.edgehistogram.server.descriptor.DescriptorValidationException;
import com.edgehistogram.server.descriptor.EdgeHistogramEvaluator;
import com.edgehistogram.server.descriptor.EhdConfig;
import com.edgehistogram.server.descriptor.GrayImage;
import com.edgehistogram.server.service.ServerConfig;
import com.edgehistogram.server.util.DataPathResolver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Offline tool to precompute descriptors and populate the SQLite cache.
 * Usage: DescriptorPrecompute <datasetRoot> [part]
 *
 * Every *.json file under the root holds {"pixels": [[...], ...]} or
 * {"channels": [[[...]]]}. Vectors are stored by content, so duplicate images
 * are computed once.
 */
public class DescriptorPrecompute {

    private static final Logger logger = LoggerFactory.getLogger(DescriptorPrecompute.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: DescriptorPrecompute <datasetRoot> [global|semi-local|blocks|full]");
            System.exit(1);
        }

        File rootDir = new File(args[0]);
        if (!rootDir.exists() || !rootDir.isDirectory()) {
            System.err.println("Invalid dataset root: " + args[0]);
            System.exit(1);
        }

        try {
            DescriptorPart part = DescriptorPart.fromId(args.length > 1 ? args[1] : null);
            ServerConfig config = ServerConfig.loadDefault();
            int stored = run(rootDir.toPath(), config, DataPathResolver.resolveDbPath(config), part);
            logger.info("Precompute complete. Stored {} descriptors.", stored);
        } catch (Exception e) {
            logger.error("Precompute failed", e);
            System.exit(1);
        }
    }

    /**
     * Computes and caches the descriptor part for every pixel file under root.
     * Returns the number of images processed successfully.
     */
    public static int run(Path root, ServerConfig config, String dbPath, DescriptorPart part)
            throws IOException, SQLException {
        logger.info("Starting offline precompute on {} into {}", root, dbPath);

        SqliteInitializer.initialize(dbPath);
        EhdConfig ehdConfig = config.descriptorDefaults();
        DescriptorResultDao resultDao = new DescriptorResultDao(dbPath);
        CachedDescriptorEvaluator evaluator = new CachedDescriptorEvaluator(
                new EdgeHistogramEvaluator(part, ehdConfig, config.cacheVersion()), resultDao);

        List<Path> files = listPixelFiles(root);
        logger.info("Found {} pixel files, computing {} with {}", files.size(), part.getId(), ehdConfig);

        ObjectMapper mapper = new ObjectMapper();
        int count = 0;
        int hits = 0;
        for (Path file : files) {
            try {
                GrayImage image = readImage(mapper, file);
                CachedDescriptorEvaluator.Evaluation evaluation = evaluator.evaluate(image);
                if (evaluation.isCacheHit()) {
                    hits++;
                }
                logger.debug("{} -> {}", root.relativize(file), evaluation.getImageHash());
                count++;
                if (count % 100 == 0) {
                    logger.info("Processed {}/{}", count, files.size());
                }
            } catch (DescriptorValidationException | IllegalArgumentException | IOException e) {
                logger.warn("Skipping {}: {}", file, e.getMessage());
            }
        }
        logger.info("{} of {} images were already cached; cache holds {} {} vectors for this configuration",
                hits, count, resultDao.countByConfiguration(part, ehdConfig, config.cacheVersion()), part.getId());
        return count;
    }

    static GrayImage readImage(ObjectMapper mapper, Path file) throws IOException {
        JsonNode root = mapper.readTree(file.toFile());
        if (root.has("channels")) {
            return GrayImage.fromChannels(mapper.treeToValue(root.get("channels"), double[][][].class));
        }
        if (!root.has("pixels")) {
            throw new IllegalArgumentException("missing 'pixels' array");
        }
        return GrayImage.fromSamples(mapper.treeToValue(root.get("pixels"), double[][].class));
    }

    private static List<Path> listPixelFiles(Path root) throws IOException {
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (file.toString().endsWith(".json")) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        return files;
    }
}

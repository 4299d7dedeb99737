package com.edgehistogram.server.service;

import com.edgehistogram.db.DescriptorResultDao;
import com.edgehistogram.server.descriptor.DescriptorPart;
import com.edgehistogram.server.descriptor.EhdConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.sql.SQLException;

@Service
public class CacheControlService {

    private static final Logger logger = LoggerFactory.getLogger(CacheControlService.class);

    private final DescriptorService descriptorService;

    public CacheControlService(DescriptorService descriptorService) {
        this.descriptorService = descriptorService;
    }

    /**
     * Clears cached vectors of one descriptor part and configuration for the
     * current version. Returns the number of rows removed.
     */
    public int clearDescriptor(DescriptorPart part, EhdConfig config) {
        DescriptorResultDao resultDao = requireDao();
        String version = descriptorService.getVersion();
        try {
            int removed = resultDao.deleteByConfiguration(part, config, version);
            logger.info("Cleared {} cached {} rows for {} {}", removed, part.getId(), config, version);
            return removed;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear descriptor cache for " + part.getId() + " " + config, e);
        }
    }

    /**
     * Clears every cached vector of one image, all parts, configurations and
     * versions.
     */
    public int clearImage(String imageHash) {
        DescriptorResultDao resultDao = requireDao();
        try {
            int removed = resultDao.deleteByImage(imageHash);
            logger.info("Cleared {} cached rows for image {}", removed, imageHash);
            return removed;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear descriptor cache for image " + imageHash, e);
        }
    }

    /**
     * Clears every cached edge histogram vector, all parts and versions.
     */
    public int clearAll() {
        DescriptorResultDao resultDao = requireDao();
        try {
            int removed = resultDao.deleteAll();
            logger.info("Cleared {} cached descriptor rows", removed);
            return removed;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear descriptor cache", e);
        }
    }

    private DescriptorResultDao requireDao() {
        if (!descriptorService.isCacheReady()) {
            throw new IllegalStateException("Descriptor cache is not enabled");
        }
        return descriptorService.getResultDao();
    }
}

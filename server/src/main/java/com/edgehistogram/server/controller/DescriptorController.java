package com.edgehistogram.server.controller;

import com.edgehistogram.server.descriptor.DescriptorPart;
import com.edgehistogram.server.descriptor.DescriptorValidationException;
import com.edgehistogram.server.descriptor.EhdConfig;
import com.edgehistogram.server.descriptor.GrayImage;
import com.edgehistogram.server.service.CacheControlService;
import com.edgehistogram.server.service.DescriptorResult;
import com.edgehistogram.server.service.DescriptorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/ehd")
public class DescriptorController {

    private static final Logger logger = LoggerFactory.getLogger(DescriptorController.class);
    private final DescriptorService descriptorService;
    private final CacheControlService cacheControlService;

    public DescriptorController(DescriptorService descriptorService, CacheControlService cacheControlService) {
        this.descriptorService = descriptorService;
        this.cacheControlService = cacheControlService;
    }

    public static class DescriptorRequest {
        // either pixels[row][col] or channels[channel][row][col]
        public double[][] pixels;
        public double[][][] channels;
        public Double threshold;
        public Boolean normalize;
        public Integer horizontalBlockCount;
        public Integer verticalBlockCount;
        public String part;
    }

    public static class CacheClearRequest {
        // clears one image when set, otherwise one part/configuration or everything
        public String imageHash;
        public String part;
        public Double threshold;
        public Boolean normalize;
        public Integer horizontalBlockCount;
        public Integer verticalBlockCount;
    }

    @PostMapping("/descriptor")
    public ResponseEntity<?> describe(@RequestBody DescriptorRequest request) {
        if (request == null || (request.pixels == null && request.channels == null)) {
            return ResponseEntity.badRequest().body("Invalid image data. Provide 'pixels' or 'channels'.");
        }

        try {
            GrayImage image = request.channels != null
                    ? GrayImage.fromChannels(request.channels)
                    : GrayImage.fromSamples(request.pixels);
            EhdConfig config = descriptorService.resolveConfig(request.threshold, request.normalize,
                    request.horizontalBlockCount, request.verticalBlockCount);
            DescriptorPart part = DescriptorPart.fromId(request.part);

            logger.info("Received descriptor request: {}x{} image, part={}, {}", image.getHeight(),
                    image.getWidth(), part.getId(), config);

            DescriptorResult result = descriptorService.describe(image, config, part);
            return ResponseEntity.ok(result);
        } catch (DescriptorValidationException e) {
            logger.warn("Rejected descriptor request ({}): {}", e.getKind(), e.getMessage());
            return ResponseEntity.badRequest().body(e.getKind() + ": " + e.getMessage());
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected descriptor request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @PostMapping("/cache/clear")
    public ResponseEntity<?> clearCache(@RequestBody(required = false) CacheClearRequest request) {
        if (!descriptorService.isCacheReady()) {
            return ResponseEntity.status(409).body("Descriptor cache is not enabled.");
        }
        try {
            int removed;
            if (request != null && request.imageHash != null) {
                removed = cacheControlService.clearImage(request.imageHash);
            } else if (request == null || request.part == null) {
                removed = cacheControlService.clearAll();
            } else {
                EhdConfig config = descriptorService.resolveConfig(request.threshold, request.normalize,
                        request.horizontalBlockCount, request.verticalBlockCount);
                removed = cacheControlService.clearDescriptor(DescriptorPart.fromId(request.part), config);
            }
            return ResponseEntity.ok(Map.of("removed", removed));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }
}

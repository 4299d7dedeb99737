package com.edgehistogram.server.descriptor;

/**
 * Raised when an image or configuration cannot produce a descriptor.
 */
public class DescriptorValidationException extends RuntimeException {

    public enum ErrorKind {
        INVALID_CHANNEL_COUNT,
        INVALID_BLOCK_COUNT,
        INVALID_IMAGE_SIZE
    }

    private final ErrorKind kind;

    public DescriptorValidationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}

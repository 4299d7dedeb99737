package com.edgehistogram.server.descriptor;

/**
 * Which view of the descriptor a caller asks for.
 */
public enum DescriptorPart {
    GLOBAL("global"),
    SEMI_LOCAL("semi-local"),
    BLOCKS("blocks"),
    FULL("full");

    private final String id;

    DescriptorPart(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Vector length for the given block counts.
     */
    public int vectorLength(int horizontalBlockCount, int verticalBlockCount) {
        int bins = EdgeOrientation.BIN_COUNT;
        switch (this) {
            case GLOBAL:
                return bins;
            case SEMI_LOCAL:
                return bins * (horizontalBlockCount + verticalBlockCount + 5);
            case BLOCKS:
                return bins * horizontalBlockCount * verticalBlockCount;
            case FULL:
                return GLOBAL.vectorLength(horizontalBlockCount, verticalBlockCount)
                        + SEMI_LOCAL.vectorLength(horizontalBlockCount, verticalBlockCount)
                        + BLOCKS.vectorLength(horizontalBlockCount, verticalBlockCount);
            default:
                throw new IllegalStateException("Unhandled part " + this);
        }
    }

    /**
     * Parses "global", "semi-local", "blocks" or "full" (or the enum name),
     * defaulting to FULL for null or blank input.
     */
    public static DescriptorPart fromId(String s) {
        if (s == null || s.isBlank()) {
            return FULL;
        }
        String norm = s.trim();
        for (DescriptorPart p : values()) {
            if (p.id.equalsIgnoreCase(norm) || p.name().equalsIgnoreCase(norm)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown descriptor part: " + s);
    }
}

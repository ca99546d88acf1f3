package com.gemflush.orchestrator.automation;

/**
 * How many claims the publish gate puts on an assembled entity.
 * Each level includes everything below it.
 */
public enum EntityRichness {
    BASIC(1),
    ENHANCED(2),
    COMPLETE(3);

    private final int level;

    EntityRichness(int level) {
        this.level = level;
    }

    /** Stored as WikidataEntity.enrichmentLevel. */
    public int level() {
        return level;
    }

    public boolean includes(EntityRichness other) {
        return level >= other.level;
    }
}

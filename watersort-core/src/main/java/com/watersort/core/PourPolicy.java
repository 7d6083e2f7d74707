package com.watersort.core;

/**
 * Decides how much of the pourable block moves when the destination cannot hold all of it.
 */
public enum PourPolicy {
    /** The pour is only legal when the whole block fits into the destination. */
    ALL_OR_NOTHING,
    /** The part of the block that fits is poured, the rest stays in the source. */
    PARTIAL
}

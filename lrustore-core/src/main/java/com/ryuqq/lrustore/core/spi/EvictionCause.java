package com.ryuqq.lrustore.core.spi;

/**
 * Reason an entry was evicted.
 *
 * @author LruStore Team
 * @since 1.0.0
 */
public enum EvictionCause {

    /**
     * A write pushed the entry count one past capacity and the oldest entry was dropped.
     */
    CAPACITY,

    /**
     * A resize shrank capacity below the entry count and the oldest entries were truncated.
     */
    RESIZE
}

package com.ryuqq.lrustore.core.spi;

/**
 * Callback notified whenever a store evicts an entry on its own.
 *
 * <p>Only automatic evictions are reported ({@link EvictionCause#CAPACITY} and
 * {@link EvictionCause#RESIZE}). Explicit removals such as {@code delete},
 * {@code remove}, {@code removeLeastRecentlyUsed} and {@code clear} are not evictions.</p>
 *
 * <p><strong>Invocation guarantees:</strong></p>
 * <ul>
 *   <li>Called synchronously on the thread that triggered the eviction</li>
 *   <li>Called after the store is consistent again, so the evicted key is already absent</li>
 *   <li>For a resize, called once per truncated entry, oldest first</li>
 *   <li>An exception thrown here propagates to the caller of write/resize; the eviction itself is not undone</li>
 *   <li>During a resize a throwing listener is still called for every remaining truncated entry;
 *       the first exception is rethrown with later ones attached as suppressed</li>
 * </ul>
 *
 * @param <K> key type
 * @param <V> value type
 * @author LruStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EvictionListener<K, V> {

    /**
     * Handles one evicted entry.
     *
     * @param key the evicted key
     * @param value the value it was bound to
     * @param cause why it was evicted
     */
    void onEviction(K key, V value, EvictionCause cause);

    /**
     * Returns a listener that ignores every eviction.
     *
     * @param <K> key type
     * @param <V> value type
     * @return a no-op listener
     */
    static <K, V> EvictionListener<K, V> noop() {
        return (key, value, cause) -> { };
    }
}

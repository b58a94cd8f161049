package com.ryuqq.lrustore.core.store;

import com.ryuqq.lrustore.core.exception.EmptyStoreException;
import com.ryuqq.lrustore.core.exception.InvalidCapacityException;
import com.ryuqq.lrustore.core.exception.KeyNotFoundException;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed-capacity key-value store that evicts the least-recently-used entry on overflow.
 *
 * <p>The store keeps its entries in <em>recency order</em>: index 0 is the least recently
 * used entry, the last index the most recently used. {@link #write} and {@link #read}
 * move the touched key to the most-recently-used end; {@link #peek}, {@link #contains}
 * and every traversal leave the order alone.</p>
 *
 * <p><strong>Invariants (after every public call returns):</strong></p>
 * <ul>
 *   <li>{@code filled() <= capacity()}</li>
 *   <li>{@code capacity() >= 1}</li>
 *   <li>Every key appears exactly once in recency order</li>
 * </ul>
 *
 * <p><strong>Failure semantics:</strong> a failing call never mutates the store. A failed
 * {@code read} leaves the order unchanged, a failed {@code delete} leaves every entry in
 * place, a failed {@code resize} keeps the old capacity.</p>
 *
 * <p><strong>Views:</strong> {@link #keys()}, {@link #values()}, {@link #entries()} and
 * {@link #asMap()} are lazy, read-only and restartable. Each {@code iterator()} call starts
 * a fresh oldest-to-newest walk over live state. Any reordering or structural change made
 * while an iterator is in use (including {@code read} and {@code write}) makes the
 * iterator fail fast with {@link java.util.ConcurrentModificationException}. Touching the key
 * that is already most recently used changes nothing and leaves iterators valid.</p>
 *
 * <p><strong>Equality:</strong> two stores are equal when they have the same capacity, the
 * same number of entries and pairwise equal entries walking both in recency order. Stores
 * holding the same entries in a different order are <em>not</em> equal. A store is never
 * equal to an object that is not an {@code LruStore}, including a plain {@link Map}.</p>
 *
 * <p><strong>Thread safety:</strong> none. Callers sharing a store across threads must
 * synchronize externally.</p>
 *
 * <p><strong>Null handling:</strong> null keys and values are rejected with
 * {@link IllegalArgumentException}.</p>
 *
 * @param <K> key type, compared with {@code equals}/{@code hashCode}
 * @param <V> value type
 * @author LruStore Team
 * @since 1.0.0
 */
public interface LruStore<K, V> extends Iterable<Map.Entry<K, V>> {

    /**
     * Inserts or replaces the value bound to {@code key} and makes it the most recently used.
     *
     * <p>If the store then holds more than {@link #capacity()} entries, the least recently
     * used entry is evicted. At most one eviction happens per write.</p>
     *
     * @param key the key
     * @param value the value
     * @throws IllegalArgumentException if key or value is null
     */
    void write(K key, V value);

    /**
     * Returns the value bound to {@code key} and makes it the most recently used.
     *
     * @param key the key
     * @return the bound value
     * @throws KeyNotFoundException if the key is absent (order unchanged)
     * @throws IllegalArgumentException if key is null
     */
    V read(K key);

    /**
     * Returns the value bound to {@code key} without touching recency order.
     *
     * @param key the key
     * @return the bound value
     * @throws KeyNotFoundException if the key is absent
     * @throws IllegalArgumentException if key is null
     */
    V peek(K key);

    /**
     * Removes {@code key}. Relative order of the remaining entries is unchanged.
     *
     * @param key the key
     * @throws KeyNotFoundException if the key is absent (store unchanged)
     * @throws IllegalArgumentException if key is null
     */
    void delete(K key);

    /**
     * Removes {@code key} and returns the value it was bound to.
     *
     * @param key the key
     * @return the removed value
     * @throws KeyNotFoundException if the key is absent (store unchanged)
     * @throws IllegalArgumentException if key is null
     */
    V remove(K key);

    /**
     * Membership test. Never affects recency order.
     *
     * @param key the key
     * @return true if the key is present
     * @throws IllegalArgumentException if key is null
     */
    boolean contains(K key);

    /**
     * Changes the capacity. When the new capacity is below the current entry count the
     * oldest {@code filled() - newCapacity} entries are evicted in one batch and the
     * survivors keep their relative order.
     *
     * @param newCapacity the new capacity
     * @throws InvalidCapacityException if newCapacity is below 1 (capacity unchanged)
     */
    void resize(int newCapacity);

    /**
     * Key at the least-recently-used end.
     *
     * @return the oldest key
     * @throws EmptyStoreException if the store is empty
     */
    K leastRecentlyUsed();

    /**
     * Key at the most-recently-used end.
     *
     * @return the newest key
     * @throws EmptyStoreException if the store is empty
     */
    K mostRecentlyUsed();

    /**
     * Removes and returns the least recently used entry.
     *
     * @return the removed entry
     * @throws EmptyStoreException if the store is empty
     */
    Map.Entry<K, V> removeLeastRecentlyUsed();

    /**
     * Removes every entry. Capacity is unchanged and no eviction is reported.
     */
    void clear();

    /**
     * Number of entries currently held.
     *
     * @return entry count
     */
    int filled();

    /**
     * Configured capacity. Only {@link #resize} changes it.
     *
     * @return capacity (at least 1)
     */
    int capacity();

    /**
     * @return true if {@code filled() == 0}
     */
    boolean isEmpty();

    /**
     * Reads {@code key} if present (refreshing its recency), or returns empty.
     *
     * @param key the key
     * @return the bound value, or empty if absent
     * @throws IllegalArgumentException if key is null
     */
    Optional<V> find(K key);

    /**
     * Writes {@code value} if {@code key} is absent; otherwise reads the existing value.
     * Either way {@code key} ends up most recently used.
     *
     * @param key the key
     * @param value the value to write when absent
     * @return the value now bound to {@code key}
     * @throws IllegalArgumentException if key or value is null
     */
    V writeIfAbsent(K key, V value);

    /**
     * Writes every mapping of {@code entries} in its iteration order.
     *
     * @param entries mappings to write
     * @throws IllegalArgumentException if entries, or any key or value in it, is null
     */
    void writeAll(Map<? extends K, ? extends V> entries);

    /**
     * Writes every pair of {@code entries} in iteration order.
     *
     * @param entries pairs to write
     * @throws IllegalArgumentException if entries, or any key or value in it, is null
     */
    void writeAll(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries);

    /**
     * Keys from least to most recently used.
     *
     * @return a live read-only view
     */
    Collection<K> keys();

    /**
     * Values from least to most recently used.
     *
     * @return a live read-only view
     */
    Collection<V> values();

    /**
     * Entries from least to most recently used.
     *
     * @return a live read-only view
     */
    Collection<Map.Entry<K, V>> entries();

    /**
     * Read-only {@link Map} view. {@code get} uses peek semantics and iteration follows
     * recency order, so handing the view to a {@code Map}-consuming API never reorders
     * the store.
     *
     * @return a live read-only map view
     */
    Map<K, V> asMap();
}

package com.ryuqq.lrustore.core.store;

import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Skeletal {@link LruStore} implementation.
 *
 * <p>Subclasses supply the recency-tracking primitives and a non-mutating
 * {@link #entryIterator()}. This class derives the views, the bulk operations,
 * and the order-sensitive {@code equals}/{@code hashCode}/{@code toString} from them.</p>
 *
 * <p>Every traversal in this class goes through {@link #entryIterator()}, never
 * through {@link #read}, so iterating a store cannot reorder it.</p>
 *
 * @param <K> key type
 * @param <V> value type
 * @author LruStore Team
 * @since 1.0.0
 */
public abstract class AbstractLruStore<K, V> implements LruStore<K, V> {

    private Collection<K> keys;
    private Collection<V> values;
    private Collection<Map.Entry<K, V>> entries;
    private Map<K, V> mapView;

    protected AbstractLruStore() {
    }

    /**
     * Walks entries from least to most recently used without touching recency order.
     *
     * <p>The iterator must be fail-fast: if the store is reordered or structurally
     * modified after the iterator was created, the next call to {@code next()} throws
     * {@link java.util.ConcurrentModificationException}. Returned entries are immutable
     * snapshots of the key/value pair at the time they were produced.</p>
     *
     * @return a fresh iterator positioned before the oldest entry
     */
    protected abstract Iterator<Map.Entry<K, V>> entryIterator();

    /**
     * Membership test for keys of unknown type, as asked by the read-only views.
     *
     * <p>Must not touch recency order. A null or foreign-typed key simply misses.</p>
     *
     * @param key any object
     * @return true if {@code key} is present
     */
    protected abstract boolean containsKeyObject(Object key);

    /**
     * Value lookup for keys of unknown type, as asked by the read-only views.
     *
     * <p>Must not touch recency order.</p>
     *
     * @param key any object
     * @return the bound value, or null if {@code key} is absent
     */
    protected abstract V peekObject(Object key);

    @Override
    public void delete(K key) {
        remove(key);
    }

    @Override
    public boolean isEmpty() {
        return filled() == 0;
    }

    @Override
    public Optional<V> find(K key) {
        if (!contains(key)) {
            return Optional.empty();
        }
        return Optional.of(read(key));
    }

    @Override
    public V writeIfAbsent(K key, V value) {
        requireValue(value);
        if (contains(key)) {
            return read(key);
        }
        write(key, value);
        return value;
    }

    @Override
    public void writeAll(Map<? extends K, ? extends V> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        writeAll(entries.entrySet());
    }

    @Override
    public void writeAll(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        // validate the whole batch first so a bad pair leaves the store untouched
        List<Map.Entry<? extends K, ? extends V>> batch = new ArrayList<>();
        for (Map.Entry<? extends K, ? extends V> entry : entries) {
            if (entry == null) {
                throw new IllegalArgumentException("entry cannot be null");
            }
            requireKey(entry.getKey());
            requireValue(entry.getValue());
            batch.add(entry);
        }
        for (Map.Entry<? extends K, ? extends V> entry : batch) {
            write(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        return entryIterator();
    }

    @Override
    public Collection<K> keys() {
        if (keys == null) {
            keys = new KeyView();
        }
        return keys;
    }

    @Override
    public Collection<V> values() {
        if (values == null) {
            values = new ValueView();
        }
        return values;
    }

    @Override
    public Collection<Map.Entry<K, V>> entries() {
        if (entries == null) {
            entries = new EntryView();
        }
        return entries;
    }

    @Override
    public Map<K, V> asMap() {
        if (mapView == null) {
            mapView = new PeekingMapView();
        }
        return mapView;
    }

    /**
     * Rejects null keys with the codebase's standard message.
     *
     * @param key the key to check
     * @throws IllegalArgumentException if key is null
     */
    protected static void requireKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    /**
     * Rejects null values with the codebase's standard message.
     *
     * @param value the value to check
     * @throws IllegalArgumentException if value is null
     */
    protected static void requireValue(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    /**
     * Order-sensitive equality against any other {@link LruStore}.
     *
     * <p>Equal when capacity and entry count match and entries compare equal pairwise in
     * recency order. Never equal to a non-{@code LruStore}.</p>
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LruStore)) return false;
        LruStore<?, ?> other = (LruStore<?, ?>) o;
        if (capacity() != other.capacity() || filled() != other.filled()) {
            return false;
        }

        Iterator<Map.Entry<K, V>> mine = entryIterator();
        Iterator<? extends Map.Entry<?, ?>> theirs = other.entries().iterator();
        while (mine.hasNext() && theirs.hasNext()) {
            if (!mine.next().equals(theirs.next())) {
                return false;
            }
        }
        return !mine.hasNext() && !theirs.hasNext();
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(capacity());
        Iterator<Map.Entry<K, V>> it = entryIterator();
        while (it.hasNext()) {
            result = 31 * result + it.next().hashCode();
        }
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{capacity=" + capacity() + ", filled=" + filled() + '}';
    }

    private final class KeyView extends AbstractCollection<K> {

        @Override
        public Iterator<K> iterator() {
            Iterator<Map.Entry<K, V>> it = entryIterator();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return it.hasNext();
                }

                @Override
                public K next() {
                    return it.next().getKey();
                }
            };
        }

        @Override
        public int size() {
            return filled();
        }

        @Override
        public boolean contains(Object o) {
            return containsKeyObject(o);
        }
    }

    private final class ValueView extends AbstractCollection<V> {

        @Override
        public Iterator<V> iterator() {
            Iterator<Map.Entry<K, V>> it = entryIterator();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return it.hasNext();
                }

                @Override
                public V next() {
                    return it.next().getValue();
                }
            };
        }

        @Override
        public int size() {
            return filled();
        }
    }

    private final class EntryView extends AbstractSet<Map.Entry<K, V>> {

        @Override
        public Iterator<Map.Entry<K, V>> iterator() {
            return entryIterator();
        }

        @Override
        public int size() {
            return filled();
        }

        @Override
        public boolean contains(Object o) {
            if (!(o instanceof Map.Entry)) {
                return false;
            }
            Map.Entry<?, ?> entry = (Map.Entry<?, ?>) o;
            return containsKeyObject(entry.getKey())
                    && Objects.equals(peekObject(entry.getKey()), entry.getValue());
        }
    }

    private final class PeekingMapView extends AbstractMap<K, V> {

        @Override
        public Set<Map.Entry<K, V>> entrySet() {
            return (Set<Map.Entry<K, V>>) entries();
        }

        @Override
        public int size() {
            return filled();
        }

        @Override
        public boolean containsKey(Object key) {
            return containsKeyObject(key);
        }

        @Override
        public V get(Object key) {
            return peekObject(key);
        }
    }
}

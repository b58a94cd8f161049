package com.ryuqq.lrustore.testkit.reference;

import com.ryuqq.lrustore.core.exception.EmptyStoreException;
import com.ryuqq.lrustore.core.exception.KeyNotFoundException;
import com.ryuqq.lrustore.core.model.Capacity;
import com.ryuqq.lrustore.core.spi.EvictionCause;
import com.ryuqq.lrustore.core.spi.EvictionListener;
import com.ryuqq.lrustore.core.store.AbstractLruStore;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Reference {@link com.ryuqq.lrustore.core.store.LruStore} for testing purposes.
 *
 * <p>Keeps the two structures of the store model literally: a key to value table and
 * an array list of keys in recency order (index 0 = least recently used). Recency updates
 * are O(N) list moves, which keeps the implementation obviously correct and usable as an
 * oracle in differential tests.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>table:</strong> HashMap&lt;K, V&gt; - values by key</li>
 *   <li><strong>order:</strong> ArrayList&lt;K&gt; - keys, oldest first</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>O(N) read/write/delete</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @param <K> key type
 * @param <V> value type
 * @author LruStore Team
 * @since 1.0.0
 */
public class ListBackedLruStore<K, V> extends AbstractLruStore<K, V> {

    private final Map<K, V> table = new HashMap<>();
    private final List<K> order = new ArrayList<>();
    private final EvictionListener<? super K, ? super V> listener;
    private Capacity capacity;
    private int modCount;

    /**
     * Creates an empty store.
     *
     * @param capacity maximum entry count
     */
    public ListBackedLruStore(int capacity) {
        this(capacity, EvictionListener.noop());
    }

    /**
     * Creates an empty store reporting evictions to {@code listener}.
     *
     * @param capacity maximum entry count
     * @param listener eviction listener
     */
    public ListBackedLruStore(int capacity, EvictionListener<? super K, ? super V> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.capacity = Capacity.of(capacity);
        this.listener = listener;
    }

    @Override
    public void write(K key, V value) {
        requireKey(key);
        requireValue(value);

        if (!table.containsKey(key)) {
            order.add(key);
            modCount++;
        } else if (!key.equals(order.get(order.size() - 1))) {
            makeNewest(key);
            modCount++;
        }
        table.put(key, value);

        if (order.size() > capacity.getValue()) {
            K eldest = order.remove(0);
            V evicted = table.remove(eldest);
            listener.onEviction(eldest, evicted, EvictionCause.CAPACITY);
        }
    }

    @Override
    public V read(K key) {
        V value = peek(key);
        if (!key.equals(order.get(order.size() - 1))) {
            makeNewest(key);
            modCount++;
        }
        return value;
    }

    @Override
    public V peek(K key) {
        requireKey(key);
        V value = table.get(key);
        if (value == null) {
            throw new KeyNotFoundException(key);
        }
        return value;
    }

    @Override
    public V remove(K key) {
        V value = peek(key);
        table.remove(key);
        order.remove(key);
        modCount++;
        return value;
    }

    @Override
    public boolean contains(K key) {
        requireKey(key);
        return table.containsKey(key);
    }

    @Override
    public void resize(int newCapacity) {
        capacity = Capacity.of(newCapacity);
        int excess = capacity.overflow(order.size());
        if (excess == 0) {
            return;
        }

        List<K> oldest = order.subList(0, excess);
        List<Map.Entry<K, V>> evicted = new ArrayList<>(excess);
        for (K key : oldest) {
            evicted.add(Map.entry(key, table.remove(key)));
        }
        oldest.clear();
        modCount++;

        RuntimeException failure = null;
        for (Map.Entry<K, V> entry : evicted) {
            try {
                listener.onEviction(entry.getKey(), entry.getValue(), EvictionCause.RESIZE);
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else if (failure != e) {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public K leastRecentlyUsed() {
        if (order.isEmpty()) {
            throw new EmptyStoreException("leastRecentlyUsed");
        }
        return order.get(0);
    }

    @Override
    public K mostRecentlyUsed() {
        if (order.isEmpty()) {
            throw new EmptyStoreException("mostRecentlyUsed");
        }
        return order.get(order.size() - 1);
    }

    @Override
    public Map.Entry<K, V> removeLeastRecentlyUsed() {
        if (order.isEmpty()) {
            throw new EmptyStoreException("removeLeastRecentlyUsed");
        }
        K eldest = order.remove(0);
        V value = table.remove(eldest);
        modCount++;
        return Map.entry(eldest, value);
    }

    @Override
    public void clear() {
        table.clear();
        order.clear();
        modCount++;
    }

    @Override
    public int filled() {
        return order.size();
    }

    @Override
    public int capacity() {
        return capacity.getValue();
    }

    @Override
    protected Iterator<Map.Entry<K, V>> entryIterator() {
        return new Iterator<>() {
            private int index;
            private final int expectedModCount = modCount;

            @Override
            public boolean hasNext() {
                return index < order.size();
            }

            @Override
            public Map.Entry<K, V> next() {
                if (modCount != expectedModCount) {
                    throw new ConcurrentModificationException();
                }
                if (index >= order.size()) {
                    throw new NoSuchElementException();
                }
                K key = order.get(index++);
                return Map.entry(key, table.get(key));
            }
        };
    }

    @Override
    protected boolean containsKeyObject(Object key) {
        return table.containsKey(key);
    }

    @Override
    protected V peekObject(Object key) {
        return table.get(key);
    }

    private void makeNewest(K key) {
        order.remove(key);
        order.add(key);
    }
}

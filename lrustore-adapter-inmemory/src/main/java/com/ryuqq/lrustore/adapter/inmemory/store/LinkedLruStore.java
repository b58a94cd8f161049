package com.ryuqq.lrustore.adapter.inmemory.store;

import com.ryuqq.lrustore.core.config.LruStoreConfig;
import com.ryuqq.lrustore.core.exception.EmptyStoreException;
import com.ryuqq.lrustore.core.exception.KeyNotFoundException;
import com.ryuqq.lrustore.core.model.Capacity;
import com.ryuqq.lrustore.core.spi.EvictionCause;
import com.ryuqq.lrustore.core.spi.EvictionListener;
import com.ryuqq.lrustore.core.store.AbstractLruStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * In-memory {@link com.ryuqq.lrustore.core.store.LruStore} backed by a hash table of
 * nodes threaded on a doubly-linked recency list.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>table:</strong> HashMap&lt;K, Node&gt; - key to node lookup (O(1) access)</li>
 *   <li><strong>head/tail:</strong> doubly-linked list of the same nodes, head = least recently used,
 *       tail = most recently used</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>write / read / peek / delete / contains:</strong> O(1)</li>
 *   <li><strong>leastRecentlyUsed / mostRecentlyUsed:</strong> O(1)</li>
 *   <li><strong>resize:</strong> O(E) where E is the number of evicted entries</li>
 *   <li><strong>traversal, equals, hashCode:</strong> O(N)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Not thread-safe</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * LinkedLruStore&lt;String, byte[]&gt; store = new LinkedLruStore&lt;&gt;(3);
 * store.write("a", a);
 * store.write("b", b);
 * store.write("c", c);
 *
 * store.read("a");       // order: b, c, a
 * store.write("d", d);   // b evicted, order: c, a, d
 * store.peek("c");       // order unchanged
 * store.resize(1);       // c and a evicted in one batch, order: d
 * </pre>
 *
 * @param <K> key type
 * @param <V> value type
 * @author LruStore Team
 * @since 1.0.0
 */
public final class LinkedLruStore<K, V> extends AbstractLruStore<K, V> {

    private static final Logger log = LoggerFactory.getLogger(LinkedLruStore.class);

    private final HashMap<K, Node<K, V>> table;
    private final EvictionListener<? super K, ? super V> listener;

    private Capacity capacity;

    /**
     * Least recently used node, or null when empty.
     */
    private Node<K, V> head;

    /**
     * Most recently used node, or null when empty.
     */
    private Node<K, V> tail;

    /**
     * Bumped on every change of membership or order. Iterators compare against it to fail fast.
     */
    private int modCount;

    /**
     * Creates an empty store.
     *
     * @param capacity maximum entry count
     * @throws com.ryuqq.lrustore.core.exception.InvalidCapacityException if capacity is below 1
     */
    public LinkedLruStore(int capacity) {
        this(new LruStoreConfig(capacity), EvictionListener.noop());
    }

    /**
     * Creates a store preloaded from {@code initial} in its iteration order.
     *
     * <p>Each mapping goes through {@link #write}, so when {@code initial} holds more entries
     * than {@code capacity} the earliest ones are evicted exactly as sequential writes would.</p>
     *
     * @param capacity maximum entry count
     * @param initial mappings to preload
     * @throws com.ryuqq.lrustore.core.exception.InvalidCapacityException if capacity is below 1
     * @throws IllegalArgumentException if initial or any key or value in it is null
     */
    public LinkedLruStore(int capacity, Map<? extends K, ? extends V> initial) {
        this(capacity);
        writeAll(initial);
    }

    /**
     * Creates a store preloaded from ordered {@code initial} pairs.
     *
     * @param capacity maximum entry count
     * @param initial pairs to preload, in order
     * @throws com.ryuqq.lrustore.core.exception.InvalidCapacityException if capacity is below 1
     * @throws IllegalArgumentException if initial or any key or value in it is null
     */
    public LinkedLruStore(int capacity, Iterable<? extends Map.Entry<? extends K, ? extends V>> initial) {
        this(capacity);
        writeAll(initial);
    }

    /**
     * Creates an empty store from a configuration.
     *
     * @param config store configuration
     * @param listener notified of automatic evictions
     * @throws IllegalArgumentException if config or listener is null
     */
    public LinkedLruStore(LruStoreConfig config, EvictionListener<? super K, ? super V> listener) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.capacity = Capacity.of(config.capacity());
        this.table = new HashMap<>(config.effectiveTableSize());
        this.listener = listener;
    }

    @Override
    public void write(K key, V value) {
        requireKey(key);
        requireValue(value);

        Node<K, V> node = table.get(key);
        if (node != null) {
            node.value = value;
            moveToTail(node);
            return;
        }

        node = new Node<>(key, value);
        table.put(key, node);
        linkLast(node);
        modCount++;

        // capacity can only be exceeded by one here
        if (table.size() > capacity.getValue()) {
            Node<K, V> eldest = head;
            unlink(eldest);
            table.remove(eldest.key);
            listener.onEviction(eldest.key, eldest.value, EvictionCause.CAPACITY);
        }
    }

    @Override
    public V read(K key) {
        Node<K, V> node = nodeFor(key);
        moveToTail(node);
        return node.value;
    }

    @Override
    public V peek(K key) {
        return nodeFor(key).value;
    }

    @Override
    public V remove(K key) {
        Node<K, V> node = nodeFor(key);
        table.remove(key);
        unlink(node);
        modCount++;
        return node.value;
    }

    @Override
    public boolean contains(K key) {
        requireKey(key);
        return table.containsKey(key);
    }

    @Override
    public void resize(int newCapacity) {
        Capacity resized = Capacity.of(newCapacity);
        int previous = capacity.getValue();
        capacity = resized;

        int excess = resized.overflow(table.size());
        if (excess == 0) {
            return;
        }

        // cut the oldest run off the list in one step, then drop it from the table
        List<Node<K, V>> evicted = new ArrayList<>(excess);
        Node<K, V> cursor = head;
        for (int i = 0; i < excess; i++) {
            evicted.add(cursor);
            table.remove(cursor.key);
            cursor = cursor.next;
        }
        head = cursor;
        head.prev = null;
        evicted.get(excess - 1).next = null;
        modCount++;

        log.debug("Resized store: capacity {} → {}, {} entries evicted", previous, newCapacity, excess);

        RuntimeException failure = null;
        for (Node<K, V> node : evicted) {
            try {
                listener.onEviction(node.key, node.value, EvictionCause.RESIZE);
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
        if (head == null) {
            throw new EmptyStoreException("leastRecentlyUsed");
        }
        return head.key;
    }

    @Override
    public K mostRecentlyUsed() {
        if (tail == null) {
            throw new EmptyStoreException("mostRecentlyUsed");
        }
        return tail.key;
    }

    @Override
    public Map.Entry<K, V> removeLeastRecentlyUsed() {
        if (head == null) {
            throw new EmptyStoreException("removeLeastRecentlyUsed");
        }
        Node<K, V> eldest = head;
        unlink(eldest);
        table.remove(eldest.key);
        modCount++;
        return Map.entry(eldest.key, eldest.value);
    }

    @Override
    public void clear() {
        table.clear();
        head = null;
        tail = null;
        modCount++;
    }

    @Override
    public int filled() {
        return table.size();
    }

    @Override
    public int capacity() {
        return capacity.getValue();
    }

    @Override
    protected Iterator<Map.Entry<K, V>> entryIterator() {
        return new EntryIterator();
    }

    @Override
    protected boolean containsKeyObject(Object key) {
        return table.containsKey(key);
    }

    @Override
    protected V peekObject(Object key) {
        Node<K, V> node = table.get(key);
        return node == null ? null : node.value;
    }

    private Node<K, V> nodeFor(K key) {
        requireKey(key);
        Node<K, V> node = table.get(key);
        if (node == null) {
            throw new KeyNotFoundException(key);
        }
        return node;
    }

    private void moveToTail(Node<K, V> node) {
        if (node == tail) {
            return;
        }
        unlink(node);
        linkLast(node);
        modCount++;
    }

    private void linkLast(Node<K, V> node) {
        node.prev = tail;
        node.next = null;
        if (tail == null) {
            head = node;
        } else {
            tail.next = node;
        }
        tail = node;
    }

    private void unlink(Node<K, V> node) {
        if (node.prev == null) {
            head = node.next;
        } else {
            node.prev.next = node.next;
        }
        if (node.next == null) {
            tail = node.prev;
        } else {
            node.next.prev = node.prev;
        }
        node.prev = null;
        node.next = null;
    }

    private static final class Node<K, V> {
        private final K key;
        private V value;
        private Node<K, V> prev;
        private Node<K, V> next;

        Node(K key, V value) {
            this.key = key;
            this.value = value;
        }
    }

    /**
     * Walks the recency list directly; never calls {@link #read}.
     */
    private final class EntryIterator implements Iterator<Map.Entry<K, V>> {
        private Node<K, V> cursor = head;
        private final int expectedModCount = modCount;

        @Override
        public boolean hasNext() {
            return cursor != null;
        }

        @Override
        public Map.Entry<K, V> next() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (cursor == null) {
                throw new NoSuchElementException();
            }
            Node<K, V> current = cursor;
            cursor = current.next;
            return Map.entry(current.key, current.value);
        }
    }
}

/**
 * In-memory LruStore implementation.
 *
 * <p>{@link com.ryuqq.lrustore.adapter.inmemory.store.LinkedLruStore} keeps a hash table of
 * nodes and threads the same nodes on a doubly-linked list in recency order, so every
 * single-key operation is O(1).</p>
 *
 * <p>The implementation is verified against the shared contract in
 * {@code lrustore-testkit} and against the list-backed reference store.</p>
 *
 * @since 1.0.0
 * @author LruStore Team
 */
package com.ryuqq.lrustore.adapter.inmemory.store;

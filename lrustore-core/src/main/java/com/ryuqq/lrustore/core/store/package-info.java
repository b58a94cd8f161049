/**
 * LruStore API package.
 *
 * <p>Defines the bounded key-value store with least-recently-used eviction that every
 * adapter implements.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lrustore.core.store.LruStore} - the store contract (write, read, peek, delete, resize, views)</li>
 *   <li>{@link com.ryuqq.lrustore.core.store.AbstractLruStore} - skeletal implementation deriving views, bulk writes and equality</li>
 * </ul>
 *
 * <h2>Recency Order</h2>
 * <pre>
 * oldest (least recently used)                 newest (most recently used)
 *   [k0] -&gt; [k1] -&gt; [k2] -&gt; ... -&gt; [kN]
 *
 * write(k) / read(k) : k moves to the newest end
 * peek(k) / contains  : order unchanged
 * overflow / resize   : oldest entries evicted first
 * </pre>
 *
 * @since 1.0.0
 * @author LruStore Team
 */
package com.ryuqq.lrustore.core.store;

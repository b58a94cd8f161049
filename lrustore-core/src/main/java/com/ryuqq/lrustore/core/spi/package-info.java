/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Hooks that callers plug into a store to observe its behaviour without
 * subclassing it.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lrustore.core.spi.EvictionListener} - notified of automatic evictions</li>
 *   <li>{@link com.ryuqq.lrustore.core.spi.EvictionCause} - capacity overflow or resize truncation</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., lrustore-adapter-inmemory) ship ready-made listeners such as a
 * logging listener. Listeners run inline on the caller's thread and should stay cheap.</p>
 *
 * @since 1.0.0
 * @author LruStore Team
 */
package com.ryuqq.lrustore.core.spi;

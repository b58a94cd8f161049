/**
 * Ready-made {@link com.ryuqq.lrustore.core.spi.EvictionListener} implementations.
 *
 * @since 1.0.0
 * @author LruStore Team
 */
package com.ryuqq.lrustore.adapter.inmemory.listener;

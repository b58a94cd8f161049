/**
 * Exception taxonomy for LruStore operations.
 *
 * <h2>Exceptions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lrustore.core.exception.InvalidCapacityException} - capacity below 1 (construction, resize)</li>
 *   <li>{@link com.ryuqq.lrustore.core.exception.KeyNotFoundException} - read, peek, delete or remove of an absent key</li>
 *   <li>{@link com.ryuqq.lrustore.core.exception.EmptyStoreException} - least/most recently used access on an empty store</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and raised synchronously. A failed operation never
 * leaves the store partially mutated.</p>
 *
 * @since 1.0.0
 * @author LruStore Team
 */
package com.ryuqq.lrustore.core.exception;

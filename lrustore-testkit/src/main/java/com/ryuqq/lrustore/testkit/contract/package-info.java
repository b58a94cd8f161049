/**
 * Reusable contract tests for {@link com.ryuqq.lrustore.core.store.LruStore} implementations.
 *
 * <p>An adapter module adds {@code lrustore-testkit} as a test dependency and extends
 * {@link com.ryuqq.lrustore.testkit.contract.AbstractLruStoreContractTest} once per
 * implementation. The contract covers recency on write and read, peek non-interference,
 * eviction and resize truncation, traversal order, failure atomicity and equality.</p>
 *
 * @since 1.0.0
 * @author LruStore Team
 */
package com.ryuqq.lrustore.testkit.contract;

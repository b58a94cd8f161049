/**
 * Value objects shared by LruStore implementations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.lrustore.core.model.Capacity} - validated maximum entry count (at least 1)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author LruStore Team
 */
package com.ryuqq.lrustore.core.model;

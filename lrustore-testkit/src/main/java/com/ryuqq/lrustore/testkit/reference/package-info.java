/**
 * Reference LruStore implementation used as a test oracle.
 *
 * @since 1.0.0
 * @author LruStore Team
 */
package com.ryuqq.lrustore.testkit.reference;
